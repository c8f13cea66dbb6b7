package technology.tabulabridge.backend;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import technology.tabulabridge.Utils;

/**
 * 引擎的运行配置：jar 位置、java 命令、JVM 启动参数、输出编码等。
 *
 * <p>
 * jar 路径的查找顺序：{@link Builder#jarPath(Path)} 显式指定的值，环境变量 {@code TABULA_JAR}，
 * 系统属性 {@code tabula.jar}，最后是工作目录下的 {@value #DEFAULT_JAR_NAME}。
 * </p>
 */
public final class EngineConfig {

    public static final String TABULA_JAVA_VERSION = "1.0.5";
    public static final String DEFAULT_JAR_NAME = "tabula-" + TABULA_JAVA_VERSION + "-jar-with-dependencies.jar";
    public static final String JAR_ENV = "TABULA_JAR";
    public static final String JAR_PROPERTY = "tabula.jar";

    static final String HEADLESS_OPTION = "-Djava.awt.headless=true";
    static final String FILE_ENCODING_OPTION = "-Dfile.encoding=UTF8";

    /**
     * silent 模式下追加的参数，用于关闭引擎自身的日志输出。
     */
    public static final List<String> SILENT_OPTIONS = Collections.unmodifiableList(Arrays.asList(
            "-Dorg.slf4j.simpleLogger.defaultLogLevel=off",
            "-Dorg.apache.commons.logging.Log=org.apache.commons.logging.impl.NoOpLog"));

    /**
     * 由本库自动加入的 JVM 参数，判断启动参数是否变化时不计入。
     */
    public static final Set<String> IGNORED_JAVA_OPTIONS;

    static {
        Set<String> ignored = new HashSet<>();
        ignored.add(HEADLESS_OPTION);
        ignored.add(FILE_ENCODING_OPTION);
        ignored.addAll(SILENT_OPTIONS);
        IGNORED_JAVA_OPTIONS = Collections.unmodifiableSet(ignored);
    }

    private final Path jarPath;
    private final String javaExecutable;
    private final List<String> javaOptions;
    private final Charset encoding;
    private final boolean silent;
    private final boolean forceSubprocess;

    private EngineConfig(Builder builder) {
        this.jarPath = builder.jarPath != null ? builder.jarPath
                : resolveJarPath(System.getenv(), System.getProperty(JAR_PROPERTY));
        this.javaExecutable = builder.javaExecutable;
        this.javaOptions = Collections.unmodifiableList(new ArrayList<>(builder.javaOptions));
        this.encoding = builder.encoding;
        this.silent = builder.silent;
        this.forceSubprocess = builder.forceSubprocess;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 全部使用默认值的配置。
     */
    public static EngineConfig defaults() {
        return builder().build();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    static Path resolveJarPath(Map<String, String> env, String property) {
        String fromEnv = env.get(JAR_ENV);
        if (fromEnv != null && !fromEnv.isEmpty()) {
            return Paths.get(fromEnv);
        }
        if (property != null && !property.isEmpty()) {
            return Paths.get(property);
        }
        return Paths.get(DEFAULT_JAR_NAME);
    }

    /**
     * 实际传给 JVM 的启动参数：用户参数，加上 macOS 下的 headless 参数，
     * 以及 UTF-8 编码时的 {@code file.encoding}。silent 参数由各 backend 自行追加。
     */
    public List<String> buildJavaOptions() {
        return buildJavaOptions(System.getProperty("os.name", ""));
    }

    List<String> buildJavaOptions(String osName) {
        List<String> rv = new ArrayList<>(javaOptions);
        if (osName.toLowerCase(Locale.ROOT).startsWith("mac") && !containsOption(rv, "java.awt.headless")) {
            rv.add(HEADLESS_OPTION);
        }
        if (StandardCharsets.UTF_8.equals(encoding) && !containsOption(rv, "file.encoding")) {
            rv.add(FILE_ENCODING_OPTION);
        }
        return rv;
    }

    /**
     * 在启动参数后追加 silent 参数（如果需要）。
     */
    static List<String> withSilentOptions(List<String> javaOptions, boolean silent) {
        List<String> rv = new ArrayList<>(javaOptions);
        if (silent) {
            for (String option : SILENT_OPTIONS) {
                if (!rv.contains(option)) {
                    rv.add(option);
                }
            }
        }
        return rv;
    }

    static Set<String> withoutIgnored(List<String> javaOptions) {
        Set<String> rv = new HashSet<>(javaOptions);
        rv.removeAll(IGNORED_JAVA_OPTIONS);
        return rv;
    }

    private static boolean containsOption(List<String> options, String name) {
        for (String option : options) {
            if (option.contains(name)) {
                return true;
            }
        }
        return false;
    }

    public Path getJarPath() {
        return jarPath;
    }

    public String getJavaExecutable() {
        return javaExecutable;
    }

    public List<String> getJavaOptions() {
        return javaOptions;
    }

    public Charset getEncoding() {
        return encoding;
    }

    public boolean isSilent() {
        return silent;
    }

    public boolean isForceSubprocess() {
        return forceSubprocess;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EngineConfig))
            return false;
        EngineConfig that = (EngineConfig) o;
        return silent == that.silent && forceSubprocess == that.forceSubprocess
                && Objects.equals(jarPath, that.jarPath)
                && Objects.equals(javaExecutable, that.javaExecutable)
                && Objects.equals(javaOptions, that.javaOptions)
                && Objects.equals(encoding, that.encoding);
    }

    @Override
    public int hashCode() {
        return Objects.hash(jarPath, javaExecutable, javaOptions, encoding, silent, forceSubprocess);
    }

    @Override
    public String toString() {
        return "EngineConfig[jarPath=" + jarPath + ",javaExecutable=" + javaExecutable
                + ",javaOptions=" + javaOptions + ",encoding=" + encoding
                + ",silent=" + silent + ",forceSubprocess=" + forceSubprocess + "]";
    }

    public static final class Builder {

        private Path jarPath;
        private String javaExecutable = "java";
        private List<String> javaOptions = new ArrayList<>();
        private Charset encoding = StandardCharsets.UTF_8;
        private boolean silent;
        private boolean forceSubprocess;

        private Builder() {
        }

        private Builder(EngineConfig config) {
            this.jarPath = config.jarPath;
            this.javaExecutable = config.javaExecutable;
            this.javaOptions = new ArrayList<>(config.javaOptions);
            this.encoding = config.encoding;
            this.silent = config.silent;
            this.forceSubprocess = config.forceSubprocess;
        }

        public Builder jarPath(Path jarPath) {
            this.jarPath = jarPath;
            return this;
        }

        public Builder jarPath(String jarPath) {
            return jarPath(jarPath == null ? null : Paths.get(jarPath));
        }

        public Builder javaExecutable(String javaExecutable) {
            this.javaExecutable = Objects.requireNonNull(javaExecutable, "javaExecutable");
            return this;
        }

        public Builder javaOptions(List<String> javaOptions) {
            this.javaOptions = javaOptions == null ? new ArrayList<>() : new ArrayList<>(javaOptions);
            return this;
        }

        /**
         * 以字符串给出 JVM 参数，按 shell 规则切分，如 {@code "-Xmx256m -Dfoo='a b'"}。
         */
        public Builder javaOptions(String javaOptions) {
            this.javaOptions = Utils.splitArguments(javaOptions);
            return this;
        }

        public Builder encoding(Charset encoding) {
            this.encoding = Objects.requireNonNull(encoding, "encoding");
            return this;
        }

        public Builder encoding(String encoding) {
            return encoding(Charset.forName(encoding));
        }

        public Builder silent(boolean silent) {
            this.silent = silent;
            return this;
        }

        public Builder forceSubprocess(boolean forceSubprocess) {
            this.forceSubprocess = forceSubprocess;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
