package technology.tabulabridge.backend;

import java.io.IOException;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import technology.tabulabridge.ExtractionOption;
import technology.tabulabridge.errors.EngineExecutionException;
import technology.tabulabridge.errors.EngineUnavailableException;

/**
 * 在当前 JVM 中运行引擎。
 *
 * <p>
 * 引擎 jar 由独立的 {@link URLClassLoader} 加载，父加载器为平台类加载器，
 * 因此 jar 自带的 commons-cli、pdfbox 等不会与应用的类路径冲突。
 * 通过反射调用 {@code CommandLineApp.buildOptions()}、{@code DefaultParser.parse(...)}
 * 以及 {@code new CommandLineApp(Appendable, CommandLine).extractTables(...)}，输出写入内存缓冲区。
 * </p>
 *
 * <p>
 * 引擎类加载之后无法再更改 JVM 启动参数：{@code -Dkey=value} 形式的参数在加载前写入系统属性，
 * 其余参数（如 {@code -Xmx}）无法在进程内生效，只记录警告。
 * </p>
 */
public class EmbeddedTabula implements TabulaBackend {

    private static final Logger logger = LoggerFactory.getLogger(EmbeddedTabula.class);

    static final String APP_CLASS = "technology.tabula.CommandLineApp";
    static final String PARSER_CLASS = "org.apache.commons.cli.DefaultParser";
    static final String OPTIONS_CLASS = "org.apache.commons.cli.Options";
    static final String COMMAND_LINE_CLASS = "org.apache.commons.cli.CommandLine";

    private final URLClassLoader classLoader;
    private final Method buildOptions;
    private final Object parser;
    private final Method parse;
    private final Constructor<?> appConstructor;
    private final Method extractTables;

    /**
     * @param config      引擎配置，使用其中的 jar 路径
     * @param javaOptions JVM 启动参数
     * @param silent      是否关闭引擎日志
     * @throws EngineUnavailableException jar 不存在或无法加载引擎类
     */
    public EmbeddedTabula(EngineConfig config, List<String> javaOptions, boolean silent)
            throws EngineUnavailableException {
        Path jar = config.getJarPath();
        if (!Files.isRegularFile(jar)) {
            throw new EngineUnavailableException("tabula-java jar is not found: " + jar.toAbsolutePath());
        }
        applySystemProperties(EngineConfig.withSilentOptions(javaOptions, silent));

        URL url;
        try {
            url = jar.toUri().toURL();
        } catch (MalformedURLException e) {
            throw new EngineUnavailableException("invalid jar path: " + jar, e);
        }
        this.classLoader = new URLClassLoader(new URL[] { url }, ClassLoader.getPlatformClassLoader());
        try {
            Class<?> appClass = Class.forName(APP_CLASS, true, classLoader);
            Class<?> parserClass = classLoader.loadClass(PARSER_CLASS);
            Class<?> optionsClass = classLoader.loadClass(OPTIONS_CLASS);
            Class<?> commandLineClass = classLoader.loadClass(COMMAND_LINE_CLASS);

            this.buildOptions = appClass.getMethod("buildOptions");
            this.parser = parserClass.getConstructor().newInstance();
            this.parse = parserClass.getMethod("parse", optionsClass, String[].class);
            this.appConstructor = appClass.getConstructor(Appendable.class, commandLineClass);
            this.extractTables = appClass.getMethod("extractTables", commandLineClass);
        } catch (ReflectiveOperationException | LinkageError e) {
            closeQuietly();
            throw new EngineUnavailableException("failed to load tabula-java from " + jar, e);
        }
        logger.info("tabula-java loaded in-process from {}", jar);
    }

    /**
     * 将 {@code -Dkey=value} 形式的参数写入系统属性。
     */
    static void applySystemProperties(List<String> javaOptions) {
        List<String> ignored = new ArrayList<>();
        for (String option : javaOptions) {
            if (option.startsWith("-D") && option.length() > 2) {
                String property = option.substring(2);
                int eq = property.indexOf('=');
                if (eq < 0) {
                    System.setProperty(property, "");
                } else {
                    System.setProperty(property.substring(0, eq), property.substring(eq + 1));
                }
            } else {
                ignored.add(option);
            }
        }
        if (!ignored.isEmpty()) {
            logger.warn("java options {} cannot be applied to the running JVM and are ignored.", ignored);
        }
    }

    @Override
    public synchronized String call(ExtractionOption option, Path input) throws IOException {
        List<String> args = new ArrayList<>(option.buildOptionList());
        if (input != null) {
            args.add(0, input.toString());
        }
        StringBuilder sb = new StringBuilder();
        ClassLoader previous = Thread.currentThread().getContextClassLoader();
        Thread.currentThread().setContextClassLoader(classLoader);
        try {
            Object options = buildOptions.invoke(null);
            Object cmd = parse.invoke(parser, options, args.toArray(new String[0]));
            Object app = appConstructor.newInstance(sb, cmd);
            extractTables.invoke(app, cmd);
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            logger.error("Error from tabula-java:\n{}\n", cause.toString());
            throw new EngineExecutionException("tabula-java failed: " + cause, cause);
        } catch (ReflectiveOperationException e) {
            throw new EngineExecutionException("tabula-java could not be invoked", e);
        } finally {
            Thread.currentThread().setContextClassLoader(previous);
        }
        return sb.toString();
    }

    @Override
    public void close() throws IOException {
        classLoader.close();
    }

    private void closeQuietly() {
        try {
            classLoader.close();
        } catch (IOException e) {
            logger.debug("failed to close class loader", e);
        }
    }
}
