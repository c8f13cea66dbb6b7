package technology.tabulabridge;

import java.io.IOException;
import java.nio.charset.Charset;
import java.util.Arrays;

import technology.tabulabridge.backend.DefaultProcessLauncher;
import technology.tabulabridge.backend.EngineConfig;
import technology.tabulabridge.backend.ProcessLauncher;
import technology.tabulabridge.backend.ProcessResult;
import technology.tabulabridge.errors.EngineNotFoundException;

/**
 * 汇总运行环境信息，用于报告问题。
 */
public final class Environment {

    private Environment() {
    }

    public static String info() {
        return info(EngineConfig.defaults(), new DefaultProcessLauncher());
    }

    static String info(EngineConfig config, ProcessLauncher launcher) {
        StringBuilder sb = new StringBuilder();
        sb.append("Java version (runtime):\n    ").append(System.getProperty("java.version"))
                .append(" (").append(System.getProperty("java.vendor")).append(")\n");
        sb.append("Java version (").append(config.getJavaExecutable()).append(" -version):\n    ")
                .append(javaVersion(config.getJavaExecutable(), launcher).trim().replace("\n", "\n    "))
                .append('\n');
        sb.append("tabula-bridge version: ").append(libraryVersion()).append('\n');
        sb.append("tabula-java version: ").append(EngineConfig.TABULA_JAVA_VERSION).append('\n');
        sb.append("tabula-java jar: ").append(config.getJarPath().toAbsolutePath()).append('\n');
        sb.append("platform: ").append(System.getProperty("os.name")).append(' ')
                .append(System.getProperty("os.version")).append(' ')
                .append(System.getProperty("os.arch"));
        return sb.toString();
    }

    /**
     * {@code java -version} 的输出（该命令写到标准错误）。
     */
    static String javaVersion(String javaExecutable, ProcessLauncher launcher) {
        try {
            ProcessResult result = launcher.launch(Arrays.asList(javaExecutable, "-version"));
            return result.getStderr(Charset.defaultCharset()) + result.getStdout(Charset.defaultCharset());
        } catch (EngineNotFoundException e) {
            return "`" + javaExecutable + " -version` failed. `" + javaExecutable
                    + "` command is not found from this process. Please ensure Java is installed and PATH is set for `java`";
        } catch (IOException e) {
            return "`" + javaExecutable + " -version` failed: " + e.getMessage();
        }
    }

    static String libraryVersion() {
        String version = Environment.class.getPackage().getImplementationVersion();
        return version == null ? "unknown" : version;
    }
}
