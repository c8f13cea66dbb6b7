package technology.tabulabridge.backend;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import technology.tabulabridge.ExtractionOption;
import technology.tabulabridge.errors.EngineExecutionException;
import technology.tabulabridge.errors.EngineNotFoundException;

/**
 * 以子进程方式运行引擎：{@code java <jvm options> -jar <jar> <options> [input]}。
 *
 * <p>
 * 每次调用都启动独立的进程，标准输出按配置的编码解码后作为结果返回。
 * 退出码为 0 但标准错误非空时只记录警告；退出码非 0 时抛出 {@link EngineExecutionException}。
 * </p>
 */
public class SubprocessTabula implements TabulaBackend {

    private static final Logger logger = LoggerFactory.getLogger(SubprocessTabula.class);

    private final ProcessLauncher launcher;
    private final String javaExecutable;
    private final Path jarPath;
    private List<String> javaOptions;
    private Charset encoding;

    public SubprocessTabula(EngineConfig config, List<String> javaOptions, boolean silent) {
        this(config, javaOptions, silent, new DefaultProcessLauncher());
    }

    public SubprocessTabula(EngineConfig config, List<String> javaOptions, boolean silent, ProcessLauncher launcher) {
        this.launcher = launcher;
        this.javaExecutable = config.getJavaExecutable();
        this.jarPath = config.getJarPath();
        this.encoding = config.getEncoding();
        this.javaOptions = EngineConfig.withSilentOptions(javaOptions, silent);
    }

    /**
     * 更新编码与 JVM 参数，供后续调用使用。
     */
    public synchronized void update(Charset encoding, List<String> javaOptions, boolean silent) {
        this.encoding = encoding;
        this.javaOptions = EngineConfig.withSilentOptions(javaOptions, silent);
    }

    public synchronized Charset getEncoding() {
        return encoding;
    }

    public synchronized List<String> getJavaOptions() {
        return Collections.unmodifiableList(javaOptions);
    }

    public Path getJarPath() {
        return jarPath;
    }

    synchronized List<String> buildCommand(ExtractionOption option, Path input) {
        List<String> command = new ArrayList<>();
        command.add(javaExecutable);
        command.addAll(javaOptions);
        command.add("-jar");
        command.add(jarPath.toString());
        command.addAll(option.buildOptionList());
        if (input != null) {
            command.add(input.toString());
        }
        return command;
    }

    @Override
    public String call(ExtractionOption option, Path input) throws IOException {
        if (!Files.isRegularFile(jarPath)) {
            throw new EngineNotFoundException("tabula-java jar is not found: " + jarPath.toAbsolutePath()
                    + ". Set " + EngineConfig.JAR_ENV + " to the path of the jar.");
        }
        List<String> command;
        Charset charset;
        synchronized (this) {
            command = buildCommand(option, input);
            charset = encoding;
        }

        ProcessResult result = launcher.launch(command);
        if (result.getExitCode() != 0) {
            String stderr = result.getStderr(charset);
            logger.error("Error from tabula-java:\n{}\n", stderr);
            throw new EngineExecutionException(result.getExitCode(), stderr);
        }
        if (result.hasStderr()) {
            logger.warn("Got stderr: {}", result.getStderr(charset));
        }
        return result.getStdout(charset);
    }
}
