package technology.tabulabridge.backend;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import technology.tabulabridge.errors.EngineNotFoundException;

/**
 * 基于 {@link ProcessBuilder} 的启动器。
 *
 * 子进程的标准输入立即关闭；标准错误在单独的线程中读取，避免任一管道写满导致死锁。
 */
public class DefaultProcessLauncher implements ProcessLauncher {

    private static final Logger logger = LoggerFactory.getLogger(DefaultProcessLauncher.class);

    static final String JAVA_NOT_FOUND_ERROR = "`%s` command is not found from this process. "
            + "Please ensure Java is installed and PATH is set for `java`";

    @Override
    public ProcessResult launch(List<String> command) throws IOException {
        logger.debug("launching {}", command);
        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new EngineNotFoundException(String.format(JAVA_NOT_FOUND_ERROR, command.get(0)), e);
        }
        return collect(process);
    }

    /* 读取子进程的输出并等待其退出；未正常完成时结束子进程 */
    ProcessResult collect(Process process) throws IOException {
        boolean completed = false;
        try {
            process.getOutputStream().close();

            StreamCollector stderr = new StreamCollector(process.getErrorStream());
            Thread stderrReader = new Thread(stderr, "tabula-stderr");
            stderrReader.setDaemon(true);
            stderrReader.start();

            byte[] stdout;
            try (InputStream in = process.getInputStream()) {
                stdout = in.readAllBytes();
            }

            int exitCode = process.waitFor();
            stderrReader.join();
            if (stderr.failure != null) {
                throw stderr.failure;
            }
            completed = true;
            return new ProcessResult(exitCode, stdout, stderr.buffer.toByteArray());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while waiting for tabula-java");
        } finally {
            if (!completed) {
                logger.debug("destroying {}", process);
                process.destroy();
            }
        }
    }

    private static final class StreamCollector implements Runnable {

        private final InputStream in;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private volatile IOException failure;

        StreamCollector(InputStream in) {
            this.in = in;
        }

        @Override
        public void run() {
            try (InputStream is = in) {
                is.transferTo(buffer);
            } catch (IOException e) {
                failure = e;
            }
        }
    }
}
