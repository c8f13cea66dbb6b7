package technology.tabulabridge.backend;

import java.nio.charset.Charset;

/**
 * 子进程结束后的退出码与输出。
 */
public final class ProcessResult {

    private final int exitCode;
    private final byte[] stdout;
    private final byte[] stderr;

    public ProcessResult(int exitCode, byte[] stdout, byte[] stderr) {
        this.exitCode = exitCode;
        this.stdout = stdout == null ? new byte[0] : stdout;
        this.stderr = stderr == null ? new byte[0] : stderr;
    }

    public int getExitCode() {
        return exitCode;
    }

    public byte[] getStdout() {
        return stdout;
    }

    public byte[] getStderr() {
        return stderr;
    }

    public String getStdout(Charset charset) {
        return new String(stdout, charset);
    }

    public String getStderr(Charset charset) {
        return new String(stderr, charset);
    }

    public boolean hasStderr() {
        return stderr.length > 0;
    }
}
