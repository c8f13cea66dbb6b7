package technology.tabulabridge.errors;

/**
 * 引擎以非零状态退出（或在进程内执行时抛出异常）。
 *
 * 携带退出码和引擎写到 stderr 的诊断文本。
 */
public class EngineExecutionException extends TabulaException {

    /** 进程内执行时没有退出码。 */
    public static final int NO_EXIT_CODE = -1;

    private final int exitCode;
    private final String stderr;

    public EngineExecutionException(int exitCode, String stderr) {
        super(String.format("tabula-java exited with status %d:%n%s", exitCode, stderr));
        this.exitCode = exitCode;
        this.stderr = stderr;
    }

    public EngineExecutionException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = NO_EXIT_CODE;
        this.stderr = cause == null ? "" : String.valueOf(cause.getMessage());
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getStderr() {
        return stderr;
    }

}
