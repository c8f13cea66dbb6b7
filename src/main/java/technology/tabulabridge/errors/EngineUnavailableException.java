package technology.tabulabridge.errors;

/**
 * 无法在进程内加载引擎。dispatcher 捕获后改用子进程方式。
 */
public class EngineUnavailableException extends TabulaException {

    public EngineUnavailableException(String message) {
        super(message);
    }

    public EngineUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

}
