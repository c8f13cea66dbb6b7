package technology.tabulabridge.errors;

/**
 * 找不到 {@code java} 可执行文件或 tabula-java 的 jar。
 */
public class EngineNotFoundException extends TabulaException {

    public EngineNotFoundException(String message) {
        super(message);
    }

    public EngineNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

}
