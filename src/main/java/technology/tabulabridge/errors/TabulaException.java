package technology.tabulabridge.errors;

import java.io.IOException;

/**
 * 与抽取引擎交互时出现的错误的基类。
 */
public class TabulaException extends IOException {

    public TabulaException(String message) {
        super(message);
    }

    public TabulaException(Throwable cause) {
        super(cause);
    }

    public TabulaException(String message, Throwable cause) {
        super(message, cause);
    }

}
