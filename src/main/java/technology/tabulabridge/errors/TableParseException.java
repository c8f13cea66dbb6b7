package technology.tabulabridge.errors;

/**
 * 引擎输出无法整理成表格，例如单表模式下各行列数不一致。
 */
public class TableParseException extends TabulaException {

    public TableParseException(String message) {
        super(message);
    }

    public TableParseException(String message, Throwable cause) {
        super(message + ", caused by " + cause, cause);
    }

}
