package technology.tabulabridge.errors;

/**
 * Tabula 模板文件内容不完整或格式错误。
 */
public class TemplateFormatException extends IllegalArgumentException {

    public TemplateFormatException(String message) {
        super(message);
    }

    public TemplateFormatException(String message, Throwable cause) {
        super(message, cause);
    }

}
