package technology.tabulabridge.errors;

/**
 * 区域参数不合法：不是 4 个值，或不满足 top &lt; bottom、left &lt; right（含 NaN）。
 */
public class InvalidAreaException extends IllegalArgumentException {

    public InvalidAreaException(String message) {
        super(message);
    }

}
