package technology.tabulabridge.errors;

/**
 * 列边界坐标没有按非递减顺序给出。
 */
public class UnsortedColumnsException extends IllegalArgumentException {

    public UnsortedColumnsException(String message) {
        super(message);
    }

}
