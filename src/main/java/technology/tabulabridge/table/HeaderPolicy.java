package technology.tabulabridge.table;

/**
 * 表头行的来源。
 *
 * <ul>
 * <li>{@link #infer()}：只把第一张表格的第一行当作表头；其余表格不消耗数据行，
 * 列名为 {@code 0..n-1}。若需要所有表格使用相同的列名，调用方应把推断出的列名作为显式列名传给后续表格。</li>
 * <li>{@link #row(int)}：每张表格各自弹出第 n 行作为表头。</li>
 * <li>{@link #none()}：不使用表头，列名为 {@code 0..n-1}。</li>
 * </ul>
 *
 * 显式列名总是优先，此时不会消耗任何数据行。
 */
public final class HeaderPolicy {

    private static final int INFER = -1;
    private static final int NONE = -2;

    private static final HeaderPolicy INFER_POLICY = new HeaderPolicy(INFER);
    private static final HeaderPolicy NONE_POLICY = new HeaderPolicy(NONE);

    private final int row;

    private HeaderPolicy(int row) {
        this.row = row;
    }

    public static HeaderPolicy infer() {
        return INFER_POLICY;
    }

    public static HeaderPolicy none() {
        return NONE_POLICY;
    }

    /**
     * @param row 表头所在行（从 0 开始）
     */
    public static HeaderPolicy row(int row) {
        if (row < 0) {
            throw new IllegalArgumentException("header row should be >= 0 but was " + row);
        }
        return new HeaderPolicy(row);
    }

    public boolean isInfer() {
        return row == INFER;
    }

    public boolean isNone() {
        return row == NONE;
    }

    /**
     * @return 表头行号；infer 与 none 返回 -1
     */
    public int getRow() {
        return row >= 0 ? row : -1;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof HeaderPolicy && ((HeaderPolicy) o).row == row;
    }

    @Override
    public int hashCode() {
        return row;
    }

    @Override
    public String toString() {
        return isInfer() ? "infer" : isNone() ? "none" : "row(" + row + ")";
    }
}
