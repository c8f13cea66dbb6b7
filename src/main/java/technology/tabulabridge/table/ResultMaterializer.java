package technology.tabulabridge.table;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import technology.tabulabridge.errors.TableParseException;

/**
 * 将原始表格整理为 {@link TypedTable}。
 *
 * <p>
 * 处理流程：
 * </p>
 * <ul>
 * <li>丢弃没有任何行的表格；</li>
 * <li>按 {@link HeaderPolicy} 或显式列名确定列名（空表头单元格命名为 {@code Unnamed: n}，重复列名追加后缀）；</li>
 * <li>空单元格映射为 null；</li>
 * <li>逐列尝试数值转换：整列都能解析为数值才转换，否则整列保留原始文本。</li>
 * </ul>
 */
public class ResultMaterializer {

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final boolean coerceNumbers;

    public ResultMaterializer() {
        this(true);
    }

    /**
     * @param coerceNumbers 为 false 时所有值都保留为文本
     */
    public ResultMaterializer(boolean coerceNumbers) {
        this.coerceNumbers = coerceNumbers;
    }

    /**
     * @param tables          引擎输出的原始表格
     * @param headerPolicy    表头来源，显式列名存在时忽略
     * @param explicitColumns 显式列名，可以为 null 或空
     * @return 每张非空表格对应一个 TypedTable
     * @throws TableParseException 某行的值比列名多，或指定的表头行不存在
     */
    public List<TypedTable> materialize(List<Table> tables, HeaderPolicy headerPolicy, List<String> explicitColumns)
            throws TableParseException {
        boolean hasExplicitColumns = explicitColumns != null && !explicitColumns.isEmpty();
        List<TypedTable> rv = new ArrayList<>();
        boolean firstTable = true;

        for (Table table : tables) {
            if (table.getRowCount() == 0) {
                continue;
            }
            List<List<Cell>> rows = new ArrayList<>(table.getRows());
            List<Integer> rowIndexes = new ArrayList<>(rows.size());
            for (int i = 0; i < rows.size(); i++) {
                rowIndexes.add(i);
            }

            List<String> columns;
            if (hasExplicitColumns) {
                columns = ColumnNames.deduplicate(explicitColumns);
            } else if (headerPolicy.isInfer() && firstTable) {
                // 只有第一张表格推断表头
                columns = ColumnNames.fromHeader(header(table, rows, rowIndexes, 0));
            } else if (headerPolicy.getRow() >= 0) {
                int headerRow = headerPolicy.getRow();
                if (headerRow >= rows.size()) {
                    throw new TableParseException(String.format(
                            "header row %d does not exist in a table with %d rows", headerRow, rows.size()));
                }
                columns = ColumnNames.fromHeader(header(table, rows, rowIndexes, headerRow));
            } else {
                columns = ColumnNames.positional(table.getColCount());
            }
            firstTable = false;

            List<List<Object>> values = new ArrayList<>(rows.size());
            for (int i = 0; i < rows.size(); i++) {
                int width = table.getRowWidth(rowIndexes.get(i));
                if (width > columns.size()) {
                    throw new TableParseException(String.format(
                            "Error failed to create a table with different column counts: expected %d fields, saw %d in row %d.%n"
                                    + "Try to enable multiple tables mode or pass explicit column names.",
                            columns.size(), width, rowIndexes.get(i)));
                }
                List<Cell> row = rows.get(i);
                List<Object> v = new ArrayList<>(columns.size());
                for (int j = 0; j < columns.size(); j++) {
                    Cell cell = j < row.size() ? row.get(j) : Cell.EMPTY;
                    v.add(cell.isEmpty() ? null : cell.getText());
                }
                values.add(v);
            }

            if (coerceNumbers) {
                for (int j = 0; j < columns.size(); j++) {
                    coerceColumn(values, j);
                }
            }
            rv.add(new TypedTable(columns, values));
        }
        return rv;
    }

    /**
     * 弹出第 i 行作为表头，只保留该行实际写入的宽度。
     */
    private static List<Cell> header(Table table, List<List<Cell>> rows, List<Integer> rowIndexes, int i) {
        List<Cell> row = rows.remove(i);
        int width = table.getRowWidth(rowIndexes.remove(i));
        return row.subList(0, width);
    }

    /**
     * 整列转换为数值：全是整数且没有缺失值时为 Long，否则为 Double；任一值无法解析则整列不变。
     */
    static void coerceColumn(List<List<Object>> rows, int column) {
        boolean allIntegers = true;
        boolean hasMissing = false;
        boolean hasValue = false;
        for (List<Object> row : rows) {
            Object value = row.get(column);
            if (value == null) {
                hasMissing = true;
                continue;
            }
            String s = value.toString().trim();
            if (INTEGER.matcher(s).matches()) {
                hasValue = true;
                if (!fitsLong(s)) {
                    allIntegers = false;
                }
            } else if (DECIMAL.matcher(s).matches()) {
                hasValue = true;
                allIntegers = false;
            } else {
                return;
            }
        }
        if (!hasValue) {
            return;
        }
        boolean asLong = allIntegers && !hasMissing;
        for (List<Object> row : rows) {
            Object value = row.get(column);
            if (value == null) {
                continue;
            }
            String s = value.toString().trim();
            row.set(column, asLong ? (Object) Long.valueOf(s) : (Object) Double.valueOf(s));
        }
    }

    private static boolean fitsLong(String s) {
        try {
            Long.parseLong(s);
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
