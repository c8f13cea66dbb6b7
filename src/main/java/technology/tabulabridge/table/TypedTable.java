package technology.tabulabridge.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 物化后的表格：唯一的列名加上若干行，每个值是 {@link Number}、{@link String} 或表示缺失的 null。
 *
 * 不可变；每行的长度等于列数。
 */
public final class TypedTable {

    private final List<String> columns;
    private final List<List<Object>> rows;

    TypedTable(List<String> columns, List<List<Object>> rows) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        List<List<Object>> copy = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException("row has " + row.size() + " values but there are "
                        + columns.size() + " columns");
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    public List<String> getColumns() {
        return columns;
    }

    public int getColumnCount() {
        return columns.size();
    }

    public int getRowCount() {
        return rows.size();
    }

    public List<List<Object>> getRows() {
        return rows;
    }

    public Object get(int row, String column) {
        int j = columns.indexOf(column);
        if (j < 0) {
            throw new IllegalArgumentException("No such column: " + column);
        }
        return rows.get(row).get(j);
    }

    /**
     * @return 第 i 行，按列顺序的 列名 → 值 映射
     */
    public Map<String, Object> getRow(int i) {
        Map<String, Object> rv = new LinkedHashMap<>();
        List<Object> row = rows.get(i);
        for (int j = 0; j < columns.size(); j++) {
            rv.put(columns.get(j), row.get(j));
        }
        return rv;
    }

    /**
     * @return 指定列的全部值
     */
    public List<Object> getColumn(String column) {
        int j = columns.indexOf(column);
        if (j < 0) {
            throw new IllegalArgumentException("No such column: " + column);
        }
        List<Object> rv = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            rv.add(row.get(j));
        }
        return rv;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TypedTable)) return false;
        TypedTable that = (TypedTable) o;
        return columns.equals(that.columns) && rows.equals(that.rows);
    }

    @Override
    public int hashCode() {
        return 31 * columns.hashCode() + rows.hashCode();
    }

    @Override
    public String toString() {
        return "TypedTable" + columns + " x " + rows.size() + " rows";
    }
}
