package technology.tabulabridge.table;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 列名的生成与去重。
 */
public final class ColumnNames {

    static final String UNNAMED_PREFIX = "Unnamed: ";

    private ColumnNames() {
    }

    /**
     * 由表头行生成列名：空单元格依次命名为 {@code Unnamed: 0}、{@code Unnamed: 1}……（计数只针对空单元格），
     * 然后用 {@link #deduplicate(List)} 去重。
     */
    public static List<String> fromHeader(List<Cell> header) {
        List<String> names = new ArrayList<>(header.size());
        int unnamed = 0;
        for (Cell cell : header) {
            if (cell.isEmpty()) {
                names.add(UNNAMED_PREFIX + unnamed++);
            } else {
                names.add(cell.getText());
            }
        }
        return deduplicate(names);
    }

    /**
     * 位置列名 {@code "0", "1", ...}，用于没有表头的表格。
     */
    public static List<String> positional(int count) {
        List<String> names = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            names.add(Integer.toString(i));
        }
        return names;
    }

    /**
     * 从左到右贪心地为重复的列名追加 {@code .1}、{@code .2}……
     *
     * <p>
     * 每个名字维护自己的计数；生成的新名字本身也参与计数，所以 {@code ["A", "A.1", "A"]}
     * 得到 {@code ["A", "A.1", "A.1.1"]}，已经被占用的后缀不会被重复分配。
     * </p>
     */
    public static List<String> deduplicate(List<String> names) {
        Map<String, Integer> counts = new HashMap<>();
        List<String> rv = new ArrayList<>(names.size());
        for (String name : names) {
            String col = name;
            int count = counts.getOrDefault(col, 0);
            while (count > 0) {
                counts.put(col, count + 1);
                col = col + "." + count;
                count = counts.getOrDefault(col, 0);
            }
            rv.add(col);
            counts.put(col, count + 1);
        }
        return rv;
    }
}
