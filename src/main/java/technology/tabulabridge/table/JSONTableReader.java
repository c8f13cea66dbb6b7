package technology.tabulabridge.table;

import java.util.ArrayList;
import java.util.List;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import technology.tabulabridge.errors.TableParseException;

/**
 * 解析 {@code --format JSON} 的输出。
 *
 * <p>
 * 顶层是表格对象数组，每个表格的 {@code data} 字段是行数组，每行是单元格对象数组，
 * 单元格的 {@code text} 字段缺失或为空表示空单元格。
 * </p>
 */
public class JSONTableReader implements TableReader {

    @Override
    public List<Table> read(String output) throws TableParseException {
        JsonElement root;
        try {
            root = JsonParser.parseString(output);
        } catch (JsonParseException e) {
            throw new TableParseException("Failed to parse JSON output of tabula-java", e);
        }
        if (root.isJsonNull()) {
            return new ArrayList<>();
        }
        if (!root.isJsonArray()) {
            throw new TableParseException("JSON output should be an array of tables but was " + abbreviate(root));
        }

        List<Table> tables = new ArrayList<>();
        for (JsonElement t : root.getAsJsonArray()) {
            if (!t.isJsonObject()) {
                throw new TableParseException("table should be an object but was " + abbreviate(t));
            }
            tables.add(readTable(t.getAsJsonObject()));
        }
        return tables;
    }

    private static Table readTable(JsonObject o) throws TableParseException {
        Table table = new Table(stringOrNull(o, "extraction_method"));
        JsonElement page = o.get("page_number");
        if (page != null && page.isJsonPrimitive() && page.getAsJsonPrimitive().isNumber()) {
            table.setPageNumber(page.getAsInt());
        }

        JsonElement data = o.get("data");
        if (data == null || data.isJsonNull()) {
            return table;
        }
        if (!data.isJsonArray()) {
            throw new TableParseException("'data' should be an array of rows but was " + abbreviate(data));
        }
        for (JsonElement r : data.getAsJsonArray()) {
            if (!r.isJsonArray()) {
                throw new TableParseException("row should be an array of cells but was " + abbreviate(r));
            }
            JsonArray row = r.getAsJsonArray();
            List<Cell> cells = new ArrayList<>(row.size());
            for (JsonElement c : row) {
                cells.add(c.isJsonObject() ? Cell.of(stringOrNull(c.getAsJsonObject(), "text")) : Cell.EMPTY);
            }
            table.addRow(cells);
        }
        return table;
    }

    private static String stringOrNull(JsonObject o, String key) {
        JsonElement e = o.get(key);
        if (e == null || e.isJsonNull() || !e.isJsonPrimitive()) {
            return null;
        }
        return e.getAsString();
    }

    private static String abbreviate(JsonElement e) {
        String s = e.toString();
        return s.length() > 80 ? s.substring(0, 77) + "..." : s;
    }
}
