package technology.tabulabridge.template;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import technology.tabulabridge.errors.TemplateFormatException;

/**
 * 读取 Tabula 应用导出的模板（JSON 数组）。
 *
 * <p>
 * 每个元素形如：
 * </p>
 *
 * <pre>
 * {"page": 1, "extraction_method": "lattice", "x1": 12.75, "y1": 269.875, "x2": 561, "y2": 790.5,
 *  "width": 548.25, "height": 520.625, "selection_id": "..."}
 * </pre>
 *
 * <p>
 * 只使用 page、extraction_method 和四个角点坐标，其余字段忽略。
 * </p>
 */
public final class TemplateLoader {

    private static final String[] GEOMETRY_KEYS = { "x1", "y1", "x2", "y2" };

    private TemplateLoader() {
    }

    public static List<TemplateRegion> load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader);
        }
    }

    public static List<TemplateRegion> load(String json) {
        return load(new StringReader(json));
    }

    /**
     * @throws TemplateFormatException 不是 JSON 数组，或某个选区缺少页码、方法或坐标
     */
    public static List<TemplateRegion> load(Reader reader) {
        JsonElement root;
        try {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException e) {
            throw new TemplateFormatException("template is not valid JSON", e);
        }
        if (!root.isJsonArray()) {
            throw new TemplateFormatException("template should be a JSON array of selections but was " + root);
        }
        JsonArray array = root.getAsJsonArray();
        List<TemplateRegion> regions = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            JsonElement e = array.get(i);
            if (!e.isJsonObject()) {
                throw new TemplateFormatException("selection #" + i + " should be an object but was " + e);
            }
            regions.add(toRegion(i, e.getAsJsonObject()));
        }
        return regions;
    }

    private static TemplateRegion toRegion(int index, JsonObject o) {
        int page = (int) number(index, o, "page");
        JsonElement m = o.get("extraction_method");
        if (m == null || m.isJsonNull() || !m.isJsonPrimitive()) {
            throw new TemplateFormatException("selection #" + index + " has no extraction_method");
        }
        ExtractionMethod method = ExtractionMethod.fromTemplateName(m.getAsString());
        if (method == null) {
            throw new TemplateFormatException("selection #" + index + " has unknown extraction_method: " + m);
        }
        double[] g = new double[GEOMETRY_KEYS.length];
        for (int i = 0; i < GEOMETRY_KEYS.length; i++) {
            g[i] = number(index, o, GEOMETRY_KEYS[i]);
        }
        return new TemplateRegion(page, method, g[0], g[1], g[2], g[3]);
    }

    private static double number(int index, JsonObject o, String key) {
        JsonElement e = o.get(key);
        if (e == null || e.isJsonNull()) {
            throw new TemplateFormatException("selection #" + index + " is missing '" + key + "'");
        }
        try {
            return e.getAsDouble();
        } catch (NumberFormatException | UnsupportedOperationException | IllegalStateException ex) {
            throw new TemplateFormatException("selection #" + index + " has non-numeric '" + key + "': " + e, ex);
        }
    }
}
