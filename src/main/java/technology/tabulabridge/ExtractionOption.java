package technology.tabulabridge;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import technology.tabulabridge.errors.UnsortedColumnsException;

/**
 * 一次抽取调用的全部参数，负责校验并渲染为 tabula-java 的命令行参数。
 *
 * <p>
 * 实例通过 {@link Builder} 构造，构造后不可变；{@link #merge(ExtractionOption)} 返回新实例。
 * 参数顺序（见 {@link #buildOptionList()}）是与引擎之间的约定，不能随意调整：
 * </p>
 *
 * <pre>
 * [raw options] [--pages P] [--area A]* [--lattice] [--stream] [--guess]
 * [--format F] [--outfile PATH] [--columns C] [--password PW] [--batch DIR] [--silent]
 * </pre>
 *
 * <p>
 * 注意：batch 模式与单文件模式互斥，由调用方保证，本类不做检查。
 * </p>
 */
public final class ExtractionOption {

    private static final Logger logger = LoggerFactory.getLogger(ExtractionOption.class);

    /**
     * {@link #fromMap(Map)} 接受的键。
     */
    public static final Set<String> KEYS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
            "pages", "guess", "area", "relative_area", "lattice", "stream", "password", "silent",
            "columns", "relative_columns", "format", "batch", "output_path", "options", "multiple_tables")));

    private final PageSelection pages;
    private final boolean guess;
    private final List<Area> areas;
    private final boolean relativeArea;
    private final boolean multipleAreas;
    private final boolean lattice;
    private final boolean stream;
    private final String password;
    private final boolean silent;
    private final List<Float> columns;
    private final boolean relativeColumns;
    private final OutputFormat format;
    private final String batch;
    private final String outputPath;
    private final String options;
    private final boolean multipleTables;

    private ExtractionOption(Builder builder) {
        this.pages = builder.pages;
        // 指定了区域时 guess 被强制关闭
        this.guess = builder.guess && builder.areas.isEmpty();
        this.areas = Collections.unmodifiableList(new ArrayList<>(builder.areas));
        this.relativeArea = builder.relativeArea;
        this.multipleAreas = builder.multipleAreas;
        this.lattice = builder.lattice;
        this.stream = builder.stream;
        this.password = builder.password;
        this.silent = builder.silent;
        this.columns = Collections.unmodifiableList(new ArrayList<>(builder.columns));
        this.relativeColumns = builder.relativeColumns;
        this.format = builder.format;
        this.batch = builder.batch;
        this.outputPath = builder.outputPath;
        this.options = builder.options;
        this.multipleTables = builder.multipleTables;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * 渲染为 tabula-java 的参数列表。
     *
     * <p>
     * 纯函数：相同的实例总是得到相同顺序的相同参数。未指定页码时只记录警告，
     * 因为引擎默认只处理第 1 页。
     * </p>
     *
     * @return 有序的参数列表
     * @throws UnsortedColumnsException 列边界不是非递减序列
     */
    public List<String> buildOptionList() {
        List<String> rv = new ArrayList<>();
        // 兼容旧用法：以字符串给出的原始参数放在最前面
        rv.addAll(Utils.splitArguments(options));

        if (hasPages()) {
            rv.add("--pages");
            rv.add(pages.toOptionValue());
        } else {
            logger.warn("'pages' argument isn't specified. Will extract only from page 1 by default.");
        }

        for (Area area : areas) {
            rv.add("--area");
            rv.add(area.toOptionValue(relativeArea));
        }

        if (lattice) {
            rv.add("--lattice");
        }
        if (stream) {
            rv.add("--stream");
        }
        if (guess && !isMultipleAreas()) {
            rv.add("--guess");
        }

        if (format != null) {
            rv.add("--format");
            rv.add(format.name());
        }
        if (isSet(outputPath)) {
            rv.add("--outfile");
            rv.add(outputPath);
        }
        if (!columns.isEmpty()) {
            checkColumnsSorted(columns);
            rv.add("--columns");
            rv.add(Utils.formatNumbers(columns, relativeColumns));
        }
        if (isSet(password)) {
            rv.add("--password");
            rv.add(password);
        }
        if (isSet(batch)) {
            rv.add("--batch");
            rv.add(batch);
        }
        if (silent) {
            rv.add("--silent");
        }
        return rv;
    }

    private static void checkColumnsSorted(List<Float> columns) {
        for (int i = 1; i < columns.size(); i++) {
            if (columns.get(i) < columns.get(i - 1)) {
                throw new UnsortedColumnsException("columns option should be sorted: " + columns);
            }
        }
    }

    /**
     * 右偏合并：本实例（override）中"有值"的字段优先，否则取 base 的值。
     *
     * <p>
     * 布尔字段按 {@code this || base} 合并，列表与字符串字段按是否为空整体取舍（不逐元素合并）。
     * 因此 override 中显式的 false / 空列表无法覆盖 base 中的 true / 非空值，
     * 例如无法通过 override 关闭 base 的 guess。
     * </p>
     *
     * @param base 提供缺省值的实例
     * @return 新实例
     */
    public ExtractionOption merge(ExtractionOption base) {
        Builder b = new Builder();
        b.pages = hasPages() ? pages : base.pages;
        b.guess = guess || base.guess;
        b.areas = !areas.isEmpty() ? areas : base.areas;
        b.relativeArea = relativeArea || base.relativeArea;
        b.multipleAreas = multipleAreas || base.multipleAreas;
        b.lattice = lattice || base.lattice;
        b.stream = stream || base.stream;
        b.password = isSet(password) ? password : base.password;
        b.silent = silent || base.silent;
        b.columns = !columns.isEmpty() ? columns : base.columns;
        b.relativeColumns = relativeColumns || base.relativeColumns;
        b.format = format != null ? format : base.format;
        b.batch = isSet(batch) ? batch : base.batch;
        b.outputPath = isSet(outputPath) ? outputPath : base.outputPath;
        b.options = isSet(options) ? options : base.options;
        b.multipleTables = multipleTables || base.multipleTables;
        return b.build();
    }

    /**
     * 由命名参数构造，未知的键直接拒绝。
     *
     * <p>
     * 支持的键见 {@link #KEYS}；{@code area} 可以是 4 个数值的列表，也可以是这种列表的列表。
     * 未给出的键取 {@link Builder} 的默认值。
     * </p>
     *
     * @throws IllegalArgumentException 存在未知的键或值的类型不对
     */
    public static ExtractionOption fromMap(Map<String, ?> values) {
        for (String key : values.keySet()) {
            if (!KEYS.contains(key)) {
                throw new IllegalArgumentException("Unknown option: " + key);
            }
        }
        Builder b = builder();
        for (Map.Entry<String, ?> e : values.entrySet()) {
            Object v = e.getValue();
            if (v == null) {
                continue;
            }
            switch (e.getKey()) {
                case "pages":
                    b.pages(toPageSelection(v));
                    break;
                case "guess":
                    b.guess(toBoolean(e.getKey(), v));
                    break;
                case "area":
                    b.areas(toAreas(v));
                    // 嵌套列表表示多区域请求，即使只有一个元素
                    b.multipleAreas(isNestedList(v));
                    break;
                case "relative_area":
                    b.relativeArea(toBoolean(e.getKey(), v));
                    break;
                case "lattice":
                    b.lattice(toBoolean(e.getKey(), v));
                    break;
                case "stream":
                    b.stream(toBoolean(e.getKey(), v));
                    break;
                case "password":
                    b.password(v.toString());
                    break;
                case "silent":
                    b.silent(toBoolean(e.getKey(), v));
                    break;
                case "columns":
                    b.columns(toFloatList(e.getKey(), v));
                    break;
                case "relative_columns":
                    b.relativeColumns(toBoolean(e.getKey(), v));
                    break;
                case "format":
                    b.format(v instanceof OutputFormat ? (OutputFormat) v : OutputFormat.parse(v.toString()));
                    break;
                case "batch":
                    b.batch(v.toString());
                    break;
                case "output_path":
                    b.outputPath(v.toString());
                    break;
                case "options":
                    b.options(v.toString());
                    break;
                case "multiple_tables":
                    b.multipleTables(toBoolean(e.getKey(), v));
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option: " + e.getKey());
            }
        }
        return b.build();
    }

    private static boolean toBoolean(String key, Object v) {
        if (v instanceof Boolean) {
            return (Boolean) v;
        }
        throw new IllegalArgumentException(key + " should be a boolean but was " + v);
    }

    @SuppressWarnings("unchecked")
    private static PageSelection toPageSelection(Object v) {
        if (v instanceof PageSelection) {
            return (PageSelection) v;
        }
        if (v instanceof Number) {
            return PageSelection.of(((Number) v).intValue());
        }
        if (v instanceof Collection) {
            List<Integer> pages = new ArrayList<>();
            for (Object o : (Collection<Object>) v) {
                pages.add(((Number) o).intValue());
            }
            return PageSelection.of(pages);
        }
        return PageSelection.parse(v.toString());
    }

    private static List<Float> toFloatList(String key, Object v) {
        if (!(v instanceof Collection)) {
            throw new IllegalArgumentException(key + " should be a list of numbers but was " + v);
        }
        List<Float> rv = new ArrayList<>();
        for (Object o : (Collection<?>) v) {
            if (!(o instanceof Number)) {
                throw new IllegalArgumentException(key + " should be a list of numbers but was " + v);
            }
            rv.add(((Number) o).floatValue());
        }
        return rv;
    }

    private static List<Area> toAreas(Object v) {
        if (v instanceof Area) {
            return Collections.singletonList((Area) v);
        }
        if (!(v instanceof List)) {
            throw new IllegalArgumentException("area should be a list but was " + v);
        }
        List<?> list = (List<?>) v;
        List<Area> rv = new ArrayList<>();
        if (!isNestedList(list)) {
            rv.add(Area.of(toFloatList("area", list)));
            return rv;
        }
        for (Object o : list) {
            if (o instanceof Area) {
                rv.add((Area) o);
            } else {
                rv.add(Area.of(toFloatList("area", o)));
            }
        }
        return rv;
    }

    private static boolean isNestedList(Object v) {
        if (v instanceof List) {
            for (Object o : (List<?>) v) {
                if (o instanceof List || o instanceof Area) {
                    return true;
                }
            }
        }
        return false;
    }

    private static boolean isSet(String s) {
        return s != null && !s.isEmpty();
    }

    public boolean hasPages() {
        return pages != null && !pages.isEmpty();
    }

    public PageSelection getPages() {
        return pages;
    }

    /**
     * 指定了区域时总是 false。
     */
    public boolean isGuess() {
        return guess;
    }

    public List<Area> getAreas() {
        return areas;
    }

    public boolean isRelativeArea() {
        return relativeArea;
    }

    /**
     * 同一页上有多个区域（由模板合并产生或直接给出多个区域）。
     */
    public boolean isMultipleAreas() {
        return multipleAreas || areas.size() > 1;
    }

    public boolean isLattice() {
        return lattice;
    }

    public boolean isStream() {
        return stream;
    }

    public String getPassword() {
        return password;
    }

    public boolean isSilent() {
        return silent;
    }

    public List<Float> getColumns() {
        return columns;
    }

    public boolean isRelativeColumns() {
        return relativeColumns;
    }

    public OutputFormat getFormat() {
        return format;
    }

    public String getBatch() {
        return batch;
    }

    public String getOutputPath() {
        return outputPath;
    }

    public String getOptions() {
        return options;
    }

    public boolean isMultipleTables() {
        return multipleTables;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExtractionOption)) return false;
        ExtractionOption that = (ExtractionOption) o;
        return guess == that.guess
                && relativeArea == that.relativeArea
                && isMultipleAreas() == that.isMultipleAreas()
                && lattice == that.lattice
                && stream == that.stream
                && silent == that.silent
                && relativeColumns == that.relativeColumns
                && multipleTables == that.multipleTables
                && Objects.equals(pages, that.pages)
                && areas.equals(that.areas)
                && Objects.equals(password, that.password)
                && columns.equals(that.columns)
                && format == that.format
                && Objects.equals(batch, that.batch)
                && Objects.equals(outputPath, that.outputPath)
                && Objects.equals(options, that.options);
    }

    @Override
    public int hashCode() {
        return Objects.hash(pages, guess, areas, relativeArea, isMultipleAreas(), lattice, stream, password, silent,
                columns, relativeColumns, format, batch, outputPath, options, multipleTables);
    }

    @Override
    public String toString() {
        return "ExtractionOption" + buildOptionListQuietly() + (multipleTables ? "" : " (single table)");
    }

    private List<String> buildOptionListQuietly() {
        List<String> rv = new ArrayList<>(Utils.splitArguments(options));
        if (hasPages()) {
            rv.add("--pages=" + pages);
        }
        for (Area area : areas) {
            rv.add("--area=" + area.toOptionValue(relativeArea));
        }
        if (lattice) rv.add("--lattice");
        if (stream) rv.add("--stream");
        if (guess && !isMultipleAreas()) rv.add("--guess");
        if (format != null) rv.add("--format=" + format);
        if (!columns.isEmpty()) rv.add("--columns=" + Utils.formatNumbers(columns, relativeColumns));
        if (isSet(password)) rv.add("--password=***");
        if (isSet(batch)) rv.add("--batch=" + batch);
        if (isSet(outputPath)) rv.add("--outfile=" + outputPath);
        if (silent) rv.add("--silent");
        return rv;
    }

    /**
     * {@link ExtractionOption} 的构造器。默认值：guess 与 multipleTables 为 true，其余为空/false。
     */
    public static final class Builder {

        PageSelection pages;
        boolean guess = true;
        List<Area> areas = new ArrayList<>();
        boolean relativeArea;
        boolean multipleAreas;
        boolean lattice;
        boolean stream;
        String password;
        boolean silent;
        List<Float> columns = new ArrayList<>();
        boolean relativeColumns;
        OutputFormat format;
        String batch;
        String outputPath;
        String options;
        boolean multipleTables = true;

        Builder() {
        }

        Builder(ExtractionOption o) {
            this.pages = o.pages;
            this.guess = o.guess;
            this.areas = new ArrayList<>(o.areas);
            this.relativeArea = o.relativeArea;
            this.multipleAreas = o.multipleAreas;
            this.lattice = o.lattice;
            this.stream = o.stream;
            this.password = o.password;
            this.silent = o.silent;
            this.columns = new ArrayList<>(o.columns);
            this.relativeColumns = o.relativeColumns;
            this.format = o.format;
            this.batch = o.batch;
            this.outputPath = o.outputPath;
            this.options = o.options;
            this.multipleTables = o.multipleTables;
        }

        public Builder pages(PageSelection pages) {
            this.pages = pages;
            return this;
        }

        public Builder pages(String pages) {
            this.pages = pages == null ? null : PageSelection.parse(pages);
            return this;
        }

        public Builder pages(int page) {
            this.pages = PageSelection.of(page);
            return this;
        }

        public Builder pages(Integer... pages) {
            this.pages = PageSelection.of(pages);
            return this;
        }

        public Builder allPages() {
            this.pages = PageSelection.all();
            return this;
        }

        public Builder guess(boolean guess) {
            this.guess = guess;
            return this;
        }

        public Builder area(Area area) {
            this.areas = new ArrayList<>();
            this.areas.add(area);
            return this;
        }

        public Builder area(float top, float left, float bottom, float right) {
            return area(new Area(top, left, bottom, right));
        }

        public Builder areas(List<Area> areas) {
            this.areas = areas == null ? new ArrayList<>() : new ArrayList<>(areas);
            return this;
        }

        public Builder addArea(Area area) {
            this.areas.add(area);
            return this;
        }

        public Builder relativeArea(boolean relativeArea) {
            this.relativeArea = relativeArea;
            return this;
        }

        public Builder multipleAreas(boolean multipleAreas) {
            this.multipleAreas = multipleAreas;
            return this;
        }

        public Builder lattice(boolean lattice) {
            this.lattice = lattice;
            return this;
        }

        public Builder stream(boolean stream) {
            this.stream = stream;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder silent(boolean silent) {
            this.silent = silent;
            return this;
        }

        public Builder columns(List<Float> columns) {
            this.columns = columns == null ? new ArrayList<>() : new ArrayList<>(columns);
            return this;
        }

        public Builder columns(Float... columns) {
            return columns(Arrays.asList(columns));
        }

        public Builder relativeColumns(boolean relativeColumns) {
            this.relativeColumns = relativeColumns;
            return this;
        }

        public Builder format(OutputFormat format) {
            this.format = format;
            return this;
        }

        public Builder batch(String batch) {
            this.batch = batch;
            return this;
        }

        public Builder outputPath(String outputPath) {
            this.outputPath = outputPath;
            return this;
        }

        /**
         * 原始参数字符串，按 shell 规则切分后原样放在参数列表最前面，用于传递本类未建模的引擎参数。
         */
        public Builder options(String options) {
            this.options = options;
            return this;
        }

        public Builder multipleTables(boolean multipleTables) {
            this.multipleTables = multipleTables;
            return this;
        }

        public ExtractionOption build() {
            return new ExtractionOption(this);
        }
    }
}
