package technology.tabulabridge.template;

import java.util.Locale;
import java.util.Objects;

import technology.tabulabridge.Area;
import technology.tabulabridge.Utils;

/**
 * Tabula 应用模板中的一个选区：页码、抽取方法以及两个角点 (x1, y1)、(x2, y2)。
 *
 * <p>
 * 坐标在读入时四舍五入到小数点后 3 位，用于消除外部工具产生的浮点噪声。
 * </p>
 */
public final class TemplateRegion {

    private static final int DECIMAL_PLACES = 3;

    private final int page;
    private final ExtractionMethod method;
    private final float x1;
    private final float y1;
    private final float x2;
    private final float y2;

    public TemplateRegion(int page, ExtractionMethod method, double x1, double y1, double x2, double y2) {
        this.page = page;
        this.method = Objects.requireNonNull(method, "method");
        this.x1 = Utils.round(x1, DECIMAL_PLACES);
        this.y1 = Utils.round(y1, DECIMAL_PLACES);
        this.x2 = Utils.round(x2, DECIMAL_PLACES);
        this.y2 = Utils.round(y2, DECIMAL_PLACES);
    }

    public int getPage() {
        return page;
    }

    public ExtractionMethod getMethod() {
        return method;
    }

    public float getX1() {
        return x1;
    }

    public float getY1() {
        return y1;
    }

    public float getX2() {
        return x2;
    }

    public float getY2() {
        return y2;
    }

    /**
     * 转换为 {@code --area} 使用的 top/left/bottom/right，即 (y1, x1, y2, x2)。
     */
    public Area toArea() {
        return new Area(y1, x1, y2, x2);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TemplateRegion)) return false;
        TemplateRegion that = (TemplateRegion) o;
        return page == that.page && method == that.method
                && Float.compare(x1, that.x1) == 0 && Float.compare(y1, that.y1) == 0
                && Float.compare(x2, that.x2) == 0 && Float.compare(y2, that.y2) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(page, method, x1, y1, x2, y2);
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "TemplateRegion[page=%d,method=%s,x1=%s,y1=%s,x2=%s,y2=%s]", page, method,
                Utils.formatNumber(x1), Utils.formatNumber(y1), Utils.formatNumber(x2), Utils.formatNumber(y2));
    }
}
