package technology.tabulabridge;

import java.awt.geom.Rectangle2D;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import technology.tabulabridge.errors.InvalidAreaException;

/**
 * 页面上的待分析区域（region of interest），对应 tabula 的 {@code --area} 参数。
 *
 * Area 继承自 Rectangle2D.Float，与引擎自身的 Rectangle 一样以 top/left/bottom/right 描述几何。
 * 坐标既可以是绝对值（PDF 点），也可以是百分比；是否为百分比由 {@link ExtractionOption#isRelativeArea()}
 * 决定，Area 本身只保存数值。
 *
 * 构造时即校验：必须恰好 4 个值，且 top &lt; bottom、left &lt; right。
 */
@SuppressWarnings("serial")
public class Area extends Rectangle2D.Float {

	/* 原始边界值，渲染时使用，避免经由 width/height 换算引入浮点误差 */
	private final float top, left, bottom, right;

	/**
	 * 使用 top/left/bottom/right 构造区域。
	 *
	 * @param top    顶部 Y 坐标
	 * @param left   左侧 X 坐标
	 * @param bottom 底部 Y 坐标
	 * @param right  右侧 X 坐标
	 * @throws InvalidAreaException 当 top &gt;= bottom 或 left &gt;= right 时
	 */
	public Area(float top, float left, float bottom, float right) {
		super();
		validate(top, left, bottom, right);
		this.top = top;
		this.left = left;
		this.bottom = bottom;
		this.right = right;
		this.setRect(left, top, right - left, bottom - top);
	}

	/**
	 * 由任意长度的数值序列构造区域，长度不是 4 时抛出 {@link InvalidAreaException}。
	 *
	 * @param values 依次为 top, left, bottom, right
	 * @return 新的 Area
	 */
	public static Area of(float... values) {
		if (values == null || values.length != 4) {
			int length = values == null ? 0 : values.length;
			throw new InvalidAreaException(String.format(Locale.US,
					"area should have 4 values for each option but %s has %d",
					Arrays.toString(values), length));
		}
		return new Area(values[0], values[1], values[2], values[3]);
	}

	/**
	 * 同 {@link #of(float...)}，接受数值列表（例如从 JSON 或 Map 中读出的值）。
	 */
	public static Area of(List<? extends Number> values) {
		if (values == null) {
			return of((float[]) null);
		}
		float[] f = new float[values.size()];
		for (int i = 0; i < f.length; i++) {
			f[i] = values.get(i).floatValue();
		}
		return of(f);
	}

	private static void validate(float top, float left, float bottom, float right) {
		if (!(top < bottom)) {
			throw new InvalidAreaException(String.format(Locale.US,
					"area option bottom=%s should be greater than top=%s",
					Utils.formatNumber(bottom), Utils.formatNumber(top)));
		}
		if (!(left < right)) {
			throw new InvalidAreaException(String.format(Locale.US,
					"area option right=%s should be greater than left=%s",
					Utils.formatNumber(right), Utils.formatNumber(left)));
		}
	}

	public float getTop() {
		return top;
	}

	public float getLeft() {
		return left;
	}

	public float getBottom() {
		return bottom;
	}

	public float getRight() {
		return right;
	}

	/**
	 * 渲染为引擎参数值 {@code top,left,bottom,right}。
	 *
	 * @param relative 为 true 时加上 {@code %} 前缀，表示百分比坐标
	 * @return 参数字符串
	 */
	public String toOptionValue(boolean relative) {
		return Utils.formatNumbers(new float[] { getTop(), getLeft(), getBottom(), getRight() }, relative);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof Area))
			return false;
		Area other = (Area) obj;
		return java.lang.Float.compare(top, other.top) == 0 && java.lang.Float.compare(left, other.left) == 0
				&& java.lang.Float.compare(bottom, other.bottom) == 0
				&& java.lang.Float.compare(right, other.right) == 0;
	}

	@Override
	public int hashCode() {
		int result = java.lang.Float.hashCode(top);
		result = 31 * result + java.lang.Float.hashCode(left);
		result = 31 * result + java.lang.Float.hashCode(bottom);
		return 31 * result + java.lang.Float.hashCode(right);
	}

	/**
	 * 返回矩形的字符串表示，包含底部和右侧信息。
	 */
	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		String s = super.toString();
		sb.append(s.substring(0, s.length() - 1));
		sb.append(String.format(Locale.US, ",bottom=%f,right=%f]", this.getBottom(), this.getRight()));
		return sb.toString();
	}

}
