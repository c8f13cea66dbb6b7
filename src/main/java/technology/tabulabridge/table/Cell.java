package technology.tabulabridge.table;

/**
 * 引擎输出中的一个单元格，只保存原始文本，不做类型转换。
 *
 * <p>
 * 空文本统一用 {@link #EMPTY} 表示，物化时映射为缺失值。
 * </p>
 */
public final class Cell {

	/** 空单元格（JSON 中缺失或为空的 text，CSV 中的空字段）。 */
	public static final Cell EMPTY = new Cell("");

	private final String text;

	private Cell(String text) {
		this.text = text;
	}

	/**
	 * @return 对应文本的单元格；null 或空字符串返回 {@link #EMPTY}
	 */
	public static Cell of(String text) {
		if (text == null || text.isEmpty()) {
			return EMPTY;
		}
		return new Cell(text);
	}

	public String getText() {
		return text;
	}

	public boolean isEmpty() {
		return text.isEmpty();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof Cell))
			return false;
		return text.equals(((Cell) obj).text);
	}

	@Override
	public int hashCode() {
		return text.hashCode();
	}

	@Override
	public String toString() {
		return isEmpty() ? "<empty>" : "\"" + text + "\"";
	}

}
