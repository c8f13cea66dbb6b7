package technology.tabulabridge.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.TreeMap;

/**
 * 引擎输出的一张原始表格（行列交叉的文本网格）。
 *
 * 单元格稀疏地保存在以 (row, col) 为键的 TreeMap 中，未设置的位置以 {@link Cell#EMPTY} 填充。
 * 同时记录每一行实际写入的宽度，用于在物化时发现列数不一致的行。
 */
public class Table {

	/**
	 * 标识该表格是由哪个提取方法得出的（JSON 输出中的 extraction_method，CSV 输出为空）。
	 */
	private final String extractionMethod;

	/* 表格元数据 */
	private int rowCount = 0;
	private int colCount = 0;
	private int pageNumber = 0;

	/* 每行实际写入的最大列号 + 1 */
	private final List<Integer> rowWidths = new ArrayList<>();

	final TreeMap<CellPosition, Cell> cells = new TreeMap<>();

	public Table(String extractionMethod) {
		this.extractionMethod = extractionMethod == null ? "" : extractionMethod;
	}

	public int getRowCount() {
		return rowCount;
	}

	public int getColCount() {
		return colCount;
	}

	public int getPageNumber() {
		return pageNumber;
	}

	public void setPageNumber(int pageNumber) {
		this.pageNumber = pageNumber;
	}

	public String getExtractionMethod() {
		return extractionMethod;
	}

	/**
	 * 将单元格放到 (row, col)。行列计数按需扩展，已有内容会被替换。
	 *
	 * @param cell 单元格
	 * @param row  行索引（从 0 开始）
	 * @param col  列索引（从 0 开始）
	 */
	public void add(Cell cell, int row, int col) {
		rowCount = Math.max(rowCount, row + 1);
		colCount = Math.max(colCount, col + 1);
		while (rowWidths.size() < rowCount) {
			rowWidths.add(0);
		}
		rowWidths.set(row, Math.max(rowWidths.get(row), col + 1));

		cells.put(new CellPosition(row, col), cell);

		this.memoizedRows = null;
	}

	/**
	 * 在表格末尾追加一行。
	 */
	public void addRow(List<Cell> row) {
		int r = rowCount;
		if (row.isEmpty()) {
			rowCount++;
			rowWidths.add(0);
			this.memoizedRows = null;
			return;
		}
		for (int j = 0; j < row.size(); j++) {
			add(row.get(j), r, j);
		}
	}

	/**
	 * @return 第 i 行实际写入的宽度（补齐前）
	 */
	public int getRowWidth(int i) {
		return i < rowWidths.size() ? rowWidths.get(i) : 0;
	}

	/**
	 * 各行宽度不一致时返回 true。
	 */
	public boolean isRagged() {
		for (int i = 0; i < rowCount; i++) {
			if (getRowWidth(i) != colCount) {
				return true;
			}
		}
		return false;
	}

	/* memoization of computed row matrix */
	private List<List<Cell>> memoizedRows = null;

	/**
	 * 返回完整的 rowCount x colCount 行矩阵，缺失单元格以 {@link Cell#EMPTY} 填充。
	 */
	public List<List<Cell>> getRows() {
		if (this.memoizedRows == null)
			this.memoizedRows = computeRows();
		return this.memoizedRows;
	}

	private List<List<Cell>> computeRows() {
		List<List<Cell>> rows = new ArrayList<>();
		for (int i = 0; i < rowCount; i++) {
			List<Cell> lastRow = new ArrayList<>();
			for (int j = 0; j < colCount; j++) {
				lastRow.add(getCell(i, j));
			}
			rows.add(Collections.unmodifiableList(lastRow));
		}
		return Collections.unmodifiableList(rows);
	}

	/**
	 * 返回指定位置的单元格，空位置返回 {@link Cell#EMPTY}（不会返回 null）。
	 */
	public Cell getCell(int i, int j) {
		return cells.getOrDefault(new CellPosition(i, j), Cell.EMPTY);
	}

	@Override
	public String toString() {
		return String.format("Table[method=%s,page=%d,rows=%d,cols=%d]", extractionMethod, pageNumber, rowCount,
				colCount);
	}

}

/**
 * 单元格的位置（行, 列），先行后列排序。
 */
class CellPosition implements Comparable<CellPosition> {

	CellPosition(int row, int col) {
		this.row = row;
		this.col = col;
	}

	final int row, col;

	@Override
	public int hashCode() {
		return row + 101 * col;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		CellPosition other = (CellPosition) obj;
		return row == other.row && col == other.col;
	}

	@Override
	public int compareTo(CellPosition other) {
		int rowdiff = row - other.row;
		return rowdiff != 0 ? rowdiff : col - other.col;
	}

}
