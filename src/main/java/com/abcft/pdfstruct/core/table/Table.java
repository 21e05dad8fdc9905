package com.abcft.pdfstruct.core.table;

import com.abcft.pdfstruct.core.model.BoundingBox;
import com.abcft.pdfstruct.core.model.Element;
import com.google.common.collect.ImmutableList;
import com.google.gson.JsonArray;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;

import java.util.List;

/**
 * A reconstructed table: rows of cells over a canonical grid of {@link #getColumnCount()} columns.
 */
public class Table extends Element {

    /**
     * 表明此单元格的已与左侧单元格合并。
     */
    public static final String LEFT_MERGED_TEXT = "←";
    /**
     * 表明此单元格的已与上方单元格合并。
     */
    public static final String UP_MERGED_TEXT = "↑";
    /**
     * 表明此单元格的已与左上方单元格合并。
     */
    public static final String UP_LEFT_MERGED_TEXT = "↖";

    private final int pageNumber;
    private final int columnCount;
    private final List<TableRow> rows;

    public Table(BoundingBox box, int pageNumber, int columnCount, List<TableRow> rows) {
        super(box);
        this.pageNumber = pageNumber;
        this.columnCount = columnCount;
        this.rows = ImmutableList.copyOf(rows);
    }

    public int getPageNumber() {
        return pageNumber;
    }

    public List<TableRow> getRows() {
        return rows;
    }

    public TableRow getRow(int index) {
        return rows.get(index);
    }

    public int getRowCount() {
        return rows.size();
    }

    public int getColumnCount() {
        return columnCount;
    }

    @Override
    public List<TableRow> getChildren() {
        return rows;
    }

    /**
     * @return the cell covering the given grid position, or {@code null} if no cell covers it.
     */
    public TableCell getCell(int row, int col) {
        // 跨行单元格只会出现在起始行及之前
        for (int r = Math.min(row, rows.size() - 1); r >= 0; --r) {
            for (TableCell cell : rows.get(r).getCells()) {
                if (cell.containsPosition(row, col)) {
                    return cell;
                }
            }
        }
        return null;
    }

    /**
     * 获取表格在给定行/列时的适当文本。
     *
     * <p>对于合并单元格，将会输出 {@value #LEFT_MERGED_TEXT}、{@value #UP_MERGED_TEXT}、{@value #UP_LEFT_MERGED_TEXT}等符号。</p>
     * <p>没有单元格覆盖的位置返回 {@code null}。</p>
     *
     * @param row grid row index.
     * @param col grid column index.
     * @return the text of the cell, a merge marker, or {@code null}.
     */
    public String getTextAt(int row, int col) {
        TableCell cell = getCell(row, col);
        if (cell == null) {
            return null;
        } else if (cell.isPivot(row, col)) {
            return cell.getText();
        } else if (cell.isLeftMerged(row, col)) {
            return LEFT_MERGED_TEXT;
        } else if (cell.isUpMerged(row, col)) {
            return UP_MERGED_TEXT;
        } else {
            return UP_LEFT_MERGED_TEXT;
        }
    }

    @Override
    public String getType() {
        return "table";
    }

    @Override
    public JsonObject toDocument(boolean detail) {
        JsonObject obj = super.toDocument(detail);
        obj.addProperty("pageNumber", pageNumber);
        obj.addProperty("rowCount", getRowCount());
        obj.addProperty("columnCount", columnCount);
        obj.add("content", toDocuments(rows, detail));
        if (detail) {
            JsonArray grid = new JsonArray();
            for (int r = 0; r < rows.size(); ++r) {
                JsonArray line = new JsonArray();
                for (int c = 0; c < columnCount; ++c) {
                    String text = getTextAt(r, c);
                    if (text == null) {
                        line.add(JsonNull.INSTANCE);
                    } else {
                        line.add(text);
                    }
                }
                grid.add(line);
            }
            obj.add("grid", grid);
        }
        return obj;
    }

    @Override
    public String toString() {
        return String.format("Table[page=%d, %dx%d, %s]", pageNumber, getRowCount(), columnCount, getBox());
    }

}
