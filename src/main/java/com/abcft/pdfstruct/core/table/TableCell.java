package com.abcft.pdfstruct.core.table;

import com.abcft.pdfstruct.core.model.BoundingBox;
import com.abcft.pdfstruct.core.model.Element;
import com.abcft.pdfstruct.core.model.TextContainer;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.gson.JsonObject;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A reconstructed table cell, anchored at its top-left grid position.
 */
public class TableCell extends Element implements TextContainer {

    private final int row;
    private final int col;
    private final int rowspan;
    private final int colspan;
    private final List<Element> content;

    public TableCell(BoundingBox box, int row, int col, int rowspan, int colspan, List<? extends Element> content) {
        super(box);
        Preconditions.checkArgument(rowspan >= 1 && colspan >= 1, "Spans must be >= 1: %sx%s", rowspan, colspan);
        this.row = row;
        this.col = col;
        this.rowspan = rowspan;
        this.colspan = colspan;
        this.content = ImmutableList.copyOf(content);
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    public int getRowspan() {
        return rowspan;
    }

    public int getColspan() {
        return colspan;
    }

    public List<Element> getContent() {
        return content;
    }

    @Override
    public List<Element> getChildren() {
        return content;
    }

    public boolean isPivot(int row, int col) {
        return this.row == row && this.col == col;
    }

    public boolean isUpMerged(int row, int col) {
        return this.row < row && row < this.row + rowspan
                && this.col == col;
    }

    public boolean isLeftMerged(int row, int col) {
        return this.row == row
                && this.col < col && col < this.col + colspan;
    }

    public boolean isUpLeftMerged(int row, int col) {
        return this.row < row && row < this.row + rowspan
                && this.col < col && col < this.col + colspan;
    }

    public boolean containsPosition(int row, int col) {
        return this.row <= row && row < this.row + rowspan
                && this.col <= col && col < this.col + colspan;
    }

    @Override
    public String getText() {
        return content.stream()
                .filter(e -> e instanceof TextContainer)
                .map(e -> ((TextContainer) e).getText())
                .collect(Collectors.joining(" "))
                .trim();
    }

    @Override
    public String getType() {
        return "cell";
    }

    @Override
    public JsonObject toDocument(boolean detail) {
        JsonObject obj = super.toDocument(detail);
        obj.addProperty("row", row);
        obj.addProperty("col", col);
        obj.addProperty("rowspan", rowspan);
        obj.addProperty("colspan", colspan);
        obj.add("content", toDocuments(content, detail));
        return obj;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%s[%d, %d]", getClass().getSimpleName(), row, col));
        sb.append(" = \"").append(getText()).append('"');
        if (rowspan != 1 || colspan != 1) {
            sb.append(", ").append(rowspan).append('x').append(colspan);
        }
        return sb.toString();
    }

}
