package com.abcft.pdfstruct.core.table;

import com.abcft.pdfstruct.core.model.BoundingBox;
import com.abcft.pdfstruct.core.model.Element;
import com.google.common.collect.ImmutableList;
import com.google.gson.JsonObject;

import java.util.List;

/**
 * A table row: the cells that begin in it, left to right.
 *
 * <p>Cells of earlier rows whose rowspan reaches into this row are not repeated here.</p>
 */
public class TableRow extends Element {

    private final int index;
    private final List<TableCell> cells;

    public TableRow(BoundingBox box, int index, List<TableCell> cells) {
        super(box);
        this.index = index;
        this.cells = ImmutableList.copyOf(cells);
    }

    public int getIndex() {
        return index;
    }

    public List<TableCell> getCells() {
        return cells;
    }

    @Override
    public List<TableCell> getChildren() {
        return cells;
    }

    /**
     * @return the sum of the colspans of the cells beginning in this row.
     */
    public int getColspanSum() {
        int sum = 0;
        for (TableCell cell : cells) {
            sum += cell.getColspan();
        }
        return sum;
    }

    @Override
    public String getType() {
        return "row";
    }

    @Override
    public JsonObject toDocument(boolean detail) {
        JsonObject obj = super.toDocument(detail);
        obj.addProperty("index", index);
        obj.add("content", toDocuments(cells, detail));
        return obj;
    }

}
