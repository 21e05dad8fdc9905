package com.abcft.pdfstruct.core.table;

import com.abcft.pdfstruct.core.model.Element;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Outcome of reconstructing one raw table: the table and the page elements it replaces.
 */
public final class TableReconstruction {

    private final Table table;
    private final List<Element> subsumedElements;
    private final int degradedRowCount;

    TableReconstruction(Table table, List<Element> subsumedElements, int degradedRowCount) {
        this.table = table;
        this.subsumedElements = ImmutableList.copyOf(subsumedElements);
        this.degradedRowCount = degradedRowCount;
    }

    public Table getTable() {
        return table;
    }

    /**
     * @return top level page elements covered by the table, in page order.
     */
    public List<Element> getSubsumedElements() {
        return subsumedElements;
    }

    /**
     * @return number of raw rows emitted with uncorrected spans.
     */
    public int getDegradedRowCount() {
        return degradedRowCount;
    }

    public boolean isDegraded() {
        return degradedRowCount > 0;
    }

}
