package com.abcft.pdfstruct.core.table;

import com.google.common.collect.ImmutableList;

import java.util.ArrayList;
import java.util.List;

/**
 * One table as reported by a table extractor: raw rows of raw cells, without span information.
 */
public final class RawTable {

    private final List<List<RawCell>> rows;

    public RawTable(List<? extends List<RawCell>> rows) {
        ImmutableList.Builder<List<RawCell>> builder = ImmutableList.builder();
        for (List<RawCell> row : rows) {
            builder.add(ImmutableList.copyOf(row));
        }
        this.rows = builder.build();
    }

    public List<List<RawCell>> getRows() {
        return rows;
    }

    public int getRowCount() {
        return rows.size();
    }

    public List<RawCell> getAllCells() {
        List<RawCell> cells = new ArrayList<>();
        rows.forEach(cells::addAll);
        return cells;
    }

    public boolean isEmpty() {
        for (List<RawCell> row : rows) {
            if (!row.isEmpty()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return String.format("RawTable[%d rows, %d cells]", rows.size(), getAllCells().size());
    }

}
