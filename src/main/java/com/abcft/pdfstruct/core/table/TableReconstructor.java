package com.abcft.pdfstruct.core.table;

import com.abcft.pdfstruct.core.ProcessContext;
import com.abcft.pdfstruct.core.model.BoundingBox;
import com.abcft.pdfstruct.core.model.Element;
import com.abcft.pdfstruct.core.model.Font;
import com.abcft.pdfstruct.core.model.Page;
import com.abcft.pdfstruct.core.model.Paragraph;
import com.abcft.pdfstruct.core.model.Word;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.math3.util.FastMath;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rebuilds the structure of a table from the raw cell rectangles of a table extractor.
 *
 * <p>The raw grid does not say which cells are merged. The column grid is taken from the finest row (the
 * row with the most cells) alone; the row grid gets one band per raw row, delimited by the shortest cell
 * of that row. A cell spans every grid interval it covers by more than the configured threshold, so edges
 * of merged cells that jitter around a boundary do not create intervals of their own. A merged region
 * that the extractor repeats in later rows is absorbed instead of being emitted again.</p>
 *
 * <p>The reconstructor is stateless: it never touches the page, it only tells which page elements the
 * table replaces.</p>
 */
public class TableReconstructor {

    private static final class PendingCell {
        final RawCell raw;
        int row;
        final int col;
        final int rowspan;
        final int colspan;
        final List<Element> content = new ArrayList<>();

        PendingCell(RawCell raw, int row, int col, int rowspan, int colspan) {
            this.raw = raw;
            this.row = row;
            this.col = col;
            this.rowspan = rowspan;
            this.colspan = colspan;
        }

        BoundingBox getBox() {
            return raw.getBox();
        }
    }

    private static final class Layout {
        final List<PendingCell> cells = new ArrayList<>();
        final PendingCell[][] occupied;
        // 降级的网格行
        final Set<Integer> degradedRows = new HashSet<>();

        Layout(int rowCount, int columnCount) {
            this.occupied = new PendingCell[rowCount][columnCount];
        }
    }

    private final TableDetectionParameters params;

    public TableReconstructor(TableDetectionParameters params) {
        this.params = params;
    }

    public TableReconstruction reconstruct(RawTable raw, Page page, ProcessContext context) {
        return reconstruct(raw, page.getPageNumber(), page.getElements(), context);
    }

    /**
     * @param raw the raw table.
     * @param pageNumber the page the table lives on.
     * @param pageElements the current top level elements of that page.
     * @param context diagnostics sink.
     * @return the table and the elements it subsumes, or {@code null} if the raw table is unusable or
     * already represented on the page.
     */
    public TableReconstruction reconstruct(RawTable raw, int pageNumber, List<Element> pageElements,
                                           ProcessContext context) {
        List<RawCell> allCells = raw.getAllCells();
        if (allCells.isEmpty()) {
            context.warn("Page {}: table discarded, no rows or cells", pageNumber);
            return null;
        }
        for (RawCell cell : allCells) {
            if (cell.getBox().isEmpty()) {
                context.warn("Page {}: table discarded, degenerate cell {}", pageNumber, cell);
                return null;
            }
        }

        CanonicalGrid columns = buildColumnGrid(raw);
        CanonicalGrid rows = buildRowGrid(raw);
        if (columns.size() == 0 || rows.size() == 0) {
            context.warn("Page {}: table discarded, {} columns x {} rows", pageNumber, columns.size(), rows.size());
            return null;
        }

        BoundingBox tableBox = BoundingBox.merge(allCells.stream().map(RawCell::getBox).collect(Collectors.toList()));
        Table existing = findExistingTable(tableBox, pageElements);
        if (existing != null) {
            context.debug("Page {}: table at {} is already represented by {}", pageNumber, tableBox, existing);
            return null;
        }

        Layout layout = layoutCells(raw, columns, rows, pageNumber, context);
        rows = checkRowCoverage(layout, rows, columns.size(), pageNumber, context);
        if (rows.size() == 0) {
            context.warn("Page {}: table discarded, no raw row landed in the grid", pageNumber);
            return null;
        }
        List<Element> subsumed = findSubsumedElements(tableBox, pageElements);
        assignContent(subsumed, layout.cells);

        Table table = assemble(tableBox, pageNumber, columns, rows, layout.cells);
        context.debug("Page {}: reconstructed {}, columns {}, rows {}, {} subsumed elements",
                pageNumber, table, columns, rows, subsumed.size());
        return new TableReconstruction(table, subsumed, layout.degradedRows.size());
    }

    // 以单元格最多的一行作为基准行，列边界只取基准行
    private CanonicalGrid buildColumnGrid(RawTable raw) {
        List<RawCell> reference = Collections.emptyList();
        for (List<RawCell> row : raw.getRows()) {
            if (row.size() > reference.size()) {
                reference = row;
            }
        }
        List<Double> edges = new ArrayList<>(reference.size() + 1);
        double right = -Double.MAX_VALUE;
        for (RawCell cell : reference) {
            edges.add(cell.getBox().getLeft());
            right = FastMath.max(right, cell.getBox().getRight());
        }
        if (!reference.isEmpty()) {
            edges.add(right);
        }
        return CanonicalGrid.fromEdges(edges, params.boundaryTolerance);
    }

    // 每个原始行一个行带，由该行最矮的单元格确定
    private CanonicalGrid buildRowGrid(RawTable raw) {
        List<Double> edges = new ArrayList<>(raw.getRowCount() + 1);
        double bottom = -Double.MAX_VALUE;
        for (List<RawCell> row : raw.getRows()) {
            RawCell shortest = null;
            for (RawCell cell : row) {
                if (shortest == null || cell.getBox().getHeight() < shortest.getBox().getHeight()) {
                    shortest = cell;
                }
            }
            if (shortest != null) {
                edges.add(shortest.getBox().getTop());
                bottom = FastMath.max(bottom, shortest.getBox().getBottom());
            }
        }
        if (!edges.isEmpty()) {
            edges.add(bottom);
        }
        return CanonicalGrid.fromEdges(edges, params.boundaryTolerance);
    }

    private Layout layoutCells(RawTable raw, CanonicalGrid columns, CanonicalGrid rows, int pageNumber,
                               ProcessContext context) {
        int columnCount = columns.size();
        Layout layout = new Layout(rows.size(), columnCount);
        PendingCell[][] occupied = layout.occupied;

        for (int r = 0; r < raw.getRowCount(); ++r) {
            List<RawCell> rawRow = new ArrayList<>(raw.getRows().get(r));
            if (rawRow.isEmpty()) {
                continue;
            }
            rawRow.sort(Comparator.comparingDouble(c -> c.getBox().getLeft()));
            int rowIndex = locateRow(rawRow, rows);
            if (rowIndex < 0) {
                context.warn("Page {}: raw row {} does not cover any grid row, skipped", pageNumber, r);
                continue;
            }

            List<PendingCell> candidates = new ArrayList<>();
            boolean valid = true;
            for (RawCell cell : rawRow) {
                BoundingBox box = cell.getBox();
                if (isDuplicate(box, layout.cells) || isDuplicate(box, candidates)) {
                    continue;
                }
                CanonicalGrid.Span colSpan = columns.span(box.getLeft(), box.getRight(), params.columnCoverageThreshold);
                CanonicalGrid.Span rowSpan = rows.span(box.getTop(), box.getBottom(), params.rowCoverageThreshold);
                if (!colSpan.isEmpty() && !rowSpan.isEmpty() && rowSpan.start < rowIndex
                        && isClaimed(occupied[rowIndex], colSpan)) {
                    // 上方跨行单元格的重复
                    continue;
                }
                int rowspan = rowSpan.end() - rowIndex;
                if (colSpan.isEmpty() || rowSpan.isEmpty() || rowspan < 1) {
                    valid = false;
                    candidates.add(new PendingCell(cell, rowIndex, colSpan.start, 1, 1));
                    continue;
                }
                candidates.add(new PendingCell(cell, rowIndex, colSpan.start, rowspan, colSpan.count));
            }

            if (valid && fits(candidates, occupied, rowIndex, columnCount)) {
                for (PendingCell cell : candidates) {
                    for (int i = cell.row; i < cell.row + cell.rowspan; ++i) {
                        for (int j = cell.col; j < cell.col + cell.colspan; ++j) {
                            occupied[i][j] = cell;
                        }
                    }
                }
                layout.cells.addAll(candidates);
            } else {
                layout.degradedRows.add(rowIndex);
                context.warn("Page {}: spans of raw row {} do not add up to {} columns, keeping raw cells",
                        pageNumber, r, columnCount);
                for (int i = 0; i < candidates.size(); ++i) {
                    PendingCell cell = candidates.get(i);
                    int col = cell.col >= 0 ? cell.col : i;
                    if (col < columnCount && occupied[rowIndex][col] == null) {
                        occupied[rowIndex][col] = cell;
                    }
                    layout.cells.add(new PendingCell(cell.raw, rowIndex, col, 1, 1));
                }
            }
        }
        return layout;
    }

    /**
     * Drops grid rows that no cell landed in and flags rows that still leave columns uncovered.
     *
     * @return the row grid, compacted when rows were dropped; cells are re-indexed accordingly.
     */
    private static CanonicalGrid checkRowCoverage(Layout layout, CanonicalGrid rows, int columnCount,
                                                  int pageNumber, ProcessContext context) {
        boolean[] landed = new boolean[rows.size()];
        for (PendingCell cell : layout.cells) {
            landed[cell.row] = true;
        }
        List<Integer> kept = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); ++i) {
            int covered = 0;
            for (PendingCell slot : layout.occupied[i]) {
                if (slot != null) {
                    covered++;
                }
            }
            if (covered == 0 && !landed[i]) {
                context.warn("Page {}: grid row {} holds no cell, merged into its neighbour", pageNumber, i);
                continue;
            }
            if (covered < columnCount && layout.degradedRows.add(i)) {
                context.warn("Page {}: {} of {} columns uncovered in grid row {}",
                        pageNumber, columnCount - covered, columnCount, i);
            }
            kept.add(i);
        }
        if (kept.size() == rows.size()) {
            return rows;
        }
        for (PendingCell cell : layout.cells) {
            cell.row = kept.indexOf(cell.row);
        }
        return rows.keepIntervals(kept);
    }

    /**
     * The grid row of a raw row is the one where its shortest cell begins.
     */
    private int locateRow(List<RawCell> rawRow, CanonicalGrid rows) {
        int rowIndex = -1;
        double minHeight = Double.MAX_VALUE;
        for (RawCell cell : rawRow) {
            BoundingBox box = cell.getBox();
            CanonicalGrid.Span span = rows.span(box.getTop(), box.getBottom(), params.rowCoverageThreshold);
            if (!span.isEmpty() && box.getHeight() < minHeight) {
                minHeight = box.getHeight();
                rowIndex = span.start;
            }
        }
        return rowIndex;
    }

    private boolean isDuplicate(BoundingBox box, List<PendingCell> cells) {
        for (PendingCell cell : cells) {
            if (cell.getBox().nearlyEquals(box, params.boundaryTolerance)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isClaimed(PendingCell[] rowSlots, CanonicalGrid.Span colSpan) {
        for (int j = colSpan.start; j < colSpan.end(); ++j) {
            if (rowSlots[j] == null) {
                return false;
            }
        }
        return true;
    }

    /**
     * Checks the row invariant: the new cells take free slots only, and together with the slots already
     * claimed from earlier rows they cover every column exactly once.
     */
    private static boolean fits(List<PendingCell> candidates, PendingCell[][] occupied, int rowIndex, int columnCount) {
        int covered = 0;
        for (PendingCell slot : occupied[rowIndex]) {
            if (slot != null) {
                covered++;
            }
        }
        Set<Long> taken = new HashSet<>();
        for (PendingCell cell : candidates) {
            covered += cell.colspan;
            for (int i = cell.row; i < cell.row + cell.rowspan; ++i) {
                for (int j = cell.col; j < cell.col + cell.colspan; ++j) {
                    if (occupied[i][j] != null || !taken.add(((long) i << 32) | j)) {
                        return false;
                    }
                }
            }
        }
        return covered == columnCount;
    }

    private Table findExistingTable(BoundingBox tableBox, List<Element> pageElements) {
        for (Element element : pageElements) {
            if (!(element instanceof Table)) {
                continue;
            }
            BoundingBox.Overlap overlap = BoundingBox.overlap(tableBox, element.getBox());
            if (overlap != null && (overlap.getBox1OverlapProportion() > params.subsumptionThreshold
                    || overlap.getBox2OverlapProportion() > params.subsumptionThreshold)) {
                return (Table) element;
            }
        }
        return null;
    }

    private List<Element> findSubsumedElements(BoundingBox tableBox, List<Element> pageElements) {
        List<Element> subsumed = new ArrayList<>();
        for (Element element : pageElements) {
            if (element instanceof Table) {
                continue;
            }
            if (tableBox.nearlyContains(element.getBox(), params.boundaryTolerance)) {
                subsumed.add(element);
                continue;
            }
            BoundingBox.Overlap overlap = BoundingBox.overlap(element.getBox(), tableBox);
            if (overlap != null && overlap.getBox1OverlapProportion() > params.subsumptionThreshold) {
                subsumed.add(element);
            }
        }
        return subsumed;
    }

    // 段落按单词拆分后分配到各单元格
    private static void assignContent(List<Element> subsumed, List<PendingCell> cells) {
        if (cells.isEmpty()) {
            return;
        }
        for (Element element : subsumed) {
            List<? extends Element> pieces = element instanceof Paragraph
                    ? ((Paragraph) element).getWords()
                    : Collections.singletonList(element);
            for (Element piece : pieces) {
                bestCell(piece.getBox(), cells).content.add(piece);
            }
        }
    }

    private static PendingCell bestCell(BoundingBox box, List<PendingCell> cells) {
        PendingCell best = null;
        double bestProportion = 0;
        for (PendingCell cell : cells) {
            BoundingBox.Overlap overlap = BoundingBox.overlap(box, cell.getBox());
            if (overlap != null && overlap.getBox1OverlapProportion() > bestProportion) {
                bestProportion = overlap.getBox1OverlapProportion();
                best = cell;
            }
        }
        if (best != null) {
            return best;
        }
        double bestDistance = Double.MAX_VALUE;
        for (PendingCell cell : cells) {
            double dx = cell.getBox().getCenterX() - box.getCenterX();
            double dy = cell.getBox().getCenterY() - box.getCenterY();
            double distance = FastMath.sqrt(dx * dx + dy * dy);
            if (distance < bestDistance) {
                bestDistance = distance;
                best = cell;
            }
        }
        return best;
    }

    private static Table assemble(BoundingBox tableBox, int pageNumber, CanonicalGrid columns, CanonicalGrid rows,
                                  List<PendingCell> cells) {
        List<List<TableCell>> rowCells = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); ++i) {
            rowCells.add(new ArrayList<>());
        }
        for (PendingCell cell : cells) {
            List<Element> content = cell.content;
            if (content.isEmpty() && StringUtils.isNotBlank(cell.raw.getText())) {
                content = Collections.singletonList(
                        new Word(cell.getBox(), cell.raw.getText().trim(), Font.UNDEFINED));
            }
            rowCells.get(cell.row).add(new TableCell(cell.getBox(), cell.row, cell.col,
                    cell.rowspan, cell.colspan, content));
        }

        List<TableRow> tableRows = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); ++i) {
            List<TableCell> line = rowCells.get(i);
            line.sort(Comparator.comparingInt(TableCell::getCol).thenComparingDouble(TableCell::getLeft));
            BoundingBox rowBox = BoundingBox.fromLTRB(tableBox.getLeft(), rows.boundary(i),
                    tableBox.getRight(), rows.boundary(i + 1));
            tableRows.add(new TableRow(rowBox, i, line));
        }
        return new Table(tableBox, pageNumber, columns.size(), tableRows);
    }

}
