package com.abcft.pdfstruct.core.table;

import com.google.common.primitives.Doubles;
import org.apache.commons.math3.util.FastMath;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Sorted boundary positions along one axis of a table; {@code n + 1} boundaries delimit {@code n} intervals.
 */
final class CanonicalGrid {

    /**
     * Run of intervals covered by a cell.
     */
    static final class Span {

        static final Span NONE = new Span(-1, 0);

        final int start;
        final int count;

        Span(int start, int count) {
            this.start = start;
            this.count = count;
        }

        boolean isEmpty() {
            return count <= 0;
        }

        int end() {
            return start + count;
        }

        @Override
        public String toString() {
            return isEmpty() ? "Span[]" : "Span[" + start + ", " + end() + ")";
        }
    }

    private final double[] boundaries;

    private CanonicalGrid(List<Double> boundaries) {
        this.boundaries = Doubles.toArray(boundaries);
    }

    /**
     * Clusters edge positions lying within {@code tolerance} of each other, each cluster yielding its mean.
     */
    static CanonicalGrid fromEdges(Collection<Double> edges, double tolerance) {
        return new CanonicalGrid(cluster(edges, tolerance));
    }

    private static List<Double> cluster(Collection<Double> edges, double tolerance) {
        List<Double> sorted = new ArrayList<>(edges);
        Collections.sort(sorted);
        List<Double> result = new ArrayList<>();
        double sum = 0;
        int count = 0;
        double last = 0;
        for (Double edge : sorted) {
            if (count > 0 && edge - last > tolerance) {
                result.add(sum / count);
                sum = 0;
                count = 0;
            }
            sum += edge;
            count++;
            last = edge;
        }
        if (count > 0) {
            result.add(sum / count);
        }
        return result;
    }

    /**
     * @return the number of intervals, 0 when fewer than two boundaries were found.
     */
    int size() {
        return FastMath.max(0, boundaries.length - 1);
    }

    double boundary(int index) {
        return boundaries[index];
    }

    /**
     * Keeps the given intervals, listed in ascending order. A dropped interval is absorbed by the kept
     * interval before it; dropped intervals before the first kept one are absorbed by that one.
     */
    CanonicalGrid keepIntervals(List<Integer> kept) {
        if (kept.isEmpty()) {
            return new CanonicalGrid(Collections.emptyList());
        }
        List<Double> result = new ArrayList<>(kept.size() + 1);
        result.add(boundaries[0]);
        for (int k = 1; k < kept.size(); ++k) {
            result.add(boundaries[kept.get(k)]);
        }
        result.add(boundaries[boundaries.length - 1]);
        return new CanonicalGrid(result);
    }

    /**
     * Counts the intervals that the segment {@code [from, to]} covers by more than {@code threshold} of
     * the interval's own length.
     *
     * @return the covered run, or {@link Span#NONE}. Covered intervals of a segment are contiguous.
     */
    Span span(double from, double to, double threshold) {
        int start = -1;
        int count = 0;
        for (int i = 0; i < size(); ++i) {
            double lo = boundaries[i];
            double hi = boundaries[i + 1];
            double length = hi - lo;
            if (length <= 0) {
                continue;
            }
            double overlap = FastMath.max(0, FastMath.min(to, hi) - FastMath.max(from, lo));
            if (overlap / length > threshold) {
                if (start < 0) {
                    start = i;
                }
                count++;
            }
        }
        return start < 0 ? Span.NONE : new Span(start, count);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("CanonicalGrid[");
        for (int i = 0; i < boundaries.length; ++i) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(String.format("%.2f", boundaries[i]));
        }
        return sb.append(']').toString();
    }

}
