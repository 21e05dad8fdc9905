package com.abcft.pdfstruct.core.model;

import com.abcft.pdfstruct.util.FloatUtils;
import com.google.common.base.Preconditions;
import org.apache.commons.math3.util.FastMath;

import java.util.List;
import java.util.Objects;

/**
 * Immutable axis-aligned rectangle in page space.
 *
 * <p>{@code top} grows downward and {@code left} grows rightward. Boxes coming from a source with another
 * axis convention must be normalized before they are constructed; see {@link #fromLTRB(double, double, double, double)}
 * and {@link #fromBottomUp(double, double, double, double, double)}.</p>
 */
public final class BoundingBox {

    /**
     * Result of intersecting two boxes.
     */
    public static final class Overlap {

        private final BoundingBox box;
        private final double box1OverlapProportion;
        private final double box2OverlapProportion;

        Overlap(BoundingBox box, double box1OverlapProportion, double box2OverlapProportion) {
            this.box = box;
            this.box1OverlapProportion = box1OverlapProportion;
            this.box2OverlapProportion = box2OverlapProportion;
        }

        /**
         * @return the intersection rectangle.
         */
        public BoundingBox getBox() {
            return box;
        }

        /**
         * @return the fraction of the first box's area covered by the intersection, in [0, 1].
         */
        public double getBox1OverlapProportion() {
            return box1OverlapProportion;
        }

        /**
         * @return the fraction of the second box's area covered by the intersection, in [0, 1].
         */
        public double getBox2OverlapProportion() {
            return box2OverlapProportion;
        }

        @Override
        public String toString() {
            return String.format("Overlap[%s, p1=%.3f, p2=%.3f]", box, box1OverlapProportion, box2OverlapProportion);
        }
    }

    private final double left;
    private final double top;
    private final double width;
    private final double height;

    public BoundingBox(double left, double top, double width, double height) {
        Preconditions.checkArgument(FloatUtils.isFinite(left, top, width, height),
                "Non-finite bounding box: [%s, %s, %s, %s]", left, top, width, height);
        Preconditions.checkArgument(width >= 0 && height >= 0,
                "Inverted bounding box: width=%s, height=%s", width, height);
        this.left = left;
        this.top = top;
        this.width = width;
        this.height = height;
    }

    public static BoundingBox fromLTRB(double left, double top, double right, double bottom) {
        return new BoundingBox(left, top, right - left, bottom - top);
    }

    /**
     * Builds a box from corner coordinates given with the origin at the bottom-left of the page
     * (PDF user space), flipping the vertical axis.
     *
     * @param x0 left.
     * @param y0 bottom, measured upward.
     * @param x1 right.
     * @param y1 top, measured upward.
     * @param pageHeight height of the page the box lives on.
     * @return the same rectangle in top-down coordinates.
     */
    public static BoundingBox fromBottomUp(double x0, double y0, double x1, double y1, double pageHeight) {
        double width = FastMath.abs(x1 - x0);
        double height = FastMath.abs(y1 - y0);
        double left = FastMath.min(x0, x1);
        double top = pageHeight - FastMath.max(y0, y1);
        return new BoundingBox(left, top, width, height);
    }

    /**
     * @param a first box.
     * @param b second box.
     * @return the overlap of the two boxes, or {@code null} if they do not intersect.
     */
    public static Overlap overlap(BoundingBox a, BoundingBox b) {
        double l = FastMath.max(a.left, b.left);
        double t = FastMath.max(a.top, b.top);
        double r = FastMath.min(a.getRight(), b.getRight());
        double btm = FastMath.min(a.getBottom(), b.getBottom());
        if (r <= l || btm <= t) {
            return null;
        }
        BoundingBox box = fromLTRB(l, t, r, btm);
        double area = box.getArea();
        return new Overlap(box, proportion(area, a.getArea()), proportion(area, b.getArea()));
    }

    private static double proportion(double part, double whole) {
        if (whole <= 0) {
            return 0;
        }
        return FastMath.min(1.0, part / whole);
    }

    /**
     * @param boxes boxes to merge, must not be empty.
     * @return the smallest box containing every input.
     */
    public static BoundingBox merge(List<BoundingBox> boxes) {
        Preconditions.checkArgument(boxes != null && !boxes.isEmpty(), "Cannot merge an empty list of bounding boxes");
        double minX = Double.MAX_VALUE;
        double minY = Double.MAX_VALUE;
        double maxX = -Double.MAX_VALUE;
        double maxY = -Double.MAX_VALUE;
        for (BoundingBox box : boxes) {
            minX = FastMath.min(minX, box.left);
            minY = FastMath.min(minY, box.top);
            maxX = FastMath.max(maxX, box.getRight());
            maxY = FastMath.max(maxY, box.getBottom());
        }
        return fromLTRB(minX, minY, maxX, maxY);
    }

    public double getLeft() {
        return left;
    }

    public double getTop() {
        return top;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public double getRight() {
        return left + width;
    }

    public double getBottom() {
        return top + height;
    }

    public double getArea() {
        return width * height;
    }

    public double getCenterX() {
        return left + width / 2;
    }

    public double getCenterY() {
        return top + height / 2;
    }

    public boolean isEmpty() {
        return width <= 0 || height <= 0;
    }

    public boolean contains(BoundingBox other) {
        return other.left >= left && other.top >= top
                && other.getRight() <= getRight() && other.getBottom() <= getBottom();
    }

    public boolean nearlyContains(BoundingBox other, double epsilon) {
        return FloatUtils.fgte(other.left, left, epsilon)
                && FloatUtils.fgte(other.top, top, epsilon)
                && FloatUtils.flte(other.getRight(), getRight(), epsilon)
                && FloatUtils.flte(other.getBottom(), getBottom(), epsilon);
    }

    public boolean nearlyEquals(BoundingBox other, double epsilon) {
        return FloatUtils.feq(left, other.left, epsilon)
                && FloatUtils.feq(top, other.top, epsilon)
                && FloatUtils.feq(getRight(), other.getRight(), epsilon)
                && FloatUtils.feq(getBottom(), other.getBottom(), epsilon);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BoundingBox)) {
            return false;
        }
        BoundingBox other = (BoundingBox) o;
        return Double.compare(left, other.left) == 0
                && Double.compare(top, other.top) == 0
                && Double.compare(width, other.width) == 0
                && Double.compare(height, other.height) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, top, width, height);
    }

    @Override
    public String toString() {
        return String.format("BoundingBox[l=%.2f,r=%.2f,t=%.2f,b=%.2f; w=%.2f,h=%.2f]",
                left, getRight(), top, getBottom(), width, height);
    }

}
