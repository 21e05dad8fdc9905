package com.abcft.pdfstruct.core.table;

import com.abcft.pdfstruct.core.model.BoundingBox;

/**
 * Vertical axis convention of the boxes in an extractor payload.
 */
public enum CoordinateSystem {

    /**
     * {@code [x0, y0, x1, y1]} = left, top, right, bottom with y growing downward.
     */
    TOP_DOWN {
        @Override
        public BoundingBox toBox(double x0, double y0, double x1, double y1, double pageHeight) {
            return BoundingBox.fromLTRB(Math.min(x0, x1), Math.min(y0, y1), Math.max(x0, x1), Math.max(y0, y1));
        }
    },

    /**
     * {@code [x0, y0, x1, y1]} = left, bottom, right, top with the origin at the bottom-left of the page
     * (PDF user space, pdfminer and camelot output).
     */
    BOTTOM_UP {
        @Override
        public BoundingBox toBox(double x0, double y0, double x1, double y1, double pageHeight) {
            return BoundingBox.fromBottomUp(x0, y0, x1, y1, pageHeight);
        }
    };

    public abstract BoundingBox toBox(double x0, double y0, double x1, double y1, double pageHeight);

}
