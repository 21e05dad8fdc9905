package com.abcft.pdfstruct.core.table;

import com.abcft.pdfstruct.core.model.BoundingBox;
import com.google.common.base.Preconditions;
import org.apache.commons.lang3.StringUtils;

/**
 * A cell rectangle as reported by a table extractor, in top-down page coordinates.
 * It may stand for a merged region without saying so.
 */
public final class RawCell {

    private final BoundingBox box;
    private final String text;

    public RawCell(BoundingBox box, String text) {
        this.box = Preconditions.checkNotNull(box, "box");
        this.text = StringUtils.defaultString(text);
    }

    public BoundingBox getBox() {
        return box;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return String.format("RawCell[\"%s\", %s]", text, box);
    }

}
