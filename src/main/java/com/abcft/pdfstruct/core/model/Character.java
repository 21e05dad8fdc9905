package com.abcft.pdfstruct.core.model;

import com.google.common.base.Preconditions;
import com.google.gson.JsonObject;

/**
 * A single glyph.
 */
public class Character extends Element implements TextContainer {

    private final String content;
    private final Font font;

    public Character(BoundingBox box, String content, Font font) {
        super(box);
        this.content = Preconditions.checkNotNull(content, "content");
        this.font = font != null ? font : Font.UNDEFINED;
    }

    public String getContent() {
        return content;
    }

    public Font getFont() {
        return font;
    }

    @Override
    public String getText() {
        return content;
    }

    @Override
    public String getType() {
        return "character";
    }

    @Override
    public JsonObject toDocument(boolean detail) {
        JsonObject obj = super.toDocument(detail);
        obj.addProperty("content", content);
        obj.add("font", font.toDocument());
        return obj;
    }

    @Override
    public String toString() {
        return content;
    }

}
