package com.abcft.pdfstruct.core.model;

import com.google.gson.JsonObject;
import org.apache.commons.lang3.StringUtils;

/**
 * An image placed on a page. The file itself is owned by whatever extracted it.
 */
public class Image extends Element {

    private final String src;

    public Image(BoundingBox box, String src) {
        super(box);
        this.src = StringUtils.defaultString(src);
    }

    public String getSrc() {
        return src;
    }

    @Override
    public String getType() {
        return "image";
    }

    @Override
    public JsonObject toDocument(boolean detail) {
        JsonObject obj = super.toDocument(detail);
        obj.addProperty("src", src);
        return obj;
    }

}
