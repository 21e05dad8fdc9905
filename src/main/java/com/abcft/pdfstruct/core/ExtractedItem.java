package com.abcft.pdfstruct.core;

import com.google.gson.JsonObject;

/**
 * Item of the document model that can be dumped as JSON.
 */
public interface ExtractedItem {

    /**
     * Dump an extracted item as a JSON {@link JsonObject}.
     *
     * @return a JSON {@link JsonObject} with minimal information.
     */
    default JsonObject toDocument() {
        return toDocument(false);
    }

    /**
     * Dump an extracted item as a JSON {@link JsonObject}.
     *
     * @param detail whether detailed data (fonts, glyphs) should be included.
     *
     * @return a JSON {@link JsonObject} with/without detailed information.
     */
    JsonObject toDocument(boolean detail);

}
