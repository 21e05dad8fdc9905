package com.abcft.pdfstruct.core.table;

import com.abcft.pdfstruct.core.model.Document;
import com.abcft.pdfstruct.core.model.Page;

import java.io.IOException;
import java.util.List;

/**
 * Capability detecting the tables of a page, implemented by wrappers around third-party table tools.
 *
 * <p>Implementations may be called concurrently for different pages of the same document. Timeouts of
 * the underlying tool are the implementation's business and are reported as an {@link IOException}.</p>
 */
public interface TableExtractor {

    /**
     * @param document the document being processed.
     * @param page the page to inspect.
     * @return the raw tables found on the page, in top-down page coordinates; an empty list when the page
     * has no table.
     * @throws IOException if the tool failed or returned a malformed payload.
     */
    List<RawTable> detectTables(Document document, Page page) throws IOException;

}
