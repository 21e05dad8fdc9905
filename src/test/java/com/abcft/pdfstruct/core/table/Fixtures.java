package com.abcft.pdfstruct.core.table;

import com.abcft.pdfstruct.core.gson.DocumentJsonReader;
import com.abcft.pdfstruct.core.model.Document;
import com.abcft.pdfstruct.core.model.Page;
import org.apache.commons.io.IOUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Loads the JSON fixtures under {@code table-reconstruction/}.
 */
final class Fixtures {

    static final double PAGE_HEIGHT = 792;
    static final String PAGE_DOCUMENT = "test-table-reconstruction.json";

    private Fixtures() {}

    static String read(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/table-reconstruction/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("No fixture " + name);
            }
            return IOUtils.toString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static List<RawTable> rawTables(String name) throws IOException {
        return new RawTableParser(CoordinateSystem.BOTTOM_UP, PAGE_HEIGHT).parse(read(name));
    }

    static RawTable rawTable(String name) throws IOException {
        return rawTables(name).get(0);
    }

    static Document document() throws IOException {
        return DocumentJsonReader.readDocument(read(PAGE_DOCUMENT));
    }

    static Page page() throws IOException {
        return document().getPage(1);
    }

}
