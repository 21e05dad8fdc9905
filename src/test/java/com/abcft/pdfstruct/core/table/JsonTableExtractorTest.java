package com.abcft.pdfstruct.core.table;

import com.abcft.pdfstruct.core.MalformedDocumentException;
import com.abcft.pdfstruct.core.model.BoundingBox;
import com.abcft.pdfstruct.core.model.Document;
import com.abcft.pdfstruct.core.model.Page;
import org.apache.commons.io.FileUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonTableExtractorTest {

    @TempDir
    File dir;

    private final Page page1 = new Page(1, Collections.emptyList(), new BoundingBox(0, 0, 612, 792));
    private final Page page2 = new Page(2, Collections.emptyList(), new BoundingBox(0, 0, 612, 792));
    private final Document document = new Document(Arrays.asList(page1, page2));

    @Test
    void shouldReadPayloadFilesByPageNumber() throws Exception {
        FileUtils.writeStringToFile(new File(dir, "tables-2.json"),
                Fixtures.read("one-cell-merged.json"), StandardCharsets.UTF_8);
        JsonTableExtractor extractor = JsonTableExtractor.fromDirectory(dir, CoordinateSystem.BOTTOM_UP);

        assertThat(extractor.detectTables(document, page1)).isEmpty();
        assertThat(extractor.detectTables(document, page2)).singleElement()
                .satisfies(table -> assertThat(table.getRowCount()).isEqualTo(3));
    }

    @Test
    void shouldReportMalformedFile() throws Exception {
        FileUtils.writeStringToFile(new File(dir, "tables-1.json"), "{not json", StandardCharsets.UTF_8);
        JsonTableExtractor extractor = JsonTableExtractor.fromDirectory(dir, CoordinateSystem.BOTTOM_UP);

        assertThatThrownBy(() -> extractor.detectTables(document, page1))
                .isInstanceOf(MalformedDocumentException.class);
    }

    @Test
    void shouldReadPayloadInConfiguredCoordinateSystem() throws Exception {
        String payload = "[[[{\"bbox\": [50, 100, 150, 130], \"text\": \"a\"}]]]";
        TableDetectionParameters topDown = new TableDetectionParameters.Builder(
                Collections.singletonMap("table.coordinateSystem", "TOP_DOWN")).build();

        RawCell asIs = JsonTableExtractor.ofPayload(payload, topDown)
                .detectTables(document, page1).get(0).getAllCells().get(0);
        RawCell flipped = JsonTableExtractor.ofPayload(payload, TableDetectionParameters.defaults())
                .detectTables(document, page1).get(0).getAllCells().get(0);

        assertThat(asIs.getBox().getTop()).isEqualTo(100.0);
        assertThat(flipped.getBox().getTop()).isEqualTo(792.0 - 130.0);
    }

    @Test
    void shouldServePerPagePayloads() throws Exception {
        JsonTableExtractor extractor = JsonTableExtractor.ofPages(
                Collections.singletonMap(1, Fixtures.read("very-simple-output.json")), CoordinateSystem.BOTTOM_UP);

        assertThat(extractor.detectTables(document, page1)).hasSize(1);
        assertThat(extractor.detectTables(document, page2)).isEmpty();
    }

}
