package com.abcft.pdfstruct.core.table;

import com.abcft.pdfstruct.core.MalformedDocumentException;
import com.abcft.pdfstruct.core.ProcessContext;
import com.abcft.pdfstruct.core.model.BoundingBox;
import com.abcft.pdfstruct.core.model.Document;
import com.abcft.pdfstruct.core.model.Element;
import com.abcft.pdfstruct.core.model.Page;
import com.abcft.pdfstruct.core.model.Paragraph;
import com.abcft.pdfstruct.core.model.Word;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TableDetectionStageTest {

    @Mock
    private TableExtractor extractor;

    private ProcessContext context;

    @BeforeEach
    void setUp() {
        context = new ProcessContext("stage-test");
    }

    @Test
    void shouldLeavePageUnchangedWhenNoTableIsDetected() throws Exception {
        Document document = Fixtures.document();
        List<Element> before = document.getPage(1).getElements();
        TableDetectionStage stage = new TableDetectionStage(
                JsonTableExtractor.ofPayload(Fixtures.read("no-table.json"), CoordinateSystem.BOTTOM_UP));

        Document after = stage.process(document, context).get();

        assertThat(after.elementsOfType(Table.class)).isEmpty();
        assertThat(after.getPage(1).getElements()).containsExactlyElementsOf(before);
        assertThat(context.hasWarnings()).isFalse();
    }

    @Test
    void shouldSpliceTableAtPositionOfFirstSubsumedElement() throws Exception {
        Document document = Fixtures.document();
        TableDetectionStage stage = new TableDetectionStage(
                JsonTableExtractor.ofPayload(Fixtures.read("very-simple-output.json"), CoordinateSystem.BOTTOM_UP));

        Document after = stage.process(document, context).get();

        List<Element> elements = after.getPage(1).getElements();
        // title, table, and the two words of the footer line
        assertThat(elements).hasSize(4);
        assertThat(elements.get(0)).isInstanceOf(Paragraph.class);
        assertThat(elements.get(1)).isInstanceOf(Table.class);
        assertThat(elements.subList(2, 4)).extracting(e -> ((Word) e).getText()).containsExactly("Page", "1");

        Table table = (Table) elements.get(1);
        assertThat(table.getPageNumber()).isEqualTo(1);
        assertThat(table.getRowCount()).isEqualTo(3);
        assertThat(after.elementsOfType(Word.class)).extracting(Word::getText)
                .contains("r0c0", "r2c5", "Quarterly");
    }

    @Test
    void shouldReconstructRowspanTable() throws Exception {
        Document document = Fixtures.document();
        TableDetectionStage stage = new TableDetectionStage(
                JsonTableExtractor.ofPayload(Fixtures.read("rowspan-table.json"), CoordinateSystem.BOTTOM_UP));

        Document after = stage.process(document, context).get();

        List<Table> tables = after.elementsOfType(Table.class);
        assertThat(tables).hasSize(1);
        TableCell a = tables.get(0).getCell(1, 0);
        assertThat(a.getRow()).isZero();
        assertThat(a.getRowspan()).isEqualTo(2);
        TableReconstructorTest.assertRowSumInvariant(tables.get(0));
    }

    @Test
    void shouldTreatExtractorFailureAsNoTable() throws Exception {
        Document document = Fixtures.document();
        List<Element> before = document.getPage(1).getElements();
        when(extractor.detectTables(same(document), any(Page.class)))
                .thenThrow(new MalformedDocumentException("camelot exited with 1"));

        Document after = new TableDetectionStage(extractor).process(document, context).get();

        assertThat(after.getPage(1).getElements()).containsExactlyElementsOf(before);
        assertThat(context.getWarnings()).singleElement().asString()
                .contains("Page 1").contains("camelot exited with 1");
    }

    @Test
    void shouldTreatUncheckedExtractorFailureAsNoTable() throws Exception {
        Document document = Fixtures.document();
        when(extractor.detectTables(any(Document.class), any(Page.class)))
                .thenThrow(new IllegalStateException("boom"));

        Document after = new TableDetectionStage(extractor).process(document, context).get();

        assertThat(after.elementsOfType(Table.class)).isEmpty();
        assertThat(context.hasWarnings()).isTrue();
    }

    @Test
    void shouldKeepOtherTablesWhenOneCannotBeReconstructed() throws Exception {
        Page page = Fixtures.page();
        RawTable broken = Fixtures.rawTable("one-cell-merged.json");
        RawTable good = Fixtures.rawTable("very-simple-output.json");
        TableDetectionParameters params = TableDetectionParameters.defaults();
        TableReconstructor reconstructor = spy(new TableReconstructor(params));
        doAnswer(invocation -> {
            if (invocation.getArgument(0) == broken) {
                throw new IllegalStateException("bad grid");
            }
            return invocation.callRealMethod();
        }).when(reconstructor).reconstruct(any(RawTable.class), any(Page.class), any(ProcessContext.class));

        int added = new TableDetectionStage(extractor, params, reconstructor)
                .reconstructPage(page, Arrays.asList(broken, good), context);

        assertThat(added).isEqualTo(1);
        assertThat(page.elementsOfType(Table.class)).hasSize(1);
        assertThat(context.getWarnings()).anyMatch(w -> w.contains("table 0") && w.contains("bad grid"));
    }

    @Test
    void shouldBeIdempotent() throws Exception {
        Document document = Fixtures.document();
        new TableDetectionStage(JsonTableExtractor.ofPayload(
                Fixtures.read("one-cell-merged.json"), CoordinateSystem.BOTTOM_UP))
                .process(document, context).get();
        List<Element> afterFirstRun = document.getPage(1).getElements();

        // same payload again, then an extractor that finds nothing
        new TableDetectionStage(JsonTableExtractor.ofPayload(
                Fixtures.read("one-cell-merged.json"), CoordinateSystem.BOTTOM_UP))
                .process(document, context).get();
        new TableDetectionStage(JsonTableExtractor.ofPayload("[]", CoordinateSystem.BOTTOM_UP))
                .process(document, context).get();

        assertThat(document.getPage(1).getElements()).containsExactlyElementsOf(afterFirstRun);
        assertThat(document.elementsOfType(Table.class)).hasSize(1);
    }

    @Test
    void shouldOnlyQueryPagesInRange() throws Exception {
        List<Page> pages = new ArrayList<>();
        for (int i = 1; i <= 5; ++i) {
            pages.add(new Page(i, Collections.emptyList(), new BoundingBox(0, 0, 612, 792)));
        }
        Document document = new Document(pages);
        when(extractor.detectTables(any(Document.class), any(Page.class))).thenReturn(Collections.emptyList());
        TableDetectionParameters params = new TableDetectionParameters.Builder()
                .setStartPageIndex(1)
                .setEndPageIndex(2)
                .build();

        new TableDetectionStage(extractor, params).process(document, context).get();

        verify(extractor).detectTables(document, pages.get(1));
        verify(extractor).detectTables(document, pages.get(2));
        verify(extractor, never()).detectTables(document, pages.get(0));
        verify(extractor, never()).detectTables(document, pages.get(3));
        verify(extractor, never()).detectTables(document, pages.get(4));
    }

    @Test
    void shouldBoundConcurrentExtractorCalls() throws Exception {
        List<Page> pages = new ArrayList<>();
        for (int i = 1; i <= 8; ++i) {
            pages.add(new Page(i, Collections.emptyList(), new BoundingBox(0, 0, 612, 792)));
        }
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        TableExtractor slow = (doc, page) -> {
            int now = running.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException(e);
            } finally {
                running.decrementAndGet();
            }
            return Collections.emptyList();
        };
        TableDetectionParameters params = new TableDetectionParameters.Builder()
                .setMaxConcurrentPages(2)
                .build();

        new TableDetectionStage(slow, params).process(new Document(pages), context).get();

        assertThat(peak.get()).isBetween(1, 2);
    }

    @Test
    void shouldReconstructTablesOfEachPage() throws Exception {
        Page first = Fixtures.page();
        Page second = new Page(2, Collections.emptyList(), new BoundingBox(0, 0, 612, 792));
        Document document = new Document(Arrays.asList(first, second));
        TableExtractor extractor = JsonTableExtractor.ofPages(Collections.singletonMap(2,
                Fixtures.read("full-row-merge.json")), CoordinateSystem.BOTTOM_UP);

        new TableDetectionStage(extractor).process(document, context).get();

        assertThat(first.elementsOfType(Table.class)).isEmpty();
        assertThat(second.getElements()).singleElement().isInstanceOf(Table.class);
        assertThat(((Table) second.getElements().get(0)).getPageNumber()).isEqualTo(2);
    }

}
