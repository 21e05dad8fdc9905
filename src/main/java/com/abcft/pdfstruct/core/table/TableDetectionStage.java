package com.abcft.pdfstruct.core.table;

import com.abcft.pdfstruct.core.ProcessContext;
import com.abcft.pdfstruct.core.gson.GsonUtil;
import com.abcft.pdfstruct.core.model.Document;
import com.abcft.pdfstruct.core.model.Page;
import com.abcft.pdfstruct.core.pipeline.Stage;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

/**
 * Pipeline stage that finds the tables of every page and splices them into the page.
 *
 * <p>Extractor calls for different pages run concurrently, at most
 * {@link TableDetectionParameters#maxConcurrentPages} at a time. Once every call has returned, tables are
 * reconstructed and spliced page after page. A page whose extractor call fails keeps its elements
 * unchanged and the failure is recorded as a warning.</p>
 */
public class TableDetectionStage implements Stage {

    public static final String NAME = "table-detection";

    private final TableExtractor extractor;
    private final TableDetectionParameters params;
    private final TableReconstructor reconstructor;

    public TableDetectionStage(TableExtractor extractor) {
        this(extractor, TableDetectionParameters.defaults());
    }

    public TableDetectionStage(TableExtractor extractor, TableDetectionParameters params) {
        this(extractor, params, new TableReconstructor(params));
    }

    TableDetectionStage(TableExtractor extractor, TableDetectionParameters params, TableReconstructor reconstructor) {
        this.extractor = extractor;
        this.params = params;
        this.reconstructor = reconstructor;
    }

    @Override
    public String getName() {
        return NAME;
    }

    public TableDetectionParameters getParams() {
        return params;
    }

    @Override
    public CompletableFuture<Document> process(Document document, ProcessContext context) {
        List<Page> pages = document.getPages().stream()
                .filter(page -> params.acceptsPage(page.getPageNumber()))
                .collect(Collectors.toList());
        if (pages.isEmpty()) {
            context.info("No page in index range [{}, {}], table detection skipped",
                    params.startPageIndex, params.endPageIndex);
            return CompletableFuture.completedFuture(document);
        }

        ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(params.maxConcurrentPages, pages.size()),
                new ThreadFactoryBuilder().setDaemon(true).setNameFormat("table-detect-%d").build());
        List<CompletableFuture<List<RawTable>>> detections = new ArrayList<>(pages.size());
        for (Page page : pages) {
            detections.add(CompletableFuture.supplyAsync(() -> detect(document, page, context), executor));
        }

        return CompletableFuture.allOf(detections.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    int tableCount = 0;
                    for (int i = 0; i < pages.size(); ++i) {
                        tableCount += reconstructPage(pages.get(i), detections.get(i).join(), context);
                    }
                    context.info("{} tables reconstructed on {} pages", tableCount, pages.size());
                    return document;
                })
                .whenComplete((result, error) -> executor.shutdown());
    }

    private List<RawTable> detect(Document document, Page page, ProcessContext context) {
        try {
            List<RawTable> tables = extractor.detectTables(document, page);
            return tables != null ? tables : Collections.emptyList();
        } catch (Exception e) {
            context.warn(e, "Page {}: table extraction failed, no table on this page", page.getPageNumber());
            return Collections.emptyList();
        }
    }

    /**
     * Reconstructs the raw tables of a page and splices each into the page's element list. A table that
     * cannot be reconstructed is left out with a warning; the other tables of the page are still added.
     *
     * @return the number of tables added to the page.
     */
    int reconstructPage(Page page, List<RawTable> rawTables, ProcessContext context) {
        int count = 0;
        for (int i = 0; i < rawTables.size(); ++i) {
            try {
                if (reconstructTable(page, rawTables.get(i), context)) {
                    count++;
                }
            } catch (RuntimeException e) {
                context.warn(e, "Page {}: table {} could not be reconstructed, skipped", page.getPageNumber(), i);
            }
        }
        return count;
    }

    private boolean reconstructTable(Page page, RawTable raw, ProcessContext context) {
        // 每次都基于最新的元素列表，前一个表格已经替换的元素不会被再次吞并
        TableReconstruction reconstruction = reconstructor.reconstruct(raw, page, context);
        if (reconstruction == null) {
            return false;
        }
        Table table = reconstruction.getTable();
        page.replaceElements(reconstruction.getSubsumedElements(), table);
        if (params.debug) {
            context.info("Page {}: {}", page.getPageNumber(),
                    GsonUtil.toJson(table.toDocument(true), true));
        }
        return true;
    }

}
