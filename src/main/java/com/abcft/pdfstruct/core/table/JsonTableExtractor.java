package com.abcft.pdfstruct.core.table;

import com.abcft.pdfstruct.core.model.Document;
import com.abcft.pdfstruct.core.model.Page;
import com.google.common.collect.ImmutableMap;
import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * {@link TableExtractor} serving JSON payloads that an external table tool produced ahead of time.
 */
public class JsonTableExtractor implements TableExtractor {

    /**
     * Source of the raw payload of a page.
     */
    @FunctionalInterface
    public interface PayloadSource {

        /**
         * @return the payload of the page, {@code null} or blank when the tool produced nothing for it.
         */
        String load(Page page) throws IOException;

    }

    public static final String DEFAULT_FILE_PATTERN = "tables-%d.json";

    private final PayloadSource source;
    private final CoordinateSystem coordinateSystem;

    public JsonTableExtractor(PayloadSource source, CoordinateSystem coordinateSystem) {
        this.source = source;
        this.coordinateSystem = coordinateSystem;
    }

    /**
     * Serves the same payload for every page, read in the coordinate system of {@code params}.
     */
    public static JsonTableExtractor ofPayload(String json, TableDetectionParameters params) {
        return ofPayload(json, params.coordinateSystem);
    }

    public static JsonTableExtractor ofPages(Map<Integer, String> payloads, TableDetectionParameters params) {
        return ofPages(payloads, params.coordinateSystem);
    }

    public static JsonTableExtractor fromDirectory(File directory, TableDetectionParameters params) {
        return fromDirectory(directory, params.coordinateSystem);
    }

    /**
     * Serves the same payload for every page.
     */
    public static JsonTableExtractor ofPayload(String json, CoordinateSystem coordinateSystem) {
        return new JsonTableExtractor(page -> json, coordinateSystem);
    }

    /**
     * Serves payloads by 1-based page number; pages without an entry have no table.
     */
    public static JsonTableExtractor ofPages(Map<Integer, String> payloads, CoordinateSystem coordinateSystem) {
        Map<Integer, String> copy = ImmutableMap.copyOf(payloads);
        return new JsonTableExtractor(page -> copy.get(page.getPageNumber()), coordinateSystem);
    }

    /**
     * Reads {@code tables-<pageNumber>.json} files from a directory; a missing file means no table.
     */
    public static JsonTableExtractor fromDirectory(File directory, CoordinateSystem coordinateSystem) {
        return new JsonTableExtractor(page -> {
            File file = new File(directory, String.format(DEFAULT_FILE_PATTERN, page.getPageNumber()));
            if (!file.isFile()) {
                return null;
            }
            return FileUtils.readFileToString(file, StandardCharsets.UTF_8);
        }, coordinateSystem);
    }

    @Override
    public List<RawTable> detectTables(Document document, Page page) throws IOException {
        String payload = source.load(page);
        return new RawTableParser(coordinateSystem, page.getHeight()).parse(payload);
    }

}
