package com.abcft.pdfstruct.core.table;

import com.abcft.pdfstruct.core.MalformedDocumentException;
import com.abcft.pdfstruct.core.gson.GsonUtil;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the JSON payload of a table extractor for one page.
 *
 * <pre>
 * [                                   // tables
 *   [                                 // rows of a table
 *     [ {"bbox": [x0, y0, x1, y1], "text": "..."}, ... ]   // cells of a row
 *   ]
 * ]
 * </pre>
 */
public final class RawTableParser {

    private final CoordinateSystem coordinateSystem;
    private final double pageHeight;

    public RawTableParser(CoordinateSystem coordinateSystem, double pageHeight) {
        this.coordinateSystem = coordinateSystem;
        this.pageHeight = pageHeight;
    }

    /**
     * @param json payload of one page; blank or {@code []} means no table.
     * @return the raw tables in top-down page coordinates.
     * @throws MalformedDocumentException if the payload does not follow the expected shape.
     */
    public List<RawTable> parse(String json) throws MalformedDocumentException {
        List<RawTable> tables = new ArrayList<>();
        if (StringUtils.isBlank(json)) {
            return tables;
        }
        JsonElement root = GsonUtil.parse(json);
        JsonArray tablesArray = asArray(root, "tables");
        for (int t = 0; t < tablesArray.size(); ++t) {
            JsonArray rowsArray = asArray(tablesArray.get(t), "table " + t);
            List<List<RawCell>> rows = new ArrayList<>(rowsArray.size());
            for (int r = 0; r < rowsArray.size(); ++r) {
                JsonArray cellsArray = asArray(rowsArray.get(r), "table " + t + " row " + r);
                List<RawCell> row = new ArrayList<>(cellsArray.size());
                for (JsonElement cell : cellsArray) {
                    row.add(parseCell(cell));
                }
                rows.add(row);
            }
            tables.add(new RawTable(rows));
        }
        return tables;
    }

    private RawCell parseCell(JsonElement element) throws MalformedDocumentException {
        if (!element.isJsonObject()) {
            throw new MalformedDocumentException("Cell is not an object: " + element);
        }
        JsonObject obj = element.getAsJsonObject();
        JsonArray bbox = asArray(obj.get("bbox"), "bbox");
        if (bbox.size() != 4) {
            throw new MalformedDocumentException("bbox must have 4 values: " + bbox);
        }
        try {
            double x0 = bbox.get(0).getAsDouble();
            double y0 = bbox.get(1).getAsDouble();
            double x1 = bbox.get(2).getAsDouble();
            double y1 = bbox.get(3).getAsDouble();
            String text = GsonUtil.getString(obj, "text", "");
            return new RawCell(coordinateSystem.toBox(x0, y0, x1, y1, pageHeight), text);
        } catch (RuntimeException e) {
            // 非数字坐标或非法矩形
            throw new MalformedDocumentException("Bad cell: " + obj, e);
        }
    }

    private static JsonArray asArray(JsonElement element, String what) throws MalformedDocumentException {
        if (element == null || !element.isJsonArray()) {
            throw new MalformedDocumentException("Expected an array for " + what + ": " + element);
        }
        return element.getAsJsonArray();
    }

}
