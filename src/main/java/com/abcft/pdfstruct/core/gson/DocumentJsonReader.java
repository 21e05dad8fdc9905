package com.abcft.pdfstruct.core.gson;

import com.abcft.pdfstruct.core.MalformedDocumentException;
import com.abcft.pdfstruct.core.model.BoundingBox;
import com.abcft.pdfstruct.core.model.Character;
import com.abcft.pdfstruct.core.model.Document;
import com.abcft.pdfstruct.core.model.Element;
import com.abcft.pdfstruct.core.model.Font;
import com.abcft.pdfstruct.core.model.FontUtils;
import com.abcft.pdfstruct.core.model.Image;
import com.abcft.pdfstruct.core.model.Page;
import com.abcft.pdfstruct.core.model.Paragraph;
import com.abcft.pdfstruct.core.model.TextUtils;
import com.abcft.pdfstruct.core.model.Word;
import com.abcft.pdfstruct.core.table.Table;
import com.abcft.pdfstruct.core.table.TableCell;
import com.abcft.pdfstruct.core.table.TableRow;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.apache.commons.io.FileUtils;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rebuilds a {@link Document} from the JSON written by {@link Document#toDocument(boolean)}.
 *
 * <p>Besides the element types of the model, a {@code line} element holding raw {@code characters} is
 * accepted; it is broken into words with {@link TextUtils#breakLineIntoWords(List)}.</p>
 */
public final class DocumentJsonReader {

    private DocumentJsonReader() {}

    public static Document readDocument(File file) throws IOException {
        Document document = readDocument(FileUtils.readFileToString(file, StandardCharsets.UTF_8));
        if (document.getInputFile() == null) {
            return new Document(document.getPages(), file.getPath());
        }
        return document;
    }

    public static Document readDocument(String json) throws MalformedDocumentException {
        JsonElement root = GsonUtil.parse(json);
        if (!root.isJsonObject()) {
            throw new MalformedDocumentException("Document must be a JSON object");
        }
        return readDocument(root.getAsJsonObject());
    }

    public static Document readDocument(JsonObject obj) throws MalformedDocumentException {
        List<Page> pages = new ArrayList<>();
        for (JsonElement e : GsonUtil.getArray(obj, "pages")) {
            pages.add(readPage(asObject(e)));
        }
        return new Document(pages, GsonUtil.getString(obj, "inputFile", null));
    }

    public static Page readPage(JsonObject obj) throws MalformedDocumentException {
        int pageNumber;
        try {
            pageNumber = obj.get("pageNumber").getAsInt();
        } catch (RuntimeException e) {
            throw new MalformedDocumentException("Bad page number: " + obj.get("pageNumber"), e);
        }
        if (pageNumber < 1) {
            throw new MalformedDocumentException("Page numbers are 1-based: " + pageNumber);
        }
        BoundingBox box = GsonUtil.boxFromJson(obj.get("box"));
        return new Page(pageNumber, readElements(GsonUtil.getArray(obj, "elements")), box);
    }

    public static List<Element> readElements(JsonArray array) throws MalformedDocumentException {
        List<Element> elements = new ArrayList<>(array.size());
        for (JsonElement e : array) {
            JsonObject obj = asObject(e);
            if ("line".equals(GsonUtil.getString(obj, "type", null))) {
                elements.addAll(readLine(obj));
            } else {
                elements.add(readElement(obj));
            }
        }
        return elements;
    }

    public static Element readElement(JsonObject obj) throws MalformedDocumentException {
        String type = GsonUtil.getString(obj, "type", null);
        if (type == null) {
            throw new MalformedDocumentException("Element without type: " + obj);
        }
        BoundingBox box = GsonUtil.boxFromJson(obj.get("box"));
        try {
            switch (type) {
                case "character":
                    return readCharacter(obj, box);
                case "word":
                    return readWord(obj, box);
                case "paragraph":
                    return new Paragraph(box, readTyped(GsonUtil.getArray(obj, "content"), Word.class));
                case "image":
                    return new Image(box, GsonUtil.getString(obj, "src", ""));
                case "table":
                    return readTable(obj, box);
                case "row":
                    return new TableRow(box, obj.get("index").getAsInt(),
                            readTyped(GsonUtil.getArray(obj, "content"), TableCell.class));
                case "cell":
                    return new TableCell(box,
                            obj.get("row").getAsInt(),
                            obj.get("col").getAsInt(),
                            obj.get("rowspan").getAsInt(),
                            obj.get("colspan").getAsInt(),
                            readElements(GsonUtil.getArray(obj, "content")));
                default:
                    throw new MalformedDocumentException("Unknown element type: " + type);
            }
        } catch (MalformedDocumentException e) {
            throw e;
        } catch (RuntimeException e) {
            // NPE / UnsupportedOperationException / IllegalArgumentException
            throw new MalformedDocumentException("Bad " + type + " element: " + e.getMessage(), e);
        }
    }

    private static Character readCharacter(JsonObject obj, BoundingBox box) throws MalformedDocumentException {
        String content = TextUtils.normalizeGlyph(GsonUtil.getString(obj, "content", ""));
        return new Character(box, content, readFont(obj.get("font")));
    }

    private static Word readWord(JsonObject obj, BoundingBox box) throws MalformedDocumentException {
        Font font = readFont(obj.get("font"));
        JsonArray characters = GsonUtil.getArray(obj, "characters");
        if (characters.size() > 0) {
            return new Word(box, readTyped(characters, Character.class), font);
        }
        return new Word(box, GsonUtil.getString(obj, "content", ""), font);
    }

    private static Table readTable(JsonObject obj, BoundingBox box) throws MalformedDocumentException {
        List<TableRow> rows = readTyped(GsonUtil.getArray(obj, "content"), TableRow.class);
        int columnCount = obj.has("columnCount") ? obj.get("columnCount").getAsInt()
                : rows.stream().mapToInt(TableRow::getColspanSum).max().orElse(0);
        return new Table(box, obj.get("pageNumber").getAsInt(), columnCount, rows);
    }

    private static List<Word> readLine(JsonObject obj) throws MalformedDocumentException {
        JsonArray array = GsonUtil.getArray(obj, "characters");
        if (array.size() == 0) {
            return Collections.emptyList();
        }
        List<Character> characters = new ArrayList<>(array.size());
        for (JsonElement e : array) {
            if (e.isJsonNull()) {
                characters.add(null);
                continue;
            }
            JsonObject c = asObject(e);
            characters.add(readCharacter(c, GsonUtil.boxFromJson(c.get("box"))));
        }
        return TextUtils.breakLineIntoWords(characters);
    }

    private static <T extends Element> List<T> readTyped(JsonArray array, Class<T> type)
            throws MalformedDocumentException {
        List<T> result = new ArrayList<>(array.size());
        for (JsonElement e : array) {
            Element element = readElement(asObject(e));
            if (!type.isInstance(element)) {
                throw new MalformedDocumentException(String.format("Expected %s but got %s",
                        type.getSimpleName(), element.getType()));
            }
            result.add(type.cast(element));
        }
        return result;
    }

    public static Font readFont(JsonElement element) {
        if (element == null || !element.isJsonObject()) {
            return Font.UNDEFINED;
        }
        JsonObject obj = element.getAsJsonObject();
        String color = GsonUtil.getString(obj, "color", null);
        if (color != null && !color.startsWith("#")) {
            // pdfminer ncolour
            color = FontUtils.ncolourToHex(color);
        }
        return new Font(
                GsonUtil.getString(obj, "name", null),
                GsonUtil.getDouble(obj, "size", 0),
                GsonUtil.getString(obj, "weight", Font.WEIGHT_MEDIUM),
                GsonUtil.getBoolean(obj, "italic", false),
                GsonUtil.getBoolean(obj, "underline", false),
                color);
    }

    private static JsonObject asObject(JsonElement e) throws MalformedDocumentException {
        if (e == null || !e.isJsonObject()) {
            throw new MalformedDocumentException("Expected a JSON object: " + e);
        }
        return e.getAsJsonObject();
    }

}
