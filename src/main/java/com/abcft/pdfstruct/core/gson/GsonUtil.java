package com.abcft.pdfstruct.core.gson;

import com.abcft.pdfstruct.core.MalformedDocumentException;
import com.abcft.pdfstruct.core.model.BoundingBox;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Gson helpers shared by the document model and the payload parsers.
 */
public class GsonUtil {

    public static final Gson DEFAULT = new GsonBuilder()
            .disableHtmlEscaping()
            .create();

    public static final Gson PRETTY = new GsonBuilder()
            .disableHtmlEscaping()
            .setPrettyPrinting()
            .create();

    private GsonUtil() {}

    public static String toJson(JsonElement element, boolean pretty) {
        return pretty ? PRETTY.toJson(element) : DEFAULT.toJson(element);
    }

    public static JsonElement parse(String json) throws MalformedDocumentException {
        if (json == null) {
            throw new MalformedDocumentException("Empty JSON input");
        }
        try {
            return JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new MalformedDocumentException("Invalid JSON: " + e.getMessage(), e);
        }
    }

    public static JsonObject boxToJson(BoundingBox box) {
        JsonObject obj = new JsonObject();
        obj.addProperty("left", box.getLeft());
        obj.addProperty("top", box.getTop());
        obj.addProperty("width", box.getWidth());
        obj.addProperty("height", box.getHeight());
        return obj;
    }

    public static BoundingBox boxFromJson(JsonElement element) throws MalformedDocumentException {
        if (element == null || !element.isJsonObject()) {
            throw new MalformedDocumentException("Missing box: " + element);
        }
        JsonObject obj = element.getAsJsonObject();
        try {
            return new BoundingBox(
                    obj.get("left").getAsDouble(),
                    obj.get("top").getAsDouble(),
                    obj.get("width").getAsDouble(),
                    obj.get("height").getAsDouble());
        } catch (RuntimeException e) {
            // NPE / NumberFormatException / IllegalArgumentException from BoundingBox
            throw new MalformedDocumentException("Bad box: " + obj, e);
        }
    }

    public static String getString(JsonObject obj, String key, String defaultValue) {
        JsonElement e = obj.get(key);
        if (e == null || e.isJsonNull()) {
            return defaultValue;
        }
        return e.getAsString();
    }

    public static double getDouble(JsonObject obj, String key, double defaultValue) {
        JsonElement e = obj.get(key);
        if (e == null || e.isJsonNull()) {
            return defaultValue;
        }
        return e.getAsDouble();
    }

    public static boolean getBoolean(JsonObject obj, String key, boolean defaultValue) {
        JsonElement e = obj.get(key);
        if (e == null || e.isJsonNull()) {
            return defaultValue;
        }
        return e.getAsBoolean();
    }

    public static JsonArray getArray(JsonObject obj, String key) throws MalformedDocumentException {
        JsonElement e = obj.get(key);
        if (e == null || e.isJsonNull()) {
            return new JsonArray();
        }
        if (!e.isJsonArray()) {
            throw new MalformedDocumentException("Expected an array for '" + key + "': " + e);
        }
        return e.getAsJsonArray();
    }

}
