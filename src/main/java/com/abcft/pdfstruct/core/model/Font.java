package com.abcft.pdfstruct.core.model;

import com.google.gson.JsonObject;
import org.apache.commons.lang3.StringUtils;

import java.util.Objects;

/**
 * Font attributes of a glyph or a word.
 */
public final class Font {

    public static final String WEIGHT_BOLD = "bold";
    public static final String WEIGHT_MEDIUM = "medium";

    public static final Font UNDEFINED = new Font("undefined", 0, WEIGHT_MEDIUM, false, false, "#000000");

    private final String name;
    private final double size;
    private final String weight;
    private final boolean italic;
    private final boolean underline;
    private final String color;

    public Font(String name, double size, String weight, boolean italic, boolean underline, String color) {
        this.name = StringUtils.defaultString(name);
        this.size = size;
        this.weight = StringUtils.defaultIfBlank(weight, WEIGHT_MEDIUM);
        this.italic = italic;
        this.underline = underline;
        this.color = StringUtils.defaultIfBlank(color, "#000000");
    }

    /**
     * Derives weight and style from the font name, the way PDF font names usually encode them
     * (e.g. {@code ABCDEF+Arial-BoldItalic}).
     */
    public static Font fromFontName(String name, double size, String color) {
        boolean bold = StringUtils.containsIgnoreCase(name, "bold");
        boolean italic = StringUtils.containsIgnoreCase(name, "italic");
        boolean underline = StringUtils.containsIgnoreCase(name, "underline");
        return new Font(name, size, bold ? WEIGHT_BOLD : WEIGHT_MEDIUM, italic, underline, color);
    }

    public String getName() {
        return name;
    }

    public double getSize() {
        return size;
    }

    public String getWeight() {
        return weight;
    }

    public boolean isBold() {
        return WEIGHT_BOLD.equals(weight);
    }

    public boolean isItalic() {
        return italic;
    }

    public boolean isUnderline() {
        return underline;
    }

    public String getColor() {
        return color;
    }

    public JsonObject toDocument() {
        JsonObject obj = new JsonObject();
        obj.addProperty("name", name);
        obj.addProperty("size", size);
        obj.addProperty("weight", weight);
        obj.addProperty("italic", italic);
        obj.addProperty("underline", underline);
        obj.addProperty("color", color);
        return obj;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Font)) {
            return false;
        }
        Font other = (Font) o;
        return Double.compare(size, other.size) == 0
                && italic == other.italic
                && underline == other.underline
                && name.equals(other.name)
                && weight.equals(other.weight)
                && color.equalsIgnoreCase(other.color);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, size, weight, italic, underline, color.toLowerCase());
    }

    @Override
    public String toString() {
        return String.format("Font[%s, %.1f, %s%s%s, %s]", name, size, weight,
                italic ? ", italic" : "", underline ? ", underline" : "", color);
    }

}
