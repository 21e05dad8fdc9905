package com.abcft.pdfstruct.core.model;

import com.google.common.collect.LinkedHashMultiset;
import com.google.common.collect.Multiset;
import com.google.common.collect.Multisets;
import org.apache.commons.math3.util.FastMath;

import java.util.Collection;

/**
 * Font helpers.
 */
public final class FontUtils {

    private FontUtils() {}

    /**
     * Groups fonts by equality and picks the most frequent group.
     *
     * @param fonts fonts of the glyphs of a word or a line.
     * @return the most common font, the first one seen on ties, or {@link Font#UNDEFINED} for an empty input.
     */
    public static Font getMostCommonFont(Collection<Font> fonts) {
        if (fonts == null || fonts.isEmpty()) {
            return Font.UNDEFINED;
        }
        Multiset<Font> baskets = LinkedHashMultiset.create(fonts);
        // 稳定排序，次数相同时保留首次出现的顺序
        return Multisets.copyHighestCountFirst(baskets).iterator().next();
    }

    /**
     * Converts a pdfminer style {@code ncolour} value ({@code [r, g, b]} or a single gray level, components
     * in [0, 1]) to a hex color string.
     */
    public static String ncolourToHex(String ncolour) {
        if (ncolour == null) {
            return "#000000";
        }
        String[] parts = ncolour.replace("[", "").replace("]", "").split(",");
        double r = parseComponent(parts, 0);
        double g = parts.length > 1 ? parseComponent(parts, 1) : r;
        double b = parts.length > 2 ? parseComponent(parts, 2) : r;
        return String.format("#%02x%02x%02x", toByte(r), toByte(g), toByte(b));
    }

    private static double parseComponent(String[] parts, int index) {
        try {
            return Double.parseDouble(parts[index].trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static int toByte(double component) {
        return (int) FastMath.max(0, FastMath.min(255, FastMath.ceil(component * 255)));
    }

}
