package com.abcft.pdfstruct.core.model;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Helpers turning raw glyph runs into words.
 */
public final class TextUtils {

    private static final String ZERO_WIDTH_SPACE = "\u200B";
    private static final Pattern UNMAPPED_GLYPH = Pattern.compile("\\(cid:\\d*\\)?");

    private TextUtils() {}

    /**
     * Returns the printable value of a glyph. Glyphs that could not be mapped to unicode
     * (reported as {@code (cid:N)}) become {@code ?}.
     */
    public static String normalizeGlyph(String glyph) {
        if (glyph == null) {
            return "";
        }
        return UNMAPPED_GLYPH.matcher(glyph).find() ? "?" : glyph;
    }

    public static boolean isSeparator(Character c) {
        return c == null || StringUtils.isBlank(c.getContent());
    }

    /**
     * Splits a line of glyphs into words at separator glyphs (blank content or {@code null} entries).
     * Zero-width spaces are dropped, leading and trailing separators ignored.
     *
     * @param line glyphs of one text line, in reading order.
     * @return words of the line, each with the merged box of its glyphs and their most common font.
     */
    public static List<Word> breakLineIntoWords(List<Character> line) {
        List<Word> words = new ArrayList<>();
        List<Character> current = new ArrayList<>();
        for (Character c : line) {
            if (c != null && ZERO_WIDTH_SPACE.equals(c.getContent())) {
                continue;
            }
            if (isSeparator(c)) {
                flush(current, words);
            } else {
                current.add(c);
            }
        }
        flush(current, words);
        return words;
    }

    private static void flush(List<Character> current, List<Word> words) {
        if (current.isEmpty()) {
            return;
        }
        words.add(Word.fromCharacters(new ArrayList<>(current)));
        current.clear();
    }

}
