package com.abcft.pdfstruct.core.model;

import com.google.common.collect.ImmutableList;
import com.google.gson.JsonObject;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A word, made of glyphs, with a representative font.
 *
 * <p>Some extractors only report word strings without glyphs; such a word has no characters and keeps
 * its text directly.</p>
 */
public class Word extends Element implements TextContainer {

    private final List<Character> characters;
    private final String text;
    private final Font font;

    public Word(BoundingBox box, List<Character> characters, Font font) {
        super(box);
        this.characters = ImmutableList.copyOf(characters);
        this.text = this.characters.stream().map(Character::getContent).collect(Collectors.joining());
        this.font = font != null ? font : FontUtils.getMostCommonFont(
                this.characters.stream().map(Character::getFont).collect(Collectors.toList()));
    }

    public Word(BoundingBox box, String text, Font font) {
        super(box);
        this.characters = ImmutableList.of();
        this.text = text != null ? text : "";
        this.font = font != null ? font : Font.UNDEFINED;
    }

    /**
     * Creates a word whose box is the merged box of its glyphs and whose font is the glyphs' most common one.
     *
     * @param characters glyphs of the word, must not be empty.
     */
    public static Word fromCharacters(List<Character> characters) {
        BoundingBox box = BoundingBox.merge(characters.stream().map(Element::getBox).collect(Collectors.toList()));
        return new Word(box, characters, null);
    }

    public List<Character> getCharacters() {
        return characters;
    }

    public Font getFont() {
        return font;
    }

    @Override
    public String getText() {
        return text;
    }

    @Override
    public List<Character> getChildren() {
        return characters;
    }

    @Override
    public String getType() {
        return "word";
    }

    @Override
    public JsonObject toDocument(boolean detail) {
        JsonObject obj = super.toDocument(detail);
        obj.addProperty("content", text);
        obj.add("font", font.toDocument());
        if (detail && !characters.isEmpty()) {
            obj.add("characters", toDocuments(characters, true));
        }
        return obj;
    }

    @Override
    public String toString() {
        return text;
    }

}
