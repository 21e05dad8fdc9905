package com.abcft.pdfstruct.core.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.gson.JsonObject;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Represents a paragraph in a document: an ordered run of words.
 */
public class Paragraph extends Element implements TextContainer {

    private final List<Word> words;

    public Paragraph(BoundingBox box, List<Word> words) {
        super(box);
        this.words = ImmutableList.copyOf(words);
    }

    /**
     * @param words words of the paragraph, must not be empty.
     */
    public static Paragraph fromWords(List<Word> words) {
        Preconditions.checkArgument(!words.isEmpty(), "A paragraph needs at least one word");
        return new Paragraph(BoundingBox.merge(words.stream().map(Element::getBox).collect(Collectors.toList())), words);
    }

    public List<Word> getWords() {
        return words;
    }

    @Override
    public List<Word> getChildren() {
        return words;
    }

    @Override
    public String getText() {
        return words.stream().map(Word::getText).collect(Collectors.joining(" "));
    }

    @Override
    public String getType() {
        return "paragraph";
    }

    @Override
    public JsonObject toDocument(boolean detail) {
        JsonObject obj = super.toDocument(detail);
        obj.add("content", toDocuments(words, detail));
        return obj;
    }

    @Override
    public String toString() {
        return getText();
    }

}
