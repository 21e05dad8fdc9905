package com.abcft.pdfstruct.core.model;

import com.abcft.pdfstruct.core.ExtractedItem;
import com.google.common.collect.ImmutableList;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.List;

/**
 * A document: an ordered list of pages.
 */
public class Document implements ExtractedItem {

    private final List<Page> pages;
    private final String inputFile;

    public Document(List<Page> pages) {
        this(pages, null);
    }

    public Document(List<Page> pages, String inputFile) {
        this.pages = ImmutableList.copyOf(pages);
        this.inputFile = inputFile;
    }

    public List<Page> getPages() {
        return pages;
    }

    /**
     * @param pageNumber 1-based page number.
     * @return the page, or {@code null} if the document has no such page.
     */
    public Page getPage(int pageNumber) {
        for (Page page : pages) {
            if (page.getPageNumber() == pageNumber) {
                return page;
            }
        }
        return null;
    }

    public String getInputFile() {
        return inputFile;
    }

    /**
     * @return every element of the given type or capability over all pages, in document order.
     */
    public <T> List<T> elementsOfType(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (Page page : pages) {
            result.addAll(page.elementsOfType(type));
        }
        return result;
    }

    @Override
    public JsonObject toDocument(boolean detail) {
        JsonObject obj = new JsonObject();
        if (inputFile != null) {
            obj.addProperty("inputFile", inputFile);
        }
        JsonArray array = new JsonArray();
        for (Page page : pages) {
            array.add(page.toDocument(detail));
        }
        obj.add("pages", array);
        return obj;
    }

}
