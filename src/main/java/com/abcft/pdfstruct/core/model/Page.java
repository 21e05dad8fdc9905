package com.abcft.pdfstruct.core.model;

import com.abcft.pdfstruct.core.ExtractedItem;
import com.abcft.pdfstruct.core.gson.GsonUtil;
import com.google.common.base.Preconditions;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * A page: its dimensions, its 1-based number and its elements in extraction order.
 */
public class Page implements ExtractedItem {

    private final int pageNumber;
    private final BoundingBox box;
    // 整体替换，不在原列表上逐个删除
    private volatile List<Element> elements;

    public Page(int pageNumber, List<? extends Element> elements, BoundingBox box) {
        Preconditions.checkArgument(pageNumber >= 1, "Page numbers are 1-based: %s", pageNumber);
        this.pageNumber = pageNumber;
        this.box = Preconditions.checkNotNull(box, "box");
        this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
    }

    public int getPageNumber() {
        return pageNumber;
    }

    public BoundingBox getBox() {
        return box;
    }

    public double getWidth() {
        return box.getWidth();
    }

    public double getHeight() {
        return box.getHeight();
    }

    /**
     * @return a read-only view of the page's top level elements.
     */
    public List<Element> getElements() {
        return elements;
    }

    /**
     * @return every element of the given type or capability, at any depth, in document order.
     */
    public <T> List<T> elementsOfType(Class<T> type) {
        return Element.elementsOfType(elements, type);
    }

    /**
     * Replaces a set of top level elements with one element, in a single swap of the element list.
     *
     * <p>The replacement takes the position of the first removed element; the remaining elements keep
     * their relative order. When nothing is removed the replacement is appended.</p>
     *
     * @param removed top level elements to drop; elements not on this page are ignored.
     * @param replacement the element to insert.
     */
    public synchronized void replaceElements(Collection<? extends Element> removed, Element replacement) {
        Preconditions.checkNotNull(replacement, "replacement");
        Map<Element, Boolean> toRemove = new IdentityHashMap<>();
        for (Element e : removed) {
            toRemove.put(e, Boolean.TRUE);
        }
        List<Element> current = elements;
        List<Element> updated = new ArrayList<>(current.size() + 1);
        boolean inserted = false;
        for (Element e : current) {
            if (toRemove.containsKey(e)) {
                if (!inserted) {
                    updated.add(replacement);
                    inserted = true;
                }
            } else {
                updated.add(e);
            }
        }
        if (!inserted) {
            updated.add(replacement);
        }
        this.elements = Collections.unmodifiableList(updated);
    }

    @Override
    public JsonObject toDocument(boolean detail) {
        JsonObject obj = new JsonObject();
        obj.addProperty("pageNumber", pageNumber);
        obj.add("box", GsonUtil.boxToJson(box));
        obj.add("elements", Element.toDocuments(elements, detail));
        return obj;
    }

    @Override
    public String toString() {
        return String.format("Page[%d, %d elements]", pageNumber, elements.size());
    }

}
