package com.abcft.pdfstruct.core.model;

import com.abcft.pdfstruct.core.ExtractedItem;
import com.abcft.pdfstruct.core.gson.GsonUtil;
import com.google.common.base.Preconditions;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base of every element living on a {@link Page}.
 *
 * <p>An element owns its children exclusively; containers are populated at construction time and never
 * re-parented afterward.</p>
 */
public abstract class Element implements ExtractedItem {

    private final BoundingBox box;

    protected Element(BoundingBox box) {
        this.box = Preconditions.checkNotNull(box, "box");
    }

    public BoundingBox getBox() {
        return box;
    }

    public double getLeft() {
        return box.getLeft();
    }

    public double getTop() {
        return box.getTop();
    }

    public double getWidth() {
        return box.getWidth();
    }

    public double getHeight() {
        return box.getHeight();
    }

    /**
     * @return the type name used in the JSON representation.
     */
    public abstract String getType();

    /**
     * @return owned child elements in order, empty for leaves.
     */
    public List<? extends Element> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public JsonObject toDocument(boolean detail) {
        JsonObject obj = new JsonObject();
        obj.addProperty("type", getType());
        obj.add("box", GsonUtil.boxToJson(box));
        return obj;
    }

    protected static JsonArray toDocuments(List<? extends Element> elements, boolean detail) {
        JsonArray array = new JsonArray();
        for (Element e : elements) {
            array.add(e.toDocument(detail));
        }
        return array;
    }

    /**
     * Walks the ownership tree depth-first, in document order, and keeps every element that is an
     * instance of {@code type}.
     *
     * @param roots the elements to start from.
     * @param type a concrete element class or a capability interface such as {@link TextContainer}.
     * @return matching elements, parents before their children.
     */
    public static <T> List<T> elementsOfType(Iterable<? extends Element> roots, Class<T> type) {
        List<T> result = new ArrayList<>();
        collect(roots, type, result);
        return result;
    }

    private static <T> void collect(Iterable<? extends Element> elements, Class<T> type, List<T> result) {
        for (Element e : elements) {
            if (type.isInstance(e)) {
                result.add(type.cast(e));
            }
            collect(e.getChildren(), type, result);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + box;
    }

}
