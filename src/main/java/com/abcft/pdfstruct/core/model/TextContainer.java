package com.abcft.pdfstruct.core.model;

/**
 * Capability of elements that carry text.
 */
public interface TextContainer {

    String getText();

}
