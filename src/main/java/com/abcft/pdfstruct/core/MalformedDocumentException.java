package com.abcft.pdfstruct.core;

import java.io.IOException;

/**
 * Signals that a document or an extractor payload is malformed.
 */
public class MalformedDocumentException extends IOException {

    public MalformedDocumentException(String message) {
        super(message);
    }

    public MalformedDocumentException(Throwable cause) {
        super(cause);
    }


    public MalformedDocumentException(String message, Throwable cause) {
        super(message, cause);
    }

}
