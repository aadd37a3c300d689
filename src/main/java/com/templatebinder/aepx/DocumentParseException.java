package com.templatebinder.aepx;

import java.io.IOException;

/**
 * The template is not well-formed XML. No document is produced.
 */
public class DocumentParseException extends IOException {

    public DocumentParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
