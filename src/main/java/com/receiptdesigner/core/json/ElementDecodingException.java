package com.receiptdesigner.core.json;

/**
 * Raised when a design document entry is present but cannot be turned into an element.
 */
public class ElementDecodingException extends RuntimeException {

    public ElementDecodingException(String message) {
        super(message);
    }

    public ElementDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
