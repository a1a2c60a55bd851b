package org.dxworks.docframe.processor;

/**
 * A conversion that could not be completed: an unsupported format or a failing output.
 */
public class ConversionException extends RuntimeException {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
