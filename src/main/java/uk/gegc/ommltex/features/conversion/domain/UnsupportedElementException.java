package uk.gegc.ommltex.features.conversion.domain;

/**
 * Exception thrown when an element type is not supported by any converter.
 */
public class UnsupportedElementException extends RuntimeException {

    public UnsupportedElementException(String message) {
        super(message);
    }
}
