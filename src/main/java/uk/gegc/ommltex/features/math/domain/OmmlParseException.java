package uk.gegc.ommltex.features.math.domain;

/**
 * Exception thrown when OMML markup cannot be read into a math tree.
 */
public class OmmlParseException extends Exception {

    public OmmlParseException(String message) {
        super(message);
    }

    public OmmlParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
