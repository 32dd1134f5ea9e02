package uk.gegc.ommltex.features.conversion.domain;

/**
 * Exception thrown when element conversion fails due to processing errors.
 */
public class ConversionFailedException extends RuntimeException {

    public ConversionFailedException(String message) {
        super(message);
    }

    public ConversionFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
