package uk.gegc.ommltex.features.conversion.domain;

/**
 * A convertible piece of a document.
 */
public interface DocumentElement {

    /**
     * @return the element type key converters are selected by, e.g. {@code math}
     */
    String elementType();
}
