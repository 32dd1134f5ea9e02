package uk.gegc.ommltex.features.math.domain.model;

import uk.gegc.ommltex.features.conversion.domain.DocumentElement;

/**
 * A formula found in a document: its original OMML markup and how it is placed.
 */
public record MathBlock(String ommlXml, MathMode mode) implements DocumentElement {

    public static final String ELEMENT_TYPE = "math";

    public MathBlock {
        mode = mode != null ? mode : MathMode.INLINE;
    }

    @Override
    public String elementType() {
        return ELEMENT_TYPE;
    }
}
