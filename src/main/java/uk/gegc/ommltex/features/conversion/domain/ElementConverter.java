package uk.gegc.ommltex.features.conversion.domain;

/**
 * Interface for converting document elements to LaTeX.
 * Strategy pattern for supporting different element types.
 */
public interface ElementConverter {

    /**
     * Checks if this converter supports the given element type.
     *
     * @param elementType the element type to check
     * @return true if this converter can handle the element type
     */
    boolean supports(String elementType);

    /**
     * Converts an element to LaTeX.
     *
     * @param element the element to convert
     * @param context per-conversion context collecting packages and warnings
     * @return ConversionResult containing the LaTeX output
     * @throws ConversionException if conversion fails
     */
    ConversionResult convert(DocumentElement element, ConversionContext context) throws ConversionException;
}
