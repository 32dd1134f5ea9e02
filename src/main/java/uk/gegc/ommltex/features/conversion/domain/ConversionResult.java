package uk.gegc.ommltex.features.conversion.domain;

/**
 * Result of element conversion containing the LaTeX output.
 */
public record ConversionResult(String latex) {

    private static final ConversionResult EMPTY = new ConversionResult("");

    public static ConversionResult empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return latex == null || latex.isEmpty();
    }
}
