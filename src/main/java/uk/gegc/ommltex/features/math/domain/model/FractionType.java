package uk.gegc.ommltex.features.math.domain.model;

/**
 * Fraction layout as carried by the OMML {@code fPr/type} property.
 */
public enum FractionType {
    BAR,
    NO_BAR,
    SKEWED,
    LINEAR;

    /**
     * Resolves an OMML {@code type} value ({@code bar}, {@code noBar}, {@code skw}, {@code lin}).
     * Unknown or missing values resolve to {@link #BAR}.
     */
    public static FractionType fromOmml(String value) {
        if (value == null) {
            return BAR;
        }
        return switch (value) {
            case "noBar" -> NO_BAR;
            case "skw" -> SKEWED;
            case "lin" -> LINEAR;
            default -> BAR;
        };
    }
}
