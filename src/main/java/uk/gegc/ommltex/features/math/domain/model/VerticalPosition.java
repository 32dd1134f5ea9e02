package uk.gegc.ommltex.features.math.domain.model;

/**
 * Vertical placement used by bars and group characters ({@code pos} property).
 */
public enum VerticalPosition {
    TOP,
    BOTTOM;

    public static VerticalPosition fromOmml(String value) {
        if (value == null) {
            return null;
        }
        return switch (value) {
            case "top" -> TOP;
            case "bot", "bottom" -> BOTTOM;
            default -> null;
        };
    }
}
