package uk.gegc.ommltex.features.math.domain.model;

/**
 * Placement of n-ary operator limits ({@code naryPr/limLoc}).
 */
public enum LimitLocation {
    UNDER_OVER,
    SUB_SUP;

    public static LimitLocation fromOmml(String value) {
        if (value == null) {
            return null;
        }
        return switch (value) {
            case "undOvr" -> UNDER_OVER;
            case "subSup" -> SUB_SUP;
            default -> null;
        };
    }
}
