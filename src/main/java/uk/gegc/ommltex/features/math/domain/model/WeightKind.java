package uk.gegc.ommltex.features.math.domain.model;

/**
 * Weight/slant of a math run ({@code rPr/sty}).
 */
public enum WeightKind {
    PLAIN(null),
    BOLD("\\mathbf"),
    ITALIC("\\mathit"),
    BOLD_ITALIC("\\boldsymbol");

    private final String wrapperCommand;

    WeightKind(String wrapperCommand) {
        this.wrapperCommand = wrapperCommand;
    }

    public String wrapperCommand() {
        return wrapperCommand;
    }

    public static WeightKind fromOmml(String value) {
        if (value == null) {
            return PLAIN;
        }
        return switch (value) {
            case "b" -> BOLD;
            case "i" -> ITALIC;
            case "bi" -> BOLD_ITALIC;
            default -> PLAIN;
        };
    }
}
