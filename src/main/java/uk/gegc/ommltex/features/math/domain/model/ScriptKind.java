package uk.gegc.ommltex.features.math.domain.model;

/**
 * Alphabet of a math run ({@code rPr/scr}). Each non-roman kind has a LaTeX wrapper command.
 */
public enum ScriptKind {
    ROMAN(null),
    SCRIPT("\\mathcal"),
    FRAKTUR("\\mathfrak"),
    DOUBLE_STRUCK("\\mathbb"),
    SANS_SERIF("\\mathsf"),
    MONOSPACE("\\mathtt");

    private final String wrapperCommand;

    ScriptKind(String wrapperCommand) {
        this.wrapperCommand = wrapperCommand;
    }

    /**
     * @return the wrapper command, or {@code null} for the roman alphabet
     */
    public String wrapperCommand() {
        return wrapperCommand;
    }

    public static ScriptKind fromOmml(String value) {
        if (value == null) {
            return ROMAN;
        }
        return switch (value) {
            case "script" -> SCRIPT;
            case "fraktur" -> FRAKTUR;
            case "double-struck" -> DOUBLE_STRUCK;
            case "sans-serif" -> SANS_SERIF;
            case "monospace" -> MONOSPACE;
            default -> ROMAN;
        };
    }
}
