package uk.gegc.ommltex.features.math.domain.model;

public enum SymbolKind {
    /** Plain character emitted as-is. */
    LITERAL,
    /** Backslash-escaped reserved character such as {@code \%}. */
    ESCAPED,
    /** Named command token such as {@code \alpha}. */
    COMMAND
}
