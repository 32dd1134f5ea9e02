package uk.gegc.ommltex.features.math.domain.model;

/**
 * Typeset form of one Unicode character.
 */
public record SymbolEntry(String latex, SymbolKind kind) {

    public static SymbolEntry of(String latex) {
        if (latex.length() > 1 && latex.charAt(0) == '\\') {
            return new SymbolEntry(latex, Character.isLetter(latex.charAt(1)) ? SymbolKind.COMMAND : SymbolKind.ESCAPED);
        }
        return new SymbolEntry(latex, SymbolKind.LITERAL);
    }

    public boolean isCommand() {
        return kind == SymbolKind.COMMAND;
    }
}
