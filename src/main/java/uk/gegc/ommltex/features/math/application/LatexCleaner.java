package uk.gegc.ommltex.features.math.application;

import java.util.regex.Pattern;

/**
 * Whitespace normalization for emitted math. Only spacing changes; tokens and groups are kept,
 * including empty groups that anchor pre-scripts such as <code>{}_{a}^{b}X</code>.
 */
public final class LatexCleaner {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern SPACE_AFTER_OPEN_BRACE = Pattern.compile("(?<!\\\\)\\{\\s+");
    private static final Pattern SPACE_BEFORE_CLOSE_BRACE = Pattern.compile("\\s+}");

    private LatexCleaner() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static String clean(String latex) {
        if (latex == null || latex.isBlank()) {
            return "";
        }
        String cleaned = WHITESPACE.matcher(latex).replaceAll(" ");
        cleaned = SPACE_AFTER_OPEN_BRACE.matcher(cleaned).replaceAll("{");
        cleaned = SPACE_BEFORE_CLOSE_BRACE.matcher(cleaned).replaceAll("}");
        return cleaned.strip();
    }
}
