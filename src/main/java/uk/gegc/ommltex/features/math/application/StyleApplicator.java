package uk.gegc.ommltex.features.math.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies a character style wrapper such as {@code \mathbb{...}} to the letters of a run only.
 * Operators and other non-letters in the same run stay outside the wrapper, so a double-struck
 * {@code ∈R} becomes {@code \in \mathbb{R}}.
 */
@Component
@RequiredArgsConstructor
public class StyleApplicator {

    private final MathSymbolTable symbols;

    /**
     * @param text   raw run text
     * @param prefix wrapper opening, e.g. <code>\mathbb{</code>
     * @param suffix wrapper closing, normally <code>}</code>
     * @return the mapped text with each maximal letter span wrapped
     */
    public String applySmartly(String text, String prefix, String suffix) {
        List<String> pieces = new ArrayList<>();
        StringBuilder letters = new StringBuilder();

        text.codePoints().forEach(codePoint -> {
            String mapped = symbols.mapChar(codePoint);
            if (mapped.startsWith("\\") || !Character.isLetter(codePoint)) {
                flush(letters, prefix, suffix, pieces);
                if (!mapped.isEmpty()) {
                    pieces.add(mapped);
                }
            } else {
                letters.appendCodePoint(codePoint);
            }
        });
        flush(letters, prefix, suffix, pieces);

        if (pieces.size() == 1) {
            return pieces.get(0);
        }
        return joinPieces(pieces, prefix);
    }

    private static void flush(StringBuilder letters, String prefix, String suffix, List<String> pieces) {
        if (letters.length() > 0) {
            pieces.add(prefix + letters + suffix);
            letters.setLength(0);
        }
    }

    private static String joinPieces(List<String> pieces, String prefix) {
        StringBuilder result = new StringBuilder();
        String previous = null;
        for (String piece : pieces) {
            if (previous != null && needsSpace(previous, piece, prefix)) {
                result.append(' ');
            }
            result.append(piece);
            previous = piece;
        }
        return result.toString();
    }

    // A bare command followed by a wrapped span reads as "\in \mathbb{R}"
    private static boolean needsSpace(String previous, String next, String prefix) {
        if (FragmentJoiner.needsSpace(previous, next)) {
            return true;
        }
        return next.startsWith(prefix) && MathSymbolTable.isCommandEndingInLetter(previous);
    }
}
