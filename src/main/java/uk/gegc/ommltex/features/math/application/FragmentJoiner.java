package uk.gegc.ommltex.features.math.application;

import java.util.List;

/**
 * Joins sibling LaTeX fragments, inserting a space only where two fragments would otherwise
 * fuse into a different command name ({@code \alpha} + {@code beta} must not become {@code \alphabeta}).
 *
 * <p>The check is a heuristic over the emitted text, not a parser: it looks at the last backslash
 * of the left fragment and treats everything after it as the trailing command unless a brace or
 * bracket shows the command already has arguments.
 */
public final class FragmentJoiner {

    private static final String GROUPING_CHARS = "{}[]";

    private FragmentJoiner() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Joins fragments in order. Empty fragments take no part in spacing decisions.
     */
    public static String join(List<String> fragments) {
        StringBuilder result = new StringBuilder();
        String previous = null;
        for (String fragment : fragments) {
            if (fragment == null || fragment.isEmpty()) {
                continue;
            }
            if (previous != null && needsSpace(previous, fragment)) {
                result.append(' ');
            }
            result.append(fragment);
            previous = fragment;
        }
        return result.toString();
    }

    /**
     * @return true when {@code previous} ends in a bare command whose last character is a letter
     * and {@code next} starts with a letter
     */
    public static boolean needsSpace(String previous, String next) {
        if (previous.isEmpty() || next.isEmpty()) {
            return false;
        }
        return endsWithCommandWord(previous) && Character.isLetter(next.codePointAt(0));
    }

    /**
     * @return true when the text after the last backslash of {@code fragment} is non-empty,
     * contains no brace or bracket, and ends in a letter
     */
    public static boolean endsWithCommandWord(String fragment) {
        int lastBackslash = fragment.lastIndexOf('\\');
        if (lastBackslash < 0) {
            return false;
        }
        String afterBackslash = fragment.substring(lastBackslash + 1);
        if (afterBackslash.isEmpty()) {
            return false;
        }
        for (int i = 0; i < afterBackslash.length(); i++) {
            if (GROUPING_CHARS.indexOf(afterBackslash.charAt(i)) >= 0) {
                return false;
            }
        }
        return Character.isLetter(afterBackslash.codePointBefore(afterBackslash.length()));
    }
}
