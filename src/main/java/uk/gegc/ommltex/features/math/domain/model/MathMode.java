package uk.gegc.ommltex.features.math.domain.model;

/**
 * How a converted formula is placed in the output.
 */
public enum MathMode {
    /** Within the text flow: {@code $...$}. */
    INLINE,
    /** Centered on its own line: {@code \[...\]}. */
    DISPLAY,
    /** Numbered equation environment. */
    EQUATION
}
