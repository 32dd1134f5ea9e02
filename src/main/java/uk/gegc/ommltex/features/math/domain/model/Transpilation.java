package uk.gegc.ommltex.features.math.domain.model;

/**
 * Result of a depth-checked transpilation.
 *
 * @param latex     the math-mode fragment; subtrees past the depth cap contribute nothing
 * @param truncated whether the depth cap was hit anywhere in the tree
 */
public record Transpilation(String latex, boolean truncated) {
}
