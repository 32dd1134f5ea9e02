package uk.gegc.ommltex.features.math.domain.model;

/**
 * Auto-sizing delimiter pair, e.g. {@code \left\{} and {@code \right\}}.
 */
public record BracketPair(String left, String right) {
}
