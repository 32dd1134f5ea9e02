package uk.gegc.ommltex.features.math.domain.model;

import java.util.List;

/**
 * Outcome of converting one formula.
 *
 * @param latex    the wrapped LaTeX, empty when the formula could not be converted
 * @param mode     the math mode used for wrapping
 * @param packages LaTeX packages the output needs, in registration order
 * @param warnings problems that degraded the output
 */
public record MathConversion(String latex, MathMode mode, List<String> packages, List<String> warnings) {

    public MathConversion {
        packages = List.copyOf(packages);
        warnings = List.copyOf(warnings);
    }
}
