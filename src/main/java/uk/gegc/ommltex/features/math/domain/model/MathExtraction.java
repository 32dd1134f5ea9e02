package uk.gegc.ommltex.features.math.domain.model;

import java.util.List;

/**
 * Outcome of converting every formula of a document fragment.
 */
public record MathExtraction(List<ConvertedBlock> blocks, List<String> packages, List<String> warnings) {

    public MathExtraction {
        blocks = List.copyOf(blocks);
        packages = List.copyOf(packages);
        warnings = List.copyOf(warnings);
    }

    public record ConvertedBlock(MathMode mode, String latex) {
    }
}
