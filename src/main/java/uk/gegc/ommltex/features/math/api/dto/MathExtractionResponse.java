package uk.gegc.ommltex.features.math.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.ommltex.features.math.domain.model.MathExtraction;
import uk.gegc.ommltex.features.math.domain.model.MathMode;

import java.util.List;

/**
 * Response DTO for document-wide formula conversion.
 */
@Schema(name = "MathExtractionResponse", description = "LaTeX for every formula of a document fragment")
public record MathExtractionResponse(
    @Schema(description = "Converted formulas in document order")
    List<Block> blocks,

    @Schema(description = "Package lines the LaTeX needs")
    List<String> packages,

    @Schema(description = "Problems that degraded individual formulas")
    List<String> warnings
) {

    @Schema(name = "MathExtractionBlock", description = "One converted formula")
    public record Block(
        @Schema(description = "Placement of the formula", example = "DISPLAY")
        MathMode mode,

        @Schema(description = "Wrapped LaTeX", example = "\\[\n\\frac{a}{b}\n\\]")
        String latex
    ) {}

    public static MathExtractionResponse from(MathExtraction extraction) {
        List<Block> blocks = extraction.blocks().stream()
                .map(block -> new Block(block.mode(), block.latex()))
                .toList();
        return new MathExtractionResponse(blocks, extraction.packages(), extraction.warnings());
    }
}
