package uk.gegc.ommltex.features.math.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO for converting every formula of a document fragment.
 */
@Schema(name = "MathExtractionRequest", description = "WordprocessingML fragment containing formulas")
public record MathExtractionRequest(
    @Schema(description = "Document XML, e.g. the content of word/document.xml")
    @NotBlank(message = "Document XML cannot be blank")
    String documentXml
) {}
