package uk.gegc.ommltex.features.math.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import uk.gegc.ommltex.features.math.domain.model.MathMode;

/**
 * Request DTO for converting one OMML formula.
 */
@Schema(name = "MathConversionRequest", description = "OMML formula to convert to LaTeX")
public record MathConversionRequest(
    @Schema(description = "OMML markup with an oMath or oMathPara element",
            example = "<m:oMath><m:r><m:t>x</m:t></m:r></m:oMath>")
    @NotBlank(message = "OMML content cannot be blank")
    String omml,

    @Schema(description = "Math mode used to wrap the output (defaults to INLINE)", example = "DISPLAY")
    MathMode mode
) {}
