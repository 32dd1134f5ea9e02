package uk.gegc.ommltex.features.math.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.ommltex.features.math.domain.model.MathConversion;
import uk.gegc.ommltex.features.math.domain.model.MathMode;

import java.util.List;

/**
 * Response DTO for a single formula conversion.
 */
@Schema(name = "MathConversionResponse", description = "LaTeX for one formula")
public record MathConversionResponse(
    @Schema(description = "Wrapped LaTeX; empty when the formula could not be converted", example = "$x^{2}$")
    String latex,

    @Schema(description = "Math mode used for wrapping", example = "INLINE")
    MathMode mode,

    @Schema(description = "Package lines the LaTeX needs")
    List<String> packages,

    @Schema(description = "Problems that degraded the output")
    List<String> warnings
) {

    public static MathConversionResponse from(MathConversion conversion) {
        return new MathConversionResponse(conversion.latex(), conversion.mode(),
                conversion.packages(), conversion.warnings());
    }
}
