package uk.gegc.ommltex.features.math.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.ommltex.features.math.api.dto.MathConversionRequest;
import uk.gegc.ommltex.features.math.api.dto.MathConversionResponse;
import uk.gegc.ommltex.features.math.api.dto.MathExtractionRequest;
import uk.gegc.ommltex.features.math.api.dto.MathExtractionResponse;
import uk.gegc.ommltex.features.math.application.MathConversionService;

/**
 * REST controller for OMML to LaTeX formula conversion.
 */
@RestController
@RequestMapping("/api/v1/math")
@RequiredArgsConstructor
@Validated
@Slf4j
@Tag(name = "Math Conversion", description = "OMML formula to LaTeX conversion")
public class MathConversionController {

    private final MathConversionService conversionService;

    @Operation(
            summary = "Convert OMML formula",
            description = "Converts one OMML formula to LaTeX wrapped in the delimiters of the requested math mode"
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Formula converted; warnings list any degradation",
                    content = @Content(schema = @Schema(implementation = MathConversionResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "OMML is blank or the request is malformed"),
            @ApiResponse(responseCode = "422", description = "Conversion failed")
    })
    @PostMapping(path = "/conversions", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<MathConversionResponse> convert(
            @io.swagger.v3.oas.annotations.parameters.RequestBody(
                    description = "OMML formula and math mode",
                    required = true
            )
            @Valid @RequestBody MathConversionRequest request) {

        log.info("Converting OMML formula: mode={}, length={}", request.mode(), request.omml().length());
        return ResponseEntity.ok(MathConversionResponse.from(
                conversionService.convert(request.omml(), request.mode())));
    }

    @Operation(
            summary = "Convert document formulas",
            description = "Finds every formula in a WordprocessingML fragment and converts each to LaTeX"
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Formulas converted in document order",
                    content = @Content(schema = @Schema(implementation = MathExtractionResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "Document XML is blank or the request is malformed")
    })
    @PostMapping(path = "/extractions", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<MathExtractionResponse> extract(
            @io.swagger.v3.oas.annotations.parameters.RequestBody(
                    description = "WordprocessingML fragment",
                    required = true
            )
            @Valid @RequestBody MathExtractionRequest request) {

        log.info("Converting document formulas: length={}", request.documentXml().length());
        return ResponseEntity.ok(MathExtractionResponse.from(
                conversionService.extractAndConvert(request.documentXml())));
    }
}
