package uk.gegc.ommltex.features.math.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.ommltex.features.conversion.application.ElementConversionService;
import uk.gegc.ommltex.features.conversion.domain.ConversionContext;
import uk.gegc.ommltex.features.conversion.domain.ConversionException;
import uk.gegc.ommltex.features.conversion.domain.ConversionFailedException;
import uk.gegc.ommltex.features.conversion.domain.ConversionResult;
import uk.gegc.ommltex.features.math.domain.model.MathBlock;
import uk.gegc.ommltex.features.math.domain.model.MathConversion;
import uk.gegc.ommltex.features.math.domain.model.MathExtraction;
import uk.gegc.ommltex.features.math.domain.model.MathMode;
import uk.gegc.ommltex.features.math.infra.MathBlockExtractor;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for formula conversion - orchestrates extraction, element dispatch and package tracking.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MathConversionService {

    private final ElementConversionService conversionService;
    private final MathBlockExtractor extractor;

    /**
     * Converts a single OMML formula.
     *
     * @param omml OMML markup holding an {@code oMath} or {@code oMathPara} element
     * @param mode math mode to wrap the result in; {@code null} means inline
     * @throws IllegalArgumentException  if {@code omml} is blank
     * @throws ConversionFailedException if the math converter rejects the element
     */
    public MathConversion convert(String omml, MathMode mode) {
        if (omml == null || omml.isBlank()) {
            throw new IllegalArgumentException("OMML content is required");
        }
        MathBlock block = new MathBlock(omml, mode);
        ConversionContext context = new ConversionContext();

        ConversionResult result;
        try {
            result = conversionService.convert(block, context);
        } catch (ConversionException e) {
            throw new ConversionFailedException("Failed to convert math block: " + e.getMessage(), e);
        }

        return new MathConversion(result.latex(), block.mode(),
                context.usePackageLines(), context.getWarnings());
    }

    /**
     * Converts every formula found in a WordprocessingML fragment, in document order.
     * Formulas that cannot be converted yield an empty block and a warning.
     */
    public MathExtraction extractAndConvert(String documentXml) {
        if (documentXml == null || documentXml.isBlank()) {
            throw new IllegalArgumentException("Document XML is required");
        }
        List<MathBlock> blocks = extractor.extract(documentXml);
        ConversionContext context = new ConversionContext();
        List<ConversionResult> results = conversionService.convertAll(blocks, context);

        List<MathExtraction.ConvertedBlock> converted = new ArrayList<>(blocks.size());
        for (int i = 0; i < blocks.size(); i++) {
            converted.add(new MathExtraction.ConvertedBlock(blocks.get(i).mode(), results.get(i).latex()));
        }
        log.info("Converted {} math blocks with {} warnings", converted.size(), context.getWarnings().size());
        return new MathExtraction(converted, context.usePackageLines(), context.getWarnings());
    }
}
