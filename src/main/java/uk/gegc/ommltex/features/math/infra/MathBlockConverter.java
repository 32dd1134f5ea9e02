package uk.gegc.ommltex.features.math.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.ommltex.features.conversion.domain.ConversionContext;
import uk.gegc.ommltex.features.conversion.domain.ConversionException;
import uk.gegc.ommltex.features.conversion.domain.ConversionResult;
import uk.gegc.ommltex.features.conversion.domain.DocumentElement;
import uk.gegc.ommltex.features.conversion.domain.ElementConverter;
import uk.gegc.ommltex.features.math.application.LatexCleaner;
import uk.gegc.ommltex.features.math.application.OmmlTranspiler;
import uk.gegc.ommltex.features.math.config.MathConversionProperties;
import uk.gegc.ommltex.features.math.domain.OmmlParseException;
import uk.gegc.ommltex.features.math.domain.model.MathBlock;
import uk.gegc.ommltex.features.math.domain.model.MathMode;
import uk.gegc.ommltex.features.math.domain.model.MathNode;
import uk.gegc.ommltex.features.math.domain.model.Transpilation;

import java.util.List;

/**
 * Converts {@link MathBlock} elements to LaTeX wrapped in the delimiters of their math mode.
 *
 * <p>A block whose OMML cannot be read, or whose tree is too deep, is not an error for the
 * conversion as a whole: a warning is recorded and the block converts to an empty string.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MathBlockConverter implements ElementConverter {

    static final List<String> REQUIRED_PACKAGES = List.of("amsmath", "amssymb", "mathtools");

    private final OmmlParser parser;
    private final OmmlTranspiler transpiler;
    private final MathConversionProperties properties;

    @Override
    public boolean supports(String elementType) {
        return MathBlock.ELEMENT_TYPE.equals(elementType);
    }

    @Override
    public ConversionResult convert(DocumentElement element, ConversionContext context) throws ConversionException {
        if (!(element instanceof MathBlock block)) {
            throw new ConversionException("Expected a math block but got element type: " + element.elementType());
        }
        REQUIRED_PACKAGES.forEach(context::requirePackage);

        MathNode.Root root;
        try {
            root = parser.parse(block.ommlXml());
        } catch (OmmlParseException e) {
            return degraded(context, "Math block could not be parsed: " + e.getMessage());
        }

        Transpilation transpilation = transpiler.transpileChecked(root);
        if (transpilation.truncated()) {
            return degraded(context, "Math block exceeds maximum nesting depth of " + properties.getMaxDepth());
        }

        String latex = properties.isCleanOutput()
                ? LatexCleaner.clean(transpilation.latex())
                : transpilation.latex().strip();
        log.debug("Converted {} math block to {} characters of LaTeX", block.mode(), latex.length());
        return new ConversionResult(wrap(latex, block.mode()));
    }

    private ConversionResult degraded(ConversionContext context, String warning) {
        log.warn(warning);
        context.addWarning(warning);
        return ConversionResult.empty();
    }

    static String wrap(String latex, MathMode mode) {
        if (latex.isEmpty()) {
            return "";
        }
        return switch (mode) {
            case INLINE -> "$" + latex + "$";
            case DISPLAY -> "\\[\n" + latex + "\n\\]";
            case EQUATION -> "\\begin{equation}\n" + latex + "\n\\end{equation}";
        };
    }
}
