package uk.gegc.ommltex.features.math.application;

import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import uk.gegc.ommltex.BaseUnitTest;
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

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class MathConversionServiceTest extends BaseUnitTest {

    @Mock
    private ElementConversionService conversionService;

    @Mock
    private MathBlockExtractor extractor;

    @InjectMocks
    private MathConversionService service;

    @Test
    void convert_defaultsToInlineAndReportsPackages() throws ConversionException {
        // Given
        when(conversionService.convert(argThat(block -> ((MathBlock) block).mode() == MathMode.INLINE), any()))
                .thenAnswer(invocation -> {
                    ConversionContext context = invocation.getArgument(1);
                    context.requirePackage("amsmath");
                    return new ConversionResult("$x$");
                });

        // When
        MathConversion conversion = service.convert("<m:oMath/>", null);

        // Then
        assertThat(conversion.latex()).isEqualTo("$x$");
        assertThat(conversion.mode()).isEqualTo(MathMode.INLINE);
        assertThat(conversion.packages()).containsExactly("\\usepackage{amsmath}");
        assertThat(conversion.warnings()).isEmpty();
    }

    @Test
    void convert_conversionException_becomesConversionFailed() throws ConversionException {
        when(conversionService.convert(any(), any())).thenThrow(new ConversionException("unexpected element"));

        assertThatThrownBy(() -> service.convert("<m:oMath/>", MathMode.DISPLAY))
                .isInstanceOf(ConversionFailedException.class)
                .hasMessageContaining("unexpected element")
                .hasCauseInstanceOf(ConversionException.class);
    }

    @Test
    void convert_blankOmml_isRejected() {
        assertThatThrownBy(() -> service.convert(" ", MathMode.INLINE))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(conversionService);
    }

    @Test
    void extractAndConvert_pairsBlocksWithResults() {
        // Given
        List<MathBlock> blocks = List.of(
                new MathBlock("<m:oMath>1</m:oMath>", MathMode.INLINE),
                new MathBlock("<m:oMath>2</m:oMath>", MathMode.DISPLAY));
        when(extractor.extract("<w:document/>")).thenReturn(blocks);
        when(conversionService.convertAll(anyList(), any())).thenAnswer(invocation -> {
            ConversionContext context = invocation.getArgument(1);
            context.addWarning("second block degraded");
            return List.of(new ConversionResult("$1$"), ConversionResult.empty());
        });

        // When
        MathExtraction extraction = service.extractAndConvert("<w:document/>");

        // Then
        assertThat(extraction.blocks()).containsExactly(
                new MathExtraction.ConvertedBlock(MathMode.INLINE, "$1$"),
                new MathExtraction.ConvertedBlock(MathMode.DISPLAY, ""));
        assertThat(extraction.warnings()).containsExactly("second block degraded");
    }

    @Test
    void extractAndConvert_blankDocument_isRejected() {
        assertThatThrownBy(() -> service.extractAndConvert(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
