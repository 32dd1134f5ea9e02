package uk.gegc.ommltex.features.conversion.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.ommltex.features.conversion.domain.ConversionContext;
import uk.gegc.ommltex.features.conversion.domain.ConversionException;
import uk.gegc.ommltex.features.conversion.domain.ConversionResult;
import uk.gegc.ommltex.features.conversion.domain.DocumentElement;
import uk.gegc.ommltex.features.conversion.domain.ElementConverter;
import uk.gegc.ommltex.features.conversion.domain.UnsupportedElementException;

import java.util.ArrayList;
import java.util.List;

/**
 * Service for converting document elements to LaTeX using appropriate converters.
 * Uses strategy pattern to delegate to specific converters.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ElementConversionService {

    private final List<ElementConverter> converters;

    /**
     * Converts a single element using the first converter that supports its type.
     *
     * @param element the element to convert
     * @param context per-request conversion context
     * @return ConversionResult containing the LaTeX output
     * @throws UnsupportedElementException if no suitable converter is found
     * @throws ConversionException if conversion fails
     */
    public ConversionResult convert(DocumentElement element, ConversionContext context) throws ConversionException {
        String elementType = element.elementType();
        ElementConverter converter = findConverter(elementType);
        if (converter == null) {
            throw new UnsupportedElementException("No suitable converter found for element type: " + elementType);
        }

        log.debug("Using converter {} for element type {}", converter.getClass().getSimpleName(), elementType);
        return converter.convert(element, context);
    }

    /**
     * Converts elements in order. A failing element is recorded as a context warning and
     * contributes an empty result; the remaining elements are still converted.
     *
     * @param elements the elements to convert
     * @param context per-request conversion context
     * @return one result per element, in input order
     * @throws UnsupportedElementException if an element type has no converter
     */
    public List<ConversionResult> convertAll(List<? extends DocumentElement> elements, ConversionContext context) {
        List<ConversionResult> results = new ArrayList<>(elements.size());
        for (DocumentElement element : elements) {
            try {
                results.add(convert(element, context));
            } catch (ConversionException e) {
                log.warn("Element of type {} could not be converted: {}", element.elementType(), e.getMessage());
                context.addWarning(e.getMessage());
                results.add(ConversionResult.empty());
            }
        }
        return results;
    }

    /**
     * Checks if any converter supports the given element type.
     *
     * @param elementType the element type to check
     * @return true if a suitable converter exists
     */
    public boolean isSupported(String elementType) {
        return findConverter(elementType) != null;
    }

    private ElementConverter findConverter(String elementType) {
        return converters.stream()
                .filter(converter -> converter.supports(elementType))
                .findFirst()
                .orElse(null);
    }
}
