package uk.gegc.ommltex.features.math.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for OMML to LaTeX math conversion.
 * Allows tuning of depth limits and output heuristics via application properties.
 */
@Configuration
@ConfigurationProperties(prefix = "ommltex.math")
@Data
public class MathConversionProperties {

    /**
     * Maximum nesting depth of math elements and nodes.
     * Deeper input is treated as a failed conversion of that math block only.
     * Default: 200
     */
    private int maxDepth = 200;

    /**
     * Length (in characters) of a numerator or denominator fragment above which
     * a bar fraction is emitted as a display-style fraction.
     * Default: 5
     */
    private int displayFractionThreshold = 5;

    /**
     * Normalize whitespace in the emitted math before wrapping it.
     * Default: true
     */
    private boolean cleanOutput = true;
}
