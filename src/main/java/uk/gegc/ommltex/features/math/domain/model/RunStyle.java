package uk.gegc.ommltex.features.math.domain.model;

/**
 * Character style of a math run.
 *
 * @param script alphabet, never {@code null}
 * @param weight weight/slant, never {@code null}
 */
public record RunStyle(ScriptKind script, WeightKind weight) {

    public static final RunStyle PLAIN = new RunStyle(ScriptKind.ROMAN, WeightKind.PLAIN);

    public RunStyle {
        script = script != null ? script : ScriptKind.ROMAN;
        weight = weight != null ? weight : WeightKind.PLAIN;
    }

    /**
     * Resolves the wrapper command for this style. A script alphabet wins over the weight.
     *
     * @return the wrapper command such as {@code \mathbb}, or {@code null} when the run is unstyled
     */
    public String wrapperCommand() {
        String scriptWrapper = script.wrapperCommand();
        if (scriptWrapper != null) {
            return scriptWrapper;
        }
        return weight.wrapperCommand();
    }
}
