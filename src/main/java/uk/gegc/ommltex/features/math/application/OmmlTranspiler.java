package uk.gegc.ommltex.features.math.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.ommltex.features.math.config.MathConversionProperties;
import uk.gegc.ommltex.features.math.domain.model.LimitLocation;
import uk.gegc.ommltex.features.math.domain.model.MathNode;
import uk.gegc.ommltex.features.math.domain.model.Transpilation;
import uk.gegc.ommltex.features.math.domain.model.VerticalPosition;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Converts a math tree into a LaTeX math-mode fragment.
 *
 * <p>The walk is depth-first and bottom-up: every node's output is built from its children's
 * already converted fragments plus its own attributes. Missing slots convert to the empty string
 * and unknown glyphs fall back to documented defaults, so conversion never throws for a
 * well-formed tree. Subtrees nested deeper than {@code ommltex.math.max-depth} are dropped.
 *
 * <p>The instance holds no per-call state and may be shared between threads.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OmmlTranspiler {

    static final String DEFAULT_NARY_GLYPH = "∫";
    static final String DEFAULT_ACCENT_GLYPH = "\u0302";
    static final String OVER_BRACE = "⏞";

    private static final String DEFAULT_BEGIN_GLYPH = "(";
    private static final String DEFAULT_END_GLYPH = ")";
    private static final String NULL_DELIMITER = ".";

    private static final List<String> STYLE_WRAPPERS = List.of(
            "\\mathit", "\\mathrm", "\\mathbf", "\\mathcal", "\\mathfrak",
            "\\mathbb", "\\mathsf", "\\mathtt", "\\boldsymbol");

    private final MathSymbolTable symbols;
    private final StyleApplicator styleApplicator;
    private final MathConversionProperties properties;

    /**
     * Converts a tree to LaTeX math. Never throws; over-deep subtrees contribute nothing.
     *
     * @param node root of the tree, usually {@link MathNode.Root}
     * @return the math-mode fragment without surrounding math delimiters
     */
    public String transpile(MathNode node) {
        return transpileChecked(node).latex();
    }

    /**
     * Converts a tree and reports whether the depth cap cut anything off.
     */
    public Transpilation transpileChecked(MathNode node) {
        if (node == null) {
            return new Transpilation("", false);
        }
        NodeVisitor visitor = new NodeVisitor(properties.getMaxDepth(), properties.getDisplayFractionThreshold());
        String latex = visitor.transpile(node);
        if (visitor.truncated) {
            log.warn("Math tree exceeds maximum depth of {}; deeper content was dropped", properties.getMaxDepth());
        }
        return new Transpilation(latex, visitor.truncated);
    }

    /**
     * Per-call walker. The depth counter lives here, not on the transpiler.
     */
    private final class NodeVisitor implements MathNode.Visitor<String> {

        private final int maxDepth;
        private final int displayFractionThreshold;
        private int depth;
        private boolean truncated;

        private NodeVisitor(int maxDepth, int displayFractionThreshold) {
            this.maxDepth = maxDepth;
            this.displayFractionThreshold = displayFractionThreshold;
        }

        String transpile(MathNode node) {
            if (depth >= maxDepth) {
                truncated = true;
                return "";
            }
            depth++;
            try {
                return node.accept(this);
            } finally {
                depth--;
            }
        }

        private String slot(List<MathNode> nodes) {
            if (nodes.isEmpty()) {
                return "";
            }
            return FragmentJoiner.join(nodes.stream()
                    .map(this::transpile)
                    .toList());
        }

        @Override
        public String visitRoot(MathNode.Root node) {
            return slot(node.children());
        }

        @Override
        public String visitRun(MathNode.Run node) {
            String wrapper = node.style().wrapperCommand();
            String text = node.text();

            if (symbols.isFunctionName(text)) {
                String function = symbols.getFunctionLatex(text);
                return wrapper != null ? wrapper + "{" + function + "}" : function;
            }
            if (wrapper != null) {
                return styleApplicator.applySmartly(text, wrapper + "{", "}");
            }
            return symbols.mapText(text);
        }

        @Override
        public String visitText(MathNode.Text node) {
            return symbols.mapText(node.value());
        }

        @Override
        public String visitFraction(MathNode.Fraction node) {
            String numerator = slot(node.numerator());
            String denominator = slot(node.denominator());

            return switch (node.type()) {
                case NO_BAR -> "\\binom{" + numerator + "}{" + denominator + "}";
                case SKEWED, LINEAR -> "{" + numerator + "}/{" + denominator + "}";
                case BAR -> {
                    boolean large = numerator.codePointCount(0, numerator.length()) > displayFractionThreshold
                            || denominator.codePointCount(0, denominator.length()) > displayFractionThreshold;
                    yield (large ? "\\dfrac{" : "\\frac{") + numerator + "}{" + denominator + "}";
                }
            };
        }

        @Override
        public String visitRadical(MathNode.Radical node) {
            String base = slot(node.base());
            if (!node.degreeHidden()) {
                String degree = slot(node.degree());
                if (!degree.isBlank()) {
                    return "\\sqrt[" + degree + "]{" + base + "}";
                }
            }
            return "\\sqrt{" + base + "}";
        }

        @Override
        public String visitSubscript(MathNode.Subscript node) {
            return scriptBase(slot(node.base())) + "_{" + slot(node.subscript()) + "}";
        }

        @Override
        public String visitSuperscript(MathNode.Superscript node) {
            return scriptBase(slot(node.base())) + "^{" + slot(node.superscript()) + "}";
        }

        @Override
        public String visitSubSup(MathNode.SubSup node) {
            String base = scriptBase(slot(node.base()));
            return base + "_{" + slot(node.subscript()) + "}^{" + slot(node.superscript()) + "}";
        }

        @Override
        public String visitPreScript(MathNode.PreScript node) {
            String base = slot(node.base());
            return "{}_{" + slot(node.subscript()) + "}^{" + slot(node.superscript()) + "}" + base;
        }

        @Override
        public String visitNaryOp(MathNode.NaryOp node) {
            String glyph = node.glyph() != null ? node.glyph() : DEFAULT_NARY_GLYPH;
            LimitLocation location = node.limitLocation() != null ? node.limitLocation() : LimitLocation.SUB_SUP;
            String subscript = slot(node.subscript());
            String superscript = slot(node.superscript());
            String base = slot(node.base());

            StringBuilder result = new StringBuilder(symbols.getNaryLatex(glyph));
            switch (location) {
                // TODO: stack UNDER_OVER limits with \limits once display placement is confirmed for inline math
                case UNDER_OVER, SUB_SUP -> appendLimits(result, subscript, superscript);
            }
            return result.append(' ').append(base).toString();
        }

        @Override
        public String visitLowerLimit(MathNode.LowerLimit node) {
            return "\\underset{" + slot(node.limit()) + "}{" + slot(node.base()) + "}";
        }

        @Override
        public String visitUpperLimit(MathNode.UpperLimit node) {
            return "\\overset{" + slot(node.limit()) + "}{" + slot(node.base()) + "}";
        }

        @Override
        public String visitMatrix(MathNode.Matrix node) {
            String content = node.rows().stream()
                    .map(row -> row.cells().stream()
                            .map(this::slot)
                            .collect(Collectors.joining(" & ")))
                    .collect(Collectors.joining(" \\\\ "));
            return "\\begin{matrix} " + content + " \\end{matrix}";
        }

        @Override
        public String visitDelimiter(MathNode.Delimiter node) {
            String begin = node.beginGlyph() != null ? node.beginGlyph() : DEFAULT_BEGIN_GLYPH;
            String end = node.endGlyph() != null ? node.endGlyph() : DEFAULT_END_GLYPH;
            String separator = node.separatorGlyph() != null ? node.separatorGlyph() : "";

            String content = node.items().stream()
                    .map(this::slot)
                    .collect(Collectors.joining(separator));

            String left = symbols.mapLeftDelimiter(begin);
            String right = symbols.mapRightDelimiter(end);
            if (left.isEmpty() && right.isEmpty()) {
                return content;
            }
            return "\\left" + orNullDelimiter(left) + " " + content + " \\right" + orNullDelimiter(right);
        }

        @Override
        public String visitEquationArray(MathNode.EquationArray node) {
            String content = node.rows().stream()
                    .map(this::slot)
                    .collect(Collectors.joining(" \\\\ "));
            return "\\begin{aligned} " + content + " \\end{aligned}";
        }

        @Override
        public String visitBar(MathNode.Bar node) {
            String base = slot(node.base());
            if (node.position() == VerticalPosition.BOTTOM) {
                return "\\underline{" + base + "}";
            }
            return "\\overline{" + base + "}";
        }

        @Override
        public String visitAccent(MathNode.Accent node) {
            String glyph = node.glyph() != null ? node.glyph() : DEFAULT_ACCENT_GLYPH;
            String base = slot(node.base());
            boolean wide = isMultiCharacter(base);
            String command = symbols.getAccentLatex(glyph, wide)
                    .orElse(wide ? "\\widehat" : "\\hat");
            return command + "{" + base + "}";
        }

        @Override
        public String visitBox(MathNode.Box node) {
            return slot(node.base());
        }

        @Override
        public String visitFunction(MathNode.Function node) {
            String name = slot(node.name());
            String argument = slot(node.argument());

            String cleanName = name.strip();
            if (symbols.isFunctionName(cleanName)) {
                return symbols.getFunctionLatex(cleanName) + " " + argument;
            }
            return name + " " + argument;
        }

        @Override
        public String visitGroupChar(MathNode.GroupChar node) {
            String base = slot(node.base());
            if (OVER_BRACE.equals(node.glyph()) || node.position() == VerticalPosition.TOP) {
                return "\\overbrace{" + base + "}";
            }
            return "\\underbrace{" + base + "}";
        }

        @Override
        public String visitBorderBox(MathNode.BorderBox node) {
            return "\\boxed{" + slot(node.base()) + "}";
        }

        @Override
        public String visitPhantom(MathNode.Phantom node) {
            return "\\phantom{" + slot(node.base()) + "}";
        }

        @Override
        public String visitUnknown(MathNode.Unknown node) {
            return slot(node.children());
        }
    }

    // Single characters and commands stay bare: x^{2}, \alpha^{2}, {xy}^{2}
    private static String scriptBase(String base) {
        if (base.codePointCount(0, base.length()) > 1 && !base.startsWith("\\")) {
            return "{" + base + "}";
        }
        return base;
    }

    private static void appendLimits(StringBuilder result, String subscript, String superscript) {
        if (!subscript.isEmpty()) {
            result.append("_{").append(subscript).append('}');
        }
        if (!superscript.isEmpty()) {
            result.append("^{").append(superscript).append('}');
        }
    }

    private static String orNullDelimiter(String delimiter) {
        return delimiter.isEmpty() ? NULL_DELIMITER : delimiter;
    }

    static boolean isMultiCharacter(String base) {
        String stripped = base;
        for (String wrapper : STYLE_WRAPPERS) {
            stripped = stripped.replace(wrapper, "");
        }
        stripped = stripped.replace("{", "").replace("}", "");
        return stripped.codePointCount(0, stripped.length()) > 1;
    }
}
