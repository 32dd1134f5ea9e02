package uk.gegc.ommltex.features.math.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import uk.gegc.ommltex.features.math.config.MathConversionProperties;
import uk.gegc.ommltex.features.math.domain.model.FractionType;
import uk.gegc.ommltex.features.math.domain.model.LimitLocation;
import uk.gegc.ommltex.features.math.domain.model.MathNode;
import uk.gegc.ommltex.features.math.domain.model.RunStyle;
import uk.gegc.ommltex.features.math.domain.model.ScriptKind;
import uk.gegc.ommltex.features.math.domain.model.Transpilation;
import uk.gegc.ommltex.features.math.domain.model.VerticalPosition;
import uk.gegc.ommltex.features.math.domain.model.WeightKind;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

@DisplayName("OmmlTranspiler")
class OmmlTranspilerTest {

    private MathConversionProperties properties;
    private OmmlTranspiler transpiler;

    @BeforeEach
    void setUp() {
        MathSymbolTable symbols = new MathSymbolTable();
        properties = new MathConversionProperties();
        transpiler = new OmmlTranspiler(symbols, new StyleApplicator(symbols), properties);
    }

    private static List<MathNode> run(String text) {
        return List.of(MathNode.Run.plain(text));
    }

    private String transpile(MathNode node) {
        return transpiler.transpile(node);
    }

    @Nested
    @DisplayName("Runs and text")
    class Runs {

        @Test
        void plainRun_mapsCharacters() {
            assertThat(transpile(MathNode.Run.plain("a≤b"))).isEqualTo("a\\leq b");
        }

        @Test
        void functionNameRun_emitsCommand() {
            assertThat(transpile(MathNode.Run.plain("sin"))).isEqualTo("\\sin");
            assertThat(transpile(MathNode.Run.plain("Pr"))).isEqualTo("\\Pr");
        }

        @Test
        void styledFunctionNameRun_keepsWrapper() {
            MathNode bold = new MathNode.Run(new RunStyle(ScriptKind.ROMAN, WeightKind.BOLD), "sin");
            assertThat(transpile(bold)).isEqualTo("\\mathbf{\\sin}");
        }

        @Test
        void doubleStruckRun_wrapsLettersOnly() {
            MathNode run = new MathNode.Run(new RunStyle(ScriptKind.DOUBLE_STRUCK, WeightKind.PLAIN), "∈R");
            assertThat(transpile(run)).isEqualTo("\\in \\mathbb{R}");
        }

        @Test
        void scriptWrapperWinsOverWeight() {
            MathNode run = new MathNode.Run(new RunStyle(ScriptKind.SCRIPT, WeightKind.BOLD), "L");
            assertThat(transpile(run)).isEqualTo("\\mathcal{L}");
        }

        @Test
        void text_mapsCharacters() {
            assertThat(transpile(new MathNode.Text("π"))).isEqualTo("\\pi");
        }

        @Test
        void siblingFragments_joinedWithSpacingPolicy() {
            MathNode root = new MathNode.Root(List.of(
                    MathNode.Run.plain("α"), MathNode.Run.plain("p"), MathNode.Run.plain("+1")));
            assertThat(transpile(root)).isEqualTo("\\alpha p+1");
        }
    }

    @Nested
    @DisplayName("Fractions and radicals")
    class FractionsAndRadicals {

        @Test
        void barFraction_isCompact() {
            MathNode fraction = new MathNode.Fraction(FractionType.BAR, run("a"), run("b"));
            assertThat(transpile(fraction)).isEqualTo("\\frac{a}{b}");
        }

        @Test
        void barFraction_withLongOperand_isDisplayStyle() {
            MathNode fraction = new MathNode.Fraction(FractionType.BAR, run("abcdef"), run("b"));
            assertThat(transpile(fraction)).isEqualTo("\\dfrac{abcdef}{b}");
        }

        @Test
        void barFraction_countsCharactersNotCodeUnits() {
            // three mathematical italic letters outside the BMP
            String italicAbc = "\uD835\uDC4E\uD835\uDC4F\uD835\uDC50";
            MathNode fraction = new MathNode.Fraction(FractionType.BAR, run(italicAbc), run("b"));
            assertThat(transpile(fraction)).isEqualTo("\\frac{" + italicAbc + "}{b}");
        }

        @Test
        void barFraction_thresholdIsConfigurable() {
            properties.setDisplayFractionThreshold(10);
            MathNode fraction = new MathNode.Fraction(FractionType.BAR, run("abcdef"), run("b"));
            assertThat(transpile(fraction)).isEqualTo("\\frac{abcdef}{b}");
        }

        @Test
        void otherFractionTypes() {
            assertThat(transpile(new MathNode.Fraction(FractionType.NO_BAR, run("n"), run("k"))))
                    .isEqualTo("\\binom{n}{k}");
            assertThat(transpile(new MathNode.Fraction(FractionType.LINEAR, run("a"), run("b"))))
                    .isEqualTo("{a}/{b}");
            assertThat(transpile(new MathNode.Fraction(FractionType.SKEWED, run("a"), run("b"))))
                    .isEqualTo("{a}/{b}");
        }

        @Test
        void radical_withDegree() {
            assertThat(transpile(new MathNode.Radical(false, run("3"), run("x")))).isEqualTo("\\sqrt[3]{x}");
        }

        @Test
        void radical_hiddenOrEmptyDegree_isSquareRoot() {
            assertThat(transpile(new MathNode.Radical(true, run("3"), run("x")))).isEqualTo("\\sqrt{x}");
            assertThat(transpile(new MathNode.Radical(false, List.of(), run("x")))).isEqualTo("\\sqrt{x}");
        }
    }

    @Nested
    @DisplayName("Scripts and limits")
    class Scripts {

        @Test
        void superscript_singleCharacterBase_isBare() {
            assertThat(transpile(new MathNode.Superscript(run("x"), run("2")))).isEqualTo("x^{2}");
        }

        @Test
        void superscript_multiCharacterBase_isBraced() {
            assertThat(transpile(new MathNode.Superscript(run("xy"), run("2")))).isEqualTo("{xy}^{2}");
        }

        @Test
        void superscript_commandBase_isBare() {
            assertThat(transpile(new MathNode.Superscript(run("α"), run("2")))).isEqualTo("\\alpha^{2}");
        }

        @Test
        void subscriptAndSubSup() {
            assertThat(transpile(new MathNode.Subscript(run("a"), run("ij")))).isEqualTo("a_{ij}");
            assertThat(transpile(new MathNode.SubSup(run("x"), run("i"), run("2")))).isEqualTo("x_{i}^{2}");
        }

        @Test
        void preScript_placesScriptsBeforeBase() {
            assertThat(transpile(new MathNode.PreScript(run("X"), run("a"), run("b")))).isEqualTo("{}_{a}^{b}X");
        }

        @Test
        void naryOp_withLimits() {
            MathNode sum = new MathNode.NaryOp("∑", LimitLocation.SUB_SUP, run("i=1"), run("n"), run("i"));
            assertThat(transpile(sum)).isEqualTo("\\sum_{i=1}^{n} i");
        }

        @Test
        void naryOp_underOverRendersLikeSubSup() {
            MathNode sum = new MathNode.NaryOp("∑", LimitLocation.UNDER_OVER, run("i=1"), run("n"), run("i"));
            assertThat(transpile(sum)).isEqualTo("\\sum_{i=1}^{n} i");
        }

        @Test
        void naryOp_defaultsToIntegralWithoutLimits() {
            MathNode integral = new MathNode.NaryOp(null, null, List.of(), List.of(), run("x"));
            assertThat(transpile(integral)).isEqualTo("\\int x");
        }

        @Test
        void naryOp_unknownGlyphPassesThrough() {
            MathNode op = new MathNode.NaryOp("⊕", null, List.of(), List.of(), run("x"));
            assertThat(transpile(op)).isEqualTo("⊕ x");
        }

        @Test
        void lowerAndUpperLimits() {
            assertThat(transpile(new MathNode.LowerLimit(run("a"), run("b")))).isEqualTo("\\underset{b}{a}");
            assertThat(transpile(new MathNode.UpperLimit(run("a"), run("b")))).isEqualTo("\\overset{b}{a}");
        }
    }

    @Nested
    @DisplayName("Layout structures")
    class Layout {

        @Test
        void matrix_joinsCellsAndRows() {
            MathNode matrix = new MathNode.Matrix(List.of(
                    new MathNode.MatrixRow(List.of(run("a"), run("b"))),
                    new MathNode.MatrixRow(List.of(run("c"), run("d")))));
            assertThat(transpile(matrix)).isEqualTo("\\begin{matrix} a & b \\\\ c & d \\end{matrix}");
        }

        @Test
        void delimiter_curlyBracesAreEscaped() {
            MathNode delimiter = new MathNode.Delimiter("{", "}", null, List.of(run("x")));
            assertThat(transpile(delimiter)).isEqualTo("\\left\\{ x \\right\\}");
        }

        @Test
        void delimiter_defaultsToParentheses() {
            MathNode delimiter = new MathNode.Delimiter(null, null, null, List.of(run("x")));
            assertThat(transpile(delimiter)).isEqualTo("\\left( x \\right)");
        }

        @Test
        void delimiter_joinsItemsWithSeparator() {
            MathNode delimiter = new MathNode.Delimiter("⟨", "⟩", "|", List.of(run("a"), run("b")));
            assertThat(transpile(delimiter)).isEqualTo("\\left\\langle a|b \\right\\rangle");
        }

        @Test
        void delimiter_emptySideBecomesNullDelimiter() {
            MathNode delimiter = new MathNode.Delimiter("", "|", null, List.of(run("x")));
            assertThat(transpile(delimiter)).isEqualTo("\\left. x \\right|");
        }

        @Test
        void delimiter_bothSidesEmpty_returnsBareContent() {
            MathNode delimiter = new MathNode.Delimiter("", "", null, List.of(run("x")));
            assertThat(transpile(delimiter)).isEqualTo("x");
        }

        @Test
        void equationArray_usesAlignedEnvironment() {
            MathNode array = new MathNode.EquationArray(List.of(run("a=b"), run("c=d")));
            assertThat(transpile(array)).isEqualTo("\\begin{aligned} a=b \\\\ c=d \\end{aligned}");
        }
    }

    @Nested
    @DisplayName("Decorations")
    class Decorations {

        @Test
        void bar_defaultsToOverline() {
            assertThat(transpile(new MathNode.Bar(null, run("x")))).isEqualTo("\\overline{x}");
            assertThat(transpile(new MathNode.Bar(VerticalPosition.BOTTOM, run("x")))).isEqualTo("\\underline{x}");
        }

        @Test
        void accent_multiCharacterBase_isWide() {
            assertThat(transpile(new MathNode.Accent("\u0302", run("ab")))).isEqualTo("\\widehat{ab}");
        }

        @Test
        void accent_singleCharacterBase_isNarrow() {
            assertThat(transpile(new MathNode.Accent("\u0302", run("a")))).isEqualTo("\\hat{a}");
            assertThat(transpile(new MathNode.Accent(null, run("a")))).isEqualTo("\\hat{a}");
        }

        @Test
        void accent_styledSingleLetter_isNarrow() {
            MathNode bold = new MathNode.Run(new RunStyle(ScriptKind.ROMAN, WeightKind.BOLD), "a");
            assertThat(transpile(new MathNode.Accent("\u0303", List.of(bold)))).isEqualTo("\\tilde{\\mathbf{a}}");
        }

        @Test
        void accent_unknownGlyph_fallsBackToCircumflex() {
            assertThat(transpile(new MathNode.Accent("?", run("ab")))).isEqualTo("\\widehat{ab}");
            assertThat(transpile(new MathNode.Accent("?", run("a")))).isEqualTo("\\hat{a}");
        }

        @Test
        void groupChar_braceDirection() {
            assertThat(transpile(new MathNode.GroupChar("⏞", null, run("x")))).isEqualTo("\\overbrace{x}");
            assertThat(transpile(new MathNode.GroupChar(null, VerticalPosition.TOP, run("x")))).isEqualTo("\\overbrace{x}");
            assertThat(transpile(new MathNode.GroupChar(null, null, run("x")))).isEqualTo("\\underbrace{x}");
        }

        @Test
        void boxes() {
            assertThat(transpile(new MathNode.Box(run("x")))).isEqualTo("x");
            assertThat(transpile(new MathNode.BorderBox(run("x")))).isEqualTo("\\boxed{x}");
            assertThat(transpile(new MathNode.Phantom(run("x")))).isEqualTo("\\phantom{x}");
        }

        @Test
        void function_recognizedName() {
            MathNode function = new MathNode.Function(run("sin"), run("x"));
            assertThat(transpile(function)).isEqualTo("\\sin x");
        }

        @Test
        void function_unrecognizedName_isLiteral() {
            MathNode function = new MathNode.Function(run("f"), run("x"));
            assertThat(transpile(function)).isEqualTo("f x");
        }

        @Test
        void function_nonNativeName_usesOperatorName() {
            MathNode function = new MathNode.Function(List.of(new MathNode.Text("arccot")), run("x"));
            assertThat(transpile(function)).isEqualTo("\\operatorname{arccot} x");
        }
    }

    @Nested
    @DisplayName("Robustness")
    class Robustness {

        @Test
        void unknownNode_concatenatesChildren() {
            MathNode unknown = new MathNode.Unknown("ctrlX", List.of(MathNode.Run.plain("a"), MathNode.Run.plain("b")));
            assertThat(transpile(unknown)).isEqualTo("ab");
        }

        @Test
        void missingSlots_degradeToEmpty() {
            assertThat(transpile(new MathNode.Fraction(null, null, null))).isEqualTo("\\frac{}{}");
            assertThat(transpile(new MathNode.Superscript(null, run("2")))).isEqualTo("^{2}");
            assertThat(transpile(new MathNode.Delimiter(null, null, null, null))).isEqualTo("\\left(  \\right)");
        }

        @Test
        void everyKindWithEmptySlots_neverThrows() {
            List<MathNode> nodes = List.of(
                    new MathNode.Root(null), new MathNode.Run(null, null), new MathNode.Text(null),
                    new MathNode.Fraction(null, null, null), new MathNode.Radical(false, null, null),
                    new MathNode.Subscript(null, null), new MathNode.Superscript(null, null),
                    new MathNode.SubSup(null, null, null), new MathNode.PreScript(null, null, null),
                    new MathNode.NaryOp(null, null, null, null, null),
                    new MathNode.LowerLimit(null, null), new MathNode.UpperLimit(null, null),
                    new MathNode.Matrix(null), new MathNode.Delimiter(null, null, null, null),
                    new MathNode.EquationArray(null), new MathNode.Bar(null, null),
                    new MathNode.Accent(null, null), new MathNode.Box(null),
                    new MathNode.Function(null, null), new MathNode.GroupChar(null, null, null),
                    new MathNode.BorderBox(null), new MathNode.Phantom(null),
                    new MathNode.Unknown(null, null));

            for (MathNode node : nodes) {
                assertThatCode(() -> transpiler.transpile(node)).doesNotThrowAnyException();
            }
        }

        @Test
        void nullNode_isEmpty() {
            assertThat(transpiler.transpile(null)).isEmpty();
        }

        @Test
        void deepTree_isTruncatedAtMaxDepth() {
            // given
            properties.setMaxDepth(50);
            MathNode node = MathNode.Run.plain("x");
            for (int i = 0; i < 100; i++) {
                node = new MathNode.Box(List.of(node));
            }

            // when
            Transpilation result = transpiler.transpileChecked(node);

            // then
            assertThat(result.truncated()).isTrue();
            assertThat(result.latex()).isEmpty();
        }

        @Test
        void treeWithinMaxDepth_isNotTruncated() {
            MathNode node = MathNode.Run.plain("x");
            for (int i = 0; i < 100; i++) {
                node = new MathNode.Box(List.of(node));
            }

            Transpilation result = transpiler.transpileChecked(node);

            assertThat(result.truncated()).isFalse();
            assertThat(result.latex()).isEqualTo("x");
        }
    }
}
