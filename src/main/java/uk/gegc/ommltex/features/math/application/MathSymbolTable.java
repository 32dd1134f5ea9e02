package uk.gegc.ommltex.features.math.application;

import org.springframework.stereotype.Component;
import uk.gegc.ommltex.features.math.domain.model.BracketPair;
import uk.gegc.ommltex.features.math.domain.model.SymbolEntry;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static java.util.Map.entry;

/**
 * Static lookup from Unicode math characters to LaTeX.
 *
 * <p>All tables are immutable and built once when the class is loaded, so a single instance
 * is safe to share between threads.
 */
@Component
public class MathSymbolTable {

    private static final Map<String, String> GREEK_LOWER = Map.ofEntries(
            entry("α", "\\alpha"),
            entry("β", "\\beta"),
            entry("γ", "\\gamma"),
            entry("δ", "\\delta"),
            entry("ε", "\\varepsilon"),
            entry("ϵ", "\\epsilon"),
            entry("ζ", "\\zeta"),
            entry("η", "\\eta"),
            entry("θ", "\\theta"),
            entry("ϑ", "\\vartheta"),
            entry("ι", "\\iota"),
            entry("κ", "\\kappa"),
            entry("ϰ", "\\varkappa"),
            entry("λ", "\\lambda"),
            entry("μ", "\\mu"),
            entry("ν", "\\nu"),
            entry("ξ", "\\xi"),
            entry("π", "\\pi"),
            entry("ϖ", "\\varpi"),
            entry("ρ", "\\rho"),
            entry("ϱ", "\\varrho"),
            entry("σ", "\\sigma"),
            entry("ς", "\\varsigma"),
            entry("τ", "\\tau"),
            entry("υ", "\\upsilon"),
            entry("φ", "\\varphi"),
            entry("ϕ", "\\phi"),
            entry("χ", "\\chi"),
            entry("ψ", "\\psi"),
            entry("ω", "\\omega")
    );

    // Capitals that look like Latin letters have no command of their own
    private static final Map<String, String> GREEK_UPPER = Map.ofEntries(
            entry("Α", "A"),
            entry("Β", "B"),
            entry("Γ", "\\Gamma"),
            entry("Δ", "\\Delta"),
            entry("Ε", "E"),
            entry("Ζ", "Z"),
            entry("Η", "H"),
            entry("Θ", "\\Theta"),
            entry("Ι", "I"),
            entry("Κ", "K"),
            entry("Λ", "\\Lambda"),
            entry("Μ", "M"),
            entry("Ν", "N"),
            entry("Ξ", "\\Xi"),
            entry("Ο", "O"),
            entry("Π", "\\Pi"),
            entry("Ρ", "P"),
            entry("Σ", "\\Sigma"),
            entry("Τ", "T"),
            entry("Υ", "\\Upsilon"),
            entry("Φ", "\\Phi"),
            entry("Χ", "X"),
            entry("Ψ", "\\Psi"),
            entry("Ω", "\\Omega")
    );

    private static final Map<String, String> OPERATORS = Map.ofEntries(
            // Reserved characters
            entry("%", "\\%"),
            entry("#", "\\#"),
            entry("&", "\\&"),
            entry("$", "\\$"),
            entry("_", "\\_"),
            // Arithmetic
            entry("−", "-"),
            entry("×", "\\times"),
            entry("÷", "\\div"),
            entry("±", "\\pm"),
            entry("∓", "\\mp"),
            entry("·", "\\cdot"),
            entry("∗", "\\ast"),
            entry("⋆", "\\star"),
            entry("∘", "\\circ"),
            entry("•", "\\bullet"),
            // Relations
            entry("≠", "\\neq"),
            entry("≤", "\\leq"),
            entry("≥", "\\geq"),
            entry("≪", "\\ll"),
            entry("≫", "\\gg"),
            entry("≈", "\\approx"),
            entry("≃", "\\simeq"),
            entry("≅", "\\cong"),
            entry("≡", "\\equiv"),
            entry("∼", "\\sim"),
            entry("∝", "\\propto"),
            entry("≺", "\\prec"),
            entry("≻", "\\succ"),
            entry("⪯", "\\preceq"),
            entry("⪰", "\\succeq"),
            // Arrows
            entry("→", "\\rightarrow"),
            entry("←", "\\leftarrow"),
            entry("↔", "\\leftrightarrow"),
            entry("⇒", "\\Rightarrow"),
            entry("⇐", "\\Leftarrow"),
            entry("⇔", "\\Leftrightarrow"),
            entry("↦", "\\mapsto"),
            entry("↑", "\\uparrow"),
            entry("↓", "\\downarrow"),
            entry("⇑", "\\Uparrow"),
            entry("⇓", "\\Downarrow"),
            entry("↗", "\\nearrow"),
            entry("↘", "\\searrow"),
            entry("↙", "\\swarrow"),
            entry("↖", "\\nwarrow"),
            entry("⟵", "\\longleftarrow"),
            entry("⟶", "\\longrightarrow"),
            entry("⟷", "\\longleftrightarrow"),
            entry("⟹", "\\Longrightarrow"),
            entry("⟸", "\\Longleftarrow"),
            entry("⟺", "\\Longleftrightarrow"),
            // Sets
            entry("∈", "\\in"),
            entry("∉", "\\notin"),
            entry("∋", "\\ni"),
            entry("⊂", "\\subset"),
            entry("⊃", "\\supset"),
            entry("⊆", "\\subseteq"),
            entry("⊇", "\\supseteq"),
            entry("⊊", "\\subsetneq"),
            entry("⊋", "\\supsetneq"),
            entry("∪", "\\cup"),
            entry("∩", "\\cap"),
            entry("∅", "\\emptyset"),
            entry("⊕", "\\oplus"),
            entry("⊗", "\\otimes"),
            entry("⊖", "\\ominus"),
            entry("⊘", "\\oslash"),
            // Logic
            entry("∧", "\\land"),
            entry("∨", "\\lor"),
            entry("¬", "\\neg"),
            entry("∀", "\\forall"),
            entry("∃", "\\exists"),
            entry("∄", "\\nexists"),
            entry("⊢", "\\vdash"),
            entry("⊣", "\\dashv"),
            entry("⊤", "\\top"),
            entry("⊥", "\\perp"),
            entry("⊨", "\\models"),
            // Calculus
            entry("∂", "\\partial"),
            entry("∞", "\\infty"),
            entry("∇", "\\nabla"),
            entry("√", "\\sqrt"),
            entry("∫", "\\int"),
            entry("∬", "\\iint"),
            entry("∭", "\\iiint"),
            entry("∮", "\\oint"),
            entry("∑", "\\sum"),
            entry("∏", "\\prod"),
            entry("∐", "\\coprod"),
            // Miscellaneous
            entry("°", "^{\\circ}"),
            entry("′", "'"),
            entry("″", "''"),
            entry("‴", "'''"),
            entry("ℓ", "\\ell"),
            entry("ℏ", "\\hbar"),
            entry("ℜ", "\\Re"),
            entry("ℑ", "\\Im"),
            entry("℘", "\\wp"),
            entry("ℵ", "\\aleph"),
            entry("∠", "\\angle"),
            entry("∡", "\\measuredangle"),
            entry("∥", "\\parallel"),
            entry("⋮", "\\vdots"),
            entry("⋯", "\\cdots"),
            entry("⋱", "\\ddots"),
            entry("…", "\\ldots"),
            entry("□", "\\square"),
            entry("△", "\\triangle"),
            entry("▽", "\\triangledown"),
            entry("★", "\\bigstar"),
            entry("♠", "\\spadesuit"),
            entry("♥", "\\heartsuit"),
            entry("♦", "\\diamondsuit"),
            entry("♣", "\\clubsuit")
    );

    private static final Map<String, String> SUPERSCRIPTS = Map.ofEntries(
            entry("⁰", "^{0}"),
            entry("¹", "^{1}"),
            entry("²", "^{2}"),
            entry("³", "^{3}"),
            entry("⁴", "^{4}"),
            entry("⁵", "^{5}"),
            entry("⁶", "^{6}"),
            entry("⁷", "^{7}"),
            entry("⁸", "^{8}"),
            entry("⁹", "^{9}"),
            entry("⁺", "^{+}"),
            entry("⁻", "^{-}"),
            entry("⁼", "^{=}"),
            entry("⁽", "^{(}"),
            entry("⁾", "^{)}"),
            entry("ⁿ", "^{n}"),
            entry("ⁱ", "^{i}")
    );

    private static final Map<String, String> SUBSCRIPTS = Map.ofEntries(
            entry("₀", "_{0}"),
            entry("₁", "_{1}"),
            entry("₂", "_{2}"),
            entry("₃", "_{3}"),
            entry("₄", "_{4}"),
            entry("₅", "_{5}"),
            entry("₆", "_{6}"),
            entry("₇", "_{7}"),
            entry("₈", "_{8}"),
            entry("₉", "_{9}"),
            entry("₊", "_{+}"),
            entry("₋", "_{-}"),
            entry("₌", "_{=}"),
            entry("₍", "_{(}"),
            entry("₎", "_{)}")
    );

    private static final Map<String, SymbolEntry> SYMBOLS = combine(
            GREEK_LOWER, GREEK_UPPER, OPERATORS, SUPERSCRIPTS, SUBSCRIPTS);

    private static final Set<Integer> INVISIBLE_CHARS = Set.of(
            0x200B, // zero-width space
            0x200C, // zero-width non-joiner
            0x200D, // zero-width joiner
            0x2060, // word joiner
            0xFEFF  // byte-order mark
    );

    private static final Map<String, String> NARY_OPERATORS = Map.ofEntries(
            entry("∑", "\\sum"),
            entry("∏", "\\prod"),
            entry("∐", "\\coprod"),
            entry("∫", "\\int"),
            entry("∬", "\\iint"),
            entry("∭", "\\iiint"),
            entry("∮", "\\oint"),
            entry("⋀", "\\bigwedge"),
            entry("⋁", "\\bigvee"),
            entry("⋂", "\\bigcap"),
            entry("⋃", "\\bigcup"),
            entry("⨁", "\\bigoplus"),
            entry("⨂", "\\bigotimes"),
            entry("⨀", "\\bigodot"),
            entry("⨄", "\\biguplus"),
            entry("⨆", "\\bigsqcup")
    );

    private static final Set<String> FUNCTION_NAMES = Set.of(
            "sin", "cos", "tan", "cot", "sec", "csc",
            "sinh", "cosh", "tanh", "coth", "sech", "csch",
            "arcsin", "arccos", "arctan", "arccot",
            "asin", "acos", "atan", "acot",
            "exp", "log", "ln", "lg",
            "lim", "liminf", "limsup",
            "max", "min", "sup", "inf",
            "arg", "det", "dim", "gcd", "hom", "ker", "deg",
            "pr", "mod"
    );

    // Names LaTeX has a command for; keyed by lower-cased name
    private static final Map<String, String> NATIVE_FUNCTIONS = nativeFunctions(
            "sin", "cos", "tan", "cot", "sec", "csc",
            "sinh", "cosh", "tanh", "coth",
            "arcsin", "arccos", "arctan",
            "exp", "log", "ln", "lg",
            "lim", "liminf", "limsup",
            "max", "min", "sup", "inf",
            "arg", "det", "dim", "gcd", "hom", "ker", "deg");

    private static final Map<String, BracketPair> BRACKETS = Map.of(
            "(", new BracketPair("\\left(", "\\right)"),
            "[", new BracketPair("\\left[", "\\right]"),
            "{", new BracketPair("\\left\\{", "\\right\\}"),
            "⟨", new BracketPair("\\left\\langle", "\\right\\rangle"),
            "|", new BracketPair("\\left|", "\\right|"),
            "‖", new BracketPair("\\left\\|", "\\right\\|"),
            "⌈", new BracketPair("\\left\\lceil", "\\right\\rceil"),
            "⌊", new BracketPair("\\left\\lfloor", "\\right\\rfloor")
    );

    private static final Map<String, String> LEFT_DELIMITERS = Map.of(
            "(", "(",
            "[", "[",
            "{", "\\{",
            "|", "|",
            "‖", "\\|",
            "⟨", "\\langle",
            "⌈", "\\lceil",
            "⌊", "\\lfloor"
    );

    private static final Map<String, String> RIGHT_DELIMITERS = Map.of(
            ")", ")",
            "]", "]",
            "}", "\\}",
            "|", "|",
            "‖", "\\|",
            "⟩", "\\rangle",
            "⌉", "\\rceil",
            "⌋", "\\rfloor"
    );

    private static final Map<String, String> NARROW_ACCENTS = Map.ofEntries(
            entry("\u0302", "\\hat"),
            entry("\u0303", "\\tilde"),
            entry("\u0304", "\\bar"),
            entry("\u0307", "\\dot"),
            entry("\u0308", "\\ddot"),
            entry("\u20D7", "\\vec"),
            entry("\u0306", "\\breve"),
            entry("\u030C", "\\check"),
            entry("\u030A", "\\mathring"),
            entry("⏞", "\\overbrace"),
            entry("⏟", "\\underbrace"),
            entry("^", "\\hat"),
            entry("~", "\\tilde"),
            entry("→", "\\vec")
    );

    private static final Map<String, String> WIDE_ACCENTS = Map.ofEntries(
            entry("\u0302", "\\widehat"),
            entry("\u0303", "\\widetilde"),
            entry("\u0304", "\\overline"),
            entry("\u0307", "\\dot"),
            entry("\u0308", "\\ddot"),
            entry("\u20D7", "\\overrightarrow"),
            entry("\u0306", "\\breve"),
            entry("\u030C", "\\check"),
            entry("\u030A", "\\mathring"),
            entry("⏞", "\\overbrace"),
            entry("⏟", "\\underbrace"),
            entry("^", "\\widehat"),
            entry("~", "\\widetilde"),
            entry("→", "\\overrightarrow")
    );

    /**
     * Looks up the registered typeset form of a character.
     *
     * @param codePoint Unicode scalar value
     * @return the entry, or empty for characters that pass through unchanged
     */
    public Optional<SymbolEntry> lookup(int codePoint) {
        return Optional.ofNullable(SYMBOLS.get(Character.toString(codePoint)));
    }

    /**
     * Maps a single character to LaTeX.
     *
     * @param codePoint Unicode scalar value
     * @return the command or escaped form, the empty string for invisible formatting characters,
     * or the character itself
     */
    public String mapChar(int codePoint) {
        if (INVISIBLE_CHARS.contains(codePoint)) {
            return "";
        }
        SymbolEntry symbol = SYMBOLS.get(Character.toString(codePoint));
        return symbol != null ? symbol.latex() : Character.toString(codePoint);
    }

    /**
     * Maps every character of {@code text}. A command ending in a letter that is followed by a
     * letter gets a separating space, so {@code αp} becomes {@code \alpha p} and not {@code \alphap}.
     */
    public String mapText(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        int[] codePoints = text.codePoints().toArray();
        StringBuilder result = new StringBuilder(text.length() + 8);
        for (int i = 0; i < codePoints.length; i++) {
            String mapped = mapChar(codePoints[i]);
            result.append(mapped);
            if (isCommandEndingInLetter(mapped)
                    && i + 1 < codePoints.length
                    && Character.isLetter(codePoints[i + 1])) {
                result.append(' ');
            }
        }
        return result.toString();
    }

    public boolean isFunctionName(String name) {
        return name != null && FUNCTION_NAMES.contains(name.toLowerCase(Locale.ROOT));
    }

    /**
     * @return the native command for the function (e.g. {@code \sin}), or
     * {@code \operatorname{name}} for names without one
     */
    public String getFunctionLatex(String name) {
        String nativeCommand = NATIVE_FUNCTIONS.get(name.toLowerCase(Locale.ROOT));
        if (nativeCommand != null) {
            return nativeCommand;
        }
        return "\\operatorname{" + name + "}";
    }

    public boolean isNaryOperator(String glyph) {
        return glyph != null && NARY_OPERATORS.containsKey(glyph);
    }

    /**
     * @return the big-operator command for the glyph, or the glyph itself when unknown
     */
    public String getNaryLatex(String glyph) {
        return NARY_OPERATORS.getOrDefault(glyph, glyph);
    }

    public Optional<BracketPair> getBracketPair(String openGlyph) {
        return Optional.ofNullable(BRACKETS.get(openGlyph));
    }

    /**
     * Maps an opening delimiter glyph for use after {@code \left}. Unknown glyphs pass through.
     */
    public String mapLeftDelimiter(String glyph) {
        return LEFT_DELIMITERS.getOrDefault(glyph, glyph);
    }

    /**
     * Maps a closing delimiter glyph for use after {@code \right}. Unknown glyphs pass through.
     */
    public String mapRightDelimiter(String glyph) {
        return RIGHT_DELIMITERS.getOrDefault(glyph, glyph);
    }

    /**
     * @param glyph accent character
     * @param wide  whether the accent spans more than one character
     * @return the accent command, or empty when the glyph is not a known accent
     */
    public Optional<String> getAccentLatex(String glyph, boolean wide) {
        Map<String, String> accents = wide ? WIDE_ACCENTS : NARROW_ACCENTS;
        return Optional.ofNullable(accents.get(glyph));
    }

    static boolean isCommandEndingInLetter(String latex) {
        return latex.length() > 1
                && latex.charAt(0) == '\\'
                && Character.isLetter(latex.charAt(latex.length() - 1));
    }

    @SafeVarargs
    private static Map<String, SymbolEntry> combine(Map<String, String>... tables) {
        Map<String, SymbolEntry> combined = new HashMap<>();
        for (Map<String, String> table : tables) {
            table.forEach((glyph, latex) -> combined.put(glyph, SymbolEntry.of(latex)));
        }
        return Map.copyOf(combined);
    }

    private static Map<String, String> nativeFunctions(String... names) {
        Map<String, String> commands = new HashMap<>();
        for (String name : names) {
            commands.put(name, "\\" + name);
        }
        commands.put("pr", "\\Pr");
        return Map.copyOf(commands);
    }
}
