package uk.gegc.ommltex.features.math.domain.model;

import java.util.List;

/**
 * Node of a parsed Office Math tree.
 *
 * <p>The set of node kinds is closed. Consumers walk the tree through {@link Visitor}, which has one
 * method per kind, so adding a kind breaks every visitor at compile time instead of silently falling
 * through a default branch.
 *
 * <p>Child slots are lists of nodes. A slot missing from the source markup is an empty list.
 * Glyph attributes are {@code null} when the markup does not specify them.
 */
public sealed interface MathNode {

    <R> R accept(Visitor<R> visitor);

    /**
     * One handler per node kind.
     */
    interface Visitor<R> {
        R visitRoot(Root node);

        R visitRun(Run node);

        R visitText(Text node);

        R visitFraction(Fraction node);

        R visitRadical(Radical node);

        R visitSubscript(Subscript node);

        R visitSuperscript(Superscript node);

        R visitSubSup(SubSup node);

        R visitPreScript(PreScript node);

        R visitNaryOp(NaryOp node);

        R visitLowerLimit(LowerLimit node);

        R visitUpperLimit(UpperLimit node);

        R visitMatrix(Matrix node);

        R visitDelimiter(Delimiter node);

        R visitEquationArray(EquationArray node);

        R visitBar(Bar node);

        R visitAccent(Accent node);

        R visitBox(Box node);

        R visitFunction(Function node);

        R visitGroupChar(GroupChar node);

        R visitBorderBox(BorderBox node);

        R visitPhantom(Phantom node);

        R visitUnknown(Unknown node);
    }

    /** Math block ({@code oMath}). */
    record Root(List<MathNode> children) implements MathNode {
        public Root {
            children = slot(children);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRoot(this);
        }
    }

    /** Styled text span ({@code r}); {@code text} is the run's concatenated literal text. */
    record Run(RunStyle style, String text) implements MathNode {
        public Run {
            style = style != null ? style : RunStyle.PLAIN;
            text = text != null ? text : "";
        }

        public static Run plain(String text) {
            return new Run(RunStyle.PLAIN, text);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRun(this);
        }
    }

    /** Bare text leaf ({@code t}) outside a run. */
    record Text(String value) implements MathNode {
        public Text {
            value = value != null ? value : "";
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitText(this);
        }
    }

    record Fraction(FractionType type, List<MathNode> numerator, List<MathNode> denominator) implements MathNode {
        public Fraction {
            type = type != null ? type : FractionType.BAR;
            numerator = slot(numerator);
            denominator = slot(denominator);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFraction(this);
        }
    }

    record Radical(boolean degreeHidden, List<MathNode> degree, List<MathNode> base) implements MathNode {
        public Radical {
            degree = slot(degree);
            base = slot(base);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitRadical(this);
        }
    }

    record Subscript(List<MathNode> base, List<MathNode> subscript) implements MathNode {
        public Subscript {
            base = slot(base);
            subscript = slot(subscript);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSubscript(this);
        }
    }

    record Superscript(List<MathNode> base, List<MathNode> superscript) implements MathNode {
        public Superscript {
            base = slot(base);
            superscript = slot(superscript);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSuperscript(this);
        }
    }

    record SubSup(List<MathNode> base, List<MathNode> subscript, List<MathNode> superscript) implements MathNode {
        public SubSup {
            base = slot(base);
            subscript = slot(subscript);
            superscript = slot(superscript);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitSubSup(this);
        }
    }

    /** Scripts placed before the base ({@code sPre}). */
    record PreScript(List<MathNode> base, List<MathNode> subscript, List<MathNode> superscript) implements MathNode {
        public PreScript {
            base = slot(base);
            subscript = slot(subscript);
            superscript = slot(superscript);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPreScript(this);
        }
    }

    /** Big operator with optional limits ({@code nary}). */
    record NaryOp(String glyph,
                  LimitLocation limitLocation,
                  List<MathNode> subscript,
                  List<MathNode> superscript,
                  List<MathNode> base) implements MathNode {
        public NaryOp {
            subscript = slot(subscript);
            superscript = slot(superscript);
            base = slot(base);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNaryOp(this);
        }
    }

    record LowerLimit(List<MathNode> base, List<MathNode> limit) implements MathNode {
        public LowerLimit {
            base = slot(base);
            limit = slot(limit);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLowerLimit(this);
        }
    }

    record UpperLimit(List<MathNode> base, List<MathNode> limit) implements MathNode {
        public UpperLimit {
            base = slot(base);
            limit = slot(limit);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUpperLimit(this);
        }
    }

    record MatrixRow(List<List<MathNode>> cells) {
        public MatrixRow {
            cells = groups(cells);
        }
    }

    record Matrix(List<MatrixRow> rows) implements MathNode {
        public Matrix {
            rows = rows != null ? List.copyOf(rows) : List.of();
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitMatrix(this);
        }
    }

    /** Bracketed content ({@code d}); each item is one {@code e} group. */
    record Delimiter(String beginGlyph,
                     String endGlyph,
                     String separatorGlyph,
                     List<List<MathNode>> items) implements MathNode {
        public Delimiter {
            items = groups(items);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDelimiter(this);
        }
    }

    record EquationArray(List<List<MathNode>> rows) implements MathNode {
        public EquationArray {
            rows = groups(rows);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitEquationArray(this);
        }
    }

    record Bar(VerticalPosition position, List<MathNode> base) implements MathNode {
        public Bar {
            base = slot(base);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBar(this);
        }
    }

    record Accent(String glyph, List<MathNode> base) implements MathNode {
        public Accent {
            base = slot(base);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAccent(this);
        }
    }

    record Box(List<MathNode> base) implements MathNode {
        public Box {
            base = slot(base);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBox(this);
        }
    }

    record Function(List<MathNode> name, List<MathNode> argument) implements MathNode {
        public Function {
            name = slot(name);
            argument = slot(argument);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitFunction(this);
        }
    }

    record GroupChar(String glyph, VerticalPosition position, List<MathNode> base) implements MathNode {
        public GroupChar {
            base = slot(base);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitGroupChar(this);
        }
    }

    record BorderBox(List<MathNode> base) implements MathNode {
        public BorderBox {
            base = slot(base);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBorderBox(this);
        }
    }

    record Phantom(List<MathNode> base) implements MathNode {
        public Phantom {
            base = slot(base);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPhantom(this);
        }
    }

    /** Element with no dedicated handling; its children are still converted. */
    record Unknown(String tag, List<MathNode> children) implements MathNode {
        public Unknown {
            children = slot(children);
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitUnknown(this);
        }
    }

    private static List<MathNode> slot(List<MathNode> nodes) {
        return nodes != null ? List.copyOf(nodes) : List.of();
    }

    private static List<List<MathNode>> groups(List<List<MathNode>> groups) {
        if (groups == null) {
            return List.of();
        }
        return groups.stream()
                .map(MathNode::slot)
                .toList();
    }
}
