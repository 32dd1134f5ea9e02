package uk.gegc.ommltex.features.math.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.ParseError;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;
import uk.gegc.ommltex.features.math.config.MathConversionProperties;
import uk.gegc.ommltex.features.math.domain.OmmlParseException;
import uk.gegc.ommltex.features.math.domain.model.FractionType;
import uk.gegc.ommltex.features.math.domain.model.LimitLocation;
import uk.gegc.ommltex.features.math.domain.model.MathNode;
import uk.gegc.ommltex.features.math.domain.model.RunStyle;
import uk.gegc.ommltex.features.math.domain.model.ScriptKind;
import uk.gegc.ommltex.features.math.domain.model.VerticalPosition;
import uk.gegc.ommltex.features.math.domain.model.WeightKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads Office Math markup (OMML) into a {@link MathNode} tree using the jsoup XML parser.
 * Elements and attributes are matched by local name, so the namespace prefix does not matter.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OmmlParser {

    private static final int MAX_TRACKED_ERRORS = 20;
    private static final Set<String> ON_VALUES = Set.of("1", "on", "true");

    private final MathConversionProperties properties;

    /**
     * Parses the first {@code oMath} or {@code oMathPara} element found in {@code xml}.
     *
     * @param xml OMML markup
     * @return the math tree
     * @throws OmmlParseException if the input is blank, holds no math element, or nests
     *                            deeper than the configured maximum depth
     */
    public MathNode.Root parse(String xml) throws OmmlParseException {
        if (xml == null || xml.isBlank()) {
            throw new OmmlParseException("OMML input is empty");
        }

        Parser parser = Parser.xmlParser().setTrackErrors(MAX_TRACKED_ERRORS);
        Document document = Jsoup.parse(xml, "", parser);
        for (ParseError error : parser.getErrors()) {
            log.debug("Recovered OMML parse error at {}: {}", error.getPosition(), error.getErrorMessage());
        }

        Element math = findMathElement(document);
        if (math == null) {
            throw new OmmlParseException("No oMath element found in OMML input");
        }

        List<MathNode> children = convertChildren(math, 1);
        log.debug("Parsed OMML {} with {} top-level nodes", localName(math), children.size());
        return new MathNode.Root(children);
    }

    private static Element findMathElement(Document document) {
        for (Element element : document.getAllElements()) {
            String name = localName(element);
            if (name.equals("oMathPara") || name.equals("oMath")) {
                return element;
            }
        }
        return null;
    }

    private MathNode convert(Element element, int depth) throws OmmlParseException {
        if (depth > properties.getMaxDepth()) {
            throw new OmmlParseException("OMML nesting exceeds maximum depth of " + properties.getMaxDepth());
        }
        int next = depth + 1;
        String name = localName(element);

        return switch (name) {
            case "oMath" -> new MathNode.Root(convertChildren(element, next));
            case "r" -> convertRun(element);
            case "t" -> new MathNode.Text(element.wholeText());
            case "f" -> new MathNode.Fraction(
                    FractionType.fromOmml(property(element, "fPr", "type")),
                    slot(element, "num", next),
                    slot(element, "den", next));
            case "rad" -> new MathNode.Radical(
                    isOn(child(child(element, "radPr"), "degHide")),
                    slot(element, "deg", next),
                    slot(element, "e", next));
            case "sSub" -> new MathNode.Subscript(
                    slot(element, "e", next),
                    slot(element, "sub", next));
            case "sSup" -> new MathNode.Superscript(
                    slot(element, "e", next),
                    slot(element, "sup", next));
            case "sSubSup" -> new MathNode.SubSup(
                    slot(element, "e", next),
                    slot(element, "sub", next),
                    slot(element, "sup", next));
            case "sPre" -> new MathNode.PreScript(
                    slot(element, "e", next),
                    slot(element, "sub", next),
                    slot(element, "sup", next));
            case "nary" -> new MathNode.NaryOp(
                    property(element, "naryPr", "chr"),
                    LimitLocation.fromOmml(property(element, "naryPr", "limLoc")),
                    slot(element, "sub", next),
                    slot(element, "sup", next),
                    slot(element, "e", next));
            case "limLow" -> new MathNode.LowerLimit(
                    slot(element, "e", next),
                    slot(element, "lim", next));
            case "limUpp" -> new MathNode.UpperLimit(
                    slot(element, "e", next),
                    slot(element, "lim", next));
            case "m" -> convertMatrix(element, next);
            case "d" -> new MathNode.Delimiter(
                    property(element, "dPr", "begChr"),
                    property(element, "dPr", "endChr"),
                    property(element, "dPr", "sepChr"),
                    groups(element, "e", next));
            case "eqArr" -> new MathNode.EquationArray(groups(element, "e", next));
            case "bar" -> new MathNode.Bar(
                    VerticalPosition.fromOmml(property(element, "barPr", "pos")),
                    slot(element, "e", next));
            case "acc" -> new MathNode.Accent(
                    property(element, "accPr", "chr"),
                    slot(element, "e", next));
            case "box" -> new MathNode.Box(slot(element, "e", next));
            case "func" -> new MathNode.Function(
                    slot(element, "fName", next),
                    slot(element, "e", next));
            case "groupChr" -> new MathNode.GroupChar(
                    property(element, "groupChrPr", "chr"),
                    VerticalPosition.fromOmml(property(element, "groupChrPr", "pos")),
                    slot(element, "e", next));
            case "borderBox" -> new MathNode.BorderBox(slot(element, "e", next));
            case "phant" -> new MathNode.Phantom(slot(element, "e", next));
            default -> new MathNode.Unknown(name, convertChildren(element, next));
        };
    }

    private MathNode convertRun(Element run) {
        ScriptKind script = ScriptKind.ROMAN;
        WeightKind weight = WeightKind.PLAIN;
        for (Element runProperties : childrenNamed(run, "rPr")) {
            Element scr = child(runProperties, "scr");
            if (scr != null) {
                script = ScriptKind.fromOmml(val(scr));
            }
            Element sty = child(runProperties, "sty");
            if (sty != null) {
                weight = WeightKind.fromOmml(val(sty));
            }
        }

        StringBuilder text = new StringBuilder();
        for (Element element : run.getAllElements()) {
            if (localName(element).equals("t")) {
                text.append(element.wholeText());
            }
        }
        return new MathNode.Run(new RunStyle(script, weight), text.toString());
    }

    private MathNode convertMatrix(Element matrix, int depth) throws OmmlParseException {
        List<MathNode.MatrixRow> rows = new ArrayList<>();
        for (Element row : childrenNamed(matrix, "mr")) {
            rows.add(new MathNode.MatrixRow(groups(row, "e", depth + 1)));
        }
        return new MathNode.Matrix(rows);
    }

    private List<MathNode> convertChildren(Element container, int depth) throws OmmlParseException {
        List<MathNode> nodes = new ArrayList<>();
        for (Element child : container.children()) {
            // property elements (rPr, fPr, ctrlPr, ...) carry attributes, not content
            if (localName(child).endsWith("Pr")) {
                continue;
            }
            nodes.add(convert(child, depth));
        }
        return nodes;
    }

    private List<MathNode> slot(Element parent, String slotName, int depth) throws OmmlParseException {
        Element slot = child(parent, slotName);
        if (slot == null) {
            return List.of();
        }
        return convertChildren(slot, depth);
    }

    private List<List<MathNode>> groups(Element parent, String groupName, int depth) throws OmmlParseException {
        List<List<MathNode>> groups = new ArrayList<>();
        for (Element group : childrenNamed(parent, groupName)) {
            groups.add(convertChildren(group, depth));
        }
        return groups;
    }

    private static String property(Element element, String propertiesName, String propertyName) {
        Element property = child(child(element, propertiesName), propertyName);
        return property != null ? val(property) : null;
    }

    // OOXML on/off: a present element without a value means "on"
    private static boolean isOn(Element flag) {
        if (flag == null) {
            return false;
        }
        String value = val(flag);
        return value == null || ON_VALUES.contains(value.toLowerCase(Locale.ROOT));
    }

    private static Element child(Element parent, String name) {
        if (parent == null) {
            return null;
        }
        for (Element child : parent.children()) {
            if (localName(child).equals(name)) {
                return child;
            }
        }
        return null;
    }

    private static List<Element> childrenNamed(Element parent, String name) {
        List<Element> matches = new ArrayList<>();
        for (Element child : parent.children()) {
            if (localName(child).equals(name)) {
                matches.add(child);
            }
        }
        return matches;
    }

    private static String val(Element element) {
        for (Attribute attribute : element.attributes()) {
            if (localName(attribute.getKey()).equals("val")) {
                return attribute.getValue();
            }
        }
        return null;
    }

    static String localName(Element element) {
        return localName(element.tagName());
    }

    private static String localName(String qualifiedName) {
        int colon = qualifiedName.indexOf(':');
        return colon >= 0 ? qualifiedName.substring(colon + 1) : qualifiedName;
    }
}
