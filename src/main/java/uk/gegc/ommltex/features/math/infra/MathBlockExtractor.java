package uk.gegc.ommltex.features.math.infra;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;
import uk.gegc.ommltex.features.math.domain.model.MathBlock;
import uk.gegc.ommltex.features.math.domain.model.MathMode;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds formulas in a WordprocessingML fragment.
 * An {@code oMath} inside an {@code oMathPara} is a display block, any other is inline.
 */
@Component
@Slf4j
public class MathBlockExtractor {

    /**
     * @param wordprocessingXml document XML, e.g. the content of {@code word/document.xml}
     * @return math blocks in document order; empty for blank input
     */
    public List<MathBlock> extract(String wordprocessingXml) {
        if (wordprocessingXml == null || wordprocessingXml.isBlank()) {
            return List.of();
        }

        Document document = Jsoup.parse(wordprocessingXml, "", Parser.xmlParser());
        document.outputSettings().prettyPrint(false);

        List<MathBlock> blocks = new ArrayList<>();
        for (Element element : document.getAllElements()) {
            if (!OmmlParser.localName(element).equals("oMath") || hasAncestor(element, "oMath")) {
                continue;
            }
            MathMode mode = hasAncestor(element, "oMathPara") ? MathMode.DISPLAY : MathMode.INLINE;
            blocks.add(new MathBlock(element.outerHtml(), mode));
        }

        log.debug("Extracted {} math blocks", blocks.size());
        return blocks;
    }

    private static boolean hasAncestor(Element element, String localName) {
        for (Element parent : element.parents()) {
            if (OmmlParser.localName(parent).equals(localName)) {
                return true;
            }
        }
        return false;
    }
}
