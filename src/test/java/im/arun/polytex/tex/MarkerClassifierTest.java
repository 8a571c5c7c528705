package im.arun.polytex.tex;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MarkerClassifierTest {

    private final MarkerClassifier classifier = new MarkerClassifier();

    private static Element element(String html) {
        return Jsoup.parseBodyFragment(html).body().child(0);
    }

    @Test
    void formulaMarkerMatchesAnyClassContainingIt() {
        assertTrue(classifier.isFormula(element("<span class=\"tex-span\">x</span>")));
        assertTrue(classifier.isFormula(element("<span class=\"bold TEX-font-style-bf\">x</span>")));
        assertFalse(classifier.isFormula(element("<span class=\"upper-index\">x</span>")));
        assertFalse(classifier.isFormula(element("<span>x</span>")));
    }

    @Test
    void markerInOtherAttributesIsIgnored() {
        assertFalse(classifier.isFormula(element("<span id=\"tex-span\" title=\"tex\">x</span>")));
    }

    @Test
    void customMarkerIsCaseInsensitive() {
        MarkerClassifier custom = new MarkerClassifier("MATH");
        assertTrue(custom.isFormula(element("<span class=\"inline-math\">x</span>")));
        assertFalse(custom.isFormula(element("<span class=\"tex-span\">x</span>")));
    }

    @Test
    void inlineImageMarker() {
        assertTrue(classifier.isInlineImage(element("<img class=\"tex-formula\" src=\"a.png\">")));
        assertFalse(classifier.isInlineImage(element("<img class=\"tex-graphics\" src=\"a.png\">")));
    }

    @Test
    void renderedMathJaxOutputIsRecognized() {
        assertTrue(classifier.isRenderedMath(element("<span class=\"MathJax_Preview\">x</span>")));
        assertFalse(classifier.isRenderedMath(element("<span class=\"preview-mathjax\">x</span>")));
    }

    @Test
    void hasAnyClassComparesWholeTokens() {
        Set<String> skip = Set.of("section-title");
        assertTrue(classifier.hasAnyClass(element("<div class=\"Section-Title\">x</div>"), skip));
        assertFalse(classifier.hasAnyClass(element("<div class=\"section-title-extra\">x</div>"), skip));
        assertFalse(classifier.hasAnyClass(element("<div class=\"section-title\">x</div>"), Set.of()));
    }
}
