package im.arun.polytex.tex;

import org.jsoup.nodes.Element;

import java.util.Locale;
import java.util.Set;

/**
 * Class-token heuristics over elements: formula detection, image placement markers and skip sets.
 * The judge marks typeset formulas with classes such as {@code tex-span}; any class containing
 * the configured marker counts.
 */
public class MarkerClassifier {
    public static final String DEFAULT_FORMULA_MARKER = "tex";
    static final String INLINE_IMAGE_MARKER = "tex-formula";
    static final String RENDERED_MATHJAX_PREFIX = "mathjax";

    private final String formulaMarker;

    public MarkerClassifier() {
        this(DEFAULT_FORMULA_MARKER);
    }

    public MarkerClassifier(String formulaMarker) {
        this.formulaMarker = formulaMarker.toLowerCase(Locale.ROOT);
    }

    /**
     * Only class tokens are scanned; ids, titles and other attribute values never mark a formula.
     */
    public boolean isFormula(Element element) {
        return hasMarker(element, formulaMarker);
    }

    /**
     * Whether an image should be embedded inline (a picture of a formula) rather than as a centered block.
     */
    public boolean isInlineImage(Element element) {
        return hasMarker(element, INLINE_IMAGE_MARKER);
    }

    /**
     * Elements produced by client-side MathJax rendering; their source lives in a sibling math script.
     */
    public boolean isRenderedMath(Element element) {
        for (String cls : element.classNames()) {
            if (cls.toLowerCase(Locale.ROOT).startsWith(RENDERED_MATHJAX_PREFIX)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True if any class token contains {@code marker}, ignoring case.
     */
    public boolean hasMarker(Element element, String marker) {
        String needle = marker.toLowerCase(Locale.ROOT);
        for (String cls : element.classNames()) {
            if (cls.toLowerCase(Locale.ROOT).contains(needle)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True if any class token equals one of {@code lowerCaseClasses}, ignoring case.
     */
    public boolean hasAnyClass(Element element, Set<String> lowerCaseClasses) {
        if (lowerCaseClasses.isEmpty()) {
            return false;
        }
        for (String cls : element.classNames()) {
            if (lowerCaseClasses.contains(cls.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
