package im.arun.polytex.tex;

import org.jsoup.nodes.Element;

/**
 * Closed set of element kinds the renderer distinguishes. Anything unknown is {@link #INLINE}.
 */
public enum NodeKind {
    LINE_BREAK,
    BOLD,
    ITALIC,
    UNDERLINE,
    SUPERSCRIPT,
    SUBSCRIPT,
    CODE,
    ORDERED_LIST,
    UNORDERED_LIST,
    PREFORMATTED,
    IMAGE,
    SCRIPT,
    IGNORED,
    PARAGRAPH,
    BLOCK,
    INLINE;

    public static NodeKind of(Element element) {
        switch (element.normalName()) {
            case "br":
                return LINE_BREAK;
            case "b":
            case "strong":
                return BOLD;
            case "i":
            case "em":
                return ITALIC;
            case "u":
                return UNDERLINE;
            case "sup":
                return SUPERSCRIPT;
            case "sub":
                return SUBSCRIPT;
            case "code":
            case "tt":
                return CODE;
            case "ol":
                return ORDERED_LIST;
            case "ul":
                return UNORDERED_LIST;
            case "pre":
                return PREFORMATTED;
            case "img":
                return IMAGE;
            case "script":
                return SCRIPT;
            case "style":
            case "noscript":
            case "template":
                return IGNORED;
            case "p":
                return PARAGRAPH;
            case "div":
            case "li":
            case "center":
            case "blockquote":
            case "section":
            case "article":
            case "h1":
            case "h2":
            case "h3":
            case "h4":
            case "h5":
            case "h6":
            case "tr":
                return BLOCK;
            default:
                return INLINE;
        }
    }

    /**
     * Kinds whose rendered output ends with a line boundary.
     */
    public boolean isBlock() {
        return this == PARAGRAPH || this == BLOCK || this == ORDERED_LIST || this == UNORDERED_LIST;
    }
}
