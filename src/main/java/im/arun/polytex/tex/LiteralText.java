package im.arun.polytex.tex;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

/**
 * Raw text of a preformatted subtree with its line structure intact.
 * Text nodes are copied verbatim, {@code <br>} becomes a newline and block children
 * (the judge wraps each sample line in a {@code div}) end on their own line.
 */
public final class LiteralText {

    private LiteralText() {}

    public static String of(Element element) {
        StringBuilder text = new StringBuilder();
        appendChildren(element, text);
        String result = text.toString().replace("\r", "");
        // HTML drops the newline that directly follows <pre>
        if (result.startsWith("\n")) {
            result = result.substring(1);
        }
        return result;
    }

    private static void appendChildren(Node parent, StringBuilder text) {
        for (Node child : parent.childNodes()) {
            if (child instanceof TextNode) {
                text.append(((TextNode) child).getWholeText());
            } else if (child instanceof Element) {
                Element element = (Element) child;
                NodeKind kind = NodeKind.of(element);
                if (kind == NodeKind.LINE_BREAK) {
                    text.append('\n');
                    continue;
                }
                appendChildren(element, text);
                if (kind.isBlock() && text.length() > 0 && text.charAt(text.length() - 1) != '\n') {
                    text.append('\n');
                }
            }
        }
    }
}
