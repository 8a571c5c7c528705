package im.arun.polytex.tex;

import im.arun.polytex.resource.ResourceCollector;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Renders a jsoup subtree of a problem statement as LaTeX.
 * <p>
 * The walk is depth-first and purely recursive. Formula mode is entered by any element the
 * {@link MarkerClassifier} flags and stays on for its whole subtree: such an element is wrapped
 * in {@code $...$} once, by the outermost flagged ancestor, and superscripts or subscripts inside
 * it become {@code ^{}} / {@code _{}}. Images are registered with the document's
 * {@link ResourceCollector}.
 */
public class TreeRenderer {
    static final String LINE_BREAK = "\\\\\n";
    static final String BLOCK_END = "\n";
    static final String PARAGRAPH_END = "\n\n";
    private static final String VERBATIM_BEGIN = "\\begin{verbatim}";
    private static final String VERBATIM_END = "\\end{verbatim}";

    private final MarkerClassifier classifier;
    private final ResourceCollector resources;

    /**
     * @param resources collector of the document being rendered; null drops every image
     */
    public TreeRenderer(MarkerClassifier classifier, ResourceCollector resources) {
        this.classifier = classifier;
        this.resources = resources;
    }

    public String render(Node node, RenderContext context) {
        if (node instanceof TextNode) {
            return TexEscaper.escape(((TextNode) node).getWholeText());
        }
        if (!(node instanceof Element)) {
            // comments and stray data nodes
            return "";
        }

        Element element = (Element) node;
        if (classifier.hasAnyClass(element, context.getSkipMarkers()) || classifier.isRenderedMath(element)) {
            return "";
        }

        NodeKind kind = NodeKind.of(element);
        switch (kind) {
            case SCRIPT:
                return renderScript(element);
            case IGNORED:
                return "";
            case LINE_BREAK:
                return LINE_BREAK;
            case IMAGE:
                return renderImage(element);
            default:
                break;
        }

        boolean nodeIsFormula = classifier.isFormula(element);
        RenderContext inner = context.enter(nodeIsFormula);
        String content = renderContent(element, kind, inner);

        if (nodeIsFormula) {
            content = wrapFormula(content, context.isInsideFormula());
        }

        if (kind == NodeKind.PARAGRAPH) {
            return content.strip() + PARAGRAPH_END;
        }
        if (kind.isBlock()) {
            return content.strip() + BLOCK_END;
        }
        return content;
    }

    /**
     * Render the children of a section root into one cleaned-up field.
     *
     * @param root                the section container, may be null
     * @param skipMarkers         classes whose elements are dropped with their subtree, e.g. {@code section-title}
     * @param addParagraphBreaks  whether every line boundary becomes a paragraph boundary
     * @return the rendered text, or empty when the section is missing or renders to nothing
     */
    public Optional<String> renderSection(Element root, Set<String> skipMarkers, boolean addParagraphBreaks) {
        if (root == null) {
            return Optional.empty();
        }

        RenderContext context = RenderContext.skipping(skipMarkers);
        String raw = renderChildren(root, context);

        List<String> lines = new ArrayList<>();
        for (String line : raw.split("\n", -1)) {
            lines.add(line.stripTrailing());
        }
        while (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty()) {
            lines.remove(lines.size() - 1);
        }

        String cleaned = TexEscaper.normalizeMath(String.join("\n", lines).strip());
        if (cleaned.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(addParagraphBreaks ? addParagraphBreaks(cleaned) : cleaned);
    }

    /**
     * Promote every line boundary outside verbatim blocks to exactly one blank line. A verbatim
     * block runs from the line containing its {@code \begin} to the line containing its {@code \end}.
     * A {@code \\} that ended a promoted line is dropped, the paragraph break replaces it.
     */
    public static String addParagraphBreaks(String text) {
        StringBuilder out = new StringBuilder(text.length() + 64);
        boolean inVerbatim = false;

        for (String line : text.split("\n", -1)) {
            if (inVerbatim) {
                out.append('\n').append(line);
                if (line.contains(VERBATIM_END)) {
                    inVerbatim = false;
                }
                continue;
            }
            if (line.isBlank()) {
                continue;
            }
            if (out.length() > 0) {
                dropTrailingLineBreak(out);
                out.append("\n\n");
            }
            out.append(line);
            // a verbatim block may open mid-line, e.g. after "\item"
            int begin = line.indexOf(VERBATIM_BEGIN);
            if (begin >= 0 && line.indexOf(VERBATIM_END, begin) < 0) {
                inVerbatim = true;
            }
        }
        return out.toString();
    }

    private static void dropTrailingLineBreak(StringBuilder out) {
        int end = out.length();
        while (end > 0 && out.charAt(end - 1) == ' ') {
            end--;
        }
        if (end >= 2 && out.charAt(end - 1) == '\\' && out.charAt(end - 2) == '\\') {
            out.setLength(end - 2);
            while (out.length() > 0 && out.charAt(out.length() - 1) == ' ') {
                out.setLength(out.length() - 1);
            }
        }
    }

    private String renderContent(Element element, NodeKind kind, RenderContext context) {
        switch (kind) {
            case SUPERSCRIPT:
                return renderIndex(element, "^", context);
            case SUBSCRIPT:
                return renderIndex(element, "_", context);
            case BOLD:
                return "\\textbf{" + renderChildren(element, context) + "}";
            case ITALIC:
                return "\\textit{" + renderChildren(element, context) + "}";
            case UNDERLINE:
                return "\\underline{" + renderChildren(element, context) + "}";
            case CODE:
                return "\\texttt{" + renderChildren(element, context) + "}";
            case ORDERED_LIST:
                return renderList(element, "enumerate", context);
            case UNORDERED_LIST:
                return renderList(element, "itemize", context);
            case PREFORMATTED:
                return renderVerbatim(element);
            default:
                return renderChildren(element, context);
        }
    }

    private String renderChildren(Element element, RenderContext context) {
        StringBuilder out = new StringBuilder();
        for (Node child : element.childNodes()) {
            out.append(render(child, context));
        }
        return out.toString();
    }

    private String renderIndex(Element element, String marker, RenderContext context) {
        String content = renderChildren(element, context);
        if (context.isInsideFormula()) {
            return marker + "{" + content.strip() + "}";
        }
        return content;
    }

    private String renderList(Element element, String environment, RenderContext context) {
        StringBuilder items = new StringBuilder();
        for (Element child : element.children()) {
            if (!"li".equals(child.normalName())) {
                continue;
            }
            String item = render(child, context).strip();
            if (!item.isEmpty()) {
                items.append("  \\item ").append(item).append('\n');
            }
        }
        // an empty list environment does not compile
        if (items.length() == 0) {
            return "";
        }
        return "\\begin{" + environment + "}\n" + items + "\\end{" + environment + "}\n";
    }

    private String renderVerbatim(Element element) {
        String text = LiteralText.of(element);
        int end = text.length();
        while (end > 0 && text.charAt(end - 1) == '\n') {
            end--;
        }
        return VERBATIM_BEGIN + "\n" + text.substring(0, end) + "\n" + VERBATIM_END + "\n";
    }

    private String renderScript(Element element) {
        String type = element.attr("type");
        if (!type.startsWith("math/")) {
            return "";
        }
        String content = element.data().strip();
        return content.isEmpty() ? "" : "$" + content + "$";
    }

    private String renderImage(Element element) {
        if (resources == null) {
            return "";
        }
        return resources.addImage(element.attr("src"), classifier.isInlineImage(element)).orElse("");
    }

    private static String wrapFormula(String content, boolean ancestorIsFormula) {
        String stripped = content.strip();
        if (ancestorIsFormula || stripped.isEmpty() || isDelimited(stripped)) {
            return stripped;
        }
        return "$" + stripped + "$";
    }

    private static boolean isDelimited(String text) {
        return text.length() >= 2 && text.startsWith("$") && text.endsWith("$");
    }
}
