package im.arun.polytex.statement;

import im.arun.polytex.model.ProblemStatement;
import im.arun.polytex.resource.ResourceCollector;
import im.arun.polytex.sample.SampleExtractor;
import im.arun.polytex.tex.MarkerClassifier;
import im.arun.polytex.tex.TreeRenderer;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Extracts {@link ProblemStatement}s from a Codeforces HTML export.
 */
public class StatementParser {
    private static final Logger logger = LoggerFactory.getLogger(StatementParser.class);
    private static final Set<String> NON_LEGEND_CLASSES = Set.of(
        "header", "input-specification", "output-specification", "sample-tests", "note");

    private final MarkerClassifier classifier;
    private final SampleExtractor sampleExtractor;
    private final boolean addParagraphBreaks;

    /**
     * @param addParagraphBreaks turn every line boundary of the rendered sections into a paragraph
     *                           boundary (Polygon keeps statement text as separate paragraphs)
     */
    public StatementParser(MarkerClassifier classifier, SampleExtractor sampleExtractor, boolean addParagraphBreaks) {
        this.classifier = classifier;
        this.sampleExtractor = sampleExtractor;
        this.addParagraphBreaks = addParagraphBreaks;
    }

    /**
     * All {@code div.problem-statement} blocks of the page, or the body when there are none.
     */
    public List<Element> findProblems(Document document) {
        List<Element> problems = document.select("div.problem-statement");
        if (!problems.isEmpty()) {
            return new ArrayList<>(problems);
        }
        Element body = document.body();
        return body != null ? List.of(body) : Collections.emptyList();
    }

    /**
     * Parse one problem. Images are registered with {@code resources}; the caller decides how
     * collectors map to output documents and attaches the collected resources itself.
     *
     * @param number one-based position of the problem, used for the fallback title
     */
    public ProblemStatement parse(Element problem, int number, ResourceCollector resources) {
        ProblemStatement statement = new ProblemStatement();
        Element header = problem.selectFirst(".header");

        String title = findTitle(problem, header, number);
        statement.setOriginalTitle(title);
        statement.setTitle(stripIndex(title));

        if (header != null) {
            statement.setTimeLimitText(headerText(header, ".time-limit"));
            statement.setMemoryLimitText(headerText(header, ".memory-limit"));
            statement.setInputFile(headerText(header, ".input-file"));
            statement.setOutputFile(headerText(header, ".output-file"));
            statement.setTimeLimitMillis(LimitParser.parseTimeLimitMillis(statement.getTimeLimitText()));
            statement.setMemoryLimitMegabytes(LimitParser.parseMemoryLimitMegabytes(statement.getMemoryLimitText()));
        }

        TreeRenderer renderer = new TreeRenderer(classifier, resources);
        statement.setLegend(renderSection(renderer, findLegend(problem), SectionKind.LEGEND));
        statement.setInputSpecification(renderSection(renderer, section(problem, SectionKind.INPUT), SectionKind.INPUT));
        statement.setOutputSpecification(renderSection(renderer, section(problem, SectionKind.OUTPUT), SectionKind.OUTPUT));
        statement.setNotes(renderSection(renderer, section(problem, SectionKind.NOTES), SectionKind.NOTES));

        statement.setSamples(sampleExtractor.extract(findSamples(problem)));

        logger.info("Parsed problem '{}' ({} samples)", title, statement.getSamples().size());
        return statement;
    }

    private String renderSection(TreeRenderer renderer, Element root, SectionKind kind) {
        return renderer.renderSection(root, kind.getSkipMarkers(), addParagraphBreaks).orElse(null);
    }

    private static Element section(Element problem, SectionKind kind) {
        return problem.selectFirst("." + kind.getContainerClass());
    }

    private static String findTitle(Element problem, Element header, int number) {
        if (header != null) {
            Element titleTag = header.selectFirst(".title");
            if (titleTag != null && !titleTag.text().isBlank()) {
                return titleTag.text();
            }
        }
        Element heading = problem.selectFirst("h1");
        if (heading != null && !heading.text().isBlank()) {
            return heading.text();
        }
        return "Problem " + number;
    }

    /**
     * "A. Sum of Two" becomes "Sum of Two".
     */
    static String stripIndex(String title) {
        int dot = title.indexOf('.');
        return dot >= 0 ? title.substring(dot + 1).strip() : title;
    }

    private static String headerText(Element header, String selector) {
        Element element = header.selectFirst(selector);
        if (element == null) {
            return null;
        }
        String text = element.text();
        return text.isBlank() ? null : text;
    }

    private Element findLegend(Element problem) {
        Element legend = section(problem, SectionKind.LEGEND);
        if (legend != null) {
            return legend;
        }
        // Codeforces leaves the legend div unclassed, right after the header
        for (Element child : problem.children()) {
            if (!"div".equals(child.normalName())) {
                continue;
            }
            if (child.classNames().isEmpty() || !classifier.hasAnyClass(child, NON_LEGEND_CLASSES)) {
                return child;
            }
        }
        return null;
    }

    private static Element findSamples(Element problem) {
        Element samples = problem.selectFirst(".sample-tests");
        if (samples != null) {
            return samples;
        }
        return problem.selectFirst(".sample-test") != null ? problem : null;
    }
}
