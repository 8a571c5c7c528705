package im.arun.polytex.statement;

import im.arun.polytex.model.ProblemStatement;
import im.arun.polytex.model.SamplePair;
import im.arun.polytex.resource.ImageFetcher;
import im.arun.polytex.resource.ResourceCollector;
import im.arun.polytex.sample.SampleExtractor;
import im.arun.polytex.tex.MarkerClassifier;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class StatementParserTest {

    @TempDir
    Path baseDir;

    private Document contest;
    private ResourceCollector resources;

    @BeforeEach
    void setUp() throws IOException {
        try (InputStream html = getClass().getResourceAsStream("/statements/contest.html")) {
            assertNotNull(html, "fixture missing");
            contest = Jsoup.parse(html, StandardCharsets.UTF_8.name(), "");
        }
        Files.createDirectories(baseDir.resolve("images"));
        ImageIO.write(new BufferedImage(4, 3, BufferedImage.TYPE_INT_RGB), "png",
            baseDir.resolve("images/graph.png").toFile());
        resources = new ResourceCollector(baseDir, mock(ImageFetcher.class));
    }

    private StatementParser parser(boolean addParagraphBreaks) {
        return new StatementParser(new MarkerClassifier(), new SampleExtractor(), addParagraphBreaks);
    }

    @Test
    void findsEveryProblemBlock() {
        assertEquals(2, parser(false).findProblems(contest).size());
    }

    @Test
    void bodyIsTheOnlyProblemWithoutStatementBlocks() {
        Document page = Jsoup.parse("<html><body><h1>Lonely</h1><div><p>Text</p></div></body></html>");

        List<Element> problems = parser(false).findProblems(page);

        assertEquals(1, problems.size());
        assertEquals("body", problems.get(0).normalName());
        ProblemStatement statement = parser(false).parse(problems.get(0), 1, resources);
        assertEquals("Lonely", statement.getOriginalTitle());
        assertEquals("Text", statement.getLegend());
    }

    @Test
    void parsesHeaderAndLimits() {
        Element first = parser(true).findProblems(contest).get(0);

        ProblemStatement statement = parser(true).parse(first, 1, resources);

        assertEquals("A. Sum of Two", statement.getOriginalTitle());
        assertEquals("Sum of Two", statement.getTitle());
        assertEquals("time limit per test 2 seconds", statement.getTimeLimitText());
        assertEquals(2000, statement.getTimeLimitMillis());
        assertEquals("memory limit per test 256 megabytes", statement.getMemoryLimitText());
        assertEquals(256, statement.getMemoryLimitMegabytes());
        assertEquals("input standard input", statement.getInputFile());
        assertEquals("output standard output", statement.getOutputFile());
    }

    @Test
    void unclassedDivAfterHeaderIsTheLegend() {
        ProblemStatement statement = parser(true).parse(parser(true).findProblems(contest).get(0), 1, resources);

        assertEquals("Given two integers $\\textit{a}$ and $\\textit{b}$, print their sum.\n\n"
                + "It is guaranteed that $1 \\leq{} \\textit{a}, \\textit{b} \\leq{} 10^{9}$.",
            statement.getLegend());
        assertEquals("The only line contains $\\textit{a}$ and $\\textit{b}$.", statement.getInputSpecification());
        assertEquals("Print $\\textit{a} + \\textit{b}$.", statement.getOutputSpecification());
    }

    @Test
    void notesCarryTheirImage() {
        ProblemStatement statement = parser(false).parse(parser(false).findProblems(contest).get(0), 1, resources);

        assertEquals("The graph of the answer:\n\n"
                + "\\begin{center}\n  \\includegraphics[bb=0 0 4 3]{graph.png}\n\\end{center}",
            statement.getNotes());
        assertEquals(1, resources.resources().size());
        assertEquals("graph.png", resources.resources().get(0).getName());
    }

    @Test
    void samplesAreExtractedInOrder() {
        ProblemStatement statement = parser(true).parse(parser(true).findProblems(contest).get(0), 1, resources);

        assertEquals(List.of(new SamplePair("1 2\n", "3\n"), new SamplePair("5 0\n", "5\n")), statement.getSamples());
    }

    @Test
    void secondProblemUsesExplicitLegendAndGigabytes() {
        Element second = parser(false).findProblems(contest).get(1);

        ProblemStatement statement = parser(false).parse(second, 2, resources);

        assertEquals("Empty Note", statement.getTitle());
        assertEquals(1500, statement.getTimeLimitMillis());
        assertEquals(1024, statement.getMemoryLimitMegabytes());
        assertNull(statement.getInputFile());
        assertNull(statement.getNotes());
        assertEquals("Print \\textbf{Hello} \\& exit\\_now.\n\n"
                + "\\begin{itemize}\n  \\item No input.\n  \\item One line of output.\n\\end{itemize}",
            statement.getLegend());
        assertEquals(List.of(new SamplePair("", "Hello\n")), statement.getSamples());
    }

    @Test
    void paragraphBreaksSplitListLines() {
        Element second = parser(true).findProblems(contest).get(1);

        String legend = parser(true).parse(second, 2, resources).getLegend();

        assertTrue(legend.contains("\\begin{itemize}\n\n  \\item No input.\n\n  \\item One line of output."), legend);
    }

    @Test
    void fallbackTitleUsesProblemNumber() {
        Element problem = Jsoup.parseBodyFragment("<div class=\"problem-statement\"><div><p>x</p></div></div>")
            .selectFirst("div.problem-statement");

        ProblemStatement statement = parser(false).parse(problem, 3, resources);

        assertEquals("Problem 3", statement.getOriginalTitle());
        assertEquals("Problem 3", statement.getTitle());
        assertNull(statement.getTimeLimitMillis());
        assertTrue(statement.getSamples().isEmpty());
    }

    @Test
    void indexIsStrippedFromTitle() {
        assertEquals("Sum of Two", StatementParser.stripIndex("A. Sum of Two"));
        assertEquals("No index", StatementParser.stripIndex("No index"));
    }
}
