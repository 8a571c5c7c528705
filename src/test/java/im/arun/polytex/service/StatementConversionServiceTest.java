package im.arun.polytex.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.polytex.config.PolytexConfig;
import im.arun.polytex.model.ProblemStatement;
import im.arun.polytex.model.StatementResource;
import im.arun.polytex.polygon.PolygonClient;
import im.arun.polytex.resource.ImageFetcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class StatementConversionServiceTest {

    @TempDir
    Path workDir;

    @Mock
    private ImageFetcher imageFetcher;

    @Mock
    private PolygonClient polygonClient;

    private Path html;
    private StatementConversionService service;

    @BeforeEach
    void setUp() throws IOException {
        html = workDir.resolve("contest.html");
        try (InputStream fixture = getClass().getResourceAsStream("/statements/contest.html")) {
            assertNotNull(fixture, "fixture missing");
            Files.copy(fixture, html);
        }
        Files.createDirectories(workDir.resolve("images"));
        ImageIO.write(new BufferedImage(4, 3, BufferedImage.TYPE_INT_RGB), "png",
            workDir.resolve("images/graph.png").toFile());

        service = new StatementConversionService(new PolytexConfig(), imageFetcher);
    }

    @Test
    void parseStatementsAttachesResourcesPerProblem() throws IOException {
        List<ProblemStatement> statements = service.parseStatements(html);

        assertEquals(2, statements.size());
        assertEquals(List.of("graph.png"), statements.get(0).getResources().stream().map(StatementResource::getName).toList());
        assertTrue(statements.get(1).getResources().isEmpty());
        assertTrue(statements.get(0).getNotes().contains("The graph of the answer:\n\n\\begin{center}"));
        verifyNoInteractions(imageFetcher);
    }

    @Test
    void exportLatexBuildsOneDocument() throws IOException {
        StatementConversionService.LatexExport export = service.exportLatex(html, "Round 1");

        String tex = export.getTex();
        assertEquals(2, export.getStatements().size());
        assertEquals(1, export.getResources().size());
        assertTrue(tex.contains("\\begin{center}\\Large Round 1\\end{center}"));
        assertTrue(tex.contains("\\section*{A. Sum of Two}"));
        assertTrue(tex.contains("\\section*{B. Empty Note}"));
        assertTrue(tex.contains("\\includegraphics[bb=0 0 4 3]{graph.png}"));
        assertTrue(tex.contains("$1 \\leq{} \\textit{a}, \\textit{b} \\leq{} 10^{9}$"));
        assertTrue(tex.indexOf("\\section*{A. Sum of Two}") < tex.indexOf("\\clearpage"));
        assertTrue(tex.indexOf("\\clearpage") < tex.indexOf("\\section*{B. Empty Note}"));
        assertFalse(tex.contains("MathJax"));
    }

    @Test
    void writeLatexPutsImagesNextToTheDocument() throws IOException {
        StatementConversionService.LatexExport export = service.exportLatex(html, null);
        Path output = workDir.resolve("out/problems.tex");

        service.writeLatex(export, output);

        assertEquals(export.getTex(), Files.readString(output, StandardCharsets.UTF_8));
        assertTrue(Files.isRegularFile(workDir.resolve("out/graph.png")));
        assertTrue(export.getTex().contains("\\Large Задачи"));
    }

    @Test
    void resourcesWithUnsafeNamesAreNotWritten() throws IOException {
        StatementConversionService.LatexExport export = new StatementConversionService.LatexExport(
            "doc", List.of(), List.of(new StatementResource("../escape.png", new byte[] {1})));
        Path output = workDir.resolve("out/doc.tex");

        service.writeLatex(export, output);

        assertTrue(Files.exists(output));
        assertFalse(Files.exists(workDir.resolve("escape.png")));
    }

    @Test
    void resourcesAreWrittenWhenOutputPathHasDotSegments() throws IOException {
        StatementConversionService.LatexExport export = new StatementConversionService.LatexExport(
            "doc", List.of(), List.of(new StatementResource("pic.png", new byte[] {1, 2})));

        service.writeLatex(export, workDir.resolve("out/sub/../doc.tex"));
        service.writeLatex(export, workDir.resolve("out/sub/./doc.tex"));

        assertArrayEquals(new byte[] {1, 2}, Files.readAllBytes(workDir.resolve("out/pic.png")));
        assertTrue(Files.exists(workDir.resolve("out/doc.tex")));
        assertTrue(Files.exists(workDir.resolve("out/sub/pic.png")));
    }

    @Test
    void uploadNamesProblemsWithPrefix() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        when(polygonClient.call("problems.list")).thenReturn(mapper.readTree("[]"));
        when(polygonClient.call(eq("problem.create"), anyMap())).thenReturn(mapper.readTree("{\"id\":1}"));

        int uploaded = service.upload(service.parseStatements(html), "round", polygonClient);

        assertEquals(2, uploaded);
        verify(polygonClient).call("problem.create", Map.of("name", "round-a"));
        verify(polygonClient).call("problem.create", Map.of("name", "round-b"));
    }
}
