package im.arun.polytex.service;

import im.arun.polytex.config.PolytexConfig;
import im.arun.polytex.latex.LatexDocumentAssembler;
import im.arun.polytex.model.ProblemStatement;
import im.arun.polytex.model.StatementResource;
import im.arun.polytex.polygon.PolygonClient;
import im.arun.polytex.polygon.PolygonUploader;
import im.arun.polytex.resource.ImageFetcher;
import im.arun.polytex.resource.OkHttpImageFetcher;
import im.arun.polytex.resource.ResourceCollector;
import im.arun.polytex.sample.SampleExtractor;
import im.arun.polytex.statement.StatementParser;
import im.arun.polytex.tex.MarkerClassifier;
import lombok.Value;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs one conversion: reads the HTML export, parses its problems and hands them to the
 * LaTeX assembler or the Polygon uploader.
 * <p>
 * Resource collectors are scoped to output documents: the LaTeX export shares one collector
 * across all problems of the file, while each Polygon problem gets its own.
 */
public class StatementConversionService {
    private static final Logger logger = LoggerFactory.getLogger(StatementConversionService.class);

    private final PolytexConfig config;
    private final MarkerClassifier classifier;
    private final SampleExtractor sampleExtractor;
    private final ImageFetcher imageFetcher;

    public StatementConversionService(PolytexConfig config) {
        this(config, new OkHttpImageFetcher(config.getConnectTimeoutSeconds(), config.getReadTimeoutSeconds()));
    }

    public StatementConversionService(PolytexConfig config, ImageFetcher imageFetcher) {
        this.config = config;
        this.classifier = new MarkerClassifier(config.getFormulaMarker());
        this.sampleExtractor = new SampleExtractor();
        this.imageFetcher = imageFetcher;
    }

    /**
     * Parse every problem of the file in Polygon form: paragraph breaks applied and
     * each statement carrying its own resources.
     */
    public List<ProblemStatement> parseStatements(Path htmlPath) throws IOException {
        Document document = readDocument(htmlPath);
        StatementParser parser = new StatementParser(classifier, sampleExtractor, true);
        Path baseDir = baseDir(htmlPath);

        List<ProblemStatement> statements = new ArrayList<>();
        List<Element> problems = parser.findProblems(document);
        for (int i = 0; i < problems.size(); i++) {
            ResourceCollector resources = new ResourceCollector(baseDir, imageFetcher);
            ProblemStatement statement = parser.parse(problems.get(i), i + 1, resources);
            statement.setResources(resources.resources());
            statements.add(statement);
        }
        logger.info("Parsed {} problem statements from {}", statements.size(), htmlPath);
        return statements;
    }

    /**
     * Convert the whole file into one LaTeX document.
     */
    public LatexExport exportLatex(Path htmlPath, String contestTitle) throws IOException {
        Document document = readDocument(htmlPath);
        StatementParser parser = new StatementParser(classifier, sampleExtractor, false);
        ResourceCollector resources = new ResourceCollector(baseDir(htmlPath), imageFetcher);

        List<ProblemStatement> statements = new ArrayList<>();
        List<Element> problems = parser.findProblems(document);
        for (int i = 0; i < problems.size(); i++) {
            statements.add(parser.parse(problems.get(i), i + 1, resources));
        }

        String tex = new LatexDocumentAssembler(config.getLabels()).renderDocument(statements, contestTitle);
        return new LatexExport(tex, statements, resources.resources());
    }

    /**
     * Write the document to {@code outputTex} and its images next to it.
     */
    public void writeLatex(LatexExport export, Path outputTex) throws IOException {
        Path texFile = outputTex.toAbsolutePath().normalize();
        Path outputDir = texFile.getParent();
        Files.createDirectories(outputDir);
        Files.writeString(texFile, export.getTex(), StandardCharsets.UTF_8);

        for (StatementResource resource : export.getResources()) {
            Path target = outputDir.resolve(resource.getName()).normalize();
            if (!outputDir.equals(target.getParent())) {
                logger.warn("Skipping resource with unsafe name '{}'", resource.getName());
                continue;
            }
            Files.write(target, resource.getContent());
            logger.info("Wrote resource {}", target);
        }
    }

    /**
     * @return number of problems uploaded successfully
     */
    public int upload(List<ProblemStatement> statements, String prefix, PolygonClient client) {
        PolygonUploader uploader = new PolygonUploader(client, config.getLanguage(), config.getCommitMessage());
        return uploader.uploadAll(statements, prefix);
    }

    private static Document readDocument(Path htmlPath) throws IOException {
        return Jsoup.parse(htmlPath.toFile(), StandardCharsets.UTF_8.name());
    }

    private static Path baseDir(Path htmlPath) {
        Path parent = htmlPath.toAbsolutePath().getParent();
        return parent != null ? parent : Path.of(".").toAbsolutePath();
    }

    /**
     * Result of a LaTeX export: the document text, the statements it was built from and the
     * images it references.
     */
    @Value
    public static class LatexExport {
        String tex;
        List<ProblemStatement> statements;
        List<StatementResource> resources;
    }
}
