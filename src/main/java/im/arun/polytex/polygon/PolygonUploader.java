package im.arun.polytex.polygon;

import com.fasterxml.jackson.databind.JsonNode;
import im.arun.polytex.model.ProblemStatement;
import im.arun.polytex.model.SamplePair;
import im.arun.polytex.model.StatementResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pushes parsed statements into Polygon problems: info, statement text, images, sample tests, commit.
 */
public class PolygonUploader {
    private static final Logger logger = LoggerFactory.getLogger(PolygonUploader.class);

    private final PolygonClient client;
    private final String language;
    private final String commitMessage;

    /**
     * @param language      statement language code, e.g. "russian"
     * @param commitMessage message for the final commit; null or blank skips committing
     */
    public PolygonUploader(PolygonClient client, String language, String commitMessage) {
        this.client = client;
        this.language = language;
        this.commitMessage = commitMessage;
    }

    /**
     * Upload every statement as {@code <prefix>-a}, {@code <prefix>-b}, ... A failing problem is logged and skipped.
     *
     * @return number of problems uploaded successfully
     */
    public int uploadAll(List<ProblemStatement> statements, String prefix) {
        Map<String, Long> existing = listExistingProblems();
        int uploaded = 0;
        for (int i = 0; i < statements.size(); i++) {
            String polygonName = ProblemNaming.problemName(prefix, i);
            try {
                upload(statements.get(i), polygonName, existing);
                uploaded++;
            } catch (PolygonException e) {
                logger.error("Error uploading {}: {}", polygonName, e.getMessage());
            }
        }
        return uploaded;
    }

    /**
     * Problem ids by name for the account, empty when the listing fails.
     */
    public Map<String, Long> listExistingProblems() {
        Map<String, Long> problems = new HashMap<>();
        try {
            for (JsonNode problem : client.call("problems.list")) {
                problems.put(problem.path("name").asText(), problem.path("id").asLong());
            }
        } catch (PolygonException e) {
            logger.warn("Failed to fetch existing problems: {}", e.getMessage());
        }
        return problems;
    }

    public long upload(ProblemStatement statement, String polygonName, Map<String, Long> existing) {
        long problemId = resolveProblemId(statement, polygonName, existing);
        String id = String.valueOf(problemId);

        Map<String, String> info = new LinkedHashMap<>();
        info.put("problemId", id);
        if (statement.getTimeLimitMillis() != null) {
            info.put("timeLimit", statement.getTimeLimitMillis().toString());
        }
        if (statement.getMemoryLimitMegabytes() != null) {
            info.put("memoryLimit", statement.getMemoryLimitMegabytes().toString());
        }
        info.put("inputFile", "stdin");
        info.put("outputFile", "stdout");
        logger.info("Updating problem info of {}", polygonName);
        client.call("problem.updateInfo", info);

        Map<String, String> text = new LinkedHashMap<>();
        text.put("problemId", id);
        text.put("lang", language);
        text.put("name", statement.getTitle());
        putIfPresent(text, "legend", statement.getLegend());
        putIfPresent(text, "input", statement.getInputSpecification());
        putIfPresent(text, "output", statement.getOutputSpecification());
        putIfPresent(text, "notes", statement.getNotes());
        logger.info("Saving statement of {}", polygonName);
        client.call("problem.saveStatement", text);

        for (StatementResource resource : statement.getResources()) {
            logger.info("Uploading statement resource {}", resource.getName());
            client.call("problem.saveStatementResource",
                    Map.of("problemId", id, "name", resource.getName()),
                    Map.of("file", new PolygonClient.FilePart(resource.getName(), resource.getContent())));
        }

        List<SamplePair> samples = statement.getSamples();
        for (int index = 1; index <= samples.size(); index++) {
            SamplePair sample = samples.get(index - 1);
            Map<String, String> test = new LinkedHashMap<>();
            test.put("problemId", id);
            test.put("testset", "tests");
            test.put("testIndex", String.valueOf(index));
            test.put("testInput", sample.getInput());
            test.put("testOutput", sample.getOutput());
            test.put("testUseInStatements", "true");
            test.put("testInputForStatements", sample.getInput());
            test.put("testOutputForStatements", sample.getOutput());
            test.put("verifyInputOutputForStatements", "false");
            logger.info("Saving sample test #{} of {}", index, polygonName);
            client.call("problem.saveTest", test);
        }

        if (commitMessage != null && !commitMessage.isBlank()) {
            logger.info("Committing {} with message: {}", polygonName, commitMessage);
            client.call("problem.commitChanges", Map.of("problemId", id, "message", commitMessage));
        }
        return problemId;
    }

    private long resolveProblemId(ProblemStatement statement, String polygonName, Map<String, Long> existing) {
        if (existing != null && existing.containsKey(polygonName)) {
            long problemId = existing.get(polygonName);
            logger.info("Reusing existing problem id={} for {}", problemId, polygonName);
            return problemId;
        }

        logger.info("Creating problem {} for '{}'", polygonName, statement.getOriginalTitle());
        try {
            long problemId = client.call("problem.create", Map.of("name", polygonName)).path("id").asLong();
            logger.info("Created problem id={} for {}", problemId, polygonName);
            remember(existing, polygonName, problemId);
            return problemId;
        } catch (PolygonException createError) {
            logger.warn("Failed to create {}: {}", polygonName, createError.getMessage());

            JsonNode problems;
            try {
                problems = client.call("problems.list");
            } catch (PolygonException listError) {
                throw new PolygonException("Failed to create and locate existing problem " + polygonName
                        + ": " + listError.getMessage(), createError);
            }
            for (JsonNode problem : problems) {
                if (polygonName.equals(problem.path("name").asText())) {
                    long problemId = problem.path("id").asLong();
                    logger.info("Found existing problem id={} for {} after creation failure", problemId, polygonName);
                    remember(existing, polygonName, problemId);
                    return problemId;
                }
            }
            throw createError;
        }
    }

    private static void remember(Map<String, Long> existing, String polygonName, long problemId) {
        if (existing != null) {
            existing.put(polygonName, problemId);
        }
    }

    private static void putIfPresent(Map<String, String> params, String key, String value) {
        if (value != null && !value.isEmpty()) {
            params.put(key, value);
        }
    }
}
