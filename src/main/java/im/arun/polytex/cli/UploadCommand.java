package im.arun.polytex.cli;

import im.arun.polytex.config.ConfigLoader;
import im.arun.polytex.config.PolytexConfig;
import im.arun.polytex.model.ProblemStatement;
import im.arun.polytex.polygon.PolygonClient;
import im.arun.polytex.service.StatementConversionService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "upload",
    description = "Upload HTML problem statements to Polygon",
    mixinStandardHelpOptions = true
)
public class UploadCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Path to the contest problems HTML file")
    private Path html;

    @Parameters(index = "1", description = "Prefix for Polygon problem names (suffix -a, -b, ... is added)")
    private String prefix;

    @Option(names = {"--config"}, description = "YAML file with Polygon credentials", defaultValue = "polytex.yaml")
    private Path configPath;

    @Option(names = {"--lang"}, description = "Polygon statement language (default: from config, russian)")
    private String language;

    @Option(names = {"--commit-message"}, description = "Commit message used after uploading each problem")
    private String commitMessage;

    @Override
    public Integer call() throws Exception {
        if (!Files.isRegularFile(html)) {
            System.err.println("Error: HTML file not found: " + html);
            return 1;
        }

        Map<String, Object> overrides = new HashMap<>();
        overrides.put("language", language);
        overrides.put("commit_message", commitMessage);
        PolytexConfig config = new ConfigLoader(configPath).load(overrides);

        PolytexConfig.Polygon polygon = config.getPolygon();
        if (isBlank(polygon.getKey()) || isBlank(polygon.getSecret())) {
            System.err.println("Error: Polygon key and secret must be set in the config file's polygon section"
                    + " or via POLYGON_API_KEY / POLYGON_API_SECRET");
            return 1;
        }

        StatementConversionService service = new StatementConversionService(config);
        List<ProblemStatement> statements = service.parseStatements(html);
        if (statements.isEmpty()) {
            System.err.println("Error: no problem statements found in the HTML file");
            return 1;
        }

        PolygonClient client = new PolygonClient(polygon, config.getConnectTimeoutSeconds(), config.getReadTimeoutSeconds());
        int uploaded = service.upload(statements, prefix, client);
        System.out.println("Uploaded " + uploaded + " of " + statements.size() + " problems");
        return uploaded == statements.size() ? 0 : 1;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
