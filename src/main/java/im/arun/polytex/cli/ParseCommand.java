package im.arun.polytex.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.polytex.config.ConfigLoader;
import im.arun.polytex.model.ProblemStatement;
import im.arun.polytex.service.StatementConversionService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "parse",
    description = "Print the statements as they would be sent to Polygon, as JSON",
    mixinStandardHelpOptions = true
)
public class ParseCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Path to the source HTML file")
    private Path html;

    @Option(names = {"--output"}, description = "Output JSON file path")
    private Path outputPath;

    @Option(names = {"--config"}, description = "Path to a YAML configuration file")
    private Path configPath;

    @Override
    public Integer call() throws Exception {
        if (!Files.isRegularFile(html)) {
            System.err.println("Error: HTML file not found: " + html);
            return 1;
        }

        StatementConversionService service = new StatementConversionService(new ConfigLoader(configPath).load());
        List<ProblemStatement> statements = service.parseStatements(html);

        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        String jsonOutput = mapper.writeValueAsString(statements);

        if (outputPath != null) {
            Files.writeString(outputPath, jsonOutput);
            System.out.println("Output written to: " + outputPath);
        } else {
            System.out.println(jsonOutput);
        }
        return 0;
    }
}
