package im.arun.polytex.cli;

import im.arun.polytex.config.ConfigLoader;
import im.arun.polytex.config.PolytexConfig;
import im.arun.polytex.service.StatementConversionService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "tex",
    description = "Convert an HTML problem set into a LaTeX document; images are written next to it",
    mixinStandardHelpOptions = true
)
public class TexCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Path to the source HTML file")
    private Path inputHtml;

    @Parameters(index = "1", description = "Path to the resulting .tex file")
    private Path outputTex;

    @Option(names = {"--contest-title"}, description = "Title printed at the top of the problem set")
    private String contestTitle;

    @Option(names = {"--config"}, description = "Path to a YAML configuration file")
    private Path configPath;

    @Option(names = {"--formula-marker"}, description = "Class substring that marks typeset formulas (default: tex)")
    private String formulaMarker;

    @Override
    public Integer call() throws Exception {
        if (!Files.isRegularFile(inputHtml)) {
            System.err.println("Error: HTML file not found: " + inputHtml);
            return 1;
        }

        Map<String, Object> overrides = new HashMap<>();
        overrides.put("formula_marker", formulaMarker);
        PolytexConfig config = new ConfigLoader(configPath).load(overrides);

        StatementConversionService service = new StatementConversionService(config);
        StatementConversionService.LatexExport export = service.exportLatex(inputHtml, contestTitle);
        if (export.getStatements().isEmpty()) {
            System.err.println("Error: no problem statements found in " + inputHtml);
            return 1;
        }

        service.writeLatex(export, outputTex);
        System.out.println("Problems: " + export.getStatements().size()
                + ", images: " + export.getResources().size());
        System.out.println("File saved: " + outputTex);
        return 0;
    }
}
