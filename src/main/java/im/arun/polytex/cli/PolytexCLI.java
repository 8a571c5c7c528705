package im.arun.polytex.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * Command-line entry point.
 */
@Command(
    name = "polytex",
    description = "Convert Codeforces HTML problem statements to LaTeX or upload them to Polygon",
    mixinStandardHelpOptions = true,
    version = "polytex 1.0",
    subcommands = {TexCommand.class, UploadCommand.class, ParseCommand.class}
)
public class PolytexCLI implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(System.err);
        return 1;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PolytexCLI()).execute(args);
        System.exit(exitCode);
    }
}
