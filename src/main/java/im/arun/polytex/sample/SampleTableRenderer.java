package im.arun.polytex.sample;

import im.arun.polytex.model.SamplePair;
import im.arun.polytex.tex.TexEscaper;

import java.util.List;
import java.util.Optional;

/**
 * Typesets sample tests as a two-column {@code longtable} in a typewriter font.
 */
public class SampleTableRenderer {
    static final String TABLE_BEGIN = "\\begin{longtable}{|p{0.48\\textwidth}|p{0.48\\textwidth}|}";
    static final String TABLE_END = "\\end{longtable}";

    private final String inputLabel;
    private final String outputLabel;

    public SampleTableRenderer(String inputLabel, String outputLabel) {
        this.inputLabel = inputLabel;
        this.outputLabel = outputLabel;
    }

    public Optional<String> render(List<SamplePair> pairs) {
        if (pairs == null || pairs.isEmpty()) {
            return Optional.empty();
        }

        StringBuilder table = new StringBuilder();
        table.append(TABLE_BEGIN).append('\n');
        table.append("\\hline\n");
        table.append("\\textbf{").append(TexEscaper.escape(inputLabel)).append("} & \\textbf{")
             .append(TexEscaper.escape(outputLabel)).append("} \\\\ \\hline\n");
        for (SamplePair pair : pairs) {
            table.append(formatCell(pair.getInput()))
                 .append(" & ")
                 .append(formatCell(pair.getOutput()))
                 .append(" \\\\ \\hline\n");
        }
        table.append(TABLE_END).append('\n');
        return Optional.of(table.toString());
    }

    static String formatCell(String text) {
        String escaped = TexEscaper.escape(text);
        int end = escaped.length();
        while (end > 0 && escaped.charAt(end - 1) == '\n') {
            end--;
        }
        String body = escaped.substring(0, end).replace("\n", "\\\\");
        return "\\begin{minipage}[t]{\\linewidth}\\raggedright\\ttfamily\n"
                + body
                + "\n\\end{minipage}";
    }
}
