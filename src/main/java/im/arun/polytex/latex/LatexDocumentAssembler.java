package im.arun.polytex.latex;

import im.arun.polytex.config.PolytexConfig;
import im.arun.polytex.model.ProblemStatement;
import im.arun.polytex.sample.SampleTableRenderer;
import im.arun.polytex.tex.TexEscaper;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds a complete, compilable LaTeX problem set from already rendered statements.
 */
public class LatexDocumentAssembler {
    private static final String PREAMBLE = String.join("\n",
        "\\documentclass[12pt]{article}",
        "\\usepackage[utf8]{inputenc}",
        "\\usepackage[T2A]{fontenc}",
        "\\usepackage[russian]{babel}",
        "\\usepackage{geometry}",
        "\\usepackage{graphicx}",
        "\\usepackage{amsmath,amssymb}",
        "\\usepackage{enumitem}",
        "\\usepackage{longtable}",
        "\\usepackage{hyperref}",
        "\\geometry{a4paper, margin=1in}",
        "\\setlength{\\parindent}{0pt}",
        "\\setlength{\\parskip}{6pt}",
        "\\begin{document}");

    private final PolytexConfig.Labels labels;
    private final SampleTableRenderer sampleTableRenderer;

    public LatexDocumentAssembler(PolytexConfig.Labels labels) {
        this.labels = labels;
        this.sampleTableRenderer = new SampleTableRenderer(labels.getInput(), labels.getOutput());
    }

    /**
     * @param contestTitle heading of the whole set; the configured default label when null or blank
     */
    public String renderDocument(List<ProblemStatement> statements, String contestTitle) {
        String heading = contestTitle != null && !contestTitle.isBlank() ? contestTitle : labels.getContestTitle();

        List<String> bodyParts = new ArrayList<>();
        for (int i = 0; i < statements.size(); i++) {
            bodyParts.add(renderProblem(statements.get(i)));
            if (i != statements.size() - 1) {
                bodyParts.add("\\clearpage");
            }
        }

        return PREAMBLE + "\n"
                + "\\begin{center}\\Large " + TexEscaper.escape(heading) + "\\end{center}\\bigskip\n"
                + String.join("\n\n", bodyParts) + "\n"
                + "\\end{document}\n";
    }

    public String renderProblem(ProblemStatement statement) {
        List<String> pieces = new ArrayList<>();
        pieces.add("\\section*{" + TexEscaper.escape(statement.getOriginalTitle()) + "}");

        List<String> limits = new ArrayList<>();
        addLimit(limits, labels.getTimeLimit(), statement.getTimeLimitText());
        addLimit(limits, labels.getMemoryLimit(), statement.getMemoryLimitText());
        addLimit(limits, labels.getInputFile(), statement.getInputFile());
        addLimit(limits, labels.getOutputFile(), statement.getOutputFile());
        if (!limits.isEmpty()) {
            pieces.add("\\textbf{" + String.join(" \\quad ", limits) + "}\\\\ \\smallskip\n");
        }

        if (statement.getLegend() != null) {
            pieces.add(statement.getLegend() + "\n");
        }
        addSection(pieces, labels.getInput(), statement.getInputSpecification());
        addSection(pieces, labels.getOutput(), statement.getOutputSpecification());
        addSection(pieces, labels.getNotes(), statement.getNotes());

        Optional<String> samples = sampleTableRenderer.render(statement.getSamples());
        if (samples.isPresent()) {
            pieces.add(subsection(labels.getSamples()));
            pieces.add(samples.get());
        }

        return String.join("\n", pieces);
    }

    private static void addLimit(List<String> limits, String label, String value) {
        if (value == null || value.isBlank()) {
            return;
        }
        String normalized = String.join(" ", value.trim().split("\\s+"));
        limits.add(TexEscaper.escape(label) + ": " + TexEscaper.escape(normalized));
    }

    private static void addSection(List<String> pieces, String label, String content) {
        if (content == null) {
            return;
        }
        pieces.add(subsection(label));
        pieces.add(content + "\n");
    }

    private static String subsection(String label) {
        return "\\subsubsection*{" + TexEscaper.escape(label) + "}";
    }
}
