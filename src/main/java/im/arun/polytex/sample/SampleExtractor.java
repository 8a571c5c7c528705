package im.arun.polytex.sample;

import im.arun.polytex.model.SamplePair;
import im.arun.polytex.tex.LiteralText;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Pulls ordered input/output pairs out of a statement's samples region.
 * <p>
 * Two row shapes are recognized: {@code div.sample-test} rows holding labeled {@code div.input} /
 * {@code div.output} blocks, and table rows with one {@code pre} per cell. The first shape present
 * wins. Without either, the {@code pre} blocks of the container are paired up in order.
 */
public class SampleExtractor {
    private static final Logger logger = LoggerFactory.getLogger(SampleExtractor.class);
    private static final Pattern TRAILING_BLANK_LINES = Pattern.compile("(\\n[ \\t]*)+\\n[ \\t]*$");

    public List<SamplePair> extract(Element container) {
        List<SamplePair> pairs = new ArrayList<>();
        if (container == null) {
            return pairs;
        }

        Elements rows = container.select("div.sample-test");
        if (rows.isEmpty()) {
            Element table = container.selectFirst("table");
            if (table != null) {
                rows = table.select("tr");
            }
        }

        if (rows.isEmpty()) {
            addPairwise(container.select("pre"), pairs);
        } else {
            for (Element row : rows) {
                extractRow(row, pairs);
            }
        }

        logger.debug("Extracted {} sample pairs", pairs.size());
        return pairs;
    }

    private void extractRow(Element row, List<SamplePair> pairs) {
        Elements inputs = row.select("div.input");
        Elements outputs = row.select("div.output");
        if (!inputs.isEmpty() && !outputs.isEmpty()) {
            int count = Math.min(inputs.size(), outputs.size());
            for (int i = 0; i < count; i++) {
                pairs.add(new SamplePair(
                        literal(inputs.get(i).selectFirst("pre")),
                        literal(outputs.get(i).selectFirst("pre"))));
            }
            return;
        }

        Elements blocks = row.select("pre");
        if (blocks.size() >= 2) {
            pairs.add(new SamplePair(literal(blocks.get(0)), literal(blocks.get(1))));
        }
    }

    private void addPairwise(Elements blocks, List<SamplePair> pairs) {
        for (int i = 0; i + 1 < blocks.size(); i += 2) {
            pairs.add(new SamplePair(literal(blocks.get(i)), literal(blocks.get(i + 1))));
        }
    }

    /**
     * Literal text of a {@code pre}, keeping inner line breaks; trailing blank lines collapse into one newline.
     */
    static String literal(Element pre) {
        if (pre == null) {
            return "";
        }
        String text = LiteralText.of(pre);
        return TRAILING_BLANK_LINES.matcher(text).replaceFirst("\n");
    }
}
