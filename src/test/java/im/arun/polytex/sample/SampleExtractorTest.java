package im.arun.polytex.sample;

import im.arun.polytex.model.SamplePair;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SampleExtractorTest {

    private final SampleExtractor extractor = new SampleExtractor();

    private static Element element(String html) {
        return Jsoup.parseBodyFragment(html).body().child(0);
    }

    @Test
    void labeledRowsArePairedInOrder() {
        Element samples = element(
            "<div class=\"sample-tests\">"
                + "<div class=\"section-title\">Examples</div>"
                + "<div class=\"sample-test\">"
                + "<div class=\"input\"><div class=\"title\">Input</div><pre>1 2\n</pre></div>"
                + "<div class=\"output\"><div class=\"title\">Output</div><pre>3\n</pre></div>"
                + "<div class=\"input\"><div class=\"title\">Input</div><pre>5 0</pre></div>"
                + "<div class=\"output\"><div class=\"title\">Output</div><pre>5</pre></div>"
                + "</div></div>");

        assertEquals(List.of(new SamplePair("1 2\n", "3\n"), new SamplePair("5 0", "5")), extractor.extract(samples));
    }

    @Test
    void lineDivsAndBreaksKeepLineStructure() {
        Element samples = element(
            "<div class=\"sample-tests\"><div class=\"sample-test\">"
                + "<div class=\"input\"><pre><div class=\"test-example-line\">3</div><div class=\"test-example-line\">1 2 3</div></pre></div>"
                + "<div class=\"output\"><pre>a<br>b\n\n  \n</pre></div>"
                + "</div></div>");

        List<SamplePair> pairs = extractor.extract(samples);

        assertEquals(1, pairs.size());
        assertEquals("3\n1 2 3\n", pairs.get(0).getInput());
        assertEquals("a\nb\n", pairs.get(0).getOutput());
    }

    @Test
    void tableRowsHoldOnePairEach() {
        Element samples = element(
            "<div><table>"
                + "<tr><th>Input</th><th>Output</th></tr>"
                + "<tr><td><pre>1</pre></td><td><pre>2</pre></td></tr>"
                + "<tr><td><pre>x &lt; y</pre></td><td><pre>yes</pre></td></tr>"
                + "</table></div>");

        assertEquals(List.of(new SamplePair("1", "2"), new SamplePair("x < y", "yes")), extractor.extract(samples));
    }

    @Test
    void barePreBlocksArePairedUp() {
        Element samples = element("<div><pre>in1</pre><pre>out1</pre><pre>dangling</pre></div>");

        assertEquals(List.of(new SamplePair("in1", "out1")), extractor.extract(samples));
    }

    @Test
    void emptyInputIsKept() {
        Element samples = element(
            "<div class=\"sample-test\"><div class=\"input\"><pre></pre></div><div class=\"output\"><pre>Hello\n</pre></div></div>");

        assertEquals(List.of(new SamplePair("", "Hello\n")), extractor.extract(samples));
    }

    @Test
    void missingContainerHasNoSamples() {
        assertTrue(extractor.extract(null).isEmpty());
        assertTrue(extractor.extract(element("<div><p>no samples</p></div>")).isEmpty());
    }
}
