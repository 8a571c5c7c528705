package im.arun.polytex.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * One sample test as shown in the statement, in the order it appears on the page.
 */
@Value
public class SamplePair {

    @JsonProperty("input")
    String input;

    @JsonProperty("output")
    String output;
}
