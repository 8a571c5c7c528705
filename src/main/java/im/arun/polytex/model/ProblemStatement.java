package im.arun.polytex.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A single problem extracted from the HTML export.
 * Section fields hold rendered LaTeX and are null when the statement has no such section.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProblemStatement {

    @JsonProperty("original_title")
    private String originalTitle;

    @JsonProperty("title")
    private String title;

    @JsonProperty("time_limit")
    private String timeLimitText;

    @JsonProperty("time_limit_ms")
    private Integer timeLimitMillis;

    @JsonProperty("memory_limit")
    private String memoryLimitText;

    @JsonProperty("memory_limit_mb")
    private Integer memoryLimitMegabytes;

    @JsonProperty("input_file")
    private String inputFile;

    @JsonProperty("output_file")
    private String outputFile;

    @JsonProperty("legend")
    private String legend;

    @JsonProperty("input")
    private String inputSpecification;

    @JsonProperty("output")
    private String outputSpecification;

    @JsonProperty("notes")
    private String notes;

    @JsonProperty("samples")
    private List<SamplePair> samples = new ArrayList<>();

    @JsonProperty("resources")
    private List<StatementResource> resources = new ArrayList<>();
}
