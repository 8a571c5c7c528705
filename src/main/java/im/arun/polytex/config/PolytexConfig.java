package im.arun.polytex.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PolytexConfig {
    @JsonProperty("formula_marker")
    private String formulaMarker = "tex";

    private String language = "russian";

    @JsonProperty("commit_message")
    private String commitMessage = "Imported from HTML";

    @JsonProperty("connect_timeout_seconds")
    private int connectTimeoutSeconds = 30;

    @JsonProperty("read_timeout_seconds")
    private int readTimeoutSeconds = 60;

    private Polygon polygon = new Polygon();

    private Labels labels = new Labels();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Polygon {
        private String key;
        private String secret;

        @JsonProperty("base_url")
        private String baseUrl = "https://polygon.codeforces.com/api";
    }

    /**
     * Headings and captions printed into the LaTeX document.
     */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Labels {
        @JsonProperty("contest_title")
        private String contestTitle = "Задачи";

        @JsonProperty("time_limit")
        private String timeLimit = "Время";

        @JsonProperty("memory_limit")
        private String memoryLimit = "Память";

        @JsonProperty("input_file")
        private String inputFile = "Ввод";

        @JsonProperty("output_file")
        private String outputFile = "Вывод";

        private String input = "Ввод";
        private String output = "Вывод";
        private String notes = "Примечание";
        private String samples = "Примеры";
    }
}
