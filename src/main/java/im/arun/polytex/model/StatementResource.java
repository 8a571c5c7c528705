package im.arun.polytex.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * An image extracted from a statement, referenced from the rendered text by {@link #getName()}.
 * Width and height are present only when the bytes could be decoded as an image.
 */
@Value
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StatementResource {

    @JsonProperty("name")
    String name;

    @JsonIgnore
    byte[] content;

    @JsonProperty("width")
    Integer width;

    @JsonProperty("height")
    Integer height;

    public StatementResource(String name, byte[] content) {
        this(name, content, null, null);
    }

    @JsonProperty("size")
    public int getSize() {
        return content.length;
    }
}
