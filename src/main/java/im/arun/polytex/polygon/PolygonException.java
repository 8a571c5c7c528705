package im.arun.polytex.polygon;

/**
 * A Polygon API call failed: transport error, unexpected response, or a FAILED status.
 */
public class PolygonException extends RuntimeException {

    public PolygonException(String message) {
        super(message);
    }

    public PolygonException(String message, Throwable cause) {
        super(message, cause);
    }
}
