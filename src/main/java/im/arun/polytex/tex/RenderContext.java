package im.arun.polytex.tex;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Per-call rendering state. A child call receives a derived copy; instances are never mutated.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RenderContext {
    boolean insideFormula;
    Set<String> skipMarkers;

    public static RenderContext root() {
        return new RenderContext(false, Set.of());
    }

    public static RenderContext skipping(Set<String> skipMarkers) {
        Set<String> lowered = skipMarkers.stream()
            .map(marker -> marker.toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
        return new RenderContext(false, lowered);
    }

    /**
     * Context for the children of a node; formula mode, once entered, stays on for the subtree.
     */
    public RenderContext enter(boolean nodeIsFormula) {
        if (insideFormula || !nodeIsFormula) {
            return this;
        }
        return new RenderContext(true, skipMarkers);
    }
}
