package im.arun.polytex.statement;

import java.util.Set;

/**
 * Logical parts of a statement rendered by the tree renderer, with the container class that
 * holds each one on the page and the markers suppressed while rendering it.
 */
public enum SectionKind {
    LEGEND("legend", Set.of()),
    INPUT("input-specification", Set.of("section-title")),
    OUTPUT("output-specification", Set.of("section-title")),
    NOTES("note", Set.of("section-title"));

    private final String containerClass;
    private final Set<String> skipMarkers;

    SectionKind(String containerClass, Set<String> skipMarkers) {
        this.containerClass = containerClass;
        this.skipMarkers = skipMarkers;
    }

    public String getContainerClass() {
        return containerClass;
    }

    public Set<String> getSkipMarkers() {
        return skipMarkers;
    }
}
