package org.iceforge.placefinder.graph;

import java.util.Objects;

/** "{@code dependent} must be realized after {@code prerequisite}" between two units. */
public record OrderingEdge(String dependent, String prerequisite) {
    public OrderingEdge {
        Objects.requireNonNull(dependent, "dependent");
        Objects.requireNonNull(prerequisite, "prerequisite");
    }

    @Override
    public String toString() {
        return dependent + " -> " + prerequisite;
    }
}
