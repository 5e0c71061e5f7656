package org.iceforge.placefinder.template;

import java.util.Objects;

/**
 * A unit output exported under an application-scoped name, for wiring into later units and for operators.
 */
public record PublishedOutput(
        String logicalId,
        CfnValue value,
        String description,
        String exportName
) {
    public PublishedOutput {
        Objects.requireNonNull(logicalId, "logicalId");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(exportName, "exportName");
    }

    /** The value as later units see it: a copy of the exported string, never a live reference. */
    public CfnValue imported() {
        return CfnValue.importValue(exportName);
    }
}
