package org.iceforge.placefinder.graph;

public enum UnitKind {
    REGISTRY,
    RUNTIME_AND_MEMORY,
    CREDENTIAL_PROVIDER,
    GATEWAY
}
