package org.iceforge.placefinder.model;

/** Wire protocol a runtime speaks (and, for gateways, exposes). */
public enum ProtocolMode {
    HTTP,
    MCP
}
