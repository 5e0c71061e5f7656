package org.iceforge.placefinder.model;

import java.util.Objects;

public record GatewayDescriptor(String name, String description, ProtocolMode protocol, AuthorizerMode authorizer) {

    public GatewayDescriptor {
        DeploymentConfigurationException.requireNonBlank("gateway.name", name);
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(authorizer, "authorizer");
        if (protocol != ProtocolMode.MCP) {
            throw new DeploymentConfigurationException("gateway.protocol", "gateways only front MCP, got " + protocol);
        }
    }

    public boolean nonProduction() {
        return !authorizer.productionReady();
    }
}
