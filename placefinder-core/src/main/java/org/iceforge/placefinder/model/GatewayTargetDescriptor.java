package org.iceforge.placefinder.model;

import org.iceforge.placefinder.template.CfnValue;

import java.util.Objects;
import java.util.Optional;

/** Routing target of a gateway: forwards to an MCP endpoint, optionally authenticating with OAuth. */
public record GatewayTargetDescriptor(
        String name,
        String description,
        CfnValue gatewayIdentifier,
        CfnValue endpoint,
        Optional<OAuthCredentialConfig> credential
) {
    public GatewayTargetDescriptor {
        DeploymentConfigurationException.requireNonBlank("gatewayTarget.name", name);
        Objects.requireNonNull(gatewayIdentifier, "gatewayIdentifier");
        Objects.requireNonNull(endpoint, "endpoint");
        credential = credential == null ? Optional.empty() : credential;
    }
}
