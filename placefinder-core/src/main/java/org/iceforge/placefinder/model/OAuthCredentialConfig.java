package org.iceforge.placefinder.model;

import org.iceforge.placefinder.template.CfnValue;

import java.util.List;
import java.util.Objects;

/** Outbound OAuth block of a gateway target: which credential provider, which scopes, which grant. */
public record OAuthCredentialConfig(CfnValue providerArn, List<String> scopes, String grantType) {

    public static final String CLIENT_CREDENTIALS = "CLIENT_CREDENTIALS";

    public OAuthCredentialConfig {
        Objects.requireNonNull(providerArn, "providerArn");
        if (scopes == null || scopes.isEmpty()) {
            throw new DeploymentConfigurationException("gatewayTarget.scopes", "must not be empty");
        }
        scopes = List.copyOf(scopes);
        grantType = grantType == null ? CLIENT_CREDENTIALS : grantType;
    }
}
