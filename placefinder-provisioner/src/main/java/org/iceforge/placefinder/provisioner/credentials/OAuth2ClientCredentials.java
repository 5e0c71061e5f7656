package org.iceforge.placefinder.provisioner.credentials;

import java.util.Objects;

/** Client id and secret of an identity-pool app client. The secret never appears in {@link #toString()}. */
public record OAuth2ClientCredentials(String clientId, String clientSecret) {

    public OAuth2ClientCredentials {
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(clientSecret, "clientSecret");
    }

    @Override
    public String toString() {
        return "OAuth2ClientCredentials[clientId=" + clientId + ", clientSecret=****]";
    }
}
