package org.iceforge.placefinder.provisioner.credentials;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A provider as the vault reports it. {@code discoveryUrl} and {@code clientId} are null when the vault
 * does not return them.
 */
public record RegisteredProvider(CredentialProviderHandle handle, String discoveryUrl, String clientId) {

    public RegisteredProvider {
        Objects.requireNonNull(handle, "handle");
    }

    /** Differences from what {@code req} asks for; empty when the provider can be used as is. */
    public List<String> mismatches(CredentialProviderRequest req) {
        List<String> out = new ArrayList<>();
        if (discoveryUrl != null && !discoveryUrl.equals(req.discoveryUrl())) {
            out.add("discovery URL " + discoveryUrl + " (wanted " + req.discoveryUrl() + ")");
        }
        if (clientId != null && !clientId.equals(req.clientId())) {
            out.add("client " + clientId + " (wanted " + req.clientId() + ")");
        }
        return out;
    }

    public String arn() {
        return handle.arn();
    }
}
