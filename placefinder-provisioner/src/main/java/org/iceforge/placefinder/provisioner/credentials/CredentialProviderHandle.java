package org.iceforge.placefinder.provisioner.credentials;

import java.util.Objects;

/** A registered OAuth2 credential provider: its name and the ARN other resources refer to. */
public record CredentialProviderHandle(String name, String arn) {
    public CredentialProviderHandle {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(arn, "arn");
    }
}
