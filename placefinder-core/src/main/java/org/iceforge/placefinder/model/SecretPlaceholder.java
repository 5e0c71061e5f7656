package org.iceforge.placefinder.model;

import java.util.Objects;

/**
 * A secret declared empty. The real value is written out-of-band after deployment:
 * <pre>
 * aws secretsmanager put-secret-value --secret-id &lt;name&gt; --secret-string '{"api_key":"..."}'
 * </pre>
 * There is deliberately no way to pass a value in.
 */
public record SecretPlaceholder(String name, String description, String jsonKey) {

    public SecretPlaceholder {
        DeploymentConfigurationException.requireNonBlank("secret.name", name);
        DeploymentConfigurationException.requireNonBlank("secret.jsonKey", jsonKey);
        Objects.requireNonNull(description, "description");
    }

    /** The only value ever declared: a JSON object with the key set to the empty string. */
    public String initialSecretString() {
        return "{\"" + jsonKey + "\":\"\"}";
    }
}
