package org.iceforge.placefinder.provisioner.aws;

import org.iceforge.placefinder.model.DeploymentConfigurationException;

import java.net.URI;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Client settings of the provisioning function, read from its environment.
 * <ul>
 *   <li>{@code PLACEFINDER_AGENTCORE_ENDPOINT}: AgentCore control plane endpoint (VPC endpoint or a local stub)</li>
 *   <li>{@code PLACEFINDER_COGNITO_ENDPOINT}: Cognito identity provider endpoint</li>
 *   <li>{@code PLACEFINDER_API_TIMEOUT}: ISO-8601 duration per API call, e.g. {@code PT20S}</li>
 * </ul>
 * The region is not configured here; it comes from each request's {@code Region} property.
 */
public class ProvisionerClientConfig {

    public static final String ENV_AGENTCORE_ENDPOINT = "PLACEFINDER_AGENTCORE_ENDPOINT";
    public static final String ENV_COGNITO_ENDPOINT = "PLACEFINDER_COGNITO_ENDPOINT";
    public static final String ENV_API_TIMEOUT = "PLACEFINDER_API_TIMEOUT";

    private URI agentCoreEndpoint;
    private URI cognitoEndpoint;
    private Duration apiTimeout;

    public static ProvisionerClientConfig fromEnvironment(Map<String, String> env) {
        ProvisionerClientConfig cfg = new ProvisionerClientConfig();
        cfg.setAgentCoreEndpoint(uri(env, ENV_AGENTCORE_ENDPOINT));
        cfg.setCognitoEndpoint(uri(env, ENV_COGNITO_ENDPOINT));
        String timeout = env.get(ENV_API_TIMEOUT);
        if (timeout != null && !timeout.isBlank()) {
            try {
                cfg.setApiTimeout(Duration.parse(timeout.trim()));
            } catch (DateTimeParseException e) {
                throw new DeploymentConfigurationException(ENV_API_TIMEOUT, "'" + timeout + "' is not an ISO-8601 duration");
            }
        }
        return cfg;
    }

    private static URI uri(Map<String, String> env, String key) {
        String v = env.get(key);
        if (v == null || v.isBlank()) {
            return null;
        }
        URI uri = URI.create(v.trim());
        if (uri.getScheme() == null || uri.getHost() == null) {
            throw new DeploymentConfigurationException(key, "'" + v + "' must be an absolute URL");
        }
        return uri;
    }

    public URI getAgentCoreEndpoint() {
        return agentCoreEndpoint;
    }

    public void setAgentCoreEndpoint(URI agentCoreEndpoint) {
        this.agentCoreEndpoint = agentCoreEndpoint;
    }

    public URI getCognitoEndpoint() {
        return cognitoEndpoint;
    }

    public void setCognitoEndpoint(URI cognitoEndpoint) {
        this.cognitoEndpoint = cognitoEndpoint;
    }

    public Duration getApiTimeout() {
        return apiTimeout;
    }

    public void setApiTimeout(Duration apiTimeout) {
        this.apiTimeout = apiTimeout;
    }
}
