package org.iceforge.placefinder.provisioner.credentials;

import org.iceforge.placefinder.model.DeploymentConfigurationException;
import org.iceforge.placefinder.model.IdentityPoolParameters;

import java.util.Map;

/**
 * Inputs of the credential step, taken from the custom resource properties. Every field is checked before
 * any remote call; a missing one fails the step with the property name.
 */
public record CredentialProviderRequest(
        String providerName,
        String userPoolId,
        String clientId,
        String region,
        String scope
) {
    public static final String PROVIDER_NAME = "ProviderName";
    public static final String USER_POOL_ID = "UserPoolId";
    public static final String CLIENT_ID = "ClientId";
    public static final String REGION = "Region";
    public static final String SCOPE = "Scope";

    public CredentialProviderRequest {
        DeploymentConfigurationException.requireNonBlank(PROVIDER_NAME, providerName);
        DeploymentConfigurationException.requireNonBlank(USER_POOL_ID, userPoolId);
        DeploymentConfigurationException.requireNonBlank(CLIENT_ID, clientId);
        DeploymentConfigurationException.requireNonBlank(REGION, region);
        scope = scope == null ? "" : scope;
    }

    public static CredentialProviderRequest fromProperties(Map<String, ?> props) {
        if (props == null) {
            throw new DeploymentConfigurationException("ResourceProperties", "must not be empty");
        }
        return new CredentialProviderRequest(
                string(props, PROVIDER_NAME),
                string(props, USER_POOL_ID),
                string(props, CLIENT_ID),
                string(props, REGION),
                string(props, SCOPE));
    }

    /** OpenID discovery document of the identity pool. */
    public String discoveryUrl() {
        return IdentityPoolParameters.discoveryUrl(region, userPoolId);
    }

    /** Same pool and client: the registered provider still carries the right credentials. */
    public boolean sameIdentity(CredentialProviderRequest other) {
        return userPoolId.equals(other.userPoolId) && clientId.equals(other.clientId) && region.equals(other.region);
    }

    private static String string(Map<String, ?> props, String key) {
        Object v = props.get(key);
        return v == null ? null : v.toString().trim();
    }
}
