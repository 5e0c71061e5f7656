package org.iceforge.placefinder.model;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Identity pool the credential provider authenticates against. Supplied by an external identity
 * collaborator, never produced by this project.
 * <p>
 * {@code tokenEndpoint} is optional. When given it must be an {@code https} URL ending in {@code /oauth2/token};
 * on a Cognito hosted domain ({@code <prefix>.auth.<region>.amazoncognito.com}) the region must be the pool's.
 */
public record IdentityPoolParameters(String poolId, String clientId, String tokenEndpoint) {

    public static final String TOKEN_PATH = "/oauth2/token";

    private static final String COGNITO_DOMAIN_SUFFIX = ".amazoncognito.com";

    public IdentityPoolParameters {
        DeploymentConfigurationException.requireNonBlank("identityPool.poolId", poolId);
        DeploymentConfigurationException.requireNonBlank("identityPool.clientId", clientId);
        tokenEndpoint = tokenEndpoint == null || tokenEndpoint.isBlank() ? null : tokenEndpoint.trim();
        if (tokenEndpoint != null) {
            checkTokenEndpoint(tokenEndpoint, regionOf(poolId));
        }
    }

    /** OpenID discovery document of a Cognito user pool. */
    public static String discoveryUrl(String region, String poolId) {
        return "https://cognito-idp." + region + ".amazonaws.com/" + poolId + "/.well-known/openid-configuration";
    }

    /** Region embedded in a Cognito pool id ({@code us-east-2_AbCdEf}), if it has one. */
    public String poolRegion() {
        return regionOf(poolId);
    }

    private static String regionOf(String poolId) {
        int idx = poolId.indexOf('_');
        return idx > 0 ? poolId.substring(0, idx) : null;
    }

    private static void checkTokenEndpoint(String endpoint, String poolRegion) {
        URI uri;
        try {
            uri = new URI(endpoint);
        } catch (URISyntaxException e) {
            throw new DeploymentConfigurationException("identityPool.tokenEndpoint", "'" + endpoint + "' is not a URL");
        }
        if (!"https".equals(uri.getScheme()) || uri.getHost() == null) {
            throw new DeploymentConfigurationException("identityPool.tokenEndpoint",
                    "'" + endpoint + "' must be an https URL");
        }
        if (!TOKEN_PATH.equals(uri.getPath())) {
            throw new DeploymentConfigurationException("identityPool.tokenEndpoint",
                    "'" + endpoint + "' must end with " + TOKEN_PATH);
        }
        String host = uri.getHost();
        if (poolRegion != null && host.endsWith(COGNITO_DOMAIN_SUFFIX)
                && !host.endsWith(".auth." + poolRegion + COGNITO_DOMAIN_SUFFIX)) {
            throw new DeploymentConfigurationException("identityPool.tokenEndpoint",
                    "'" + endpoint + "' is not in the pool's region " + poolRegion);
        }
    }
}
