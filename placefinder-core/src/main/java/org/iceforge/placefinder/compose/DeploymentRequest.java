package org.iceforge.placefinder.compose;

import org.iceforge.placefinder.model.AuthorizerMode;
import org.iceforge.placefinder.model.IdentityPoolParameters;
import org.iceforge.placefinder.model.InboundJwtAuthorizer;
import org.iceforge.placefinder.units.ProvisionerPackage;

import java.util.Optional;

/**
 * Everything the composer needs. Optional parts are empty rather than null.
 *
 * @param appName           logical application name all resource names derive from
 * @param imageUri          externally supplied artifact reference; empty means "derive from the registry"
 * @param profile           deployment profile
 * @param identityPool      identity pool for the credential provider (required by OAuth profiles)
 * @param gatewayAuthorizer inbound authorization of the gateway
 * @param runtimeAuthorizer optional JWT authorizer on the runtime itself
 * @param provisioner       location of the credential provisioning function package
 */
public record DeploymentRequest(
        String appName,
        Optional<String> imageUri,
        DeploymentProfile profile,
        Optional<IdentityPoolParameters> identityPool,
        AuthorizerMode gatewayAuthorizer,
        Optional<InboundJwtAuthorizer> runtimeAuthorizer,
        Optional<ProvisionerPackage> provisioner
) {
    public DeploymentRequest {
        imageUri = imageUri == null ? Optional.empty() : imageUri.filter(s -> !s.isBlank());
        profile = profile == null ? DeploymentProfile.HTTP_OAUTH : profile;
        identityPool = identityPool == null ? Optional.empty() : identityPool;
        gatewayAuthorizer = gatewayAuthorizer == null ? AuthorizerMode.NONE : gatewayAuthorizer;
        runtimeAuthorizer = runtimeAuthorizer == null ? Optional.empty() : runtimeAuthorizer;
        provisioner = provisioner == null ? Optional.empty() : provisioner;
    }
}
