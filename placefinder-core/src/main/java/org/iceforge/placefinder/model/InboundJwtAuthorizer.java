package org.iceforge.placefinder.model;

import java.util.List;

/** JWT authorization on the runtime's inbound endpoint, bound to one identity pool. */
public record InboundJwtAuthorizer(String poolId, List<String> allowedClients) {

    public InboundJwtAuthorizer {
        DeploymentConfigurationException.requireNonBlank("runtime.authorizer.poolId", poolId);
        if (allowedClients == null || allowedClients.isEmpty()) {
            throw new DeploymentConfigurationException("runtime.authorizer.allowedClients", "must not be empty");
        }
        allowedClients = List.copyOf(allowedClients);
    }
}
