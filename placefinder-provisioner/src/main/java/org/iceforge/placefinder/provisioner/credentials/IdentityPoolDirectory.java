package org.iceforge.placefinder.provisioner.credentials;

/** Read access to identity-pool app clients. */
public interface IdentityPoolDirectory {

    /**
     * @throws RemoteProvisioningException the client cannot be described or has no secret
     */
    OAuth2ClientCredentials clientCredentials(String userPoolId, String clientId);
}
