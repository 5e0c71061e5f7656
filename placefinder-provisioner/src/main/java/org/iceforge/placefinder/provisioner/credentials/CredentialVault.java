package org.iceforge.placefinder.provisioner.credentials;

import java.util.Optional;

/**
 * The token vault's OAuth2 credential providers, addressed by name.
 */
public interface CredentialVault {

    /**
     * Register a custom OAuth2 provider discovered through {@code discoveryUrl}.
     *
     * @throws ProviderAlreadyExistsException a provider with that name is already registered
     * @throws RemoteProvisioningException    any other failure
     */
    CredentialProviderHandle create(String name, String discoveryUrl, OAuth2ClientCredentials credentials);

    /** The registered provider with its discovery URL and client, or empty when there is none with that name. */
    Optional<RegisteredProvider> find(String name);

    /**
     * @throws ProviderNotFoundException   nothing registered under that name
     * @throws RemoteProvisioningException any other failure
     */
    void delete(String name);
}
