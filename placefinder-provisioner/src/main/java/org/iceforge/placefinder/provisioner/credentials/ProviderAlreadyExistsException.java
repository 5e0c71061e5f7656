package org.iceforge.placefinder.provisioner.credentials;

/** A provider with the requested name is already registered in the token vault. */
public class ProviderAlreadyExistsException extends RemoteProvisioningException {

    private final String providerName;

    public ProviderAlreadyExistsException(String providerName, Throwable cause) {
        super("CreateOauth2CredentialProvider", "provider '" + providerName + "' already exists", cause);
        this.providerName = providerName;
    }

    public String providerName() {
        return providerName;
    }
}
