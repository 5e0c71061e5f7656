package org.iceforge.placefinder.provisioner.credentials;

/** No provider with the requested name is registered in the token vault. */
public class ProviderNotFoundException extends RemoteProvisioningException {

    private final String providerName;

    public ProviderNotFoundException(String operation, String providerName, Throwable cause) {
        super(operation, "provider '" + providerName + "' not found", cause);
        this.providerName = providerName;
    }

    public String providerName() {
        return providerName;
    }
}
