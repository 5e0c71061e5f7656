package org.iceforge.placefinder.provisioner.credentials;

/**
 * A remote call of the credential step failed. Fatal: the step reports failure with this message.
 */
public class RemoteProvisioningException extends RuntimeException {

    private final String operation;

    public RemoteProvisioningException(String operation, String message) {
        super(operation + " failed: " + message);
        this.operation = operation;
    }

    public RemoteProvisioningException(String operation, String message, Throwable cause) {
        super(operation + " failed: " + message, cause);
        this.operation = operation;
    }

    public String operation() {
        return operation;
    }
}
