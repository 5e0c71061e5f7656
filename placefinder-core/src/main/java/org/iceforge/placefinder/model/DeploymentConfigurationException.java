package org.iceforge.placefinder.model;

/**
 * Invalid or missing deployment input. Raised before anything remote is touched; the message names the field.
 */
public class DeploymentConfigurationException extends RuntimeException {

    private final String field;

    public DeploymentConfigurationException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public String field() {
        return field;
    }

    public static String requireNonBlank(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new DeploymentConfigurationException(field, "must not be empty");
        }
        return value;
    }
}
