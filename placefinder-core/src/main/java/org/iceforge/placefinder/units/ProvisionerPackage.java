package org.iceforge.placefinder.units;

import org.iceforge.placefinder.model.DeploymentConfigurationException;

/**
 * Where the credential provisioning function's deployment jar was uploaded.
 */
public record ProvisionerPackage(String s3Bucket, String s3Key, String handler, int memoryMb, int timeoutSeconds) {

    /** Object key of the shaded function jar when none is configured. */
    public static final String DEFAULT_KEY = "placefinder-provisioner-lambda.jar";

    public static final String DEFAULT_HANDLER = "org.iceforge.placefinder.provisioner.cfn.OAuth2ProviderHandler::handleRequest";

    public ProvisionerPackage {
        DeploymentConfigurationException.requireNonBlank("provisioner.s3Bucket", s3Bucket);
        DeploymentConfigurationException.requireNonBlank("provisioner.s3Key", s3Key);
        handler = handler == null || handler.isBlank() ? DEFAULT_HANDLER : handler;
        if (memoryMb < 128 || memoryMb > 10240) {
            throw new DeploymentConfigurationException("provisioner.memoryMb", "must be between 128 and 10240");
        }
        if (timeoutSeconds < 1 || timeoutSeconds > 900) {
            throw new DeploymentConfigurationException("provisioner.timeoutSeconds", "must be between 1 and 900");
        }
    }

    public static ProvisionerPackage of(String s3Bucket, String s3Key) {
        return new ProvisionerPackage(s3Bucket, s3Key, DEFAULT_HANDLER, 512, 60);
    }
}
