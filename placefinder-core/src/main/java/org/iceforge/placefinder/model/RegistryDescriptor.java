package org.iceforge.placefinder.model;

import java.util.regex.Pattern;

/** Image repository with a count-based retention rule; retained when the unit is torn down. */
public record RegistryDescriptor(String repositoryName, int keepLastImages, boolean scanOnPush) {

    private static final Pattern NAME = Pattern.compile("^[a-z0-9]+([._-][a-z0-9]+)*(/[a-z0-9]+([._-][a-z0-9]+)*)*$");

    public RegistryDescriptor {
        if (repositoryName == null || !NAME.matcher(repositoryName).matches()) {
            throw new DeploymentConfigurationException("registry.repositoryName", "invalid repository name '" + repositoryName + "'");
        }
        if (keepLastImages < 1) {
            throw new DeploymentConfigurationException("registry.keepLastImages", "must be at least 1");
        }
    }
}
