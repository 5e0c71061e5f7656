package org.iceforge.placefinder.model;

import org.iceforge.placefinder.template.CfnValue;

import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Container image the runtime pulls: {@code <registry-host>/<repository>:<tag>}.
 * <p>
 * Either supplied externally (a literal) or derived from the registry unit's exported repository URI plus a
 * tag. A derived reference is a floating tag; nothing checks that an image was pushed under it before the
 * runtime is realized.
 */
public record ArtifactReference(CfnValue value, boolean derivedFromRegistry) {

    public static final String DEFAULT_TAG = "latest";

    private static final Pattern IMAGE_URI = Pattern.compile(
            "^[A-Za-z0-9.-]+(:[0-9]+)?(/[a-z0-9]+([._-][a-z0-9]+)*)+(:[A-Za-z0-9_][A-Za-z0-9_.-]{0,127})?(@sha256:[a-f0-9]{64})?$");
    private static final Pattern TAG = Pattern.compile("^[A-Za-z0-9_][A-Za-z0-9_.-]{0,127}$");

    public ArtifactReference {
        Objects.requireNonNull(value, "value");
    }

    public static ArtifactReference external(String imageUri) {
        DeploymentConfigurationException.requireNonBlank("imageUri", imageUri);
        String trimmed = imageUri.trim();
        if (!IMAGE_URI.matcher(trimmed).matches()) {
            throw new DeploymentConfigurationException("imageUri",
                    "'" + trimmed + "' is not of the form <registry-host>/<repository>:<tag>");
        }
        return new ArtifactReference(CfnValue.literal(trimmed), false);
    }

    /** {@code <repositoryUri>:<tag>} where {@code repositoryUri} is the registry unit's exported URI. */
    public static ArtifactReference fromRegistry(CfnValue repositoryUri, String tag) {
        if (tag == null || !TAG.matcher(tag).matches()) {
            throw new DeploymentConfigurationException("imageTag", "invalid tag '" + tag + "'");
        }
        return new ArtifactReference(
                CfnValue.sub("${RepositoryUri}:" + tag, Map.of("RepositoryUri", repositoryUri)), true);
    }
}
