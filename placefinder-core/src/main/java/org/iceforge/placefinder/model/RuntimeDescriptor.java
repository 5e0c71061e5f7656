package org.iceforge.placefinder.model;

import org.iceforge.placefinder.template.CfnValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Container-backed managed runtime. The environment keeps insertion order so identical inputs render
 * byte-identical templates.
 */
public record RuntimeDescriptor(
        String name,
        String description,
        ArtifactReference artifact,
        ProtocolMode protocol,
        NetworkMode network,
        Map<String, CfnValue> environment,
        Optional<InboundJwtAuthorizer> authorizer
) {
    private static final Pattern NAME = Pattern.compile("^[A-Za-z][A-Za-z0-9_]{0,47}$");
    private static final Pattern ENV_KEY = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    public RuntimeDescriptor {
        if (name == null || !NAME.matcher(name).matches()) {
            throw new DeploymentConfigurationException("runtime.name", "invalid runtime name '" + name + "'");
        }
        Objects.requireNonNull(artifact, "artifact");
        Objects.requireNonNull(protocol, "protocol");
        Objects.requireNonNull(network, "network");
        environment = environment == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(environment));
        for (String key : environment.keySet()) {
            if (!ENV_KEY.matcher(key).matches()) {
                throw new DeploymentConfigurationException("runtime.environment", "invalid variable name '" + key + "'");
            }
        }
        authorizer = authorizer == null ? Optional.empty() : authorizer;
    }
}
