package org.iceforge.placefinder.compose;

import org.iceforge.placefinder.graph.DeploymentGraph;
import org.iceforge.placefinder.graph.DeploymentUnit;
import org.iceforge.placefinder.model.ArtifactReference;
import org.iceforge.placefinder.model.DeploymentConfigurationException;
import org.iceforge.placefinder.model.IdentityPoolParameters;
import org.iceforge.placefinder.model.PromptDescriptor;
import org.iceforge.placefinder.template.CfnValue;
import org.iceforge.placefinder.units.AppNaming;
import org.iceforge.placefinder.units.CredentialUnitBuilder;
import org.iceforge.placefinder.units.GatewayUnitBuilder;
import org.iceforge.placefinder.units.PromptTemplates;
import org.iceforge.placefinder.units.RegistryUnitBuilder;
import org.iceforge.placefinder.units.RuntimeMemoryUnitBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Builds the unit graph in dependency order and threads each unit's exports into the units after it.
 * <p>
 * Edges:
 * <ul>
 *   <li>runtime-and-memory after registry, only when the image reference is derived from the registry</li>
 *   <li>credential provider: no unit prerequisites</li>
 *   <li>gateway after runtime-and-memory (runtime id / ARN) and, with OAuth, after the credential provider</li>
 * </ul>
 */
public final class DeploymentComposer {
    private static final Logger log = LoggerFactory.getLogger(DeploymentComposer.class);

    public DeploymentGraph compose(DeploymentRequest req) {
        AppNaming naming = new AppNaming(req.appName());
        DeploymentProfile profile = req.profile();
        checkIdentityInputs(req);

        DeploymentGraph graph = new DeploymentGraph(naming.appName());

        DeploymentUnit registry = graph.add(new RegistryUnitBuilder(naming).build());

        ArtifactReference artifact = req.imageUri()
                .map(ArtifactReference::external)
                .orElseGet(() -> defaultArtifact(registry));
        if (artifact.derivedFromRegistry()) {
            log.info("Using default ECR image URI: export {} with tag '{}'",
                    registry.output(RegistryUnitBuilder.OUTPUT_REPOSITORY_URI).exportName(), ArtifactReference.DEFAULT_TAG);
        } else {
            log.info("Using provided image URI: {}", req.imageUri().orElseThrow());
        }

        Optional<PromptDescriptor> prompt = profile.managedPrompt()
                ? Optional.of(PromptTemplates.holidayPlannerScope(naming))
                : Optional.empty();
        DeploymentUnit runtime = graph.add(new RuntimeMemoryUnitBuilder(naming)
                .build(artifact, profile.runtimeProtocol(), req.runtimeAuthorizer(), prompt));
        if (artifact.derivedFromRegistry()) {
            runtime.addDependency(registry);
        }

        Optional<DeploymentUnit> credential = Optional.empty();
        if (profile.oauthTarget()) {
            IdentityPoolParameters pool = req.identityPool().orElseThrow();
            credential = Optional.of(graph.add(new CredentialUnitBuilder(naming).build(pool,
                    req.provisioner().orElseThrow(() -> new DeploymentConfigurationException("provisioner",
                            "profile " + profile + " needs the provisioning function package location")))));
        }

        DeploymentUnit gateway = graph.add(new GatewayUnitBuilder(naming).build(
                runtime.exportedValue(RuntimeMemoryUnitBuilder.OUTPUT_RUNTIME_ID),
                runtime.exportedValue(RuntimeMemoryUnitBuilder.OUTPUT_RUNTIME_ARN),
                credential.map(c -> c.exportedValue(CredentialUnitBuilder.OUTPUT_PROVIDER_ARN)),
                req.gatewayAuthorizer(),
                req.identityPool()));
        gateway.addDependency(runtime);
        credential.ifPresent(gateway::addDependency);

        graph.validate();
        log.info("Composed {} units for {} ({}): waves={}", graph.units().size(), naming.appName(), profile,
                graph.realizationWaves());
        return graph;
    }

    /** {@code <account>.dkr.ecr.<region>.<suffix>/<appLower>-mcp:latest}, via the registry's exported URI. */
    static ArtifactReference defaultArtifact(DeploymentUnit registry) {
        CfnValue repositoryUri = registry.exportedValue(RegistryUnitBuilder.OUTPUT_REPOSITORY_URI);
        return ArtifactReference.fromRegistry(repositoryUri, ArtifactReference.DEFAULT_TAG);
    }

    private static void checkIdentityInputs(DeploymentRequest req) {
        if (req.profile().oauthTarget() && req.identityPool().isEmpty()) {
            throw new DeploymentConfigurationException("identityPool",
                    "profile " + req.profile() + " registers an OAuth2 credential provider and needs poolId and clientId");
        }
        req.runtimeAuthorizer().ifPresent(a -> req.identityPool().ifPresent(pool -> {
            if (!a.poolId().equals(pool.poolId())) {
                throw new DeploymentConfigurationException("identityPool.poolId",
                        "'" + pool.poolId() + "' does not match the runtime authorizer pool '" + a.poolId() + "'");
            }
        }));
    }
}
