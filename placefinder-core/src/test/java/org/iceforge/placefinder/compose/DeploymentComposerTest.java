package org.iceforge.placefinder.compose;

import org.iceforge.placefinder.graph.DeploymentGraph;
import org.iceforge.placefinder.graph.DeploymentUnit;
import org.iceforge.placefinder.graph.UnitKind;
import org.iceforge.placefinder.model.AuthorizerMode;
import org.iceforge.placefinder.model.DeploymentConfigurationException;
import org.iceforge.placefinder.model.InboundJwtAuthorizer;
import org.iceforge.placefinder.template.CfnValue;
import org.iceforge.placefinder.template.ResolutionContext;
import org.iceforge.placefinder.units.GatewayUnitBuilder;
import org.iceforge.placefinder.units.RegistryUnitBuilder;
import org.iceforge.placefinder.units.RuntimeMemoryUnitBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DeploymentComposerTest {

    private static final String REGISTRY = "placeFinder-EcrStack";
    private static final String RUNTIME = "placeFinder-AgentCoreStack";
    private static final String CREDENTIAL = "placeFinder-CredentialStack";
    private static final String GATEWAY = "placeFinder-GatewayStack";

    private final DeploymentComposer composer = new DeploymentComposer();
    private final ResolutionContext ohio = ResolutionContext.of("123456789012", "us-east-2");

    private static CfnValue containerUri(DeploymentUnit runtime) {
        Map<?, ?> artifact = (Map<?, ?>) runtime.resource(RuntimeMemoryUnitBuilder.RUNTIME).properties().get("AgentRuntimeArtifact");
        Map<?, ?> container = (Map<?, ?>) artifact.get("ContainerConfiguration");
        return (CfnValue) container.get("ContainerUri");
    }

    @Test
    void defaultImageResolvesToRegistryLatest() {
        DeploymentGraph graph = composer.compose(TestRequests.httpOAuth());

        DeploymentUnit registry = graph.unit(REGISTRY);
        String repositoryUri = registry.output(RegistryUnitBuilder.OUTPUT_REPOSITORY_URI).value()
                .resolve(ohio.withAttributes(Map.of(RegistryUnitBuilder.REPOSITORY, "placefinder-mcp")));
        String image = containerUri(graph.unit(RUNTIME))
                .resolve(ohio.withExports(Map.of("placeFinder-EcrRepositoryUri", repositoryUri)));

        assertThat(image).isEqualTo("123456789012.dkr.ecr.us-east-2.amazonaws.com/placefinder-mcp:latest");
        assertThat(graph.hasEdge(RUNTIME, REGISTRY)).isTrue();
    }

    @Test
    void externalImageHasNoRegistryEdge() {
        String uri = "987654321098.dkr.ecr.eu-west-1.amazonaws.com/other:2024-10-01";
        DeploymentGraph graph = composer.compose(TestRequests.httpOAuth(uri));

        assertThat(containerUri(graph.unit(RUNTIME))).isEqualTo(CfnValue.literal(uri));
        assertThat(graph.hasEdge(RUNTIME, REGISTRY)).isFalse();
        assertThat(graph.realizationWaves()).containsExactly(List.of(REGISTRY, RUNTIME, CREDENTIAL), List.of(GATEWAY));
    }

    @Test
    void blankImageFallsBackToDefault() {
        DeploymentGraph graph = composer.compose(TestRequests.httpOAuth("  "));

        assertThat(graph.hasEdge(RUNTIME, REGISTRY)).isTrue();
    }

    @Test
    void oauthProfileWiresCredentialUnitBeforeGateway() {
        DeploymentGraph graph = composer.compose(TestRequests.httpOAuth());

        assertThat(graph.unit(UnitKind.CREDENTIAL_PROVIDER)).isPresent();
        assertThat(graph.unit(CREDENTIAL).dependencies()).isEmpty();
        assertThat(graph.hasEdge(GATEWAY, CREDENTIAL)).isTrue();
        assertThat(graph.hasEdge(GATEWAY, RUNTIME)).isTrue();
        assertThat(graph.realizationWaves()).containsExactly(
                List.of(REGISTRY, CREDENTIAL), List.of(RUNTIME), List.of(GATEWAY));
        assertThat(graph.unit(GATEWAY).resource(GatewayUnitBuilder.TARGET).properties())
                .containsKey("CredentialProviderConfigurations");
        assertThat(graph.unit(RUNTIME).resource(RuntimeMemoryUnitBuilder.RUNTIME).properties())
                .containsEntry("ProtocolConfiguration", "HTTP");
    }

    @Test
    void mcpProfileHasNoCredentialUnitAndAManagedPrompt() {
        DeploymentGraph graph = composer.compose(TestRequests.mcpNoAuth());

        assertThat(graph.unit(UnitKind.CREDENTIAL_PROVIDER)).isEmpty();
        assertThat(graph.units()).hasSize(3);
        assertThat(graph.unit(GATEWAY).resource(GatewayUnitBuilder.TARGET).properties())
                .doesNotContainKey("CredentialProviderConfigurations");
        assertThat(graph.unit(RUNTIME).hasResource(RuntimeMemoryUnitBuilder.PROMPT)).isTrue();
        assertThat(graph.unit(RUNTIME).resource(RuntimeMemoryUnitBuilder.RUNTIME).properties())
                .containsEntry("ProtocolConfiguration", "MCP");
    }

    @Test
    void gatewayDefaultsToNoneAuthorizer() {
        DeploymentGraph graph = composer.compose(TestRequests.mcpNoAuth());

        assertThat(graph.unit(GATEWAY).resource(GatewayUnitBuilder.GATEWAY).properties())
                .containsEntry("AuthorizerType", AuthorizerMode.NONE.name());
    }

    @Test
    void oauthProfileWithoutPoolFailsFast() {
        DeploymentRequest req = new DeploymentRequest("placeFinder", Optional.empty(), DeploymentProfile.HTTP_OAUTH,
                Optional.empty(), AuthorizerMode.NONE, Optional.empty(), Optional.of(TestRequests.PACKAGE));

        assertThatThrownBy(() -> composer.compose(req))
                .isInstanceOf(DeploymentConfigurationException.class)
                .satisfies(e -> assertThat(((DeploymentConfigurationException) e).field()).isEqualTo("identityPool"));
    }

    @Test
    void oauthProfileWithoutProvisionerPackageFailsFast() {
        DeploymentRequest req = new DeploymentRequest("placeFinder", Optional.empty(), DeploymentProfile.HTTP_OAUTH,
                Optional.of(TestRequests.POOL), AuthorizerMode.NONE, Optional.empty(), Optional.empty());

        assertThatThrownBy(() -> composer.compose(req))
                .isInstanceOf(DeploymentConfigurationException.class)
                .hasMessageStartingWith("provisioner");
    }

    @Test
    void runtimeAuthorizerMustUseTheIdentityPool() {
        DeploymentRequest req = new DeploymentRequest("placeFinder", Optional.empty(), DeploymentProfile.HTTP_OAUTH,
                Optional.of(TestRequests.POOL), AuthorizerMode.NONE,
                Optional.of(new InboundJwtAuthorizer("us-east-2_Other", List.of("client"))),
                Optional.of(TestRequests.PACKAGE));

        assertThatThrownBy(() -> composer.compose(req))
                .isInstanceOf(DeploymentConfigurationException.class)
                .hasMessageContaining("us-east-2_Other");
    }

    @Test
    void exportsResolveEndToEnd() {
        DeploymentGraph graph = composer.compose(TestRequests.httpOAuth());

        Map<String, String> exports = graph.resolveExports(ohio, Map.of(
                REGISTRY, Map.of("EcrRepo", "placefinder-mcp"),
                RUNTIME, Map.of(
                        "Runtime.AgentRuntimeId", "placeFinder_mcp-AbC123xYz",
                        "Runtime.AgentRuntimeArn", "arn:aws:bedrock-agentcore:us-east-2:123456789012:runtime/placeFinder_mcp-AbC123xYz",
                        "Memory.MemoryId", "placeFinder_memory-1",
                        "Memory.MemoryArn", "arn:aws:bedrock-agentcore:us-east-2:123456789012:memory/placeFinder_memory-1",
                        "GoogleApiSecret", "arn:aws:secretsmanager:us-east-2:123456789012:secret:placeFinder/google-api-key-x"),
                CREDENTIAL, Map.of("OAuth2CredentialProvider.credentialProviderArn",
                        "arn:aws:bedrock-agentcore:us-east-2:123456789012:token-vault/default/oauth2credentialprovider/placeFinder-cognito-oauth"),
                GATEWAY, Map.of(
                        "Gateway.GatewayIdentifier", "gw-1",
                        "Gateway.GatewayArn", "arn:gw-1",
                        "Gateway.GatewayUrl", "https://gw-1.gateway.bedrock-agentcore.us-east-2.amazonaws.com/mcp",
                        "McpTarget.TargetId", "t-1")));

        assertThat(exports)
                .containsEntry("placeFinder-EcrRepositoryUri", "123456789012.dkr.ecr.us-east-2.amazonaws.com/placefinder-mcp")
                .containsEntry("placeFinder-RuntimeId", "placeFinder_mcp-AbC123xYz")
                .containsEntry("placeFinder-GatewayUrl", "https://gw-1.gateway.bedrock-agentcore.us-east-2.amazonaws.com/mcp")
                .containsKey("placeFinder-OAuth2ProviderArn");
    }
}
