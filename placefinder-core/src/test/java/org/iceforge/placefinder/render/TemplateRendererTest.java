package org.iceforge.placefinder.render;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.iceforge.placefinder.compose.DeploymentComposer;
import org.iceforge.placefinder.compose.TestRequests;
import org.iceforge.placefinder.graph.DeploymentGraph;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateRendererTest {

    private final TemplateRenderer renderer = new TemplateRenderer();

    @Test
    void identicalInputsRenderIdenticalBytes() {
        DeploymentGraph a = new DeploymentComposer().compose(TestRequests.httpOAuth());
        DeploymentGraph b = new DeploymentComposer().compose(TestRequests.httpOAuth());

        for (String unit : a.topologicalOrder()) {
            assertThat(renderer.toJson(renderer.render(a.unit(unit))))
                    .isEqualTo(renderer.toJson(renderer.render(b.unit(unit))));
        }
        assertThat(renderer.toJson(renderer.manifest(a, Optional.empty())))
                .isEqualTo(renderer.toJson(renderer.manifest(b, Optional.empty())));
    }

    @Test
    void registryTemplateRetainsRepositoryAndExportsUri() {
        DeploymentGraph graph = new DeploymentComposer().compose(TestRequests.mcpNoAuth());

        ObjectNode template = renderer.render(graph.unit("placeFinder-EcrStack"));

        assertThat(template.path("AWSTemplateFormatVersion").asText()).isEqualTo("2010-09-09");
        JsonNode repo = template.path("Resources").path("EcrRepo");
        assertThat(repo.path("Type").asText()).isEqualTo("AWS::ECR::Repository");
        assertThat(repo.path("DeletionPolicy").asText()).isEqualTo("Retain");
        assertThat(repo.path("Properties").path("RepositoryName").asText()).isEqualTo("placefinder-mcp");
        assertThat(template.path("Outputs").path("EcrRepositoryUri").path("Export").path("Name").asText())
                .isEqualTo("placeFinder-EcrRepositoryUri");
    }

    @Test
    void gatewayTemplateUsesImportsAndDependsOn() {
        DeploymentGraph graph = new DeploymentComposer().compose(TestRequests.httpOAuth());

        ObjectNode template = renderer.render(graph.unit("placeFinder-GatewayStack"));
        JsonNode target = template.path("Resources").path("McpTarget");

        assertThat(target.path("DependsOn")).hasSize(2);
        JsonNode oauth = target.path("Properties").path("CredentialProviderConfigurations").get(0)
                .path("CredentialProvider").path("OauthCredentialProvider");
        assertThat(oauth.path("ProviderArn").path("Fn::ImportValue").asText()).isEqualTo("placeFinder-OAuth2ProviderArn");
        assertThat(oauth.path("Scopes").get(0).asText()).isEqualTo("placeFinder-api/mcp");
        assertThat(renderer.toJson(target)).contains("/invocations?qualifier=DEFAULT");
    }

    @Test
    void manifestListsUnitsInRealizationOrder() {
        DeploymentGraph graph = new DeploymentComposer().compose(TestRequests.httpOAuth());

        ObjectNode manifest = renderer.manifest(graph, Optional.of("aws://123456789012/us-east-2"));

        assertThat(manifest.path("waves")).hasSize(3);
        assertThat(manifest.path("units").fieldNames()).toIterable()
                .containsExactly("placeFinder-EcrStack", "placeFinder-CredentialStack",
                        "placeFinder-AgentCoreStack", "placeFinder-GatewayStack");
        assertThat(manifest.path("units").path("placeFinder-GatewayStack").path("dependencies"))
                .hasSize(2);
        assertThat(manifest.path("units").path("placeFinder-EcrStack").path("environment").asText())
                .isEqualTo("aws://123456789012/us-east-2");
    }

    @Test
    void runtimeEnvironmentKeepsInsertionOrder() {
        DeploymentGraph graph = new DeploymentComposer().compose(TestRequests.httpOAuth());

        JsonNode env = renderer.render(graph.unit("placeFinder-AgentCoreStack"))
                .path("Resources").path("Runtime").path("Properties").path("EnvironmentVariables");

        assertThat(env.fieldNames()).toIterable()
                .startsWith("AWS_REGION", "AGENTCORE_MEMORY_ID", "GOOGLE_API_SECRET_NAME")
                .endsWith("OTEL_EXPORTER_OTLP_LOGS_HEADERS");
    }
}
