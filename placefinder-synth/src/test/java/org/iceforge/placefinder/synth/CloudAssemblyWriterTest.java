package org.iceforge.placefinder.synth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.placefinder.compose.DeploymentComposer;
import org.iceforge.placefinder.graph.DeploymentGraph;
import org.iceforge.placefinder.render.TemplateRenderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class CloudAssemblyWriterTest {

    @TempDir
    Path dir;

    private final CloudAssemblyWriter writer = new CloudAssemblyWriter(new TemplateRenderer());

    private static DeploymentGraph oauthGraph() {
        DeploymentProperties props = new DeploymentProperties();
        props.getIdentityPool().setPoolId("us-east-2_AbCdEf");
        props.getIdentityPool().setClientId("client-1");
        props.getProvisioner().setS3Bucket("assets");
        props.getProvisioner().setS3Key("fn.jar");
        return new DeploymentComposer().compose(props.toRequest());
    }

    @Test
    void writesOneTemplatePerUnitAndManifestLast() throws Exception {
        DeploymentGraph graph = oauthGraph();

        List<Path> files = writer.write(graph, Optional.of("aws://123456789012/us-east-2"), dir.resolve("out"));

        assertThat(files).hasSize(graph.units().size() + 1);
        assertThat(files.get(files.size() - 1).getFileName()).hasToString(CloudAssemblyWriter.MANIFEST_FILE);
        assertThat(dir.resolve("out/placeFinder-GatewayStack.template.json")).exists();
        assertThat(dir.resolve("out/placeFinder-CredentialStack.template.json")).exists();

        JsonNode manifest = new ObjectMapper().readTree(dir.resolve("out/manifest.json").toFile());
        assertThat(manifest.path("units").path("placeFinder-GatewayStack").path("environment").asText())
                .isEqualTo("aws://123456789012/us-east-2");
        assertThat(manifest.path("waves").size()).isEqualTo(3);
    }

    @Test
    void rewritingProducesIdenticalBytes() throws Exception {
        writer.write(oauthGraph(), Optional.empty(), dir);
        String first = Files.readString(dir.resolve("placeFinder-AgentCoreStack.template.json"));

        writer.write(oauthGraph(), Optional.empty(), dir);

        assertThat(Files.readString(dir.resolve("placeFinder-AgentCoreStack.template.json"))).isEqualTo(first);
    }
}
