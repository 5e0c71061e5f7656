package org.iceforge.placefinder.synth;

import org.iceforge.placefinder.graph.DeploymentGraph;
import org.iceforge.placefinder.graph.DeploymentUnit;
import org.iceforge.placefinder.render.TemplateRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Writes one {@code <unit>.template.json} per unit plus {@code manifest.json} into the output directory.
 * Files of a previous run with the same names are replaced.
 */
public class CloudAssemblyWriter {

    private static final Logger log = LoggerFactory.getLogger(CloudAssemblyWriter.class);

    public static final String MANIFEST_FILE = "manifest.json";

    private final TemplateRenderer renderer;

    public CloudAssemblyWriter(TemplateRenderer renderer) {
        this.renderer = Objects.requireNonNull(renderer);
    }

    /** @return the written files, templates in realization order followed by the manifest */
    public List<Path> write(DeploymentGraph graph, Optional<String> environment, Path outputDir) {
        List<Path> written = new ArrayList<>();
        try {
            Files.createDirectories(outputDir);
            for (String name : graph.topologicalOrder()) {
                DeploymentUnit unit = graph.unit(name);
                Path file = outputDir.resolve(TemplateRenderer.templateFileName(unit));
                Files.writeString(file, renderer.toJson(renderer.render(unit)), StandardCharsets.UTF_8);
                written.add(file);
                log.debug("Wrote {} ({} resources)", file, unit.resources().size());
            }
            Path manifest = outputDir.resolve(MANIFEST_FILE);
            Files.writeString(manifest, renderer.toJson(renderer.manifest(graph, environment)), StandardCharsets.UTF_8);
            written.add(manifest);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write cloud assembly to " + outputDir, e);
        }
        log.info("Wrote cloud assembly for {} to {} ({} files)", graph.appName(), outputDir, written.size());
        return written;
    }
}
