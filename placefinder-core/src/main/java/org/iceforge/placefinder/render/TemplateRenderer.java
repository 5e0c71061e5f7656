package org.iceforge.placefinder.render;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.iceforge.placefinder.graph.DeploymentGraph;
import org.iceforge.placefinder.graph.DeploymentUnit;
import org.iceforge.placefinder.template.CfnResource;
import org.iceforge.placefinder.template.CfnValue;
import org.iceforge.placefinder.template.PublishedOutput;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Renders units as CloudFormation templates and the graph as an assembly manifest.
 * Identical graphs render byte-identical JSON.
 */
public final class TemplateRenderer {

    public static final String FORMAT_VERSION = "2010-09-09";
    public static final String MANIFEST_VERSION = "1";

    private final ObjectMapper mapper;

    public TemplateRenderer(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper).copy()
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public TemplateRenderer() {
        this(new ObjectMapper());
    }

    public ObjectNode render(DeploymentUnit unit) {
        ObjectNode template = mapper.createObjectNode();
        template.put("AWSTemplateFormatVersion", FORMAT_VERSION);
        if (unit.description() != null) {
            template.put("Description", unit.description());
        }

        ObjectNode resources = template.putObject("Resources");
        for (CfnResource r : unit.resourcesInOrder()) {
            ObjectNode node = resources.putObject(r.logicalId());
            node.put("Type", r.type());
            if (!r.properties().isEmpty()) {
                node.set("Properties", tree(r.properties()));
            }
            if (!r.dependsOn().isEmpty()) {
                ArrayNode deps = node.putArray("DependsOn");
                r.dependsOn().stream().sorted().forEach(deps::add);
            }
            if (r.deletionPolicy() != null) {
                node.put("DeletionPolicy", r.deletionPolicy());
            }
            if (r.updateReplacePolicy() != null) {
                node.put("UpdateReplacePolicy", r.updateReplacePolicy());
            }
        }

        if (!unit.outputs().isEmpty()) {
            ObjectNode outputs = template.putObject("Outputs");
            for (PublishedOutput o : unit.outputs()) {
                ObjectNode node = outputs.putObject(o.logicalId());
                node.set("Value", tree(o.value()));
                if (o.description() != null) {
                    node.put("Description", o.description());
                }
                node.putObject("Export").put("Name", o.exportName());
            }
        }
        return template;
    }

    /**
     * Manifest listing units in realization order with their dependencies, waves and exports.
     *
     * @param environment {@code aws://<account>/<region>} when pinned, empty for environment-agnostic units
     */
    public ObjectNode manifest(DeploymentGraph graph, Optional<String> environment) {
        ObjectNode manifest = mapper.createObjectNode();
        manifest.put("version", MANIFEST_VERSION);
        manifest.put("appName", graph.appName());

        ObjectNode units = manifest.putObject("units");
        for (String name : graph.topologicalOrder()) {
            DeploymentUnit u = graph.unit(name);
            ObjectNode node = units.putObject(name);
            node.put("kind", u.kind().name());
            node.put("templateFile", templateFileName(u));
            node.put("environment", environment.orElse("aws://unknown-account/unknown-region"));
            ArrayNode deps = node.putArray("dependencies");
            u.dependencies().stream().sorted().forEach(deps::add);
            ArrayNode exports = node.putArray("exports");
            u.outputs().forEach(o -> exports.add(o.exportName()));
        }

        ArrayNode waves = manifest.putArray("waves");
        for (List<String> wave : graph.realizationWaves()) {
            ArrayNode w = waves.addArray();
            wave.forEach(w::add);
        }
        return manifest;
    }

    public String toJson(JsonNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to serialize template", e);
        }
    }

    public static String templateFileName(DeploymentUnit unit) {
        return unit.name() + ".template.json";
    }

    private JsonNode tree(Object value) {
        return mapper.valueToTree(CfnValue.toTemplateTree(value));
    }
}
