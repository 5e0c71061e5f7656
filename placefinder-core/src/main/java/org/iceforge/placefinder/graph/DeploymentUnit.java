package org.iceforge.placefinder.graph;

import org.iceforge.placefinder.template.CfnResource;
import org.iceforge.placefinder.template.CfnValue;
import org.iceforge.placefinder.template.PublishedOutput;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A named, independently realized group of resources (one CloudFormation stack).
 * <p>
 * Units talk to each other only through {@link PublishedOutput exports}; a dependent unit copies the
 * export name, never holds the producing unit's resources.
 */
public final class DeploymentUnit {

    private final String name;
    private final UnitKind kind;
    private final String description;
    private final Map<String, CfnResource> resources = new LinkedHashMap<>();
    private final Map<String, PublishedOutput> outputs = new LinkedHashMap<>();
    private final Set<String> dependencies = new LinkedHashSet<>();

    public DeploymentUnit(String name, UnitKind kind, String description) {
        this.name = Objects.requireNonNull(name, "name");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.description = description;
    }

    public String name() { return name; }
    public UnitKind kind() { return kind; }
    public String description() { return description; }

    public CfnResource add(CfnResource resource) {
        if (resources.putIfAbsent(resource.logicalId(), resource) != null) {
            throw new IllegalArgumentException("Duplicate logical id " + resource.logicalId() + " in unit " + name);
        }
        return resource;
    }

    public PublishedOutput publish(String logicalId, CfnValue value, String description, String exportName) {
        PublishedOutput out = new PublishedOutput(logicalId, value, description, exportName);
        if (outputs.putIfAbsent(logicalId, out) != null) {
            throw new IllegalArgumentException("Duplicate output " + logicalId + " in unit " + name);
        }
        return out;
    }

    /** Import handle for one of this unit's outputs, for use in a later unit. */
    public CfnValue exportedValue(String outputLogicalId) {
        PublishedOutput out = outputs.get(outputLogicalId);
        if (out == null) {
            throw new IllegalArgumentException("Unit " + name + " publishes no output " + outputLogicalId);
        }
        return out.imported();
    }

    /** Explicit ordering edge: this unit is realized only after {@code prerequisite} completed. */
    public void addDependency(DeploymentUnit prerequisite) {
        if (prerequisite == this) {
            throw new IllegalArgumentException("Unit " + name + " cannot depend on itself");
        }
        dependencies.add(prerequisite.name());
    }

    public Set<String> dependencies() {
        return Collections.unmodifiableSet(dependencies);
    }

    public List<CfnResource> resources() {
        return List.copyOf(resources.values());
    }

    public CfnResource resource(String logicalId) {
        CfnResource r = resources.get(logicalId);
        if (r == null) {
            throw new IllegalArgumentException("Unit " + name + " has no resource " + logicalId);
        }
        return r;
    }

    public boolean hasResource(String logicalId) {
        return resources.containsKey(logicalId);
    }

    public List<PublishedOutput> outputs() {
        return List.copyOf(outputs.values());
    }

    public PublishedOutput output(String logicalId) {
        PublishedOutput out = outputs.get(logicalId);
        if (out == null) {
            throw new IllegalArgumentException("Unit " + name + " publishes no output " + logicalId);
        }
        return out;
    }

    /** Every export name read anywhere in this unit. */
    public Set<String> imports() {
        Set<String> out = new LinkedHashSet<>();
        resources.values().forEach(r -> out.addAll(r.imports()));
        outputs.values().forEach(o -> out.addAll(o.value().imports()));
        return out;
    }

    /** Resources of this unit in an order that honors in-unit prerequisites. */
    public List<CfnResource> resourcesInOrder() {
        List<CfnResource> ordered = new ArrayList<>();
        Set<String> placed = new LinkedHashSet<>();
        while (placed.size() < resources.size()) {
            boolean progressed = false;
            for (CfnResource r : resources.values()) {
                if (!placed.contains(r.logicalId()) && placed.containsAll(r.prerequisites())) {
                    ordered.add(r);
                    placed.add(r.logicalId());
                    progressed = true;
                }
            }
            if (!progressed) {
                throw new OrderingViolationException("Resource cycle in unit " + name);
            }
        }
        return ordered;
    }

    @Override
    public String toString() {
        return name + "[" + kind + "]";
    }
}
