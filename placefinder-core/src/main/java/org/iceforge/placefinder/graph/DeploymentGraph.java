package org.iceforge.placefinder.graph;

import org.iceforge.placefinder.template.CfnResource;
import org.iceforge.placefinder.template.PublishedOutput;
import org.iceforge.placefinder.template.ResolutionContext;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The composed set of units and the partial order in which the provisioning engine may realize them.
 */
public final class DeploymentGraph {

    private final String appName;
    private final Map<String, DeploymentUnit> units = new LinkedHashMap<>();

    public DeploymentGraph(String appName) {
        this.appName = appName;
    }

    public String appName() {
        return appName;
    }

    public DeploymentUnit add(DeploymentUnit unit) {
        if (units.putIfAbsent(unit.name(), unit) != null) {
            throw new IllegalArgumentException("Duplicate unit " + unit.name());
        }
        return unit;
    }

    public List<DeploymentUnit> units() {
        return List.copyOf(units.values());
    }

    public DeploymentUnit unit(String name) {
        DeploymentUnit u = units.get(name);
        if (u == null) {
            throw new IllegalArgumentException("No unit named " + name);
        }
        return u;
    }

    public Optional<DeploymentUnit> unit(UnitKind kind) {
        return units.values().stream().filter(u -> u.kind() == kind).findFirst();
    }

    public List<OrderingEdge> edges() {
        List<OrderingEdge> out = new ArrayList<>();
        for (DeploymentUnit u : units.values()) {
            for (String dep : u.dependencies()) {
                out.add(new OrderingEdge(u.name(), dep));
            }
        }
        return out;
    }

    public boolean hasEdge(String dependent, String prerequisite) {
        DeploymentUnit u = units.get(dependent);
        return u != null && u.dependencies().contains(prerequisite);
    }

    /** All units that must complete before {@code unitName}, directly or transitively. */
    public Set<String> transitivePrerequisites(String unitName) {
        Set<String> seen = new LinkedHashSet<>();
        List<String> stack = new ArrayList<>(unit(unitName).dependencies());
        while (!stack.isEmpty()) {
            String next = stack.remove(stack.size() - 1);
            if (seen.add(next)) {
                stack.addAll(unit(next).dependencies());
            }
        }
        return seen;
    }

    /**
     * Units grouped into waves: every unit in a wave depends only on units of earlier waves,
     * so units inside one wave may be realized in parallel.
     */
    public List<List<String>> realizationWaves() {
        List<List<String>> waves = new ArrayList<>();
        Set<String> done = new LinkedHashSet<>();
        while (done.size() < units.size()) {
            List<String> wave = new ArrayList<>();
            for (DeploymentUnit u : units.values()) {
                if (!done.contains(u.name()) && done.containsAll(u.dependencies())) {
                    wave.add(u.name());
                }
            }
            if (wave.isEmpty()) {
                throw new OrderingViolationException("Cycle between units " + remaining(done));
            }
            waves.add(List.copyOf(wave));
            done.addAll(wave);
        }
        return waves;
    }

    public List<String> topologicalOrder() {
        return realizationWaves().stream().flatMap(List::stream).toList();
    }

    /**
     * Check the graph is complete:
     * <ul>
     *   <li>edges point at known units and form no cycle</li>
     *   <li>export names are unique</li>
     *   <li>every imported export is published by a unit the importer (transitively) depends on</li>
     *   <li>in-unit references and DependsOn name resources of the same unit</li>
     * </ul>
     */
    public DeploymentGraph validate() {
        for (DeploymentUnit u : units.values()) {
            for (String dep : u.dependencies()) {
                if (!units.containsKey(dep)) {
                    throw new OrderingViolationException(u.name() + " depends on unknown unit " + dep);
                }
            }
        }
        realizationWaves();

        Map<String, String> exporters = new HashMap<>();
        for (DeploymentUnit u : units.values()) {
            for (PublishedOutput o : u.outputs()) {
                String prev = exporters.putIfAbsent(o.exportName(), u.name());
                if (prev != null) {
                    throw new IllegalStateException("Export " + o.exportName() + " published by both " + prev + " and " + u.name());
                }
            }
        }

        for (DeploymentUnit u : units.values()) {
            Set<String> prerequisites = transitivePrerequisites(u.name());
            for (String imported : u.imports()) {
                String producer = exporters.get(imported);
                if (producer == null) {
                    throw new OrderingViolationException(u.name() + " imports " + imported + " which no unit exports");
                }
                if (!prerequisites.contains(producer)) {
                    throw new OrderingViolationException(u.name() + " imports " + imported + " from " + producer
                            + " without an ordering edge");
                }
            }
            for (CfnResource r : u.resources()) {
                for (String ref : r.prerequisites()) {
                    if (!u.hasResource(ref)) {
                        throw new OrderingViolationException(r.logicalId() + " in " + u.name() + " refers to unknown resource " + ref);
                    }
                }
            }
            for (PublishedOutput o : u.outputs()) {
                for (String ref : o.value().references()) {
                    if (!u.hasResource(ref)) {
                        throw new OrderingViolationException("Output " + o.logicalId() + " in " + u.name() + " refers to unknown resource " + ref);
                    }
                }
            }
            u.resourcesInOrder();
        }
        return this;
    }

    /**
     * Resolve every export the way the engine would, unit by unit in realization order.
     * {@code attributesByUnit} supplies the physical ids / attributes the engine would have assigned.
     */
    public Map<String, String> resolveExports(ResolutionContext base, Map<String, Map<String, String>> attributesByUnit) {
        Map<String, String> exports = new LinkedHashMap<>();
        for (String name : topologicalOrder()) {
            DeploymentUnit u = units.get(name);
            ResolutionContext ctx = base
                    .withAttributes(attributesByUnit.getOrDefault(name, Map.of()))
                    .withExports(exports);
            for (PublishedOutput o : u.outputs()) {
                exports.put(o.exportName(), o.value().resolve(ctx));
            }
        }
        return exports;
    }

    private Set<String> remaining(Set<String> done) {
        Set<String> out = new LinkedHashSet<>(units.keySet());
        out.removeAll(done);
        return out;
    }
}
