package org.iceforge.placefinder.graph;

import org.iceforge.placefinder.template.CfnResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Follows a realization of a {@link DeploymentGraph} resource by resource and refuses to start
 * anything whose prerequisites have not reported success.
 * <p>
 * A resource's prerequisites are its in-unit DependsOn / Ref / GetAtt targets plus every resource of
 * every unit its own unit depends on.
 */
public final class RealizationTracker {
    private static final Logger log = LoggerFactory.getLogger(RealizationTracker.class);

    public enum State {
        PENDING,
        IN_PROGRESS,
        SUCCEEDED,
        FAILED
    }

    public record Node(String unit, String logicalId) {
        public Node {
            Objects.requireNonNull(unit, "unit");
            Objects.requireNonNull(logicalId, "logicalId");
        }

        @Override
        public String toString() {
            return unit + "/" + logicalId;
        }
    }

    private final Map<Node, State> states = new LinkedHashMap<>();
    private final Map<Node, Set<Node>> prerequisites = new LinkedHashMap<>();

    public RealizationTracker(DeploymentGraph graph) {
        graph.validate();
        for (DeploymentUnit u : graph.units()) {
            Set<Node> upstream = new LinkedHashSet<>();
            for (String dep : graph.transitivePrerequisites(u.name())) {
                for (CfnResource r : graph.unit(dep).resources()) {
                    upstream.add(new Node(dep, r.logicalId()));
                }
            }
            for (CfnResource r : u.resources()) {
                Node node = new Node(u.name(), r.logicalId());
                Set<Node> pre = new LinkedHashSet<>(upstream);
                r.prerequisites().forEach(p -> pre.add(new Node(u.name(), p)));
                prerequisites.put(node, pre);
                states.put(node, State.PENDING);
            }
        }
    }

    public State state(Node node) {
        State s = states.get(node);
        if (s == null) {
            throw new IllegalArgumentException("Unknown resource " + node);
        }
        return s;
    }

    public Set<Node> prerequisitesOf(Node node) {
        state(node);
        return Set.copyOf(prerequisites.get(node));
    }

    /** Pending resources whose prerequisites have all succeeded. */
    public List<Node> ready() {
        return states.entrySet().stream()
                .filter(e -> e.getValue() == State.PENDING)
                .map(Map.Entry::getKey)
                .filter(this::prerequisitesMet)
                .toList();
    }

    public void start(Node node) {
        if (state(node) != State.PENDING) {
            throw new IllegalStateException(node + " is " + state(node) + ", not PENDING");
        }
        if (!prerequisitesMet(node)) {
            List<Node> missing = prerequisites.get(node).stream()
                    .filter(p -> states.get(p) != State.SUCCEEDED)
                    .toList();
            throw new OrderingViolationException("Cannot start " + node + " before " + missing);
        }
        states.put(node, State.IN_PROGRESS);
        log.debug("Realizing {}", node);
    }

    public void succeed(Node node) {
        transition(node, State.SUCCEEDED);
    }

    public void fail(Node node) {
        transition(node, State.FAILED);
        log.warn("Realization of {} failed; dependents will not start", node);
    }

    public boolean isComplete() {
        return states.values().stream().allMatch(s -> s == State.SUCCEEDED);
    }

    private void transition(Node node, State target) {
        if (state(node) != State.IN_PROGRESS) {
            throw new IllegalStateException(node + " is " + state(node) + ", not IN_PROGRESS");
        }
        states.put(node, target);
    }

    private boolean prerequisitesMet(Node node) {
        return prerequisites.get(node).stream().allMatch(p -> states.get(p) == State.SUCCEEDED);
    }
}
