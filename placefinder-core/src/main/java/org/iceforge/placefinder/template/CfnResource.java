package org.iceforge.placefinder.template;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One resource declaration inside a unit: logical id, CloudFormation type, properties and
 * explicit {@code DependsOn} edges.
 */
public final class CfnResource {

    private final String logicalId;
    private final String type;
    private final Map<String, Object> properties;
    private final Set<String> dependsOn = new LinkedHashSet<>();
    private String deletionPolicy;
    private String updateReplacePolicy;

    public CfnResource(String logicalId, String type, Map<String, Object> properties) {
        this.logicalId = Objects.requireNonNull(logicalId, "logicalId");
        this.type = Objects.requireNonNull(type, "type");
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public String logicalId() { return logicalId; }
    public String type() { return type; }
    public Map<String, Object> properties() { return properties; }
    public Set<String> dependsOn() { return Collections.unmodifiableSet(dependsOn); }
    public String deletionPolicy() { return deletionPolicy; }
    public String updateReplacePolicy() { return updateReplacePolicy; }

    /** Explicit ordering edge: this resource must be realized after {@code other}. */
    public CfnResource addDependency(CfnResource other) {
        if (other == this) {
            throw new IllegalArgumentException(logicalId + " cannot depend on itself");
        }
        dependsOn.add(other.logicalId());
        return this;
    }

    /** Keep the physical resource when it is removed from the template or replaced. */
    public CfnResource retainOnDelete() {
        this.deletionPolicy = "Retain";
        this.updateReplacePolicy = "Retain";
        return this;
    }

    public CfnValue ref() {
        return CfnValue.ref(logicalId);
    }

    public CfnValue getAtt(String attribute) {
        return CfnValue.getAtt(logicalId, attribute);
    }

    /** In-unit logical ids read through Ref / GetAtt / Sub in the properties. */
    public Set<String> implicitReferences() {
        Set<String> out = new LinkedHashSet<>();
        CfnValue.walk(properties, v -> out.addAll(v.references()));
        out.remove(logicalId);
        return out;
    }

    public Set<String> imports() {
        Set<String> out = new LinkedHashSet<>();
        CfnValue.walk(properties, v -> out.addAll(v.imports()));
        return out;
    }

    /** Explicit and implicit prerequisites inside the unit. */
    public Set<String> prerequisites() {
        Set<String> out = new LinkedHashSet<>(dependsOn);
        out.addAll(implicitReferences());
        return out;
    }

    @Override
    public String toString() {
        return logicalId + "(" + type + ")";
    }
}
