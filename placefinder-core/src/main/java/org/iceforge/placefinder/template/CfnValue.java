package org.iceforge.placefinder.template;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A property value in a unit's template: either a literal string or a CloudFormation intrinsic
 * that the provisioning engine resolves at deploy time.
 * <br>
 * Values are immutable and compared by value, so identical inputs always render identical templates.
 */
public interface CfnValue {

    /** Plain Java tree (String / Map / List) that serializes to the CloudFormation JSON form. */
    Object toTemplate();

    /** Logical ids of resources in the same unit that this value reads. */
    Set<String> references();

    /** Export names of other units that this value imports. */
    Set<String> imports();

    /** Resolve to a concrete string; used to simulate what the engine would produce. */
    String resolve(ResolutionContext ctx);

    static CfnValue literal(String value) {
        return new Literal(value);
    }

    static CfnValue ref(String logicalId) {
        return new Ref(logicalId);
    }

    static CfnValue getAtt(String logicalId, String attribute) {
        return new GetAtt(logicalId, attribute);
    }

    static CfnValue importValue(String exportName) {
        return new ImportValue(exportName);
    }

    static CfnValue sub(String template) {
        return new Sub(template, Map.of());
    }

    static CfnValue sub(String template, Map<String, CfnValue> variables) {
        return new Sub(template, variables);
    }

    /** Visit every {@link CfnValue} nested anywhere inside a property tree. */
    static void walk(Object tree, Consumer<CfnValue> visitor) {
        if (tree instanceof CfnValue v) {
            visitor.accept(v);
            if (v instanceof Sub s) {
                s.variables().values().forEach(visitor);
            }
        } else if (tree instanceof Map<?, ?> m) {
            m.values().forEach(child -> walk(child, visitor));
        } else if (tree instanceof Collection<?> c) {
            c.forEach(child -> walk(child, visitor));
        }
    }

    /**
     * Convert a property tree into the plain form Jackson serializes. Insertion-ordered maps keep their
     * order; any other map comes out sorted by key, so {@code Map.of} iteration order never leaks.
     */
    static Object toTemplateTree(Object tree) {
        if (tree instanceof CfnValue v) {
            return toTemplateTree(v.toTemplate());
        }
        if (tree instanceof Map<?, ?> m) {
            Map<String, Object> out = m instanceof LinkedHashMap<?, ?> ? new LinkedHashMap<>() : new TreeMap<>();
            m.forEach((k, child) -> out.put(String.valueOf(k), toTemplateTree(child)));
            return out;
        }
        if (tree instanceof Collection<?> c) {
            return c.stream().map(CfnValue::toTemplateTree).toList();
        }
        return tree;
    }

    record Literal(String value) implements CfnValue {
        public Literal {
            Objects.requireNonNull(value, "value");
        }

        @Override public Object toTemplate() { return value; }
        @Override public Set<String> references() { return Set.of(); }
        @Override public Set<String> imports() { return Set.of(); }
        @Override public String resolve(ResolutionContext ctx) { return value; }
    }

    record Ref(String logicalId) implements CfnValue {
        public Ref {
            Objects.requireNonNull(logicalId, "logicalId");
        }

        @Override public Object toTemplate() { return Map.of("Ref", logicalId); }

        @Override
        public Set<String> references() {
            return logicalId.startsWith("AWS::") ? Set.of() : Set.of(logicalId);
        }

        @Override public Set<String> imports() { return Set.of(); }

        @Override
        public String resolve(ResolutionContext ctx) {
            return logicalId.startsWith("AWS::") ? ctx.pseudo(logicalId) : ctx.attribute(logicalId, null);
        }
    }

    record GetAtt(String logicalId, String attribute) implements CfnValue {
        public GetAtt {
            Objects.requireNonNull(logicalId, "logicalId");
            Objects.requireNonNull(attribute, "attribute");
        }

        @Override public Object toTemplate() { return Map.of("Fn::GetAtt", List.of(logicalId, attribute)); }
        @Override public Set<String> references() { return Set.of(logicalId); }
        @Override public Set<String> imports() { return Set.of(); }
        @Override public String resolve(ResolutionContext ctx) { return ctx.attribute(logicalId, attribute); }
    }

    record ImportValue(String exportName) implements CfnValue {
        public ImportValue {
            Objects.requireNonNull(exportName, "exportName");
        }

        @Override public Object toTemplate() { return Map.of("Fn::ImportValue", exportName); }
        @Override public Set<String> references() { return Set.of(); }
        @Override public Set<String> imports() { return Set.of(exportName); }
        @Override public String resolve(ResolutionContext ctx) { return ctx.importedValue(exportName); }
    }

    /**
     * {@code Fn::Sub}. Placeholders are pseudo parameters ({@code ${AWS::Region}}), in-unit references
     * ({@code ${Logical}} / {@code ${Logical.Attr}}) or names bound in {@code variables}.
     */
    record Sub(String template, Map<String, CfnValue> variables) implements CfnValue {
        private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}!][^}]*)}");

        public Sub {
            Objects.requireNonNull(template, "template");
            variables = variables == null ? Map.of() : Map.copyOf(variables);
        }

        @Override
        public Object toTemplate() {
            if (variables.isEmpty()) {
                return Map.of("Fn::Sub", template);
            }
            Map<String, Object> vars = new LinkedHashMap<>();
            variables.keySet().stream().sorted().forEach(k -> vars.put(k, variables.get(k).toTemplate()));
            return Map.of("Fn::Sub", List.of(template, vars));
        }

        @Override
        public Set<String> references() {
            Set<String> out = new LinkedHashSet<>();
            for (String name : placeholders()) {
                if (name.startsWith("AWS::") || variables.containsKey(name)) {
                    continue;
                }
                int dot = name.indexOf('.');
                out.add(dot < 0 ? name : name.substring(0, dot));
            }
            variables.values().forEach(v -> out.addAll(v.references()));
            return out;
        }

        @Override
        public Set<String> imports() {
            Set<String> out = new LinkedHashSet<>();
            variables.values().forEach(v -> out.addAll(v.imports()));
            return out;
        }

        @Override
        public String resolve(ResolutionContext ctx) {
            Matcher m = PLACEHOLDER.matcher(template);
            StringBuilder sb = new StringBuilder();
            while (m.find()) {
                String name = m.group(1);
                String value;
                if (name.startsWith("AWS::")) {
                    value = ctx.pseudo(name);
                } else if (variables.containsKey(name)) {
                    value = variables.get(name).resolve(ctx);
                } else {
                    int dot = name.indexOf('.');
                    value = dot < 0
                            ? ctx.attribute(name, null)
                            : ctx.attribute(name.substring(0, dot), name.substring(dot + 1));
                }
                m.appendReplacement(sb, Matcher.quoteReplacement(value));
            }
            m.appendTail(sb);
            return sb.toString().replace("${!", "${");
        }

        private List<String> placeholders() {
            Matcher m = PLACEHOLDER.matcher(template);
            List<String> names = new ArrayList<>();
            while (m.find()) {
                names.add(m.group(1));
            }
            return names;
        }
    }
}
