package org.iceforge.placefinder.model;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A named extraction policy over conversational data, scoped by namespace templates such as
 * {@code /preferences/{actorId}/}.
 */
public record MemoryStrategy(StrategyKind kind, String name, List<String> namespaces) {

    public enum StrategyKind {
        USER_PREFERENCE("UserPreferenceMemoryStrategy"),
        SEMANTIC("SemanticMemoryStrategy"),
        SUMMARIZATION("SummaryMemoryStrategy");

        private final String templateKey;

        StrategyKind(String templateKey) {
            this.templateKey = templateKey;
        }

        public String templateKey() {
            return templateKey;
        }
    }

    public static final Set<String> PLACEHOLDERS = Set.of("actorId", "sessionId", "strategyId");

    private static final Pattern TOKEN = Pattern.compile("\\{([^{}]*)}");
    private static final Pattern NAME = Pattern.compile("^[A-Za-z][A-Za-z0-9_]{0,47}$");

    public MemoryStrategy {
        Objects.requireNonNull(kind, "kind");
        if (name == null || !NAME.matcher(name).matches()) {
            throw new DeploymentConfigurationException("memoryStrategy.name", "invalid strategy name '" + name + "'");
        }
        if (namespaces == null || namespaces.isEmpty()) {
            throw new DeploymentConfigurationException("memoryStrategy.namespaces", "strategy " + name + " needs a namespace");
        }
        namespaces = List.copyOf(namespaces);
        for (String ns : namespaces) {
            checkNamespace(name, ns);
        }
    }

    public static MemoryStrategy userPreference(String name, String... namespaces) {
        return new MemoryStrategy(StrategyKind.USER_PREFERENCE, name, List.of(namespaces));
    }

    public static MemoryStrategy semantic(String name, String... namespaces) {
        return new MemoryStrategy(StrategyKind.SEMANTIC, name, List.of(namespaces));
    }

    public static MemoryStrategy summarization(String name, String... namespaces) {
        return new MemoryStrategy(StrategyKind.SUMMARIZATION, name, List.of(namespaces));
    }

    private static void checkNamespace(String strategy, String ns) {
        if (ns == null || !ns.startsWith("/")) {
            throw new DeploymentConfigurationException("memoryStrategy.namespaces",
                    "namespace '" + ns + "' of " + strategy + " must start with /");
        }
        Matcher m = TOKEN.matcher(ns);
        while (m.find()) {
            if (!PLACEHOLDERS.contains(m.group(1))) {
                throw new DeploymentConfigurationException("memoryStrategy.namespaces",
                        "unknown placeholder {" + m.group(1) + "} in " + ns + "; allowed " + PLACEHOLDERS);
            }
        }
        String stripped = TOKEN.matcher(ns).replaceAll("");
        if (stripped.indexOf('{') >= 0 || stripped.indexOf('}') >= 0) {
            throw new DeploymentConfigurationException("memoryStrategy.namespaces", "unbalanced braces in " + ns);
        }
    }
}
