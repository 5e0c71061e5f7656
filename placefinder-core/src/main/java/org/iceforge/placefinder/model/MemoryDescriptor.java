package org.iceforge.placefinder.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Long-term memory attached to the runtime. Strategy order is preserved; strategy names are unique.
 */
public record MemoryDescriptor(
        String name,
        String description,
        List<MemoryStrategy> strategies,
        int eventExpiryDays
) {
    public static final int DEFAULT_EVENT_EXPIRY_DAYS = 90;

    private static final Pattern NAME = Pattern.compile("^[A-Za-z][A-Za-z0-9_]{0,47}$");

    public MemoryDescriptor {
        if (name == null || !NAME.matcher(name).matches()) {
            throw new DeploymentConfigurationException("memory.name", "invalid memory name '" + name + "'");
        }
        strategies = strategies == null ? List.of() : List.copyOf(strategies);
        Set<String> seen = new HashSet<>();
        for (MemoryStrategy s : strategies) {
            if (!seen.add(s.name())) {
                throw new DeploymentConfigurationException("memory.strategies",
                        "duplicate strategy name '" + s.name() + "' in " + name);
            }
        }
        if (eventExpiryDays < 7 || eventExpiryDays > 365) {
            throw new DeploymentConfigurationException("memory.eventExpiryDays", "must be between 7 and 365");
        }
    }
}
