package org.iceforge.placefinder.provisioner.credentials;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of the credential provider as seen by one invocation of the step.
 * <pre>
 * ABSENT -> CREATING -> PRESENT -> DELETING -> ABSENT
 * </pre>
 * An invocation starts in PRESENT when it operates on a provider that is already registered.
 */
public enum ProviderState {
    ABSENT,
    CREATING,
    PRESENT,
    DELETING;

    public Set<ProviderState> next() {
        return switch (this) {
            case ABSENT -> EnumSet.of(CREATING);
            case CREATING -> EnumSet.of(PRESENT);
            case PRESENT -> EnumSet.of(DELETING);
            case DELETING -> EnumSet.of(ABSENT);
        };
    }
}
