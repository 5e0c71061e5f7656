package org.iceforge.placefinder.provisioner.credentials;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/** Records and checks the state transitions of one provider during one step invocation. */
public final class ProviderLifecycle {
    private static final Logger log = LoggerFactory.getLogger(ProviderLifecycle.class);

    private final String providerName;
    private final List<ProviderState> history = new ArrayList<>();

    ProviderLifecycle(String providerName, ProviderState initial) {
        this.providerName = providerName;
        history.add(initial);
    }

    public ProviderState current() {
        return history.get(history.size() - 1);
    }

    public List<ProviderState> history() {
        return List.copyOf(history);
    }

    void moveTo(ProviderState target) {
        ProviderState from = current();
        if (!from.next().contains(target)) {
            throw new IllegalStateException("Provider '" + providerName + "' cannot go from " + from + " to " + target);
        }
        history.add(target);
        log.debug("Provider '{}': {} -> {}", providerName, from, target);
    }
}
