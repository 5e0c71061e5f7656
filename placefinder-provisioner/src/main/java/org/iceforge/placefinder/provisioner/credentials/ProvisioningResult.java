package org.iceforge.placefinder.provisioner.credentials;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of one step invocation: the provider (absent after a delete) and the states it went through.
 */
public record ProvisioningResult(Optional<CredentialProviderHandle> provider, List<ProviderState> transitions) {

    public ProvisioningResult {
        provider = provider == null ? Optional.empty() : provider;
        transitions = List.copyOf(transitions);
    }

    public ProviderState finalState() {
        return transitions.get(transitions.size() - 1);
    }

    public CredentialProviderHandle requireProvider() {
        return provider.orElseThrow(() -> new IllegalStateException("no provider after " + transitions));
    }
}
