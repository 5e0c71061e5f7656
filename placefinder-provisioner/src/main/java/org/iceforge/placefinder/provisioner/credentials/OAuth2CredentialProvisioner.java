package org.iceforge.placefinder.provisioner.credentials;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Registers, re-validates and removes the OAuth2 client-credentials provider for an identity pool client.
 * <p>
 * Every operation is safe to repeat; the engine may deliver the same event more than once.
 * <ul>
 *   <li>create: a name conflict adopts the registered provider if it has the same discovery URL and client,
 *   and fails otherwise</li>
 *   <li>update, same name and client: re-validated; if it vanished it is created again</li>
 *   <li>update, same name but a different pool or client: replaced in place</li>
 *   <li>update, new name: a new provider is created; the engine deletes the old one afterwards</li>
 *   <li>delete: a missing provider counts as deleted</li>
 * </ul>
 * The client secret goes straight from the directory to the vault and is never logged.
 */
public class OAuth2CredentialProvisioner {
    private static final Logger log = LoggerFactory.getLogger(OAuth2CredentialProvisioner.class);

    private final CredentialVault vault;
    private final IdentityPoolDirectory directory;

    public OAuth2CredentialProvisioner(CredentialVault vault, IdentityPoolDirectory directory) {
        this.vault = Objects.requireNonNull(vault);
        this.directory = Objects.requireNonNull(directory);
    }

    public ProvisioningResult create(CredentialProviderRequest req) {
        ProviderLifecycle lifecycle = new ProviderLifecycle(req.providerName(), ProviderState.ABSENT);
        CredentialProviderHandle handle = register(req, lifecycle);
        return new ProvisioningResult(Optional.of(handle), lifecycle.history());
    }

    public ProvisioningResult update(CredentialProviderRequest req, CredentialProviderRequest previous) {
        if (previous == null || !previous.providerName().equals(req.providerName())) {
            log.info("Provider renamed from '{}' to '{}'; registering the new one",
                    previous == null ? "<unknown>" : previous.providerName(), req.providerName());
            return create(req);
        }

        Optional<RegisteredProvider> existing = vault.find(req.providerName());
        if (existing.isEmpty()) {
            log.warn("Provider '{}' is missing from the token vault; creating it again", req.providerName());
            return create(req);
        }

        ProviderLifecycle lifecycle = new ProviderLifecycle(req.providerName(), ProviderState.PRESENT);
        List<String> drift = existing.get().mismatches(req);
        if (req.sameIdentity(previous) && drift.isEmpty()) {
            log.info("Provider '{}' present, arn={}", req.providerName(), existing.get().arn());
            return new ProvisioningResult(Optional.of(existing.get().handle()), lifecycle.history());
        }

        if (drift.isEmpty()) {
            log.info("Provider '{}' now targets pool {} client {}; replacing it",
                    req.providerName(), req.userPoolId(), req.clientId());
        } else {
            log.warn("Provider '{}' registered with {}; replacing it", req.providerName(), drift);
        }
        // read the new secret before removing anything
        OAuth2ClientCredentials credentials = directory.clientCredentials(req.userPoolId(), req.clientId());
        lifecycle.moveTo(ProviderState.DELETING);
        deleteQuietly(req.providerName());
        lifecycle.moveTo(ProviderState.ABSENT);
        lifecycle.moveTo(ProviderState.CREATING);
        CredentialProviderHandle handle = createOrAdopt(req, credentials);
        lifecycle.moveTo(ProviderState.PRESENT);
        return new ProvisioningResult(Optional.of(handle), lifecycle.history());
    }

    public ProvisioningResult delete(CredentialProviderRequest req) {
        ProviderLifecycle lifecycle = new ProviderLifecycle(req.providerName(), ProviderState.PRESENT);
        lifecycle.moveTo(ProviderState.DELETING);
        deleteQuietly(req.providerName());
        lifecycle.moveTo(ProviderState.ABSENT);
        return new ProvisioningResult(Optional.empty(), lifecycle.history());
    }

    private CredentialProviderHandle register(CredentialProviderRequest req, ProviderLifecycle lifecycle) {
        OAuth2ClientCredentials credentials = directory.clientCredentials(req.userPoolId(), req.clientId());
        lifecycle.moveTo(ProviderState.CREATING);
        CredentialProviderHandle handle = createOrAdopt(req, credentials);
        lifecycle.moveTo(ProviderState.PRESENT);
        return handle;
    }

    private CredentialProviderHandle createOrAdopt(CredentialProviderRequest req, OAuth2ClientCredentials credentials) {
        try {
            return vault.create(req.providerName(), req.discoveryUrl(), credentials);
        } catch (ProviderAlreadyExistsException e) {
            RegisteredProvider adopted = vault.find(req.providerName()).orElseThrow(() ->
                    new RemoteProvisioningException("GetOauth2CredentialProvider",
                            "provider '" + req.providerName() + "' reported as existing but cannot be read", e));
            List<String> mismatches = adopted.mismatches(req);
            if (!mismatches.isEmpty()) {
                throw new RemoteProvisioningException("CreateOauth2CredentialProvider",
                        "provider '" + req.providerName() + "' already exists with " + String.join(", ", mismatches), e);
            }
            log.info("Provider '{}' already registered; adopting arn={}", req.providerName(), adopted.arn());
            return adopted.handle();
        }
    }

    private void deleteQuietly(String name) {
        try {
            vault.delete(name);
        } catch (ProviderNotFoundException e) {
            log.info("Provider '{}' already absent", name);
        }
    }
}
