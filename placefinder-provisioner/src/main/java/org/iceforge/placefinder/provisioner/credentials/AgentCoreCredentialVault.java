package org.iceforge.placefinder.provisioner.credentials;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.bedrockagentcorecontrol.BedrockAgentCoreControlClient;
import software.amazon.awssdk.services.bedrockagentcorecontrol.model.CreateOauth2CredentialProviderRequest;
import software.amazon.awssdk.services.bedrockagentcorecontrol.model.CreateOauth2CredentialProviderResponse;
import software.amazon.awssdk.services.bedrockagentcorecontrol.model.CustomOauth2ProviderConfigInput;
import software.amazon.awssdk.services.bedrockagentcorecontrol.model.CustomOauth2ProviderConfigOutput;
import software.amazon.awssdk.services.bedrockagentcorecontrol.model.DeleteOauth2CredentialProviderRequest;
import software.amazon.awssdk.services.bedrockagentcorecontrol.model.GetOauth2CredentialProviderRequest;
import software.amazon.awssdk.services.bedrockagentcorecontrol.model.GetOauth2CredentialProviderResponse;
import software.amazon.awssdk.services.bedrockagentcorecontrol.model.Oauth2Discovery;
import software.amazon.awssdk.services.bedrockagentcorecontrol.model.Oauth2ProviderConfigInput;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Token vault backed by the AgentCore control plane.
 * <p>
 * Remote errors are classified by HTTP status: 409 (and a 400 saying "already exists") is a conflict,
 * 404 is not-found, anything else is fatal.
 */
public class AgentCoreCredentialVault implements CredentialVault {

    private static final Logger log = LoggerFactory.getLogger(AgentCoreCredentialVault.class);

    public static final String CUSTOM_OAUTH2_VENDOR = "CustomOauth2";

    private final BedrockAgentCoreControlClient control;

    public AgentCoreCredentialVault(BedrockAgentCoreControlClient control) {
        this.control = Objects.requireNonNull(control);
    }

    @Override
    public CredentialProviderHandle create(String name, String discoveryUrl, OAuth2ClientCredentials credentials) {
        CreateOauth2CredentialProviderRequest req = CreateOauth2CredentialProviderRequest.builder()
                .name(name)
                .credentialProviderVendor(CUSTOM_OAUTH2_VENDOR)
                .oauth2ProviderConfigInput(Oauth2ProviderConfigInput.builder()
                        .customOauth2ProviderConfig(CustomOauth2ProviderConfigInput.builder()
                                .oauthDiscovery(Oauth2Discovery.builder().discoveryUrl(discoveryUrl).build())
                                .clientId(credentials.clientId())
                                .clientSecret(credentials.clientSecret())
                                .build())
                        .build())
                .build();
        try {
            CreateOauth2CredentialProviderResponse resp = control.createOauth2CredentialProvider(req);
            log.info("Created OAuth2 credential provider name='{}' arn={}", name, resp.credentialProviderArn());
            return new CredentialProviderHandle(name, resp.credentialProviderArn());
        } catch (AwsServiceException e) {
            if (isConflict(e)) {
                throw new ProviderAlreadyExistsException(name, e);
            }
            throw remote("CreateOauth2CredentialProvider", e);
        } catch (SdkException e) {
            throw remote("CreateOauth2CredentialProvider", e);
        }
    }

    @Override
    public Optional<RegisteredProvider> find(String name) {
        try {
            GetOauth2CredentialProviderResponse resp = control.getOauth2CredentialProvider(
                    GetOauth2CredentialProviderRequest.builder().name(name).build());
            String discoveryUrl = null;
            String clientId = null;
            if (resp.oauth2ProviderConfigOutput() != null
                    && resp.oauth2ProviderConfigOutput().customOauth2ProviderConfig() != null) {
                CustomOauth2ProviderConfigOutput custom = resp.oauth2ProviderConfigOutput().customOauth2ProviderConfig();
                clientId = custom.clientId();
                if (custom.oauthDiscovery() != null) {
                    discoveryUrl = custom.oauthDiscovery().discoveryUrl();
                }
            }
            return Optional.of(new RegisteredProvider(
                    new CredentialProviderHandle(name, resp.credentialProviderArn()), discoveryUrl, clientId));
        } catch (AwsServiceException e) {
            if (e.statusCode() == 404) {
                return Optional.empty();
            }
            throw remote("GetOauth2CredentialProvider", e);
        } catch (SdkException e) {
            throw remote("GetOauth2CredentialProvider", e);
        }
    }

    @Override
    public void delete(String name) {
        try {
            control.deleteOauth2CredentialProvider(DeleteOauth2CredentialProviderRequest.builder().name(name).build());
            log.info("Deleted OAuth2 credential provider name='{}'", name);
        } catch (AwsServiceException e) {
            if (e.statusCode() == 404) {
                throw new ProviderNotFoundException("DeleteOauth2CredentialProvider", name, e);
            }
            throw remote("DeleteOauth2CredentialProvider", e);
        } catch (SdkException e) {
            throw remote("DeleteOauth2CredentialProvider", e);
        }
    }

    static boolean isConflict(AwsServiceException e) {
        if (e.statusCode() == 409) {
            return true;
        }
        String msg = message(e);
        return e.statusCode() == 400 && msg.toLowerCase(Locale.ROOT).contains("already exists");
    }

    private static RemoteProvisioningException remote(String operation, SdkException e) {
        return new RemoteProvisioningException(operation, message(e), e);
    }

    private static String message(SdkException e) {
        if (e instanceof AwsServiceException ase && ase.awsErrorDetails() != null
                && ase.awsErrorDetails().errorMessage() != null) {
            return ase.awsErrorDetails().errorMessage();
        }
        return String.valueOf(e.getMessage());
    }
}
