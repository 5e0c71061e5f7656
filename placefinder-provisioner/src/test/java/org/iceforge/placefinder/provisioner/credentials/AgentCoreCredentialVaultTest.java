package org.iceforge.placefinder.provisioner.credentials;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.bedrockagentcorecontrol.BedrockAgentCoreControlClient;
import software.amazon.awssdk.services.bedrockagentcorecontrol.model.BedrockAgentCoreControlException;
import software.amazon.awssdk.services.bedrockagentcorecontrol.model.CreateOauth2CredentialProviderRequest;
import software.amazon.awssdk.services.bedrockagentcorecontrol.model.CreateOauth2CredentialProviderResponse;
import software.amazon.awssdk.services.bedrockagentcorecontrol.model.CustomOauth2ProviderConfigOutput;
import software.amazon.awssdk.services.bedrockagentcorecontrol.model.DeleteOauth2CredentialProviderRequest;
import software.amazon.awssdk.services.bedrockagentcorecontrol.model.GetOauth2CredentialProviderRequest;
import software.amazon.awssdk.services.bedrockagentcorecontrol.model.GetOauth2CredentialProviderResponse;
import software.amazon.awssdk.services.bedrockagentcorecontrol.model.Oauth2Discovery;
import software.amazon.awssdk.services.bedrockagentcorecontrol.model.Oauth2ProviderConfigOutput;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AgentCoreCredentialVaultTest {

    private final BedrockAgentCoreControlClient control = Mockito.mock(BedrockAgentCoreControlClient.class);
    private final AgentCoreCredentialVault vault = new AgentCoreCredentialVault(control);
    private final OAuth2ClientCredentials creds = new OAuth2ClientCredentials("client-1", "s3cr3t");

    private static BedrockAgentCoreControlException error(int status, String message) {
        return (BedrockAgentCoreControlException) BedrockAgentCoreControlException.builder()
                .statusCode(status)
                .awsErrorDetails(AwsErrorDetails.builder().errorMessage(message).build())
                .build();
    }

    @Test
    void create_sendsCustomOAuth2Configuration() {
        when(control.createOauth2CredentialProvider(any(CreateOauth2CredentialProviderRequest.class)))
                .thenReturn(CreateOauth2CredentialProviderResponse.builder().name("p").credentialProviderArn("arn:p").build());

        CredentialProviderHandle handle = vault.create("p", "https://issuer/.well-known/openid-configuration", creds);

        ArgumentCaptor<CreateOauth2CredentialProviderRequest> captor =
                ArgumentCaptor.forClass(CreateOauth2CredentialProviderRequest.class);
        verify(control).createOauth2CredentialProvider(captor.capture());
        CreateOauth2CredentialProviderRequest sent = captor.getValue();
        assertEquals("arn:p", handle.arn());
        assertEquals("p", sent.name());
        assertEquals(AgentCoreCredentialVault.CUSTOM_OAUTH2_VENDOR, sent.credentialProviderVendorAsString());
        assertEquals("client-1", sent.oauth2ProviderConfigInput().customOauth2ProviderConfig().clientId());
        assertEquals("https://issuer/.well-known/openid-configuration",
                sent.oauth2ProviderConfigInput().customOauth2ProviderConfig().oauthDiscovery().discoveryUrl());
    }

    @Test
    void create_conflictIsClassified() {
        when(control.createOauth2CredentialProvider(any(CreateOauth2CredentialProviderRequest.class)))
                .thenThrow(error(409, "Provider exists"));

        ProviderAlreadyExistsException ex = assertThrows(ProviderAlreadyExistsException.class,
                () -> vault.create("p", "https://x", creds));
        assertEquals("p", ex.providerName());
    }

    @Test
    void create_validationSayingAlreadyExistsIsAConflict() {
        when(control.createOauth2CredentialProvider(any(CreateOauth2CredentialProviderRequest.class)))
                .thenThrow(error(400, "Credential provider with name: p already exists"));

        assertThrows(ProviderAlreadyExistsException.class, () -> vault.create("p", "https://x", creds));
    }

    @Test
    void create_otherErrorsCarryTheRemoteMessage() {
        when(control.createOauth2CredentialProvider(any(CreateOauth2CredentialProviderRequest.class)))
                .thenThrow(error(403, "not authorized to perform CreateOauth2CredentialProvider"));

        RemoteProvisioningException ex = assertThrows(RemoteProvisioningException.class,
                () -> vault.create("p", "https://x", creds));
        assertFalse(ex instanceof ProviderAlreadyExistsException);
        assertTrue(ex.getMessage().contains("not authorized"));
        assertFalse(ex.getMessage().contains("s3cr3t"));
    }

    @Test
    void create_clientSideFailureIsFatal() {
        when(control.createOauth2CredentialProvider(any(CreateOauth2CredentialProviderRequest.class)))
                .thenThrow(SdkClientException.create("Unable to execute HTTP request"));

        RemoteProvisioningException ex = assertThrows(RemoteProvisioningException.class,
                () -> vault.create("p", "https://x", creds));
        assertEquals("CreateOauth2CredentialProvider", ex.operation());
    }

    @Test
    void find_notFoundIsEmpty() {
        when(control.getOauth2CredentialProvider(any(GetOauth2CredentialProviderRequest.class)))
                .thenThrow(error(404, "not found"));

        assertEquals(Optional.empty(), vault.find("p"));
    }

    @Test
    void find_returnsArnWithoutConfig() {
        when(control.getOauth2CredentialProvider(any(GetOauth2CredentialProviderRequest.class)))
                .thenReturn(GetOauth2CredentialProviderResponse.builder().name("p").credentialProviderArn("arn:p").build());

        assertEquals(Optional.of(new RegisteredProvider(new CredentialProviderHandle("p", "arn:p"), null, null)),
                vault.find("p"));
    }

    @Test
    void find_reportsDiscoveryUrlAndClient() {
        when(control.getOauth2CredentialProvider(any(GetOauth2CredentialProviderRequest.class)))
                .thenReturn(GetOauth2CredentialProviderResponse.builder()
                        .name("p")
                        .credentialProviderArn("arn:p")
                        .oauth2ProviderConfigOutput(Oauth2ProviderConfigOutput.builder()
                                .customOauth2ProviderConfig(CustomOauth2ProviderConfigOutput.builder()
                                        .clientId("client-1")
                                        .oauthDiscovery(Oauth2Discovery.builder().discoveryUrl("https://issuer/d").build())
                                        .build())
                                .build())
                        .build());

        RegisteredProvider found = vault.find("p").orElseThrow();
        assertEquals("client-1", found.clientId());
        assertEquals("https://issuer/d", found.discoveryUrl());
        assertEquals("arn:p", found.arn());
    }

    @Test
    void delete_notFoundIsClassified() {
        when(control.deleteOauth2CredentialProvider(any(DeleteOauth2CredentialProviderRequest.class)))
                .thenThrow(error(404, "missing"));

        assertThrows(ProviderNotFoundException.class, () -> vault.delete("p"));
    }

    @Test
    void delete_throttlingIsFatal() {
        when(control.deleteOauth2CredentialProvider(any(DeleteOauth2CredentialProviderRequest.class)))
                .thenThrow(error(429, "Rate exceeded"));

        RemoteProvisioningException ex = assertThrows(RemoteProvisioningException.class, () -> vault.delete("p"));
        assertFalse(ex instanceof ProviderNotFoundException);
    }
}
