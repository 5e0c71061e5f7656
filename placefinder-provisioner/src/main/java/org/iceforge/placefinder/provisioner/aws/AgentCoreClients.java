package org.iceforge.placefinder.provisioner.aws;

import org.iceforge.placefinder.provisioner.credentials.AgentCoreCredentialVault;
import org.iceforge.placefinder.provisioner.credentials.CognitoIdentityPoolDirectory;
import org.iceforge.placefinder.provisioner.credentials.OAuth2CredentialProvisioner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.bedrockagentcorecontrol.BedrockAgentCoreControlClient;
import software.amazon.awssdk.services.bedrockagentcorecontrol.BedrockAgentCoreControlClientBuilder;
import software.amazon.awssdk.services.cognitoidentityprovider.CognitoIdentityProviderClient;
import software.amazon.awssdk.services.cognitoidentityprovider.CognitoIdentityProviderClientBuilder;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds the AgentCore control and Cognito clients for one region and keeps one provisioner per region
 * for the life of the function container.
 * <p>
 * Credentials come from the standard SDK chain (the function's execution role); HTTP goes through the
 * Apache client.
 */
public class AgentCoreClients {

    private static final Logger log = LoggerFactory.getLogger(AgentCoreClients.class);

    private final ProvisionerClientConfig config;
    private final Map<String, OAuth2CredentialProvisioner> provisioners = new ConcurrentHashMap<>();

    public AgentCoreClients(ProvisionerClientConfig config) {
        this.config = Objects.requireNonNull(config);
    }

    public OAuth2CredentialProvisioner provisioner(String region) {
        return provisioners.computeIfAbsent(region, r -> {
            log.info("Creating AWS clients for region {} (agentcore endpoint={}, cognito endpoint={}, timeout={})",
                    r, orDefault(config.getAgentCoreEndpoint()), orDefault(config.getCognitoEndpoint()),
                    orDefault(config.getApiTimeout()));
            return new OAuth2CredentialProvisioner(
                    new AgentCoreCredentialVault(control(r)),
                    new CognitoIdentityPoolDirectory(cognito(r)));
        });
    }

    BedrockAgentCoreControlClient control(String region) {
        BedrockAgentCoreControlClientBuilder b = BedrockAgentCoreControlClient.builder()
                .httpClientBuilder(ApacheHttpClient.builder())
                .region(Region.of(region));
        if (config.getAgentCoreEndpoint() != null) {
            b.endpointOverride(config.getAgentCoreEndpoint());
        }
        if (config.getApiTimeout() != null) {
            b.overrideConfiguration(timeout());
        }
        return b.build();
    }

    CognitoIdentityProviderClient cognito(String region) {
        CognitoIdentityProviderClientBuilder b = CognitoIdentityProviderClient.builder()
                .httpClientBuilder(ApacheHttpClient.builder())
                .region(Region.of(region));
        if (config.getCognitoEndpoint() != null) {
            b.endpointOverride(config.getCognitoEndpoint());
        }
        if (config.getApiTimeout() != null) {
            b.overrideConfiguration(timeout());
        }
        return b.build();
    }

    private ClientOverrideConfiguration timeout() {
        return ClientOverrideConfiguration.builder().apiCallTimeout(config.getApiTimeout()).build();
    }

    private static Object orDefault(Object v) {
        return v == null ? "<default>" : v;
    }
}
