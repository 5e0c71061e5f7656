package org.iceforge.placefinder.provisioner.cfn;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestStreamHandler;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.placefinder.model.DeploymentConfigurationException;
import org.iceforge.placefinder.provisioner.aws.AgentCoreClients;
import org.iceforge.placefinder.provisioner.aws.ProvisionerClientConfig;
import org.iceforge.placefinder.provisioner.credentials.CredentialProviderHandle;
import org.iceforge.placefinder.provisioner.credentials.CredentialProviderRequest;
import org.iceforge.placefinder.provisioner.credentials.OAuth2CredentialProvisioner;
import org.iceforge.placefinder.provisioner.credentials.ProvisioningResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Lambda entry point of the {@code Custom::OAuth2CredentialProvider} resource.
 * <p>
 * Every request ends with exactly one response upload: SUCCESS with {@code credentialProviderArn} and
 * {@code scope}, or FAILED with the error message. The physical id is the provider ARN.
 */
public class OAuth2ProviderHandler implements RequestStreamHandler {

    private static final Logger log = LoggerFactory.getLogger(OAuth2ProviderHandler.class);

    public static final String ATTR_PROVIDER_ARN = "credentialProviderArn";
    public static final String ATTR_SCOPE = "scope";

    private final ObjectMapper mapper;
    private final Function<String, OAuth2CredentialProvisioner> provisionerForRegion;
    private final CustomResourceResponder responder;

    /** Used by the Lambda runtime: clients configured from the function environment. */
    public OAuth2ProviderHandler() {
        this(defaultMapper(), new AgentCoreClients(ProvisionerClientConfig.fromEnvironment(System.getenv()))::provisioner,
                new HttpCustomResourceResponder(HttpClient.newHttpClient(), defaultMapper(), Duration.ofSeconds(30)));
    }

    public OAuth2ProviderHandler(ObjectMapper mapper,
                                 Function<String, OAuth2CredentialProvisioner> provisionerForRegion,
                                 CustomResourceResponder responder) {
        this.mapper = Objects.requireNonNull(mapper);
        this.provisionerForRegion = Objects.requireNonNull(provisionerForRegion);
        this.responder = Objects.requireNonNull(responder);
    }

    @Override
    public void handleRequest(InputStream input, OutputStream output, Context context) throws IOException {
        CustomResourceEvent event = mapper.readValue(input, CustomResourceEvent.class);
        CustomResourceResponse response = handle(event, fallbackPhysicalId(context));
        responder.send(event.responseUrl(), response);
        output.write(response.status().getBytes(StandardCharsets.UTF_8));
    }

    /** Run the request and build its response; never throws for failures of the step itself. */
    CustomResourceResponse handle(CustomResourceEvent event, String fallbackPhysicalId) {
        String physicalId = event.physicalResourceId() != null ? event.physicalResourceId() : fallbackPhysicalId;
        log.info("{} {} ({}) physicalId={}", event.requestType(), event.logicalResourceId(), event.resourceType(), physicalId);
        try {
            CredentialProviderRequest req;
            try {
                req = CredentialProviderRequest.fromProperties(event.resourceProperties());
            } catch (DeploymentConfigurationException e) {
                if (event.type() == CustomResourceEvent.RequestType.DELETE) {
                    // a create rejected for its inputs never registered anything
                    log.warn("Delete of {} with invalid properties ({}); nothing to remove",
                            event.logicalResourceId(), e.getMessage());
                    return CustomResourceResponse.success(event, physicalId, "Nothing to delete", Map.of());
                }
                throw e;
            }
            OAuth2CredentialProvisioner provisioner = provisionerForRegion.apply(req.region());

            ProvisioningResult result = switch (event.type()) {
                case CREATE -> provisioner.create(req);
                case UPDATE -> provisioner.update(req, previous(event));
                case DELETE -> provisioner.delete(req);
            };
            log.info("{} {} finished in state {} via {}", event.requestType(), req.providerName(),
                    result.finalState(), result.transitions());

            if (result.provider().isEmpty()) {
                return CustomResourceResponse.success(event, physicalId, "Deleted " + req.providerName(), Map.of());
            }
            CredentialProviderHandle handle = result.requireProvider();
            Map<String, String> data = new LinkedHashMap<>();
            data.put(ATTR_PROVIDER_ARN, handle.arn());
            data.put(ATTR_SCOPE, req.scope());
            return CustomResourceResponse.success(event, handle.arn(), "Provider " + handle.name() + " ready", data);
        } catch (RuntimeException e) {
            log.error("{} {} failed", event.requestType(), event.logicalResourceId(), e);
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return CustomResourceResponse.failed(event, physicalId, reason);
        }
    }

    private static CredentialProviderRequest previous(CustomResourceEvent event) {
        if (event.oldResourceProperties() == null) {
            return null;
        }
        try {
            return CredentialProviderRequest.fromProperties(event.oldResourceProperties());
        } catch (DeploymentConfigurationException e) {
            log.warn("Ignoring unreadable previous properties of {}: {}", event.logicalResourceId(), e.getMessage());
            return null;
        }
    }

    private static String fallbackPhysicalId(Context context) {
        return context != null && context.getLogStreamName() != null ? context.getLogStreamName() : "oauth2-provider-pending";
    }

    static ObjectMapper defaultMapper() {
        return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
}
