package org.iceforge.placefinder.provisioner.cfn;

import com.amazonaws.services.lambda.runtime.Context;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.placefinder.provisioner.credentials.CredentialProviderHandle;
import org.iceforge.placefinder.provisioner.credentials.CredentialProviderRequest;
import org.iceforge.placefinder.provisioner.credentials.OAuth2CredentialProvisioner;
import org.iceforge.placefinder.provisioner.credentials.ProviderState;
import org.iceforge.placefinder.provisioner.credentials.ProvisioningResult;
import org.iceforge.placefinder.provisioner.credentials.RemoteProvisioningException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class OAuth2ProviderHandlerTest {

    private static final String ARN =
            "arn:aws:bedrock-agentcore:us-east-2:123456789012:token-vault/default/oauth2credentialprovider/placeFinder-cognito-oauth";
    private static final String RESPONSE_URL = "https://cloudformation-custom-resource-response-useast2.s3.amazonaws.com/x?sig=1";

    OAuth2CredentialProvisioner provisioner;
    CustomResourceResponder responder;
    Context context;
    OAuth2ProviderHandler handler;

    @BeforeEach
    void setUp() {
        provisioner = mock(OAuth2CredentialProvisioner.class);
        responder = mock(CustomResourceResponder.class);
        context = mock(Context.class);
        when(context.getLogStreamName()).thenReturn("2025/01/01/[$LATEST]abc");
        handler = new OAuth2ProviderHandler(new ObjectMapper(), region -> provisioner, responder);
    }

    private static String event(String type, String physicalId, String clientId) {
        String physical = physicalId == null ? "" : "\"PhysicalResourceId\":\"" + physicalId + "\",";
        String client = clientId == null ? "" : "\"ClientId\":\"" + clientId + "\",";
        return "{\"RequestType\":\"" + type + "\","
                + "\"ResponseURL\":\"" + RESPONSE_URL + "\","
                + "\"StackId\":\"arn:aws:cloudformation:us-east-2:123456789012:stack/placeFinder-CredentialStack/1\","
                + "\"RequestId\":\"req-1\","
                + "\"ResourceType\":\"Custom::OAuth2CredentialProvider\","
                + "\"LogicalResourceId\":\"OAuth2CredentialProvider\","
                + physical
                + "\"ResourceProperties\":{\"ServiceToken\":\"arn:fn\",\"ProviderName\":\"placeFinder-cognito-oauth\","
                + "\"UserPoolId\":\"us-east-2_AbCdEf\"," + client
                + "\"Region\":\"us-east-2\",\"Scope\":\"placeFinder-api/mcp\"},"
                + "\"OldResourceProperties\":{\"ProviderName\":\"placeFinder-cognito-oauth\",\"UserPoolId\":\"us-east-2_AbCdEf\","
                + "\"ClientId\":\"client-1\",\"Region\":\"us-east-2\",\"Scope\":\"placeFinder-api/mcp\"}}";
    }

    private CustomResourceResponse run(String json) throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        handler.handleRequest(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), out, context);
        ArgumentCaptor<CustomResourceResponse> captor = ArgumentCaptor.forClass(CustomResourceResponse.class);
        verify(responder).send(eq(RESPONSE_URL), captor.capture());
        assertThat(out.toString(StandardCharsets.UTF_8)).isEqualTo(captor.getValue().status());
        return captor.getValue();
    }

    @Test
    void create_respondsWithArnAsPhysicalIdAndData() throws Exception {
        when(provisioner.create(any())).thenReturn(new ProvisioningResult(
                Optional.of(new CredentialProviderHandle("placeFinder-cognito-oauth", ARN)),
                List.of(ProviderState.ABSENT, ProviderState.CREATING, ProviderState.PRESENT)));

        CustomResourceResponse resp = run(event("Create", null, "client-1"));

        assertThat(resp.status()).isEqualTo(CustomResourceResponse.SUCCESS);
        assertThat(resp.physicalResourceId()).isEqualTo(ARN);
        assertThat(resp.data())
                .containsEntry(OAuth2ProviderHandler.ATTR_PROVIDER_ARN, ARN)
                .containsEntry(OAuth2ProviderHandler.ATTR_SCOPE, "placeFinder-api/mcp");
        assertThat(resp.requestId()).isEqualTo("req-1");
        assertThat(resp.logicalResourceId()).isEqualTo("OAuth2CredentialProvider");
    }

    @Test
    void create_missingClientId_failsWithoutRemoteCalls() throws Exception {
        CustomResourceResponse resp = run(event("Create", null, null));

        assertThat(resp.status()).isEqualTo(CustomResourceResponse.FAILED);
        assertThat(resp.reason()).contains("ClientId");
        assertThat(resp.physicalResourceId()).isEqualTo("2025/01/01/[$LATEST]abc");
        verifyNoInteractions(provisioner);
    }

    @Test
    void remoteFailure_becomesFailedResponseWithMessage() throws Exception {
        when(provisioner.create(any())).thenThrow(
                new RemoteProvisioningException("CreateOauth2CredentialProvider", "Rate exceeded"));

        CustomResourceResponse resp = run(event("Create", null, "client-1"));

        assertThat(resp.status()).isEqualTo(CustomResourceResponse.FAILED);
        assertThat(resp.reason()).isEqualTo("CreateOauth2CredentialProvider failed: Rate exceeded");
    }

    @Test
    void update_passesPreviousProperties() throws Exception {
        when(provisioner.update(any(), any())).thenReturn(new ProvisioningResult(
                Optional.of(new CredentialProviderHandle("placeFinder-cognito-oauth", ARN)), List.of(ProviderState.PRESENT)));

        CustomResourceResponse resp = run(event("Update", ARN, "client-1"));

        ArgumentCaptor<CredentialProviderRequest> previous = ArgumentCaptor.forClass(CredentialProviderRequest.class);
        verify(provisioner).update(any(), previous.capture());
        assertThat(previous.getValue().clientId()).isEqualTo("client-1");
        assertThat(resp.physicalResourceId()).isEqualTo(ARN);
    }

    @Test
    void delete_keepsPhysicalIdAndSucceeds() throws Exception {
        when(provisioner.delete(any())).thenReturn(new ProvisioningResult(Optional.empty(),
                List.of(ProviderState.PRESENT, ProviderState.DELETING, ProviderState.ABSENT)));

        CustomResourceResponse resp = run(event("Delete", ARN, "client-1"));

        assertThat(resp.status()).isEqualTo(CustomResourceResponse.SUCCESS);
        assertThat(resp.physicalResourceId()).isEqualTo(ARN);
        assertThat(resp.data()).isEmpty();
    }

    @Test
    void delete_afterRejectedCreate_succeedsWithoutRemoteCalls() throws Exception {
        CustomResourceResponse resp = run(event("Delete", "2025/01/01/[$LATEST]abc", null));

        assertThat(resp.status()).isEqualTo(CustomResourceResponse.SUCCESS);
        verifyNoInteractions(provisioner);
    }

    @Test
    void responseSerializesWithCloudFormationFieldNames() throws Exception {
        CustomResourceEvent ev = new ObjectMapper().readValue(event("Create", null, "client-1"), CustomResourceEvent.class);
        String json = new ObjectMapper().writeValueAsString(CustomResourceResponse.failed(ev, "pid", "boom"));

        assertThat(json).contains("\"Status\":\"FAILED\"", "\"Reason\":\"boom\"", "\"PhysicalResourceId\":\"pid\"",
                "\"StackId\":", "\"RequestId\":\"req-1\"", "\"LogicalResourceId\":\"OAuth2CredentialProvider\"", "\"Data\":{}");
    }
}
