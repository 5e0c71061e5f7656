package org.iceforge.placefinder.provisioner.credentials;

import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.cognitoidentityprovider.CognitoIdentityProviderClient;
import software.amazon.awssdk.services.cognitoidentityprovider.model.DescribeUserPoolClientRequest;
import software.amazon.awssdk.services.cognitoidentityprovider.model.UserPoolClientType;

import java.util.Objects;

/** Cognito user pools as the identity pool directory. */
public class CognitoIdentityPoolDirectory implements IdentityPoolDirectory {

    private final CognitoIdentityProviderClient cognito;

    public CognitoIdentityPoolDirectory(CognitoIdentityProviderClient cognito) {
        this.cognito = Objects.requireNonNull(cognito);
    }

    @Override
    public OAuth2ClientCredentials clientCredentials(String userPoolId, String clientId) {
        UserPoolClientType client;
        try {
            client = cognito.describeUserPoolClient(DescribeUserPoolClientRequest.builder()
                    .userPoolId(userPoolId)
                    .clientId(clientId)
                    .build())
                    .userPoolClient();
        } catch (AwsServiceException e) {
            String msg = e.awsErrorDetails() != null ? e.awsErrorDetails().errorMessage() : e.getMessage();
            throw new RemoteProvisioningException("DescribeUserPoolClient", msg, e);
        } catch (SdkException e) {
            throw new RemoteProvisioningException("DescribeUserPoolClient", e.getMessage(), e);
        }
        if (client == null || client.clientSecret() == null || client.clientSecret().isEmpty()) {
            throw new RemoteProvisioningException("DescribeUserPoolClient",
                    "app client " + clientId + " of " + userPoolId + " has no client secret");
        }
        return new OAuth2ClientCredentials(clientId, client.clientSecret());
    }
}
