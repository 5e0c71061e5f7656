package org.iceforge.placefinder.units;

import org.iceforge.placefinder.graph.DeploymentUnit;
import org.iceforge.placefinder.graph.UnitKind;
import org.iceforge.placefinder.model.IdentityPoolParameters;
import org.iceforge.placefinder.model.PolicyStatement;
import org.iceforge.placefinder.template.CfnResource;
import org.iceforge.placefinder.template.CfnValue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Credential provisioning unit: the function that registers the OAuth2 client-credentials provider and the
 * custom resource that drives it through create / update / delete.
 * <p>
 * To the rest of the graph it is an ordinary unit that publishes {@code OAuth2ProviderArn}.
 */
public final class CredentialUnitBuilder {

    public static final String UNIT_SUFFIX = "CredentialStack";
    public static final String FUNCTION_ROLE = "OAuth2ProviderFunctionRole";
    public static final String FUNCTION = "OAuth2ProviderFunction";
    public static final String PROVIDER = "OAuth2CredentialProvider";
    public static final String PROVIDER_TYPE = "Custom::OAuth2CredentialProvider";
    public static final String ATTR_PROVIDER_ARN = "credentialProviderArn";
    public static final String OUTPUT_PROVIDER_ARN = "OAuth2ProviderArn";

    private final AppNaming naming;

    public CredentialUnitBuilder(AppNaming naming) {
        this.naming = naming;
    }

    public DeploymentUnit build(IdentityPoolParameters pool, ProvisionerPackage pkg) {
        DeploymentUnit unit = new DeploymentUnit(naming.unitName(UNIT_SUFFIX), UnitKind.CREDENTIAL_PROVIDER,
                naming.appName() + " OAuth2 credential provider registration");

        CfnResource role = unit.add(functionRole(pool));
        CfnResource function = unit.add(function(role, pkg));

        Map<String, Object> props = new LinkedHashMap<>();
        props.put("ServiceToken", function.getAtt("Arn"));
        props.put("ProviderName", naming.credentialProviderName());
        props.put("UserPoolId", pool.poolId());
        props.put("ClientId", pool.clientId());
        props.put("Region", CfnValue.ref("AWS::Region"));
        props.put("Scope", naming.oauthScope());
        CfnResource provider = unit.add(new CfnResource(PROVIDER, PROVIDER_TYPE, props));

        unit.publish(OUTPUT_PROVIDER_ARN, provider.getAtt(ATTR_PROVIDER_ARN), "OAuth2 Credential Provider ARN",
                naming.exportName(OUTPUT_PROVIDER_ARN));
        return unit;
    }

    List<PolicyStatement> functionStatements(IdentityPoolParameters pool) {
        String agentCore = "arn:${AWS::Partition}:bedrock-agentcore:${AWS::Region}:${AWS::AccountId}:";
        return List.of(
                PolicyStatement.allow("CognitoDescribeClient",
                        List.of("cognito-idp:DescribeUserPoolClient"),
                        List.of(CfnValue.sub("arn:${AWS::Partition}:cognito-idp:${AWS::Region}:${AWS::AccountId}:userpool/"
                                + pool.poolId()))),
                PolicyStatement.allow("AgentCoreOAuth2Provider",
                        List.of("bedrock-agentcore:CreateOauth2CredentialProvider",
                                "bedrock-agentcore:GetOauth2CredentialProvider",
                                "bedrock-agentcore:DeleteOauth2CredentialProvider",
                                "bedrock-agentcore:CreateTokenVault",
                                "bedrock-agentcore:GetTokenVault"),
                        List.of(CfnValue.sub(agentCore + "token-vault/default"),
                                CfnValue.sub(agentCore + "token-vault/default/*"))),
                PolicyStatement.allow("TokenVaultSecrets",
                        List.of("secretsmanager:CreateSecret",
                                "secretsmanager:DeleteSecret",
                                "secretsmanager:PutSecretValue"),
                        List.of(CfnValue.sub("arn:${AWS::Partition}:secretsmanager:${AWS::Region}:${AWS::AccountId}:secret:bedrock-agentcore-identity!*"))));
    }

    private CfnResource functionRole(IdentityPoolParameters pool) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("Description", "Execution role of the " + naming.appName() + " OAuth2 provider function");
        props.put("AssumeRolePolicyDocument", IamDocuments.trustPolicy("lambda.amazonaws.com", null));
        props.put("ManagedPolicyArns", List.of(
                CfnValue.sub("arn:${AWS::Partition}:iam::aws:policy/service-role/AWSLambdaBasicExecutionRole")));
        props.put("Policies", List.of(IamDocuments.inlinePolicy("OAuth2ProviderAccess", functionStatements(pool))));
        return new CfnResource(FUNCTION_ROLE, "AWS::IAM::Role", props);
    }

    private CfnResource function(CfnResource role, ProvisionerPackage pkg) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("Description", "Manages " + naming.appName() + " OAuth2 credential provider in AgentCore");
        props.put("Runtime", "java17");
        props.put("Handler", pkg.handler());
        props.put("Code", Map.of("S3Bucket", CfnValue.sub(pkg.s3Bucket()), "S3Key", pkg.s3Key()));
        props.put("Role", role.getAtt("Arn"));
        props.put("Timeout", pkg.timeoutSeconds());
        props.put("MemorySize", pkg.memoryMb());
        return new CfnResource(FUNCTION, "AWS::Lambda::Function", props);
    }
}
