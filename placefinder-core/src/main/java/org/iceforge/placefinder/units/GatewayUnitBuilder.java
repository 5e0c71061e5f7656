package org.iceforge.placefinder.units;

import org.iceforge.placefinder.graph.DeploymentUnit;
import org.iceforge.placefinder.graph.UnitKind;
import org.iceforge.placefinder.model.AuthorizerMode;
import org.iceforge.placefinder.model.DeploymentConfigurationException;
import org.iceforge.placefinder.model.GatewayDescriptor;
import org.iceforge.placefinder.model.GatewayTargetDescriptor;
import org.iceforge.placefinder.model.IdentityPoolParameters;
import org.iceforge.placefinder.model.OAuthCredentialConfig;
import org.iceforge.placefinder.model.PolicyStatement;
import org.iceforge.placefinder.model.ProtocolMode;
import org.iceforge.placefinder.template.CfnResource;
import org.iceforge.placefinder.template.CfnValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Gateway-and-target unit: gateway role, MCP gateway, and the target forwarding to the runtime.
 * <p>
 * The target is ordered after the gateway (its parent) and after the role (the runtime invocation policy
 * must be in effect before traffic flows). Credential completion is an edge on the whole unit.
 */
public final class GatewayUnitBuilder {
    private static final Logger log = LoggerFactory.getLogger(GatewayUnitBuilder.class);

    public static final String UNIT_SUFFIX = "GatewayStack";
    public static final String GATEWAY_ROLE = "GatewayRole";
    public static final String GATEWAY = "Gateway";
    public static final String TARGET = "McpTarget";

    public static final String OUTPUT_GATEWAY_ID = "GatewayId";
    public static final String OUTPUT_GATEWAY_ARN = "GatewayArn";
    public static final String OUTPUT_GATEWAY_URL = "GatewayUrl";
    public static final String OUTPUT_TARGET_ID = "GatewayTargetId";

    private final AppNaming naming;

    public GatewayUnitBuilder(AppNaming naming) {
        this.naming = naming;
    }

    public GatewayDescriptor gateway(AuthorizerMode authorizer) {
        return new GatewayDescriptor(naming.gatewayName(),
                naming.appName() + " MCP Gateway - routes requests to the MCP server Runtime",
                ProtocolMode.MCP, authorizer);
    }

    public GatewayTargetDescriptor target(CfnValue runtimeId, Optional<CfnValue> credentialProviderArn) {
        return new GatewayTargetDescriptor(
                naming.gatewayTargetName(),
                "MCP server target pointing to the AgentCore Runtime",
                CfnValue.getAtt(GATEWAY, "GatewayIdentifier"),
                EndpointTemplates.runtimeInvocationUrl(runtimeId),
                credentialProviderArn.map(arn -> new OAuthCredentialConfig(arn, List.of(naming.oauthScope()),
                        OAuthCredentialConfig.CLIENT_CREDENTIALS)));
    }

    public DeploymentUnit build(CfnValue runtimeId,
                                CfnValue runtimeArn,
                                Optional<CfnValue> credentialProviderArn,
                                AuthorizerMode authorizer,
                                Optional<IdentityPoolParameters> pool) {
        GatewayDescriptor gateway = gateway(authorizer);
        if (gateway.nonProduction()) {
            log.warn("Gateway {} uses authorizer {}; for development/demo only, use CUSTOM_JWT or AWS_IAM in production",
                    gateway.name(), gateway.authorizer());
        }
        if (authorizer == AuthorizerMode.CUSTOM_JWT && pool.isEmpty()) {
            throw new DeploymentConfigurationException("identityPool", "CUSTOM_JWT gateway authorizer needs identity pool parameters");
        }

        DeploymentUnit unit = new DeploymentUnit(naming.unitName(UNIT_SUFFIX), UnitKind.GATEWAY,
                naming.appName() + " AgentCore Gateway");

        CfnResource role = unit.add(gatewayRole(runtimeArn));
        CfnResource gatewayResource = unit.add(gatewayResource(gateway, role, pool));
        CfnResource target = unit.add(targetResource(target(runtimeId, credentialProviderArn)));

        target.addDependency(gatewayResource);
        target.addDependency(role);

        unit.publish(OUTPUT_GATEWAY_ID, gatewayResource.getAtt("GatewayIdentifier"), "AgentCore Gateway ID",
                naming.exportName(OUTPUT_GATEWAY_ID));
        unit.publish(OUTPUT_GATEWAY_ARN, gatewayResource.getAtt("GatewayArn"), "AgentCore Gateway ARN",
                naming.exportName(OUTPUT_GATEWAY_ARN));
        unit.publish(OUTPUT_GATEWAY_URL, gatewayResource.getAtt("GatewayUrl"),
                "AgentCore Gateway URL - MCP clients connect to this endpoint",
                naming.exportName(OUTPUT_GATEWAY_URL));
        unit.publish(OUTPUT_TARGET_ID, target.getAtt("TargetId"), "Gateway Target ID",
                naming.exportName(OUTPUT_TARGET_ID));
        return unit;
    }

    private CfnResource gatewayRole(CfnValue runtimeArn) {
        PolicyStatement invoke = PolicyStatement.allow("InvokeRuntime",
                List.of("bedrock-agentcore:InvokeRuntime", "bedrock-agentcore:InvokeAgentRuntime"),
                List.of(runtimeArn, CfnValue.sub("${RuntimeArn}/*", Map.of("RuntimeArn", runtimeArn))));

        Map<String, Object> props = new LinkedHashMap<>();
        props.put("Description", "IAM role for " + naming.appName() + " AgentCore Gateway");
        props.put("AssumeRolePolicyDocument", IamDocuments.trustPolicy("bedrock-agentcore.amazonaws.com",
                CfnValue.sub("arn:${AWS::Partition}:bedrock-agentcore:${AWS::Region}:${AWS::AccountId}:*")));
        props.put("Policies", List.of(IamDocuments.inlinePolicy("GatewayInvokeRuntime", List.of(invoke))));
        return new CfnResource(GATEWAY_ROLE, "AWS::IAM::Role", props);
    }

    private CfnResource gatewayResource(GatewayDescriptor gateway, CfnResource role, Optional<IdentityPoolParameters> pool) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("Name", gateway.name());
        props.put("ProtocolType", gateway.protocol().name());
        props.put("RoleArn", role.getAtt("Arn"));
        props.put("AuthorizerType", gateway.authorizer().name());
        if (gateway.authorizer() == AuthorizerMode.CUSTOM_JWT) {
            IdentityPoolParameters p = pool.orElseThrow();
            props.put("AuthorizerConfiguration", Map.of("CustomJWTAuthorizer", Map.of(
                    "DiscoveryUrl", CfnValue.sub("https://cognito-idp.${AWS::Region}.${AWS::URLSuffix}/" + p.poolId()
                            + "/.well-known/openid-configuration"),
                    "AllowedClients", List.of(p.clientId()))));
        }
        props.put("Description", gateway.description());
        return new CfnResource(GATEWAY, "AWS::BedrockAgentCore::Gateway", props);
    }

    private CfnResource targetResource(GatewayTargetDescriptor target) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("Name", target.name());
        props.put("GatewayIdentifier", target.gatewayIdentifier());
        target.credential().ifPresent(c -> {
            Map<String, Object> oauth = new LinkedHashMap<>();
            oauth.put("ProviderArn", c.providerArn());
            oauth.put("Scopes", c.scopes());
            oauth.put("GrantType", c.grantType());
            props.put("CredentialProviderConfigurations", List.of(Map.of(
                    "CredentialProviderType", "OAUTH",
                    "CredentialProvider", Map.of("OauthCredentialProvider", oauth))));
        });
        props.put("TargetConfiguration", Map.of("Mcp", Map.of("McpServer", Map.of("Endpoint", target.endpoint()))));
        props.put("Description", target.description());
        return new CfnResource(TARGET, "AWS::BedrockAgentCore::GatewayTarget", props);
    }
}
