package org.iceforge.placefinder.units;

import org.iceforge.placefinder.graph.DeploymentUnit;
import org.iceforge.placefinder.graph.UnitKind;
import org.iceforge.placefinder.model.ArtifactReference;
import org.iceforge.placefinder.model.InboundJwtAuthorizer;
import org.iceforge.placefinder.model.MemoryDescriptor;
import org.iceforge.placefinder.model.MemoryStrategy;
import org.iceforge.placefinder.model.NetworkMode;
import org.iceforge.placefinder.model.PolicyStatement;
import org.iceforge.placefinder.model.PromptDescriptor;
import org.iceforge.placefinder.model.ProtocolMode;
import org.iceforge.placefinder.model.RuntimeDescriptor;
import org.iceforge.placefinder.model.SecretPlaceholder;
import org.iceforge.placefinder.template.CfnResource;
import org.iceforge.placefinder.template.CfnValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runtime-and-memory unit: API-key secret placeholder, long-term memory, optional managed prompt,
 * runtime execution role, the container runtime and the X-Ray log resource policy.
 * <p>
 * Its only input from the registry unit is the artifact reference string.
 */
public final class RuntimeMemoryUnitBuilder {

    public static final String UNIT_SUFFIX = "AgentCoreStack";

    public static final String SECRET = "GoogleApiSecret";
    public static final String MEMORY = "Memory";
    public static final String PROMPT = "Prompt";
    public static final String RUNTIME_ROLE = "RuntimeRole";
    public static final String RUNTIME = "Runtime";
    public static final String XRAY_POLICY = "XRayResourcePolicy";

    public static final String OUTPUT_RUNTIME_ID = "RuntimeId";
    public static final String OUTPUT_RUNTIME_ARN = "RuntimeArn";
    public static final String OUTPUT_MEMORY_ID = "MemoryId";
    public static final String OUTPUT_MEMORY_ARN = "MemoryArn";
    public static final String OUTPUT_SECRET_ARN = "GoogleApiSecretArn";
    public static final String OUTPUT_PROMPT_ARN = "PromptArn";

    private final AppNaming naming;

    public RuntimeMemoryUnitBuilder(AppNaming naming) {
        this.naming = naming;
    }

    public SecretPlaceholder secret() {
        return new SecretPlaceholder(naming.secretName(),
                "Google API key for Places & Weather APIs. Update after deployment.", "api_key");
    }

    public MemoryDescriptor memory() {
        return new MemoryDescriptor(
                naming.memoryName(),
                naming.appName() + " long-term memory with user preference, semantic, and summary strategies",
                List.of(
                        MemoryStrategy.userPreference("user_preference_strategy", "/preferences/{actorId}/"),
                        MemoryStrategy.semantic("semantic_strategy", "/facts/{actorId}/"),
                        MemoryStrategy.summarization("summary_strategy", "/summaries/{sessionId}/")),
                MemoryDescriptor.DEFAULT_EVENT_EXPIRY_DAYS);
    }

    public RuntimeDescriptor runtime(ArtifactReference artifact,
                                     ProtocolMode protocol,
                                     Optional<InboundJwtAuthorizer> authorizer,
                                     boolean withPrompt) {
        Optional<CfnValue> promptId = withPrompt ? Optional.of(CfnValue.getAtt(PROMPT, "Id")) : Optional.empty();
        return new RuntimeDescriptor(
                naming.runtimeName(),
                naming.appName() + " MCP server (Places, Weather, User Preferences)",
                artifact,
                protocol,
                NetworkMode.PUBLIC,
                RuntimeEnvironment.build(naming, CfnValue.getAtt(MEMORY, "MemoryId"), naming.secretName(), promptId),
                authorizer);
    }

    public DeploymentUnit build(ArtifactReference artifact,
                                ProtocolMode protocol,
                                Optional<InboundJwtAuthorizer> authorizer,
                                Optional<PromptDescriptor> prompt) {
        DeploymentUnit unit = new DeploymentUnit(naming.unitName(UNIT_SUFFIX), UnitKind.RUNTIME_AND_MEMORY,
                naming.appName() + " AgentCore runtime, memory and observability");

        CfnResource secret = unit.add(secretResource(secret()));
        CfnResource memory = unit.add(memoryResource(memory()));
        Optional<CfnResource> promptResource = prompt.map(p -> unit.add(promptResource(p)));

        RuntimeDescriptor runtime = runtime(artifact, protocol, authorizer, prompt.isPresent());
        CfnResource role = unit.add(runtimeRole(secret, promptResource));
        unit.add(runtimeResource(runtime, role));
        unit.add(xrayResourcePolicy());

        unit.publish(OUTPUT_RUNTIME_ID, CfnValue.getAtt(RUNTIME, "AgentRuntimeId"), "AgentCore Runtime ID",
                naming.exportName(OUTPUT_RUNTIME_ID));
        unit.publish(OUTPUT_RUNTIME_ARN, CfnValue.getAtt(RUNTIME, "AgentRuntimeArn"), "AgentCore Runtime ARN",
                naming.exportName(OUTPUT_RUNTIME_ARN));
        unit.publish(OUTPUT_MEMORY_ID, memory.getAtt("MemoryId"), "AgentCore Memory ID",
                naming.exportName(OUTPUT_MEMORY_ID));
        unit.publish(OUTPUT_MEMORY_ARN, memory.getAtt("MemoryArn"), "AgentCore Memory ARN",
                naming.exportName(OUTPUT_MEMORY_ARN));
        unit.publish(OUTPUT_SECRET_ARN, secret.ref(), "Google API key secret ARN",
                naming.exportName(OUTPUT_SECRET_ARN));
        promptResource.ifPresent(p -> unit.publish(OUTPUT_PROMPT_ARN, p.getAtt("Arn"), "Bedrock managed prompt ARN",
                naming.exportName(OUTPUT_PROMPT_ARN)));
        return unit;
    }

    private CfnResource secretResource(SecretPlaceholder secret) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("Name", secret.name());
        props.put("Description", secret.description());
        props.put("SecretString", secret.initialSecretString());
        return new CfnResource(SECRET, "AWS::SecretsManager::Secret", props);
    }

    private CfnResource memoryResource(MemoryDescriptor memory) {
        List<Object> strategies = new ArrayList<>();
        for (MemoryStrategy s : memory.strategies()) {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("Name", s.name());
            body.put("Namespaces", s.namespaces());
            strategies.add(Map.of(s.kind().templateKey(), body));
        }
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("Name", memory.name());
        props.put("Description", memory.description());
        props.put("EventExpiryDuration", memory.eventExpiryDays());
        props.put("MemoryStrategies", strategies);
        return new CfnResource(MEMORY, "AWS::BedrockAgentCore::Memory", props);
    }

    private CfnResource promptResource(PromptDescriptor prompt) {
        Map<String, Object> text = new LinkedHashMap<>();
        text.put("Text", prompt.templateText());
        text.put("InputVariables", prompt.inputVariables().stream().map(v -> Map.of("Name", v)).toList());

        Map<String, Object> inference = new LinkedHashMap<>();
        inference.put("Temperature", prompt.temperature());
        inference.put("TopP", prompt.topP());
        inference.put("MaxTokens", prompt.maxTokens());

        Map<String, Object> variant = new LinkedHashMap<>();
        variant.put("Name", "default");
        variant.put("TemplateType", "TEXT");
        variant.put("ModelId", prompt.modelId());
        variant.put("InferenceConfiguration", Map.of("Text", inference));
        variant.put("TemplateConfiguration", Map.of("Text", text));

        Map<String, Object> props = new LinkedHashMap<>();
        props.put("Name", prompt.name());
        props.put("Description", prompt.description());
        props.put("DefaultVariant", "default");
        props.put("Variants", List.of(variant));
        return new CfnResource(PROMPT, "AWS::Bedrock::Prompt", props);
    }

    List<PolicyStatement> runtimeStatements(CfnResource secret, Optional<CfnResource> prompt) {
        String arnPrefix = "arn:${AWS::Partition}:%s:${AWS::Region}:${AWS::AccountId}:";
        List<PolicyStatement> statements = new ArrayList<>();
        statements.add(PolicyStatement.allow("ECRPullImage",
                List.of("ecr:BatchGetImage", "ecr:GetDownloadUrlForLayer"),
                List.of(CfnValue.sub(arnPrefix.formatted("ecr") + "repository/" + naming.lower() + "-*"))));
        statements.add(PolicyStatement.allowUnscoped("ECRAuth", List.of("ecr:GetAuthorizationToken")));
        statements.add(PolicyStatement.allow("SecretRead",
                List.of("secretsmanager:GetSecretValue", "secretsmanager:DescribeSecret"),
                List.of(secret.ref())));
        statements.add(PolicyStatement.allow("AgentCoreMemoryAccess",
                List.of("bedrock-agentcore:*"),
                List.of(CfnValue.sub(arnPrefix.formatted("bedrock-agentcore") + "memory/*"))));
        statements.add(PolicyStatement.allow("WorkloadIdentityTokens",
                List.of("bedrock-agentcore:GetWorkloadAccessToken",
                        "bedrock-agentcore:GetWorkloadAccessTokenForJWT",
                        "bedrock-agentcore:GetWorkloadAccessTokenForUserId"),
                List.of(CfnValue.sub(arnPrefix.formatted("bedrock-agentcore") + "workload-identity-directory/default"),
                        CfnValue.sub(arnPrefix.formatted("bedrock-agentcore")
                                + "workload-identity-directory/default/workload-identity/" + naming.runtimeName() + "-*"))));
        statements.add(PolicyStatement.allow("S3VectorStoreAccess",
                List.of("s3vectors:QueryVectors", "s3vectors:PutVectors", "s3vectors:GetVectors", "s3vectors:DeleteVectors"),
                List.of(CfnValue.sub(arnPrefix.formatted("s3vectors") + "bucket/*"))));
        statements.add(PolicyStatement.allow("OTLPCloudWatchExport",
                List.of("logs:PutLogEvents", "logs:CreateLogStream", "logs:CreateLogGroup", "logs:DescribeLogStreams"),
                List.of(
                        CfnValue.sub(arnPrefix.formatted("logs") + "log-group:/aws/vendedlogs/bedrock-agentcore/*"),
                        CfnValue.sub(arnPrefix.formatted("logs") + "log-group:/aws/vendedlogs/bedrock-agentcore/*:log-stream:*"),
                        CfnValue.sub(arnPrefix.formatted("logs") + "log-group:" + naming.runtimeLogGroup() + "*"),
                        CfnValue.sub(arnPrefix.formatted("logs") + "log-group:aws/spans:*"))));
        statements.add(PolicyStatement.allowUnscoped("CloudWatchLogsDelivery", List.of(
                "logs:PutDeliverySource",
                "logs:PutDeliveryDestination",
                "logs:CreateDelivery",
                "logs:GetDeliverySource",
                "logs:GetDeliveryDestination",
                "logs:GetDelivery",
                "logs:DeleteDeliverySource",
                "logs:DeleteDeliveryDestination",
                "logs:DeleteDelivery")));
        statements.add(PolicyStatement.allowUnscoped("XRayTracing",
                List.of("xray:PutTraceSegments", "xray:PutTelemetryRecords", "cloudwatch:PutMetricData")));
        prompt.ifPresent(p -> statements.add(PolicyStatement.allow("PromptRead",
                List.of("bedrock:GetPrompt"), List.of(p.getAtt("Arn")))));
        return statements;
    }

    private CfnResource runtimeRole(CfnResource secret, Optional<CfnResource> prompt) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("Description", "Execution role for the " + naming.appName() + " AgentCore runtime");
        props.put("AssumeRolePolicyDocument", IamDocuments.trustPolicy("bedrock-agentcore.amazonaws.com",
                CfnValue.sub("arn:${AWS::Partition}:bedrock-agentcore:${AWS::Region}:${AWS::AccountId}:*")));
        props.put("Policies", List.of(IamDocuments.inlinePolicy("RuntimeAccess", runtimeStatements(secret, prompt))));
        return new CfnResource(RUNTIME_ROLE, "AWS::IAM::Role", props);
    }

    private CfnResource runtimeResource(RuntimeDescriptor runtime, CfnResource role) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("AgentRuntimeName", runtime.name());
        props.put("Description", runtime.description());
        props.put("AgentRuntimeArtifact", Map.of("ContainerConfiguration", Map.of("ContainerUri", runtime.artifact().value())));
        props.put("RoleArn", role.getAtt("Arn"));
        props.put("NetworkConfiguration", Map.of("NetworkMode", runtime.network().name()));
        props.put("ProtocolConfiguration", runtime.protocol().name());
        props.put("EnvironmentVariables", new LinkedHashMap<>(runtime.environment()));
        runtime.authorizer().ifPresent(a -> props.put("AuthorizerConfiguration", Map.of("CustomJWTAuthorizer", Map.of(
                "DiscoveryUrl", CfnValue.sub(
                        "https://cognito-idp.${AWS::Region}.${AWS::URLSuffix}/" + a.poolId() + "/.well-known/openid-configuration"),
                "AllowedClients", a.allowedClients()))));
        return new CfnResource(RUNTIME, "AWS::BedrockAgentCore::Runtime", props);
    }

    private CfnResource xrayResourcePolicy() {
        Map<String, Object> statement = new LinkedHashMap<>();
        statement.put("Effect", "Allow");
        statement.put("Principal", Map.of("Service", "xray.amazonaws.com"));
        statement.put("Action", List.of("logs:PutLogEvents", "logs:CreateLogStream"));
        statement.put("Resource", "arn:${AWS::Partition}:logs:${AWS::Region}:${AWS::AccountId}:log-group:aws/spans:*");

        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("Version", "2012-10-17");
        doc.put("Statement", List.of(statement));

        Map<String, Object> props = new LinkedHashMap<>();
        props.put("PolicyName", naming.appName() + "-XRayCloudWatchLogsAccess");
        props.put("PolicyDocument", CfnValue.sub(Json.compact(doc)));
        return new CfnResource(XRAY_POLICY, "AWS::Logs::ResourcePolicy", props);
    }
}
