package org.iceforge.placefinder.units;

import org.iceforge.placefinder.template.CfnValue;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Environment injected into the runtime container: region, memory id, secret name (never the value),
 * and the OpenTelemetry exporter settings. Insertion order is kept in the rendered template.
 */
public final class RuntimeEnvironment {

    private RuntimeEnvironment() {}

    public static Map<String, CfnValue> build(AppNaming naming,
                                              CfnValue memoryId,
                                              String secretName,
                                              Optional<CfnValue> promptId) {
        String service = naming.serviceName();
        String logGroup = naming.runtimeLogGroup();

        Map<String, CfnValue> env = new LinkedHashMap<>();
        env.put("AWS_REGION", CfnValue.sub("${AWS::Region}"));

        env.put("AGENTCORE_MEMORY_ID", memoryId);

        // fetched by the app from Secrets Manager at startup
        env.put("GOOGLE_API_SECRET_NAME", CfnValue.literal(secretName));

        env.put("AGENT_OBSERVABILITY_ENABLED", CfnValue.literal("true"));
        env.put("OTEL_SERVICE_NAME", CfnValue.literal(service));
        env.put("OTEL_PYTHON_DISTRO", CfnValue.literal("aws_distro"));
        env.put("OTEL_PYTHON_CONFIGURATOR", CfnValue.literal("aws_configurator"));
        env.put("OTEL_EXPORTER_OTLP_PROTOCOL", CfnValue.literal("http/protobuf"));
        env.put("OTEL_TRACES_EXPORTER", CfnValue.literal("otlp"));
        env.put("OTEL_METRICS_EXPORTER", CfnValue.literal("otlp"));
        env.put("OTEL_LOGS_EXPORTER", CfnValue.literal("otlp"));
        env.put("OTEL_EXPORTER_OTLP_ENDPOINT", CfnValue.sub("https://xray.${AWS::Region}.${AWS::URLSuffix}"));
        env.put("OTEL_PROPAGATORS", CfnValue.literal("xray,tracecontext,baggage"));
        env.put("OTEL_RESOURCE_ATTRIBUTES", CfnValue.sub(String.join(",",
                "service.name=" + service,
                "aws.log.group.names=" + logGroup,
                "cloud.region=${AWS::Region}")));
        env.put("OTEL_EXPORTER_OTLP_LOGS_HEADERS", CfnValue.literal(String.join(",",
                "x-aws-log-group=" + logGroup,
                "x-aws-log-stream=runtime-logs",
                "x-aws-metric-namespace=bedrock-agentcore")));

        promptId.ifPresent(id -> env.put("BEDROCK_PROMPT_ID", id));
        return env;
    }
}
