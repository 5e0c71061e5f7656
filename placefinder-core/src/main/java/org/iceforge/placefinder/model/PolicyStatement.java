package org.iceforge.placefinder.model;

import org.iceforge.placefinder.template.CfnValue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One IAM statement attached to an execution role.
 * <p>
 * Resources are scoped by account and region wherever the action supports resource-level permissions;
 * the {@code *} resource is accepted only when every action is one of {@link #ACTIONS_WITHOUT_RESOURCE_ARN}.
 */
public record PolicyStatement(String sid, Effect effect, List<String> actions, List<CfnValue> resources) {

    public static final Set<String> ACTIONS_WITHOUT_RESOURCE_ARN = Set.of(
            "ecr:GetAuthorizationToken",
            "logs:PutDeliverySource",
            "logs:PutDeliveryDestination",
            "logs:CreateDelivery",
            "logs:GetDeliverySource",
            "logs:GetDeliveryDestination",
            "logs:GetDelivery",
            "logs:DeleteDeliverySource",
            "logs:DeleteDeliveryDestination",
            "logs:DeleteDelivery",
            "xray:PutTraceSegments",
            "xray:PutTelemetryRecords",
            "cloudwatch:PutMetricData"
    );

    private static final CfnValue WILDCARD = CfnValue.literal("*");

    public PolicyStatement {
        DeploymentConfigurationException.requireNonBlank("policy.sid", sid);
        Objects.requireNonNull(effect, "effect");
        if (actions == null || actions.isEmpty()) {
            throw new DeploymentConfigurationException("policy.actions", sid + " has no actions");
        }
        if (resources == null || resources.isEmpty()) {
            throw new DeploymentConfigurationException("policy.resources", sid + " has no resources");
        }
        actions = List.copyOf(actions);
        resources = List.copyOf(resources);
        if (resources.contains(WILDCARD)) {
            List<String> scoped = actions.stream().filter(a -> !ACTIONS_WITHOUT_RESOURCE_ARN.contains(a)).toList();
            if (!scoped.isEmpty()) {
                throw new DeploymentConfigurationException("policy.resources",
                        sid + " grants " + scoped + " on * although they support resource-level ARNs");
            }
        }
    }

    public static PolicyStatement allow(String sid, List<String> actions, List<CfnValue> resources) {
        return new PolicyStatement(sid, Effect.ALLOW, actions, resources);
    }

    /** Allow on {@code *}; only for actions without a resource-level ARN format. */
    public static PolicyStatement allowUnscoped(String sid, List<String> actions) {
        return new PolicyStatement(sid, Effect.ALLOW, actions, List.of(WILDCARD));
    }

    public Map<String, Object> toTemplate() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("Sid", sid);
        m.put("Effect", effect.wireName());
        m.put("Action", actions.size() == 1 ? actions.get(0) : actions);
        m.put("Resource", resources.size() == 1 ? resources.get(0) : resources);
        return m;
    }
}
