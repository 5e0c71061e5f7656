package org.iceforge.placefinder.units;

import org.iceforge.placefinder.model.PolicyStatement;
import org.iceforge.placefinder.template.CfnValue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** IAM policy documents in template form. */
final class IamDocuments {

    private IamDocuments() {}

    /** Trust policy for a service principal, confined to this account and a source ARN pattern. */
    static Map<String, Object> trustPolicy(String servicePrincipal, CfnValue sourceArnPattern) {
        Map<String, Object> statement = new LinkedHashMap<>();
        statement.put("Effect", "Allow");
        statement.put("Principal", Map.of("Service", servicePrincipal));
        statement.put("Action", "sts:AssumeRole");
        if (sourceArnPattern != null) {
            Map<String, Object> condition = new LinkedHashMap<>();
            condition.put("StringEquals", Map.of("aws:SourceAccount", CfnValue.ref("AWS::AccountId")));
            condition.put("ArnLike", Map.of("aws:SourceArn", sourceArnPattern));
            statement.put("Condition", condition);
        }
        return document(List.of(statement));
    }

    static Map<String, Object> inlinePolicy(String name, List<PolicyStatement> statements) {
        Map<String, Object> policy = new LinkedHashMap<>();
        policy.put("PolicyName", name);
        policy.put("PolicyDocument", document(statements.stream().map(PolicyStatement::toTemplate).toList()));
        return policy;
    }

    private static Map<String, Object> document(List<?> statements) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("Version", "2012-10-17");
        doc.put("Statement", statements);
        return doc;
    }
}
