package org.iceforge.placefinder.units;

import org.iceforge.placefinder.template.CfnValue;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * URL construction for values that cross unit boundaries.
 * <p>
 * The runtime invocation endpoint carries the runtime ARN as one percent-encoded path segment:
 * <pre>
 * https://bedrock-agentcore.{region}.amazonaws.com/runtimes/{urlencoded runtime ARN}/invocations?qualifier=DEFAULT
 * </pre>
 * Literal text is encoded at synthesis time; {@code ${...}} placeholders are left intact and resolve to
 * region, account and runtime id, none of which contain reserved characters.
 */
public final class EndpointTemplates {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{[^}]+}");

    private EndpointTemplates() {}

    /** RFC 3986 encoding of one path segment: everything but unreserved characters is escaped. */
    public static String percentEncodePathSegment(String raw) {
        return URLEncoder.encode(raw, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("*", "%2A")
                .replace("%7E", "~");
    }

    /** Percent-encode the literal parts of an {@code Fn::Sub} template, keeping placeholders. */
    public static String percentEncodeTemplate(String template) {
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        int last = 0;
        while (m.find()) {
            sb.append(percentEncodePathSegment(template.substring(last, m.start())));
            sb.append(m.group());
            last = m.end();
        }
        sb.append(percentEncodePathSegment(template.substring(last)));
        return sb.toString();
    }

    public static String runtimeArnTemplate(String runtimeIdPlaceholder) {
        return "arn:${AWS::Partition}:bedrock-agentcore:${AWS::Region}:${AWS::AccountId}:runtime/${" + runtimeIdPlaceholder + "}";
    }

    /** Invocation URL of a runtime whose id is imported from another unit. */
    public static CfnValue runtimeInvocationUrl(CfnValue runtimeId) {
        String encodedArn = percentEncodeTemplate(runtimeArnTemplate("RuntimeId"));
        return CfnValue.sub(
                "https://bedrock-agentcore.${AWS::Region}.${AWS::URLSuffix}/runtimes/" + encodedArn
                        + "/invocations?qualifier=DEFAULT",
                Map.of("RuntimeId", runtimeId));
    }

    /** Same URL for a concrete runtime ARN and region. */
    public static String runtimeInvocationUrl(String region, String runtimeArn) {
        return "https://bedrock-agentcore." + region + ".amazonaws.com/runtimes/"
                + percentEncodePathSegment(runtimeArn) + "/invocations?qualifier=DEFAULT";
    }
}
