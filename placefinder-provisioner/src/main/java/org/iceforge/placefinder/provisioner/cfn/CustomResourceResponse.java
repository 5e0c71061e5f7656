package org.iceforge.placefinder.provisioner.cfn;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/** Body PUT to the pre-signed response URL. */
public record CustomResourceResponse(
        @JsonProperty("Status") String status,
        @JsonProperty("Reason") String reason,
        @JsonProperty("PhysicalResourceId") String physicalResourceId,
        @JsonProperty("StackId") String stackId,
        @JsonProperty("RequestId") String requestId,
        @JsonProperty("LogicalResourceId") String logicalResourceId,
        @JsonProperty("Data") Map<String, String> data
) {
    public static final String SUCCESS = "SUCCESS";
    public static final String FAILED = "FAILED";

    // CloudFormation truncates longer reasons
    private static final int MAX_REASON = 1000;

    public CustomResourceResponse {
        data = data == null ? Map.of() : Map.copyOf(data);
        if (reason != null && reason.length() > MAX_REASON) {
            reason = reason.substring(0, MAX_REASON);
        }
    }

    public static CustomResourceResponse success(CustomResourceEvent event, String physicalId, String reason,
                                                 Map<String, String> data) {
        return new CustomResourceResponse(SUCCESS, reason, physicalId, event.stackId(), event.requestId(),
                event.logicalResourceId(), data);
    }

    public static CustomResourceResponse failed(CustomResourceEvent event, String physicalId, String reason) {
        return new CustomResourceResponse(FAILED, reason, physicalId, event.stackId(), event.requestId(),
                event.logicalResourceId(), Map.of());
    }
}
