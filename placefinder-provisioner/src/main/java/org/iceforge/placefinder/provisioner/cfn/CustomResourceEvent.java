package org.iceforge.placefinder.provisioner.cfn;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/** Custom resource request as delivered by CloudFormation. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CustomResourceEvent(
        @JsonProperty("RequestType") String requestType,
        @JsonProperty("ResponseURL") String responseUrl,
        @JsonProperty("StackId") String stackId,
        @JsonProperty("RequestId") String requestId,
        @JsonProperty("ResourceType") String resourceType,
        @JsonProperty("LogicalResourceId") String logicalResourceId,
        @JsonProperty("PhysicalResourceId") String physicalResourceId,
        @JsonProperty("ResourceProperties") Map<String, Object> resourceProperties,
        @JsonProperty("OldResourceProperties") Map<String, Object> oldResourceProperties
) {
    public enum RequestType {
        CREATE("Create"),
        UPDATE("Update"),
        DELETE("Delete");

        private final String wireName;

        RequestType(String wireName) {
            this.wireName = wireName;
        }

        public static RequestType of(String wireName) {
            for (RequestType t : values()) {
                if (t.wireName.equals(wireName)) {
                    return t;
                }
            }
            throw new IllegalArgumentException("Unknown RequestType '" + wireName + "'");
        }
    }

    public RequestType type() {
        return RequestType.of(requestType);
    }
}
