package org.iceforge.placefinder.template;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Values the provisioning engine would supply when resolving intrinsics: pseudo parameters,
 * resource attributes of the unit being resolved, and exports published by earlier units.
 */
public record ResolutionContext(
        String account,
        String region,
        String partition,
        String urlSuffix,
        Map<String, String> attributes,   // "Logical" for Ref, "Logical.Attr" for GetAtt
        Map<String, String> exports
) {
    public ResolutionContext {
        Objects.requireNonNull(account, "account");
        Objects.requireNonNull(region, "region");
        partition = partition == null ? "aws" : partition;
        urlSuffix = urlSuffix == null ? "amazonaws.com" : urlSuffix;
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        exports = exports == null ? Map.of() : Map.copyOf(exports);
    }

    public static ResolutionContext of(String account, String region) {
        return new ResolutionContext(account, region, null, null, Map.of(), Map.of());
    }

    public ResolutionContext withAttributes(Map<String, String> more) {
        Map<String, String> merged = new HashMap<>(attributes);
        merged.putAll(more);
        return new ResolutionContext(account, region, partition, urlSuffix, merged, exports);
    }

    public ResolutionContext withExports(Map<String, String> more) {
        Map<String, String> merged = new HashMap<>(exports);
        merged.putAll(more);
        return new ResolutionContext(account, region, partition, urlSuffix, attributes, merged);
    }

    String pseudo(String name) {
        return switch (name) {
            case "AWS::AccountId" -> account;
            case "AWS::Region" -> region;
            case "AWS::Partition" -> partition;
            case "AWS::URLSuffix" -> urlSuffix;
            default -> throw new IllegalStateException("Unsupported pseudo parameter " + name);
        };
    }

    String attribute(String logicalId, String attribute) {
        String key = attribute == null ? logicalId : logicalId + "." + attribute;
        String v = attributes.get(key);
        if (v == null) {
            throw new IllegalStateException("No value known for " + key);
        }
        return v;
    }

    String importedValue(String exportName) {
        String v = exports.get(exportName);
        if (v == null) {
            throw new IllegalStateException("Export " + exportName + " has not been published");
        }
        return v;
    }
}
