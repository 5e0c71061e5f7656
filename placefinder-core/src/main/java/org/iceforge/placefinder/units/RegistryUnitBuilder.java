package org.iceforge.placefinder.units;

import org.iceforge.placefinder.graph.DeploymentUnit;
import org.iceforge.placefinder.graph.UnitKind;
import org.iceforge.placefinder.model.RegistryDescriptor;
import org.iceforge.placefinder.template.CfnResource;
import org.iceforge.placefinder.template.CfnValue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Registry unit: the image repository. A leaf; it has no inputs.
 */
public final class RegistryUnitBuilder {

    public static final String UNIT_SUFFIX = "EcrStack";
    public static final String REPOSITORY = "EcrRepo";
    public static final String OUTPUT_REPOSITORY_URI = "EcrRepositoryUri";
    public static final String OUTPUT_REPOSITORY_NAME = "EcrRepositoryName";

    private final AppNaming naming;

    public RegistryUnitBuilder(AppNaming naming) {
        this.naming = naming;
    }

    public RegistryDescriptor descriptor() {
        return new RegistryDescriptor(naming.repositoryName(), 10, true);
    }

    public DeploymentUnit build() {
        RegistryDescriptor registry = descriptor();
        DeploymentUnit unit = new DeploymentUnit(naming.unitName(UNIT_SUFFIX), UnitKind.REGISTRY,
                naming.appName() + " container image repository");

        Map<String, Object> props = new LinkedHashMap<>();
        props.put("RepositoryName", registry.repositoryName());
        props.put("ImageScanningConfiguration", Map.of("ScanOnPush", registry.scanOnPush()));
        props.put("EmptyOnDelete", false);
        props.put("LifecyclePolicy", Map.of("LifecyclePolicyText", lifecyclePolicy(registry.keepLastImages())));

        CfnResource repo = unit.add(new CfnResource(REPOSITORY, "AWS::ECR::Repository", props)).retainOnDelete();

        // same string as GetAtt RepositoryUri, spelled out so the image reference can be derived from it
        unit.publish(OUTPUT_REPOSITORY_URI,
                CfnValue.sub("${AWS::AccountId}.dkr.ecr.${AWS::Region}.${AWS::URLSuffix}/${" + REPOSITORY + "}"),
                "ECR Repository URI",
                naming.exportName(OUTPUT_REPOSITORY_URI));
        unit.publish(OUTPUT_REPOSITORY_NAME, repo.ref(), "ECR Repository Name",
                naming.exportName(OUTPUT_REPOSITORY_NAME));
        return unit;
    }

    static String lifecyclePolicy(int keepLast) {
        Map<String, Object> rule = new LinkedHashMap<>();
        rule.put("rulePriority", 1);
        rule.put("description", "Keep last " + keepLast + " images");
        rule.put("selection", Map.of(
                "tagStatus", "any",
                "countType", "imageCountMoreThan",
                "countNumber", keepLast));
        rule.put("action", Map.of("type", "expire"));
        return Json.compact(Map.of("rules", List.of(rule)));
    }
}
