package org.iceforge.placefinder.units;

import org.iceforge.placefinder.graph.DeploymentUnit;
import org.iceforge.placefinder.model.AuthorizerMode;
import org.iceforge.placefinder.model.DeploymentConfigurationException;
import org.iceforge.placefinder.model.IdentityPoolParameters;
import org.iceforge.placefinder.template.CfnResource;
import org.iceforge.placefinder.template.CfnValue;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GatewayUnitBuilderTest {

    private final GatewayUnitBuilder builder = new GatewayUnitBuilder(new AppNaming("placeFinder"));
    private final CfnValue runtimeId = CfnValue.importValue("placeFinder-RuntimeId");
    private final CfnValue runtimeArn = CfnValue.importValue("placeFinder-RuntimeArn");
    private final IdentityPoolParameters pool = new IdentityPoolParameters("us-east-2_Pool", "client", null);

    @Test
    void targetDependsOnGatewayAndRole() {
        DeploymentUnit unit = builder.build(runtimeId, runtimeArn, Optional.empty(), AuthorizerMode.NONE, Optional.empty());
        CfnResource target = unit.resource(GatewayUnitBuilder.TARGET);

        assertThat(target.dependsOn()).containsExactlyInAnyOrder(GatewayUnitBuilder.GATEWAY, GatewayUnitBuilder.GATEWAY_ROLE);
        assertThat(target.properties()).doesNotContainKey("CredentialProviderConfigurations");
        assertThat(unit.resource(GatewayUnitBuilder.GATEWAY).properties()).containsEntry("AuthorizerType", "NONE");
    }

    @Test
    void credentialBlockPresentOnlyWithProviderArn() {
        DeploymentUnit unit = builder.build(runtimeId, runtimeArn,
                Optional.of(CfnValue.importValue("placeFinder-OAuth2ProviderArn")), AuthorizerMode.NONE, Optional.empty());

        CfnResource target = unit.resource(GatewayUnitBuilder.TARGET);
        assertThat(target.properties()).containsKey("CredentialProviderConfigurations");
        assertThat(target.imports()).contains("placeFinder-OAuth2ProviderArn", "placeFinder-RuntimeId");
    }

    @Test
    void customJwtNeedsPool() {
        assertThatThrownBy(() -> builder.build(runtimeId, runtimeArn, Optional.empty(), AuthorizerMode.CUSTOM_JWT, Optional.empty()))
                .isInstanceOf(DeploymentConfigurationException.class)
                .hasMessageStartingWith("identityPool");
    }

    @Test
    void customJwtRendersAuthorizerConfiguration() {
        DeploymentUnit unit = builder.build(runtimeId, runtimeArn, Optional.empty(), AuthorizerMode.CUSTOM_JWT, Optional.of(pool));

        assertThat(unit.resource(GatewayUnitBuilder.GATEWAY).properties())
                .containsEntry("AuthorizerType", "CUSTOM_JWT")
                .containsKey("AuthorizerConfiguration");
    }

    @Test
    void noneIsFlaggedNonProduction() {
        assertThat(builder.gateway(AuthorizerMode.NONE).nonProduction()).isTrue();
        assertThat(builder.gateway(AuthorizerMode.AWS_IAM).nonProduction()).isFalse();
    }
}
