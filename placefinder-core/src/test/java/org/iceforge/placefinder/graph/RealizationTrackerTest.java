package org.iceforge.placefinder.graph;

import org.iceforge.placefinder.compose.DeploymentComposer;
import org.iceforge.placefinder.compose.TestRequests;
import org.iceforge.placefinder.template.CfnResource;
import org.iceforge.placefinder.units.CredentialUnitBuilder;
import org.iceforge.placefinder.units.GatewayUnitBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RealizationTrackerTest {

    DeploymentGraph graph;
    RealizationTracker tracker;
    RealizationTracker.Node target;

    @BeforeEach
    void setUp() {
        graph = new DeploymentComposer().compose(TestRequests.httpOAuth());
        tracker = new RealizationTracker(graph);
        target = new RealizationTracker.Node("placeFinder-" + GatewayUnitBuilder.UNIT_SUFFIX, GatewayUnitBuilder.TARGET);
    }

    @Test
    void targetWaitsForGatewayRoleAndEveryCredentialResource() {
        String gatewayUnit = "placeFinder-" + GatewayUnitBuilder.UNIT_SUFFIX;
        String credentialUnit = "placeFinder-" + CredentialUnitBuilder.UNIT_SUFFIX;

        assertThat(tracker.prerequisitesOf(target)).contains(
                new RealizationTracker.Node(gatewayUnit, GatewayUnitBuilder.GATEWAY),
                new RealizationTracker.Node(gatewayUnit, GatewayUnitBuilder.GATEWAY_ROLE),
                new RealizationTracker.Node(credentialUnit, CredentialUnitBuilder.FUNCTION_ROLE),
                new RealizationTracker.Node(credentialUnit, CredentialUnitBuilder.FUNCTION),
                new RealizationTracker.Node(credentialUnit, CredentialUnitBuilder.PROVIDER));
    }

    @Test
    void startingTargetEarlyIsAnOrderingViolation() {
        assertThatThrownBy(() -> tracker.start(target))
                .isInstanceOf(OrderingViolationException.class)
                .hasMessageContaining(GatewayUnitBuilder.TARGET);
    }

    @Test
    void targetBecomesReadyOnlyAfterAllPrerequisitesSucceed() {
        while (!tracker.ready().contains(target)) {
            List<RealizationTracker.Node> ready = tracker.ready();
            assertThat(ready).isNotEmpty();
            for (RealizationTracker.Node n : ready) {
                tracker.start(n);
                tracker.succeed(n);
            }
        }
        tracker.prerequisitesOf(target)
                .forEach(p -> assertThat(tracker.state(p)).isEqualTo(RealizationTracker.State.SUCCEEDED));

        tracker.start(target);
        tracker.succeed(target);
        assertThat(tracker.isComplete()).isTrue();
    }

    @Test
    void failedCredentialProviderBlocksTheTarget() {
        String credentialUnit = "placeFinder-" + CredentialUnitBuilder.UNIT_SUFFIX;
        RealizationTracker.Node provider = new RealizationTracker.Node(credentialUnit, CredentialUnitBuilder.PROVIDER);

        boolean progressed = true;
        while (progressed) {
            progressed = false;
            for (RealizationTracker.Node n : tracker.ready()) {
                tracker.start(n);
                if (n.equals(provider)) {
                    tracker.fail(n);
                } else {
                    tracker.succeed(n);
                }
                progressed = true;
            }
        }

        assertThat(tracker.state(target)).isEqualTo(RealizationTracker.State.PENDING);
        assertThat(tracker.isComplete()).isFalse();
        assertThatThrownBy(() -> tracker.start(target)).isInstanceOf(OrderingViolationException.class);
    }

    @Test
    void runtimeResourcesWaitForTheRegistryWhenImageIsDerived() {
        String runtimeUnit = "placeFinder-AgentCoreStack";
        RealizationTracker.Node runtime = new RealizationTracker.Node(runtimeUnit, "Runtime");
        for (CfnResource r : graph.unit("placeFinder-EcrStack").resources()) {
            assertThat(tracker.prerequisitesOf(runtime))
                    .contains(new RealizationTracker.Node("placeFinder-EcrStack", r.logicalId()));
        }
    }
}
