package org.iceforge.placefinder.units;

import org.iceforge.placefinder.model.DeploymentConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AppNamingTest {

    @Test
    void namesDeriveFromAppName() {
        AppNaming n = new AppNaming("placeFinder");

        assertEquals("placefinder-mcp", n.repositoryName());
        assertEquals("placeFinder_mcp", n.runtimeName());
        assertEquals("placeFinder_memory", n.memoryName());
        assertEquals("placeFinder/google-api-key", n.secretName());
        assertEquals("placeFinder-cognito-oauth", n.credentialProviderName());
        assertEquals("placeFinder-api/mcp", n.oauthScope());
        assertEquals("placeFinder-EcrStack", n.unitName("EcrStack"));
        assertEquals("placeFinder-RuntimeId", n.exportName("RuntimeId"));
        assertEquals("/aws/bedrock-agentcore/runtimes/placeFinder-mcp", n.runtimeLogGroup());
    }

    @Test
    void invalidAppNameNamesTheField() {
        DeploymentConfigurationException ex = assertThrows(DeploymentConfigurationException.class,
                () -> new AppNaming("place-finder"));
        assertEquals("appName", ex.field());
        assertThrows(DeploymentConfigurationException.class, () -> new AppNaming(" "));
    }
}
