package org.iceforge.placefinder.units;

import org.iceforge.placefinder.model.DeploymentConfigurationException;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Every name derived from the logical application name. Case folding happens once, here.
 */
public final class AppNaming {

    private static final Pattern APP_NAME = Pattern.compile("^[A-Za-z][A-Za-z0-9]{0,31}$");

    private final String appName;
    private final String lower;

    public AppNaming(String appName) {
        DeploymentConfigurationException.requireNonBlank("appName", appName);
        if (!APP_NAME.matcher(appName).matches()) {
            throw new DeploymentConfigurationException("appName",
                    "'" + appName + "' must start with a letter and contain only letters and digits");
        }
        this.appName = appName;
        this.lower = appName.toLowerCase(Locale.ROOT);
    }

    public String appName() { return appName; }

    public String lower() { return lower; }

    public String unitName(String suffix) { return appName + "-" + suffix; }

    public String exportName(String outputName) { return appName + "-" + outputName; }

    public String repositoryName() { return lower + "-mcp"; }

    public String runtimeName() { return appName + "_mcp"; }

    public String memoryName() { return appName + "_memory"; }

    public String secretName() { return appName + "/google-api-key"; }

    public String serviceName() { return appName + "-mcp"; }

    public String runtimeLogGroup() { return "/aws/bedrock-agentcore/runtimes/" + serviceName(); }

    public String credentialProviderName() { return appName + "-cognito-oauth"; }

    public String oauthScope() { return appName + "-api/mcp"; }

    public String gatewayName() { return appName + "-Gateway"; }

    public String gatewayTargetName() { return appName + "-McpTarget"; }

    public String promptName() { return appName + "-holiday-planner-scope"; }
}
