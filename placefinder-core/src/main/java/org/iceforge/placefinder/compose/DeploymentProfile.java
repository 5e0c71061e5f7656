package org.iceforge.placefinder.compose;

import org.iceforge.placefinder.model.ProtocolMode;

/**
 * The configuration axis along which deployments differ. One composer serves every profile.
 */
public enum DeploymentProfile {

    /** HTTP runtime; gateway target authenticates to the runtime with an OAuth2 client-credentials provider. */
    HTTP_OAUTH(ProtocolMode.HTTP, true, false),

    /** MCP runtime with a managed prompt; gateway target carries no credential block. */
    MCP_NO_AUTH(ProtocolMode.MCP, false, true);

    private final ProtocolMode runtimeProtocol;
    private final boolean oauthTarget;
    private final boolean managedPrompt;

    DeploymentProfile(ProtocolMode runtimeProtocol, boolean oauthTarget, boolean managedPrompt) {
        this.runtimeProtocol = runtimeProtocol;
        this.oauthTarget = oauthTarget;
        this.managedPrompt = managedPrompt;
    }

    public ProtocolMode runtimeProtocol() {
        return runtimeProtocol;
    }

    public boolean oauthTarget() {
        return oauthTarget;
    }

    public boolean managedPrompt() {
        return managedPrompt;
    }
}
