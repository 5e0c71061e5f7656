package org.iceforge.placefinder.synth;

import org.iceforge.placefinder.compose.DeploymentProfile;
import org.iceforge.placefinder.compose.DeploymentRequest;
import org.iceforge.placefinder.model.AuthorizerMode;
import org.iceforge.placefinder.model.IdentityPoolParameters;
import org.iceforge.placefinder.model.InboundJwtAuthorizer;
import org.iceforge.placefinder.units.ProvisionerPackage;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Deployment inputs of the Place Finder stacks.
 * <p>
 * Bound from {@code application.yml}, the environment ({@code PLACEFINDER_DEPLOY_*}) and the command line.
 * Identity pool values come from the external identity setup and are never created here.
 */
@ConfigurationProperties(prefix = "placefinder.deploy")
public class DeploymentProperties {

    /** Logical application name; every resource and export name derives from it. */
    private String appName = "placeFinder";

    /** Artifact reference; blank means the registry unit's repository with tag {@code latest}. */
    private String imageUri;

    private DeploymentProfile profile = DeploymentProfile.HTTP_OAUTH;

    /** Inbound authorization of the gateway. NONE is for development only. */
    private AuthorizerMode gatewayAuthorizer = AuthorizerMode.NONE;

    /** Target account, when pinned. */
    private String account;

    /** Target region, when pinned. */
    private String region;

    /** Directory the cloud assembly is written to. */
    private String outputDir = "cdk.out";

    private IdentityPool identityPool = new IdentityPool();

    private Provisioner provisioner = new Provisioner();

    private RuntimeAuthorizer runtimeAuthorizer = new RuntimeAuthorizer();

    public DeploymentRequest toRequest() {
        return new DeploymentRequest(
                appName,
                Optional.ofNullable(imageUri),
                profile,
                identityPool.toParameters(),
                gatewayAuthorizer,
                runtimeAuthorizer.toAuthorizer(),
                provisioner.toPackage());
    }

    /** {@code aws://<account>/<region>} when both are set. */
    public Optional<String> environment() {
        if (isBlank(account) || isBlank(region)) {
            return Optional.empty();
        }
        return Optional.of("aws://" + account + "/" + region);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    public String getAppName() {
        return appName;
    }

    public void setAppName(String appName) {
        this.appName = appName;
    }

    public String getImageUri() {
        return imageUri;
    }

    public void setImageUri(String imageUri) {
        this.imageUri = imageUri;
    }

    public DeploymentProfile getProfile() {
        return profile;
    }

    public void setProfile(DeploymentProfile profile) {
        this.profile = profile;
    }

    public AuthorizerMode getGatewayAuthorizer() {
        return gatewayAuthorizer;
    }

    public void setGatewayAuthorizer(AuthorizerMode gatewayAuthorizer) {
        this.gatewayAuthorizer = gatewayAuthorizer;
    }

    public String getAccount() {
        return account;
    }

    public void setAccount(String account) {
        this.account = account;
    }

    public String getRegion() {
        return region;
    }

    public void setRegion(String region) {
        this.region = region;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public IdentityPool getIdentityPool() {
        return identityPool;
    }

    public void setIdentityPool(IdentityPool identityPool) {
        this.identityPool = identityPool;
    }

    public Provisioner getProvisioner() {
        return provisioner;
    }

    public void setProvisioner(Provisioner provisioner) {
        this.provisioner = provisioner;
    }

    public RuntimeAuthorizer getRuntimeAuthorizer() {
        return runtimeAuthorizer;
    }

    public void setRuntimeAuthorizer(RuntimeAuthorizer runtimeAuthorizer) {
        this.runtimeAuthorizer = runtimeAuthorizer;
    }

    /**
     * Cognito user pool and app client the credential provider uses.
     * <p>
     * Only identifiers go here; the client secret is read from Cognito by the provisioning function.
     */
    public static class IdentityPool {

        private String poolId;

        private String clientId;

        /** Token endpoint of the pool's hosted domain, checked against the pool's region. */
        private String tokenEndpoint;

        Optional<IdentityPoolParameters> toParameters() {
            if (isBlank(poolId) && isBlank(clientId)) {
                return Optional.empty();
            }
            return Optional.of(new IdentityPoolParameters(poolId, clientId, tokenEndpoint));
        }

        public String getPoolId() {
            return poolId;
        }

        public void setPoolId(String poolId) {
            this.poolId = poolId;
        }

        public String getClientId() {
            return clientId;
        }

        public void setClientId(String clientId) {
            this.clientId = clientId;
        }

        public String getTokenEndpoint() {
            return tokenEndpoint;
        }

        public void setTokenEndpoint(String tokenEndpoint) {
            this.tokenEndpoint = tokenEndpoint;
        }
    }

    /** Uploaded jar of the credential provisioning function. */
    public static class Provisioner {

        private String s3Bucket;

        private String s3Key = ProvisionerPackage.DEFAULT_KEY;

        private int memoryMb = 512;

        private int timeoutSeconds = 60;

        Optional<ProvisionerPackage> toPackage() {
            if (isBlank(s3Bucket)) {
                return Optional.empty();
            }
            String key = isBlank(s3Key) ? ProvisionerPackage.DEFAULT_KEY : s3Key;
            return Optional.of(new ProvisionerPackage(s3Bucket, key, ProvisionerPackage.DEFAULT_HANDLER,
                    memoryMb, timeoutSeconds));
        }

        public String getS3Bucket() {
            return s3Bucket;
        }

        public void setS3Bucket(String s3Bucket) {
            this.s3Bucket = s3Bucket;
        }

        public String getS3Key() {
            return s3Key;
        }

        public void setS3Key(String s3Key) {
            this.s3Key = s3Key;
        }

        public int getMemoryMb() {
            return memoryMb;
        }

        public void setMemoryMb(int memoryMb) {
            this.memoryMb = memoryMb;
        }

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }
    }

    /** Optional JWT authorizer on the runtime endpoint. Disabled while {@code poolId} is unset. */
    public static class RuntimeAuthorizer {

        private String poolId;

        private List<String> allowedClients = new ArrayList<>();

        Optional<InboundJwtAuthorizer> toAuthorizer() {
            return isBlank(poolId) ? Optional.empty() : Optional.of(new InboundJwtAuthorizer(poolId, allowedClients));
        }

        public String getPoolId() {
            return poolId;
        }

        public void setPoolId(String poolId) {
            this.poolId = poolId;
        }

        public List<String> getAllowedClients() {
            return allowedClients;
        }

        public void setAllowedClients(List<String> allowedClients) {
            this.allowedClients = allowedClients;
        }
    }
}
