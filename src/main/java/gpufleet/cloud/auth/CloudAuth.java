package gpufleet.cloud.auth;

import yandex.cloud.api.compute.v1.InstanceServiceGrpc;
import yandex.cloud.sdk.ServiceFactory;
import yandex.cloud.sdk.auth.Auth;

import java.time.Duration;

/**
 * Authenticated gRPC stubs for the Compute API.
 */
public class CloudAuth {
    private final InstanceServiceGrpc.InstanceServiceBlockingStub instanceService;

    /**
     * @param oauthToken     token from the INI file, or null to read env var OAUTH_TOKEN
     * @param requestTimeout deadline applied to every call
     */
    public CloudAuth(String oauthToken, Duration requestTimeout) {
        var credentials = Auth.oauthTokenBuilder();
        if (oauthToken != null && !oauthToken.isBlank()) {
            credentials = credentials.oauth(oauthToken.trim());
        } else {
            credentials = credentials.fromEnv("OAUTH_TOKEN");
        }

        ServiceFactory factory = ServiceFactory.builder()
                .credentialProvider(credentials)
                .requestTimeout(requestTimeout)
                .build();

        this.instanceService = factory.create(
                InstanceServiceGrpc.InstanceServiceBlockingStub.class,
                InstanceServiceGrpc::newBlockingStub
        );
    }

    public InstanceServiceGrpc.InstanceServiceBlockingStub instanceService() { return instanceService; }
}
