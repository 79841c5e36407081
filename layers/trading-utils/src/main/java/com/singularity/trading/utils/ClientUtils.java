package com.singularity.trading.utils;

import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.amazonaws.services.lambda.runtime.LambdaRuntime;
import com.amazonaws.xray.interceptors.TracingInterceptor;
import software.amazon.awssdk.awscore.client.builder.AwsClientBuilder;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.Map;

/**
 * Utility class for creating AWS SDK clients with X-Ray and custom endpoint support.
 */
public class ClientUtils {

    private ClientUtils() {}

    /**
     * Provides a default X-Ray configuration for AWS SDK clients.
     * Adds the TracingInterceptor to the client configuration.
     *
     * @return A ClientOverrideConfiguration with X-Ray tracing enabled.
     */
    public static ClientOverrideConfiguration getXRayConfig() {
        return ClientOverrideConfiguration.builder()
                .addExecutionInterceptor(new TracingInterceptor())
                .build();
    }

    /**
     * X-Ray configuration with an upper bound on every API call, including SDK-level retries.
     * Document store round trips must be bounded so that a hung write surfaces as an unknown outcome.
     *
     * @param apiCallTimeout The total time allowed for one API call.
     * @return A ClientOverrideConfiguration with tracing and the call timeout.
     */
    public static ClientOverrideConfiguration getTimedXRayConfig(Duration apiCallTimeout) {
        return getXRayConfig().toBuilder()
                .apiCallTimeout(apiCallTimeout)
                .build();
    }

    /**
     * Configures a client builder with a custom endpoint if the AWS_ENDPOINT_URL
     * environment variable is set. This is useful for local development with LocalStack.
     *
     * @param builder The AWS client builder to configure.
     * @param <B>     The type of the client builder.
     * @return The (potentially) modified client builder.
     */
    public static <B extends AwsClientBuilder<B, ?>> B configureEndpoint(B builder) {
        return configureEndpoint(builder, System.getenv());
    }

    /**
     * Same as {@link #configureEndpoint(AwsClientBuilder)} but reads AWS_ENDPOINT_URL from the given
     * environment, falling back to the system property of the same name.
     */
    public static <B extends AwsClientBuilder<B, ?>> B configureEndpoint(B builder, Map<String, String> env) {
        LambdaLogger logger = LambdaRuntime.getLogger();
        String endpoint = env.get("AWS_ENDPOINT_URL");
        if (endpoint == null || endpoint.isEmpty()) {
            endpoint = System.getProperty("AWS_ENDPOINT_URL");
        }
        if (endpoint != null && !endpoint.isEmpty()) {
            logger.log("Configuring client with endpoint: " + endpoint);
            try {
                builder.endpointOverride(new URI(endpoint));
            } catch (URISyntaxException e) {
                throw new IllegalArgumentException("Invalid endpoint URI: " + endpoint, e);
            }
        }
        return builder;
    }
}
