package com.singularity.trading.store;

import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.singularity.trading.utils.ClientUtils;
import com.singularity.trading.utils.EnvUtils;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.ssm.SsmClient;
import software.amazon.awssdk.services.ssm.model.GetParameterRequest;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Chooses the document store implementation once, at function start-up.
 */
public final class DocumentStores {

    public static final String BACKEND_S3 = "s3";
    public static final String BACKEND_DYNAMODB = "dynamodb";
    public static final String BACKEND_MEMORY = "memory";

    private DocumentStores() {}

    /**
     * Builds the store selected by {@code STORE_BACKEND}. When unset, the backend is inferred from
     * which of {@code BUCKET_NAME}/{@code SSM_PARAMETER_NAME}/{@code TABLE_NAME} is present, and
     * falls back to the in-memory store.
     *
     * @param env    The function environment.
     * @param logger Where the selection is logged.
     * @return The configured store.
     * @throws IllegalArgumentException on an unknown backend or missing backend settings.
     */
    public static DocumentStore fromEnvironment(Map<String, String> env, LambdaLogger logger) {
        String backend = selectBackend(env);
        Duration timeout = Duration.ofMillis(EnvUtils.positiveInt(env, "STORE_TIMEOUT_MS", 5000));

        switch (backend) {
            case BACKEND_S3: {
                ClientOverrideConfiguration clientConfig = ClientUtils.getTimedXRayConfig(timeout);
                String bucketName = resolveBucketName(env, clientConfig);
                S3Client s3Client = ClientUtils.configureEndpoint(S3Client.builder(), env)
                        .forcePathStyle(EnvUtils.get(env, "AWS_ENDPOINT_URL", null) != null)
                        .overrideConfiguration(clientConfig)
                        .build();
                logger.log("Using S3 document store, bucket " + bucketName);
                return new S3DocumentStore(s3Client, bucketName);
            }
            case BACKEND_DYNAMODB: {
                String tableName = EnvUtils.get(env, "TABLE_NAME", null);
                if (tableName == null) {
                    throw new IllegalArgumentException("TABLE_NAME is required for the dynamodb backend");
                }
                DynamoDbClient dynamoDbClient = ClientUtils.configureEndpoint(DynamoDbClient.builder(), env)
                        .overrideConfiguration(ClientUtils.getTimedXRayConfig(timeout))
                        .build();
                logger.log("Using DynamoDB document store, table " + tableName);
                return new DynamoDbDocumentStore(dynamoDbClient, tableName);
            }
            case BACKEND_MEMORY:
                logger.log("WARNING: using the in-memory document store; state is local to this process");
                return new InMemoryDocumentStore();
            default:
                throw new IllegalArgumentException("Unknown STORE_BACKEND: " + backend);
        }
    }

    static String selectBackend(Map<String, String> env) {
        String configured = EnvUtils.get(env, "STORE_BACKEND", null);
        if (configured != null) {
            return configured.toLowerCase(Locale.ROOT);
        }
        if (EnvUtils.get(env, "BUCKET_NAME", null) != null || EnvUtils.get(env, "SSM_PARAMETER_NAME", null) != null) {
            return BACKEND_S3;
        }
        if (EnvUtils.get(env, "TABLE_NAME", null) != null) {
            return BACKEND_DYNAMODB;
        }
        return BACKEND_MEMORY;
    }

    private static String resolveBucketName(Map<String, String> env, ClientOverrideConfiguration clientConfig) {
        String bucketName = EnvUtils.get(env, "BUCKET_NAME", null);
        if (bucketName != null) {
            return bucketName;
        }
        String ssmParamName = EnvUtils.get(env, "SSM_PARAMETER_NAME", null);
        if (ssmParamName == null) {
            throw new IllegalArgumentException("BUCKET_NAME or SSM_PARAMETER_NAME is required for the s3 backend");
        }
        try (SsmClient ssmClient = ClientUtils.configureEndpoint(SsmClient.builder(), env)
                .overrideConfiguration(clientConfig)
                .build()) {
            return ssmClient.getParameter(GetParameterRequest.builder()
                    .name(ssmParamName)
                    .build()).parameter().value();
        }
    }
}
