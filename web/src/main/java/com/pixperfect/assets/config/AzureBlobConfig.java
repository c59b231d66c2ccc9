package com.pixperfect.assets.config;

import com.azure.identity.DefaultAzureCredentialBuilder;
import com.azure.storage.blob.BlobServiceClient;
import com.azure.storage.blob.BlobServiceClientBuilder;
import com.azure.storage.common.policy.RequestRetryOptions;
import com.azure.storage.common.policy.RetryPolicyType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.util.StringUtils;

import java.time.Duration;

/**
 * Blob client for the {@code azure} profile. Each try is bounded by
 * {@code assets.storage.call-timeout}, the same budget the S3 client gets.
 * A connection string, when set, takes precedence over endpoint plus
 * {@code DefaultAzureCredential} (Azurite, shared-key accounts).
 */
@Slf4j
@Configuration
@Profile("azure")
public class AzureBlobConfig {

    private static final Duration RETRY_DELAY = Duration.ofMillis(500);
    private static final Duration MAX_RETRY_DELAY = Duration.ofSeconds(5);

    @Value("${azure.blob.endpoint:}")
    private String endpoint;

    @Value("${azure.storage.connection-string:}")
    private String connectionString;

    @Value("${azure.storage.max-tries:3}")
    private int maxTries;

    @Value("${assets.storage.call-timeout:10s}")
    private Duration callTimeout;

    @Bean
    public BlobServiceClient blobServiceClient() {
        BlobServiceClientBuilder builder = new BlobServiceClientBuilder()
                .retryOptions(retryOptions());

        if (StringUtils.hasText(connectionString)) {
            log.info("Azure blob client using connection string");
            builder.connectionString(connectionString);
        } else if (StringUtils.hasText(endpoint)) {
            log.info("Azure blob client using endpoint {} with DefaultAzureCredential", endpoint);
            builder.endpoint(endpoint).credential(new DefaultAzureCredentialBuilder().build());
        } else {
            throw new IllegalStateException(
                    "Profile 'azure' needs azure.blob.endpoint or azure.storage.connection-string");
        }
        return builder.buildClient();
    }

    RequestRetryOptions retryOptions() {
        return new RequestRetryOptions(RetryPolicyType.EXPONENTIAL, maxTries, callTimeout,
                RETRY_DELAY, MAX_RETRY_DELAY, null);
    }
}
