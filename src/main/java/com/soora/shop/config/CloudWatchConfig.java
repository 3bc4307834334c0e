package com.soora.shop.config;

import io.micrometer.cloudwatch2.CloudWatchMeterRegistry;
import io.micrometer.core.instrument.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchAsyncClient;

import java.util.Map;

/**
 * CloudWatch metrics export for the storefront.
 * Only active with {@code cloud.aws.cloudwatch.enabled=true}; local runs and tests keep
 * the actuator's in-memory registry.
 *
 * Everything {@link com.soora.shop.infrastructure.metrics.StoreMetricsService} records is
 * published under the configured namespace: product views and stock rejections, orders
 * placed and their status changes, revenue, query latency per endpoint and error counts.
 * Each datum carries {@code application} and {@code region} dimensions so the dashboards
 * of several regional deployments can share one namespace.
 *
 * @author Soora Platform Team
 */
@Configuration
@ConditionalOnProperty(name = "cloud.aws.cloudwatch.enabled", havingValue = "true")
public class CloudWatchConfig {

    static final String APPLICATION_NAME = "soora-shop-api";

    @Value("${cloud.aws.region:ap-southeast-1}")
    private String awsRegion;

    @Value("${app.region:Singapore}")
    private String storeRegion;

    @Value("${cloud.aws.cloudwatch.namespace:SooraShop}")
    private String namespace;

    @Value("${cloud.aws.cloudwatch.batch-size:20}")
    private Integer batchSize;

    @Value("${cloud.aws.cloudwatch.step:PT1M}")
    private String step; // Publish interval (ISO-8601 duration)

    @Bean(destroyMethod = "close")
    public CloudWatchAsyncClient cloudWatchAsyncClient() {
        return CloudWatchAsyncClient.builder()
                .region(Region.of(awsRegion))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }

    /**
     * CloudWatch meter registry. Spring Boot adds it to the composite registry that
     * {@link com.soora.shop.infrastructure.metrics.StoreMetricsService} writes to.
     *
     * @param cloudWatchAsyncClient CloudWatch client
     * @return CloudWatchMeterRegistry
     */
    @Bean
    public CloudWatchMeterRegistry cloudWatchMeterRegistry(CloudWatchAsyncClient cloudWatchAsyncClient) {
        CloudWatchMeterRegistry registry = new CloudWatchMeterRegistry(
                exportConfig(),
                Clock.SYSTEM,
                cloudWatchAsyncClient
        );
        registry.config().commonTags("application", APPLICATION_NAME, "region", storeRegion);
        return registry;
    }

    /**
     * Export settings taken from {@code cloud.aws.cloudwatch.*}.
     */
    io.micrometer.cloudwatch2.CloudWatchConfig exportConfig() {
        Map<String, String> configuration = Map.of(
                "cloudwatch.namespace", namespace,
                "cloudwatch.batchSize", String.valueOf(batchSize),
                "cloudwatch.step", step
        );
        return configuration::get;
    }
}
