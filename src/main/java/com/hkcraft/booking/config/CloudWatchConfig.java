package com.hkcraft.booking.config;

import io.micrometer.cloudwatch2.CloudWatchMeterRegistry;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchAsyncClient;

import java.util.Map;

/**
 * CloudWatch metrics configuration.
 * Active only when craft.metrics.cloudwatch.enabled=true; otherwise the
 * actuator's default registry collects the same meters locally.
 *
 * @author Craft Booking Team
 */
@Configuration
@ConditionalOnProperty(name = "craft.metrics.cloudwatch.enabled", havingValue = "true")
public class CloudWatchConfig {

    @Value("${cloud.aws.region:ap-east-1}")
    private String awsRegion;

    @Value("${cloud.aws.cloudwatch.namespace:CraftBooking}")
    private String namespace;

    @Value("${cloud.aws.cloudwatch.batch-size:20}")
    private Integer batchSize;

    @Value("${cloud.aws.cloudwatch.step:PT1M}")
    private String step;

    @Value("${craft.metrics.environment:local}")
    private String environment;

    @Bean
    public CloudWatchAsyncClient cloudWatchAsyncClient() {
        return CloudWatchAsyncClient.builder()
                .region(Region.of(awsRegion))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .build();
    }

    /**
     * CloudWatch meter registry used by {@code BookingMetricsService}.
     * Settings are resolved through the registry's own "cloudwatch." property keys.
     */
    @Bean
    public MeterRegistry meterRegistry(CloudWatchAsyncClient cloudWatchAsyncClient) {
        Map<String, String> settings = Map.of(
                "cloudwatch.namespace", namespace,
                "cloudwatch.batchSize", String.valueOf(batchSize),
                "cloudwatch.step", step
        );
        io.micrometer.cloudwatch2.CloudWatchConfig cloudWatchConfig = settings::get;

        return new CloudWatchMeterRegistry(cloudWatchConfig, Clock.SYSTEM, cloudWatchAsyncClient);
    }

    /**
     * Tags every booking meter with the service and deployment environment.
     */
    @Bean
    public MeterRegistryCustomizer<MeterRegistry> bookingCommonTags() {
        return registry -> registry.config().commonTags(
                "service", "craft-booking-engine",
                "environment", environment);
    }
}
