package com.openforge.invoicemate.artifact;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

import java.net.URI;

/**
 * Object-store beans for issued artifacts. Credentials come from
 * {@code invoicemate.artifact.access-key/secret-key} when set, otherwise from
 * the AWS default chain (environment, profile, instance role).
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ArtifactProperties.class)
public class StorageConfig {

    @Bean(destroyMethod = "close")
    public S3Client s3Client(ArtifactProperties props) {
        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(props.region()))
                .credentialsProvider(credentials(props))
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(props.pathStyleAccess())
                        .build())
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(props.apiCallTimeout())
                        .build());
        if (hasEndpoint(props)) {
            builder.endpointOverride(URI.create(props.endpoint()));
        }
        log.info("[Issuer] S3 client ready: bucket={} region={} endpoint={}",
                props.bucket(), props.region(), hasEndpoint(props) ? props.endpoint() : "(aws)");
        return builder.build();
    }

    @Bean(destroyMethod = "close")
    public S3Presigner s3Presigner(ArtifactProperties props) {
        S3Presigner.Builder builder = S3Presigner.builder()
                .region(Region.of(props.region()))
                .credentialsProvider(credentials(props))
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(props.pathStyleAccess())
                        .build());
        if (hasEndpoint(props)) {
            builder.endpointOverride(URI.create(props.endpoint()));
        }
        return builder.build();
    }

    @Bean
    public ArtifactStorage artifactStorage(S3Client s3Client, S3Presigner s3Presigner, ArtifactProperties props) {
        return new S3ArtifactStorage(s3Client, s3Presigner, props.bucket());
    }

    private static AwsCredentialsProvider credentials(ArtifactProperties props) {
        if (props.hasStaticCredentials()) {
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(props.accessKey(), props.secretKey()));
        }
        return DefaultCredentialsProvider.create();
    }

    private static boolean hasEndpoint(ArtifactProperties props) {
        return props.endpoint() != null && !props.endpoint().isBlank();
    }
}
