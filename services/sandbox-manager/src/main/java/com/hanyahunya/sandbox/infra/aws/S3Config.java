package com.hanyahunya.sandbox.infra.aws;

import com.hanyahunya.sandbox.infra.config.SandboxManagerProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

import java.net.URI;

@Configuration
@ConditionalOnProperty(prefix = "sandbox.storage", name = "type", havingValue = "s3")
public class S3Config {

    @Bean(destroyMethod = "close")
    public S3Client s3Client(SandboxManagerProperties properties) {
        SandboxManagerProperties.S3 s3 = properties.storage().s3();

        S3ClientBuilder builder = S3Client.builder()
                .region(Region.of(s3.region()))
                .credentialsProvider(credentialsProvider(s3));

        // MinIO / OSS 등 S3 호환 엔드포인트
        if (s3.endpoint() != null && !s3.endpoint().isBlank()) {
            builder.endpointOverride(URI.create(s3.endpoint()))
                    .forcePathStyle(true);
        }
        return builder.build();
    }

    private AwsCredentialsProvider credentialsProvider(SandboxManagerProperties.S3 s3) {
        if (s3.accessKeyId() == null || s3.accessKeyId().isBlank()) {
            return DefaultCredentialsProvider.create();
        }
        return StaticCredentialsProvider.create(AwsBasicCredentials.create(s3.accessKeyId(), s3.secretAccessKey()));
    }
}
