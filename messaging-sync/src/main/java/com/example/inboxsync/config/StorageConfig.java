package com.example.inboxsync.config;

import java.net.URI;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;

@Configuration
public class StorageConfig {

    @Bean(destroyMethod = "close")
    public S3Client attachmentCacheS3Client(SyncProperties syncProperties) {
        SyncProperties.Storage storage = syncProperties.getStorage();
        return S3Client.builder()
                .credentialsProvider(credentials(storage))
                .region(Region.of(storage.getRegion()))
                .endpointOverride(URI.create(storage.getEndpoint()))
                .serviceConfiguration(S3Configuration.builder()
                        .pathStyleAccessEnabled(true)
                        .build())
                .build();
    }

    private AwsCredentialsProvider credentials(SyncProperties.Storage storage) {
        if (StringUtils.hasText(storage.getAccessKey()) && StringUtils.hasText(storage.getSecretKey())) {
            return StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(storage.getAccessKey(), storage.getSecretKey()));
        }
        return DefaultCredentialsProvider.create();
    }
}
