package com.whereq.newscaster.config;

import com.whereq.newscaster.rehost.ArtifactRehoster;
import com.whereq.newscaster.rehost.ArtifactStorage;
import com.whereq.newscaster.rehost.S3ArtifactStorage;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;

import java.net.URI;
import java.time.Clock;

/**
 * Artifact storage: S3 client, storage and the rehosters for each artifact kind
 */
@Configuration
public class StorageConfig {

    @Bean(destroyMethod = "close")
    public S3Client s3Client(NewscasterProperties properties) {
        NewscasterProperties.StorageConfig storage = properties.getStorage();

        S3ClientBuilder builder = S3Client.builder()
            .region(Region.of(storage.getRegion()));

        if (storage.getAccessKey() != null && !storage.getAccessKey().isBlank()) {
            builder.credentialsProvider(StaticCredentialsProvider.create(
                AwsBasicCredentials.create(storage.getAccessKey(), storage.getSecretKey())));
        } else {
            builder.credentialsProvider(DefaultCredentialsProvider.create());
        }

        // S3-compatible stores (R2, MinIO) need path-style access
        if (storage.getEndpoint() != null && !storage.getEndpoint().isBlank()) {
            builder.endpointOverride(URI.create(storage.getEndpoint()))
                .serviceConfiguration(S3Configuration.builder()
                    .pathStyleAccessEnabled(true)
                    .build());
        }
        return builder.build();
    }

    @Bean
    public ArtifactStorage artifactStorage(S3Client s3Client, NewscasterProperties properties) {
        NewscasterProperties.StorageConfig storage = properties.getStorage();
        return new S3ArtifactStorage(s3Client, storage.getBucket(), storage.getRegion(), storage.getPublicBaseUrl());
    }

    @Bean
    public ArtifactRehoster videoRehoster(@Qualifier("artifactWebClient") WebClient artifactWebClient,
                                          ArtifactStorage artifactStorage, NewscasterProperties properties,
                                          Clock clock) {
        NewscasterProperties.StorageConfig storage = properties.getStorage();
        return new ArtifactRehoster(artifactWebClient, artifactStorage, storage.getVideoPrefix(),
            storage.getDownloadTimeout(), clock);
    }

    @Bean
    public ArtifactRehoster audioPublisher(@Qualifier("artifactWebClient") WebClient artifactWebClient,
                                           ArtifactStorage artifactStorage, NewscasterProperties properties,
                                           Clock clock) {
        NewscasterProperties.StorageConfig storage = properties.getStorage();
        return new ArtifactRehoster(artifactWebClient, artifactStorage, storage.getAudioPrefix(),
            storage.getDownloadTimeout(), clock);
    }
}
