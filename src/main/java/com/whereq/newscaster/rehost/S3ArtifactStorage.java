package com.whereq.newscaster.rehost;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.nio.file.Path;

/**
 * S3 (or S3-compatible) artifact storage
 */
@Slf4j
public class S3ArtifactStorage implements ArtifactStorage {

    private final S3Client s3Client;
    private final String bucket;
    private final String region;
    private final String publicBaseUrl;

    public S3ArtifactStorage(S3Client s3Client, String bucket, String region, String publicBaseUrl) {
        this.s3Client = s3Client;
        this.bucket = bucket;
        this.region = region;
        this.publicBaseUrl = publicBaseUrl;
        if (isConfigured()) {
            log.info("Initialized artifact storage for bucket: {}", bucket);
        } else {
            log.warn("No storage bucket configured, artifacts will keep their remote URLs");
        }
    }

    @Override
    public String upload(Path file, String key, String contentType) {
        if (!isConfigured()) {
            throw new IllegalStateException("Storage bucket is not configured");
        }
        log.info("Uploading {} to s3://{}/{} ({})", file.getFileName(), bucket, key, contentType);

        PutObjectRequest putObjectRequest = PutObjectRequest.builder()
            .bucket(bucket)
            .key(key)
            .contentType(contentType)
            .build();

        s3Client.putObject(putObjectRequest, RequestBody.fromFile(file));

        String url = publicUrl(key);
        log.info("Artifact uploaded: {}", url);
        return url;
    }

    public boolean isConfigured() {
        return bucket != null && !bucket.isBlank();
    }

    String publicUrl(String key) {
        if (publicBaseUrl != null && !publicBaseUrl.isBlank()) {
            String base = publicBaseUrl.endsWith("/") ? publicBaseUrl.substring(0, publicBaseUrl.length() - 1) : publicBaseUrl;
            return base + "/" + key;
        }
        return "https://" + bucket + ".s3." + region + ".amazonaws.com/" + key;
    }
}
