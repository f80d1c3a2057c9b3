package com.whereq.newscaster.rehost;

import com.whereq.newscaster.exception.RehostException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Copies artifacts produced by the render service, whose URLs may expire, into
 * storage we control. Remote objects are never deleted here.
 */
@Slf4j
public class ArtifactRehoster {

    private static final DateTimeFormatter DATE_PATH = DateTimeFormatter.ofPattern("yyyy/MM/dd").withZone(ZoneOffset.UTC);

    private final WebClient webClient;
    private final ArtifactStorage storage;
    private final String keyPrefix;
    private final Duration downloadTimeout;
    private final Clock clock;

    public ArtifactRehoster(WebClient webClient, ArtifactStorage storage, String keyPrefix,
                            Duration downloadTimeout, Clock clock) {
        this.webClient = webClient;
        this.storage = storage;
        this.keyPrefix = keyPrefix;
        this.downloadTimeout = downloadTimeout;
        this.clock = clock;
    }

    /**
     * Download a remote artifact and upload it to our storage
     *
     * @param remoteUrl   URL reported by the render service
     * @param contentHint content type to use when neither the server nor the extension tells
     * @return stable public URL
     * @throws RehostException when the download or the upload fails
     */
    public String rehost(String remoteUrl, String contentHint) {
        if (remoteUrl == null || remoteUrl.isBlank()) {
            throw new RehostException("No artifact URL to rehost");
        }
        String baseName = baseName(remoteUrl);
        Path tempFile = null;
        try {
            tempFile = Files.createTempFile("rehost-", suffix(baseName));
            String headerType = download(remoteUrl, tempFile);
            String contentType = ContentTypes.resolve(headerType, baseName, contentHint);
            return storage.upload(tempFile, keyFor(baseName), contentType);
        } catch (RehostException e) {
            throw e;
        } catch (Exception e) {
            log.error("Failed to rehost {}: {}", remoteUrl, e.getMessage());
            throw new RehostException("Failed to rehost " + remoteUrl + ": " + e.getMessage(), e);
        } finally {
            deleteQuietly(tempFile);
        }
    }

    /**
     * Upload a locally produced artifact, e.g. synthesized audio
     *
     * @return stable public URL
     */
    public String publish(Path localFile, String contentHint) {
        if (localFile == null || !Files.isRegularFile(localFile)) {
            throw new RehostException("Artifact file does not exist: " + localFile);
        }
        String baseName = localFile.getFileName().toString();
        String contentType = ContentTypes.resolve(null, baseName, contentHint);
        try {
            return storage.upload(localFile, keyFor(baseName), contentType);
        } catch (RuntimeException e) {
            log.error("Failed to publish {}: {}", localFile, e.getMessage());
            throw new RehostException("Failed to publish " + localFile + ": " + e.getMessage(), e);
        }
    }

    private String download(String remoteUrl, Path target) {
        log.info("Downloading artifact {}", remoteUrl);
        AtomicReference<String> contentType = new AtomicReference<>();

        Flux<DataBuffer> body = webClient.get()
            .uri(URI.create(remoteUrl))
            .exchangeToFlux(response -> {
                if (!response.statusCode().is2xxSuccessful()) {
                    return response.releaseBody()
                        .thenMany(Flux.error(new RehostException(
                            "Download of " + remoteUrl + " returned HTTP " + response.statusCode().value())));
                }
                response.headers().contentType().ifPresent(type -> contentType.set(type.toString()));
                if (contentType.get() == null) {
                    contentType.set(response.headers().asHttpHeaders().getFirst(HttpHeaders.CONTENT_TYPE));
                }
                return response.bodyToFlux(DataBuffer.class);
            });

        DataBufferUtils.write(body, target).block(downloadTimeout);
        log.debug("Artifact {} downloaded to {}", remoteUrl, target);
        return contentType.get();
    }

    String keyFor(String baseName) {
        String datePath = DATE_PATH.format(clock.instant());
        String key = datePath + "/" + UUID.randomUUID() + "-" + baseName;
        return keyPrefix == null || keyPrefix.isBlank() ? key : trimSlashes(keyPrefix) + "/" + key;
    }

    static String baseName(String remoteUrl) {
        String path;
        try {
            path = URI.create(remoteUrl).getPath();
        } catch (IllegalArgumentException e) {
            path = remoteUrl;
        }
        String name = path != null ? FilenameUtils.getName(path) : null;
        if (name == null || name.isBlank()) {
            return "artifact";
        }
        return name.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    private static String suffix(String baseName) {
        String extension = FilenameUtils.getExtension(baseName);
        return extension == null || extension.isEmpty() ? ".tmp" : "." + extension;
    }

    private static String trimSlashes(String value) {
        return value.replaceAll("^/+", "").replaceAll("/+$", "");
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete temp file {}: {}", file, e.getMessage());
        }
    }
}
