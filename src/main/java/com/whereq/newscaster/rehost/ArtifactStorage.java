package com.whereq.newscaster.rehost;

import java.nio.file.Path;

/**
 * Durable blob storage we control
 */
public interface ArtifactStorage {

    /**
     * Upload a local file
     *
     * @return public URL of the stored object
     */
    String upload(Path file, String key, String contentType);
}
