package com.whereq.newscaster.pipeline;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;

/**
 * Speech audio for a script. Either already reachable at {@code remoteUrl} or
 * written to {@code localFile}, which the audio stage publishes.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SynthesizedAudio {

    private String remoteUrl;

    private Path localFile;

    private String contentType;

    public static SynthesizedAudio remote(String url) {
        return SynthesizedAudio.builder().remoteUrl(url).build();
    }

    public static SynthesizedAudio local(Path file, String contentType) {
        return SynthesizedAudio.builder().localFile(file).contentType(contentType).build();
    }
}
