package com.whereq.newscaster.rehost;

import com.whereq.newscaster.exception.RehostException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ArtifactRehosterTest {

    private static final String REMOTE_URL = "https://render.example.com/outputs/abc123.mp4?sig=expiring";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private ArtifactStorage storage;

    private final AtomicReference<Path> uploadedFile = new AtomicReference<>();
    private final AtomicReference<String> uploadedContent = new AtomicReference<>();

    @BeforeEach
    void captureUploads() {
        lenient().when(storage.upload(any(Path.class), anyString(), anyString())).thenAnswer(invocation -> {
            Path file = invocation.getArgument(0);
            uploadedFile.set(file);
            uploadedContent.set(Files.readString(file, StandardCharsets.UTF_8));
            return "https://newscaster.s3.us-west-2.amazonaws.com/" + invocation.getArgument(1);
        });
    }

    private ArtifactRehoster rehoster(HttpStatus status, String contentType, String body) {
        WebClient webClient = WebClient.builder()
            .exchangeFunction(request -> {
                ClientResponse.Builder response = ClientResponse.create(status);
                if (contentType != null) {
                    response.header(HttpHeaders.CONTENT_TYPE, contentType);
                }
                return Mono.just(response.body(body).build());
            })
            .build();
        return new ArtifactRehoster(webClient, storage, "videos", Duration.ofSeconds(5), CLOCK);
    }

    @Test
    @DisplayName("Artifact is streamed to storage under a dated, unique key")
    void rehostUploadsUnderDatedKey() {
        // given
        ArtifactRehoster rehoster = rehoster(HttpStatus.OK, "video/mp4", "fake-mp4-bytes");

        // when
        String url = rehoster.rehost(REMOTE_URL, null);

        // then
        assertThat(url).matches("https://newscaster\\.s3\\.us-west-2\\.amazonaws\\.com/videos/2024/05/01/[0-9a-f-]{36}-abc123\\.mp4");
        assertThat(uploadedContent.get()).isEqualTo("fake-mp4-bytes");
        verify(storage).upload(any(Path.class), anyString(), eq("video/mp4"));
        assertThat(Files.exists(uploadedFile.get())).isFalse();
    }

    @Test
    @DisplayName("Two rehosts of the same artifact never share a key")
    void keysAreUnique() {
        ArtifactRehoster rehoster = rehoster(HttpStatus.OK, "video/mp4", "bytes");

        String first = rehoster.rehost(REMOTE_URL, null);
        String second = rehoster.rehost(REMOTE_URL, null);

        assertThat(first).isNotEqualTo(second);
    }

    @Test
    @DisplayName("Without a Content-Type header the extension decides")
    void contentTypeFromExtension() {
        // given
        ArtifactRehoster rehoster = rehoster(HttpStatus.OK, null, "bytes");

        // when
        rehoster.rehost("https://render.example.com/outputs/clip.webm", "video/mp4");

        // then
        verify(storage).upload(any(Path.class), anyString(), eq("video/webm"));
    }

    @Test
    @DisplayName("Generic server content type falls back to the hint for unknown extensions")
    void contentTypeFromHint() {
        ArtifactRehoster rehoster = rehoster(HttpStatus.OK, "application/octet-stream", "bytes");

        rehoster.rehost("https://render.example.com/outputs/result", "video/mp4");

        verify(storage).upload(any(Path.class), anyString(), eq("video/mp4"));
    }

    @Test
    @DisplayName("Failed download raises RehostException without uploading")
    void downloadFailure() {
        ArtifactRehoster rehoster = rehoster(HttpStatus.FORBIDDEN, "text/plain", "expired");

        assertThatThrownBy(() -> rehoster.rehost(REMOTE_URL, "video/mp4"))
            .isInstanceOf(RehostException.class)
            .hasMessageContaining("403");
        verify(storage, never()).upload(any(Path.class), anyString(), anyString());
    }

    @Test
    @DisplayName("Failed upload raises RehostException and removes the temp file")
    void uploadFailure() {
        // given
        ArtifactRehoster rehoster = rehoster(HttpStatus.OK, "video/mp4", "bytes");
        when(storage.upload(any(Path.class), anyString(), anyString())).thenAnswer(invocation -> {
            uploadedFile.set(invocation.getArgument(0));
            throw new IllegalStateException("Access Denied");
        });

        // when / then
        assertThatThrownBy(() -> rehoster.rehost(REMOTE_URL, "video/mp4"))
            .isInstanceOf(RehostException.class)
            .hasMessageContaining("Access Denied");
        assertThat(Files.exists(uploadedFile.get())).isFalse();
    }

    @Test
    @DisplayName("Missing URL is rejected")
    void missingUrl() {
        ArtifactRehoster rehoster = rehoster(HttpStatus.OK, "video/mp4", "bytes");

        assertThatThrownBy(() -> rehoster.rehost(null, "video/mp4")).isInstanceOf(RehostException.class);
        assertThatThrownBy(() -> rehoster.rehost(" ", "video/mp4")).isInstanceOf(RehostException.class);
    }

    @Test
    @DisplayName("Local artifacts are published through the same storage")
    void publishLocalFile(@TempDir Path dir) throws Exception {
        // given
        Path audio = dir.resolve("narration.mp3");
        Files.writeString(audio, "id3-bytes", StandardCharsets.UTF_8);
        ArtifactRehoster publisher = rehoster(HttpStatus.OK, null, "");

        // when
        String url = publisher.publish(audio, "audio/wav");

        // then
        assertThat(url).contains("/videos/2024/05/01/").endsWith("-narration.mp3");
        verify(storage).upload(eq(audio), anyString(), eq("audio/mpeg"));
        assertThat(Files.exists(audio)).isTrue();
    }

    @Test
    @DisplayName("Publishing a missing file fails")
    void publishMissingFile(@TempDir Path dir) {
        ArtifactRehoster publisher = rehoster(HttpStatus.OK, null, "");

        assertThatThrownBy(() -> publisher.publish(dir.resolve("nothing.mp3"), "audio/mpeg"))
            .isInstanceOf(RehostException.class);
    }

    @Test
    @DisplayName("Base names are taken from the URL path and made key-safe")
    void baseNames() {
        assertThat(ArtifactRehoster.baseName(REMOTE_URL)).isEqualTo("abc123.mp4");
        assertThat(ArtifactRehoster.baseName("https://render.example.com/")).isEqualTo("artifact");
        assertThat(ArtifactRehoster.baseName("https://render.example.com/a%20b.mp4")).isEqualTo("a_b.mp4");
    }
}
