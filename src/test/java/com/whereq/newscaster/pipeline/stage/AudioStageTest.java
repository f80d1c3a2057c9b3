package com.whereq.newscaster.pipeline.stage;

import com.whereq.newscaster.exception.RehostException;
import com.whereq.newscaster.exception.StageFailureException;
import com.whereq.newscaster.model.StageResult;
import com.whereq.newscaster.model.WorkItem;
import com.whereq.newscaster.pipeline.PrerecordedSpeechSynthesizer;
import com.whereq.newscaster.pipeline.Script;
import com.whereq.newscaster.pipeline.SynthesizedAudio;
import com.whereq.newscaster.rehost.ArtifactRehoster;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.Map;

import static com.whereq.newscaster.pipeline.StageContextFixtures.contextWith;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AudioStageTest {

    private static final Script SCRIPT = Script.builder().title("Rates hold").text("Rates hold. The bank...").build();

    @Mock
    private ArtifactRehoster rehoster;

    private final WorkItem item = WorkItem.builder().id("story-1").title("Rates hold").build();

    private static StageResult script() {
        return StageResult.success(ScriptStage.NAME, SCRIPT);
    }

    @Test
    @DisplayName("Audio returned by URL is copied to our storage")
    void remoteAudioIsRehosted() {
        // given
        when(rehoster.rehost("https://vendor.example/tmp/a.mp3?exp=1", "audio/mpeg"))
            .thenReturn("https://cdn.example.com/audio/2024/05/01/x-a.mp3");
        AudioStage stage = new AudioStage((script, workItem) -> SynthesizedAudio.remote("https://vendor.example/tmp/a.mp3?exp=1"), rehoster);

        // when
        StageResult result = stage.execute(item, contextWith(script()));

        // then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getOutput()).isEqualTo("https://cdn.example.com/audio/2024/05/01/x-a.mp3");
        assertThat(result.getWarning()).isNull();
    }

    @Test
    @DisplayName("Failed audio rehost keeps the synthesizer URL and adds a warning")
    void remoteAudioRehostFailure() {
        // given
        when(rehoster.rehost(anyString(), anyString())).thenThrow(new RehostException("bucket missing"));
        AudioStage stage = new AudioStage((script, workItem) -> SynthesizedAudio.remote("https://vendor.example/tmp/a.mp3?exp=1"), rehoster);

        // when
        StageResult result = stage.execute(item, contextWith(script()));

        // then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getOutput()).isEqualTo("https://vendor.example/tmp/a.mp3?exp=1");
        assertThat(result.getWarning()).contains("bucket missing");
        verify(rehoster, never()).publish(any(Path.class), anyString());
    }

    @Test
    @DisplayName("Local audio is published and its URL returned")
    void localAudioIsPublished() {
        // given
        Path file = Path.of("/tmp/story-1.wav");
        when(rehoster.publish(file, "audio/wav")).thenReturn("https://cdn.example.com/audio/story-1.wav");
        AudioStage stage = new AudioStage((script, workItem) -> SynthesizedAudio.local(file, "audio/wav"), rehoster);

        // when
        StageResult result = stage.execute(item, contextWith(script()));

        // then
        assertThat(result.getOutput()).isEqualTo("https://cdn.example.com/audio/story-1.wav");
    }

    @Test
    @DisplayName("Local audio without a content type is published as mpeg")
    void defaultContentType() {
        Path file = Path.of("/tmp/story-1.mp3");
        when(rehoster.publish(file, "audio/mpeg")).thenReturn("https://cdn.example.com/audio/story-1.mp3");
        AudioStage stage = new AudioStage((script, workItem) -> SynthesizedAudio.local(file, null), rehoster);

        assertThat(stage.execute(item, contextWith(script())).getOutput()).isEqualTo("https://cdn.example.com/audio/story-1.mp3");
    }

    @Test
    @DisplayName("Synthesizer receives the script produced by the previous stage")
    void usesScriptOutput() {
        // given
        String expected = "https://tts.example.com/" + SCRIPT.getText().length();
        when(rehoster.rehost(anyString(), anyString())).thenAnswer(invocation -> invocation.getArgument(0));
        AudioStage stage = new AudioStage((script, workItem) -> SynthesizedAudio.remote("https://tts.example.com/" + script.getText().length()), rehoster);

        // when
        StageResult result = stage.execute(item, contextWith(script()));

        // then
        assertThat(result.getOutput()).isEqualTo(expected);
    }

    @Test
    @DisplayName("Fails without a script or with empty synthesizer output")
    void failures() {
        AudioStage nothing = new AudioStage((script, workItem) -> SynthesizedAudio.builder().build(), rehoster);

        assertThatThrownBy(() -> nothing.execute(item, contextWith()))
            .isInstanceOf(StageFailureException.class)
            .hasMessageContaining("No script");
        assertThatThrownBy(() -> nothing.execute(item, contextWith(script())))
            .isInstanceOf(StageFailureException.class)
            .hasMessageContaining("neither URL nor file");
    }

    @Test
    @DisplayName("Publish failures propagate as rehost errors")
    void publishFailure() {
        Path file = Path.of("/tmp/story-1.mp3");
        when(rehoster.publish(file, "audio/mpeg")).thenThrow(new RehostException("bucket missing"));
        AudioStage stage = new AudioStage((script, workItem) -> SynthesizedAudio.local(file, "audio/mpeg"), rehoster);

        assertThatThrownBy(() -> stage.execute(item, contextWith(script()))).isInstanceOf(RehostException.class);
    }

    @Test
    @DisplayName("Prerecorded narration comes from the item attribute and is rehosted")
    void prerecordedSynthesizer() {
        // given
        when(rehoster.rehost("https://cdn.example.com/voice/story-2.mp3", "audio/mpeg"))
            .thenReturn("https://cdn.example.com/audio/2024/05/01/x-story-2.mp3");
        AudioStage stage = new AudioStage(new PrerecordedSpeechSynthesizer(), rehoster);
        WorkItem narrated = WorkItem.builder()
            .id("story-2")
            .attributes(Map.of(PrerecordedSpeechSynthesizer.AUDIO_ATTRIBUTE, "https://cdn.example.com/voice/story-2.mp3"))
            .build();

        // when / then
        assertThat(stage.execute(narrated, contextWith(script())).getOutput())
            .isEqualTo("https://cdn.example.com/audio/2024/05/01/x-story-2.mp3");
        assertThatThrownBy(() -> stage.execute(item, contextWith(script())))
            .isInstanceOf(StageFailureException.class)
            .hasMessageContaining(PrerecordedSpeechSynthesizer.AUDIO_ATTRIBUTE);
    }
}
