package com.whereq.newscaster.pipeline.stage;

import com.whereq.newscaster.exception.RehostException;
import com.whereq.newscaster.exception.StageFailureException;
import com.whereq.newscaster.model.StageResult;
import com.whereq.newscaster.model.WorkItem;
import com.whereq.newscaster.pipeline.Script;
import com.whereq.newscaster.pipeline.SpeechSynthesizer;
import com.whereq.newscaster.pipeline.Stage;
import com.whereq.newscaster.pipeline.StageContext;
import com.whereq.newscaster.pipeline.SynthesizedAudio;
import com.whereq.newscaster.rehost.ArtifactRehoster;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Synthesizes speech for the script and copies it to our storage.
 * Output is the audio URL consumed by the video stage.
 */
@Slf4j
@RequiredArgsConstructor
public class AudioStage implements Stage {

    public static final String NAME = "audio";

    private static final String DEFAULT_CONTENT_TYPE = "audio/mpeg";

    private final SpeechSynthesizer synthesizer;

    private final ArtifactRehoster rehoster;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StageResult execute(WorkItem item, StageContext context) {
        Script script = context.output(ScriptStage.NAME, Script.class);
        if (script == null) {
            throw new StageFailureException(NAME, "No script available for item " + item.getId());
        }

        SynthesizedAudio audio = synthesizer.synthesize(script, item);
        if (audio == null) {
            throw new StageFailureException(NAME, "Speech synthesizer returned nothing for item " + item.getId());
        }

        String contentType = audio.getContentType() != null ? audio.getContentType() : DEFAULT_CONTENT_TYPE;
        if (audio.getRemoteUrl() != null && !audio.getRemoteUrl().isBlank()) {
            return rehostRemote(item, audio.getRemoteUrl(), contentType);
        }
        if (audio.getLocalFile() == null) {
            throw new StageFailureException(NAME, "Synthesized audio of item " + item.getId() + " has neither URL nor file");
        }

        String url = rehoster.publish(audio.getLocalFile(), contentType);
        log.info("Published audio of item {} to {}", item.getId(), url);
        return StageResult.success(NAME, url);
    }

    private StageResult rehostRemote(WorkItem item, String remoteUrl, String contentType) {
        try {
            String url = rehoster.rehost(remoteUrl, contentType);
            log.info("Rehosted audio of item {} to {}", item.getId(), url);
            return StageResult.success(NAME, url);
        } catch (RehostException e) {
            // vendor URL works until it expires
            String warning = "Rehost failed, using synthesizer URL: " + e.getMessage();
            log.warn("Audio of item {}: {}", item.getId(), warning);
            StageResult result = StageResult.success(NAME, remoteUrl);
            result.setWarning(warning);
            return result;
        }
    }
}
