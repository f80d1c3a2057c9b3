package com.whereq.newscaster.pipeline;

import com.whereq.newscaster.exception.StageFailureException;
import com.whereq.newscaster.model.WorkItem;

/**
 * Takes the narration from the item's {@value #AUDIO_ATTRIBUTE} attribute,
 * for articles narrated outside this service. Active when no text-to-speech
 * synthesizer is configured.
 */
public class PrerecordedSpeechSynthesizer implements SpeechSynthesizer {

    public static final String AUDIO_ATTRIBUTE = "audio_url";

    @Override
    public SynthesizedAudio synthesize(Script script, WorkItem item) {
        String url = item.getAttributes() != null ? item.getAttributes().get(AUDIO_ATTRIBUTE) : null;
        if (url == null || url.isBlank()) {
            throw new StageFailureException("audio", "Item " + item.getId() + " has no " + AUDIO_ATTRIBUTE
                + " and no speech synthesizer is configured");
        }
        return SynthesizedAudio.remote(url);
    }
}
