package com.whereq.newscaster.pipeline;

import com.whereq.newscaster.model.WorkItem;

/**
 * Text-to-speech for a narration script
 */
@FunctionalInterface
public interface SpeechSynthesizer {

    SynthesizedAudio synthesize(Script script, WorkItem item);
}
