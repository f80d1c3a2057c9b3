package com.whereq.newscaster.model;

/**
 * Kinds of asynchronous remote work tracked as jobs
 */
public enum JobKind {
    AUDIO_RENDER,
    VIDEO_RENDER
}
