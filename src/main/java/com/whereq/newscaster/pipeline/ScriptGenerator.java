package com.whereq.newscaster.pipeline;

import com.whereq.newscaster.model.WorkItem;

/**
 * Turns an article into a narration script
 */
@FunctionalInterface
public interface ScriptGenerator {

    Script generate(WorkItem item);
}
