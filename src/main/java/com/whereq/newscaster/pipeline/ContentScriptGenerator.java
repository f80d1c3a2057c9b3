package com.whereq.newscaster.pipeline;

import com.whereq.newscaster.exception.StageFailureException;
import com.whereq.newscaster.model.WorkItem;

/**
 * Uses the article text as the narration script, prefixed with its title.
 * Active when no other generator is configured.
 */
public class ContentScriptGenerator implements ScriptGenerator {

    @Override
    public Script generate(WorkItem item) {
        String content = item.getContent();
        if (content == null || content.isBlank()) {
            throw new StageFailureException("script", "Item " + item.getId() + " has no content");
        }
        String text = item.getTitle() != null && !item.getTitle().isBlank()
            ? item.getTitle().trim() + ". " + content.trim()
            : content.trim();
        return Script.builder().title(item.getTitle()).text(text).build();
    }
}
