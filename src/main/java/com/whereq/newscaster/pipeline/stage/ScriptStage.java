package com.whereq.newscaster.pipeline.stage;

import com.whereq.newscaster.exception.StageFailureException;
import com.whereq.newscaster.model.StageResult;
import com.whereq.newscaster.model.WorkItem;
import com.whereq.newscaster.pipeline.Script;
import com.whereq.newscaster.pipeline.ScriptGenerator;
import com.whereq.newscaster.pipeline.Stage;
import com.whereq.newscaster.pipeline.StageContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Produces the narration script of an item
 */
@Slf4j
@RequiredArgsConstructor
public class ScriptStage implements Stage {

    public static final String NAME = "script";

    private final ScriptGenerator generator;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StageResult execute(WorkItem item, StageContext context) {
        Script script = generator.generate(item);
        if (script == null || script.getText() == null || script.getText().isBlank()) {
            throw new StageFailureException(NAME, "Script generator returned no text for item " + item.getId());
        }
        log.debug("Script for item {}: {} chars", item.getId(), script.getText().length());
        return StageResult.success(NAME, script);
    }
}
