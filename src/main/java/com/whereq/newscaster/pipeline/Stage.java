package com.whereq.newscaster.pipeline;

import com.whereq.newscaster.model.StageResult;
import com.whereq.newscaster.model.WorkItem;

/**
 * One step of the per-item stage chain
 */
public interface Stage {

    /**
     * Stage name, unique within a chain
     */
    String name();

    /**
     * Run the stage for one item
     *
     * @return the stage result; a failed result stops the chain for this item
     * @throws com.whereq.newscaster.exception.RenderJobException on failure, same effect as a failed result
     */
    StageResult execute(WorkItem item, StageContext context);
}
