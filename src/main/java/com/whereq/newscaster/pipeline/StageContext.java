package com.whereq.newscaster.pipeline;

import com.whereq.newscaster.model.StageResult;
import com.whereq.newscaster.polling.CancellationToken;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-item state shared along the stage chain: run id, cancellation token and
 * the results of the stages that already ran for the same item
 */
@Getter
public class StageContext {

    private final String runId;

    private final CancellationToken token;

    private final Map<String, StageResult> results = new LinkedHashMap<>();

    public StageContext(String runId, CancellationToken token) {
        this.runId = runId;
        this.token = token != null ? token : CancellationToken.none();
    }

    public Optional<StageResult> result(String stage) {
        return Optional.ofNullable(results.get(stage));
    }

    /**
     * Output of an earlier successful stage
     *
     * @return the output, or null when the stage did not run, failed or produced another type
     */
    public <T> T output(String stage, Class<T> type) {
        StageResult result = results.get(stage);
        return result != null && result.isSuccess() ? result.outputAs(type) : null;
    }

    public Map<String, StageResult> getResults() {
        return Collections.unmodifiableMap(results);
    }

    void record(StageResult result) {
        results.put(result.getStage(), result);
    }
}
