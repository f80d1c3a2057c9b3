package com.whereq.newscaster.pipeline.stage;

import com.whereq.newscaster.client.RenderJobClient;
import com.whereq.newscaster.config.NewscasterProperties;
import com.whereq.newscaster.exception.PollingTimeoutException;
import com.whereq.newscaster.exception.RehostException;
import com.whereq.newscaster.exception.RemoteJobFailureException;
import com.whereq.newscaster.exception.RenderJobException;
import com.whereq.newscaster.exception.StageFailureException;
import com.whereq.newscaster.exception.UnexpectedResponseException;
import com.whereq.newscaster.model.Job;
import com.whereq.newscaster.model.JobKind;
import com.whereq.newscaster.model.JobStatus;
import com.whereq.newscaster.model.PollingPolicy;
import com.whereq.newscaster.model.RenderInput;
import com.whereq.newscaster.model.RenderRequest;
import com.whereq.newscaster.model.StageResult;
import com.whereq.newscaster.model.WorkItem;
import com.whereq.newscaster.pipeline.Stage;
import com.whereq.newscaster.pipeline.StageContext;
import com.whereq.newscaster.polling.JobPoller;
import com.whereq.newscaster.rehost.ArtifactRehoster;
import com.whereq.newscaster.store.JobRecordStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Lip-syncs the item's audio onto the avatar template: submit, record,
 * poll to completion, then copy the output to our storage.
 */
@Slf4j
public class VideoRenderStage implements Stage {

    public static final String NAME = "video";

    /**
     * Item attribute overriding the configured video template
     */
    public static final String TEMPLATE_ATTRIBUTE = "video_template_url";

    private static final String VIDEO_CONTENT_TYPE = "video/mp4";

    private final RenderJobClient client;
    private final JobRecordStore store;
    private final JobPoller poller;
    private final ArtifactRehoster rehoster;
    private final NewscasterProperties.RenderConfig render;
    private final PollingPolicy policy;
    private final Clock clock;

    public VideoRenderStage(RenderJobClient client, JobRecordStore store, JobPoller poller, ArtifactRehoster rehoster,
                            NewscasterProperties.RenderConfig render, PollingPolicy policy, Clock clock) {
        this.client = client;
        this.store = store;
        this.poller = poller;
        this.rehoster = rehoster;
        this.render = render;
        this.policy = policy;
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StageResult execute(WorkItem item, StageContext context) {
        String audioUrl = context.output(AudioStage.NAME, String.class);
        if (audioUrl == null) {
            throw new StageFailureException(NAME, "No audio available for item " + item.getId());
        }
        String templateUrl = templateFor(item);
        if (templateUrl == null) {
            throw new StageFailureException(NAME, "No video template configured for item " + item.getId());
        }

        RenderRequest request = RenderRequest.builder()
            .model(render.getModel())
            .input(List.of(RenderInput.video(templateUrl), RenderInput.audio(audioUrl)))
            .options(new LinkedHashMap<>(render.getOptions()))
            .kind(JobKind.VIDEO_RENDER)
            .build();

        String jobId;
        try {
            jobId = client.submit(request);
        } catch (RenderJobException e) {
            throw e.withStage(NAME);
        }

        Job submitted = Job.submitted(jobId, JobKind.VIDEO_RENDER, request.getInput(), clock.instant());
        submitted.setItemId(item.getId());
        submitted.setStage(NAME);
        store.save(submitted);
        log.info("Submitted video render {} for item {} (run {})", jobId, item.getId(), context.getRunId());

        Job done = poller.run(jobId, policy, context.getToken());

        if (done.getStatus() == JobStatus.POLLING_TIMEOUT) {
            throw new PollingTimeoutException(done);
        }
        if (done.getStatus().isFailure()) {
            throw new RemoteJobFailureException(done);
        }
        if (done.getRemoteOutputUrl() == null) {
            throw new UnexpectedResponseException("Job " + jobId + " completed without an output URL")
                .withJobId(jobId).withStage(NAME);
        }

        String warning = null;
        try {
            String stableUrl = rehoster.rehost(done.getRemoteOutputUrl(), VIDEO_CONTENT_TYPE);
            done = store.update(jobId, job -> job.setRehostedUrl(stableUrl));
        } catch (RehostException e) {
            // remote URL stays usable until it expires
            warning = "Rehost failed, using remote output URL: " + e.getMessage();
            log.warn("Job {} of item {}: {}", jobId, item.getId(), warning);
        }

        return StageResult.builder()
            .stage(NAME)
            .success(true)
            .output(done.bestOutputUrl())
            .job(done)
            .warning(warning)
            .build();
    }

    private String templateFor(WorkItem item) {
        if (item.getAttributes() != null) {
            String override = item.getAttributes().get(TEMPLATE_ATTRIBUTE);
            if (override != null && !override.isBlank()) {
                return override;
            }
        }
        String configured = render.getVideoTemplateUrl();
        return configured == null || configured.isBlank() ? null : configured;
    }
}
