package com.whereq.newscaster.service;

import com.whereq.newscaster.config.NewscasterProperties;
import com.whereq.newscaster.exception.RehostException;
import com.whereq.newscaster.model.Job;
import com.whereq.newscaster.model.JobStatus;
import com.whereq.newscaster.model.PollingPolicy;
import com.whereq.newscaster.polling.CancellationToken;
import com.whereq.newscaster.polling.JobPoller;
import com.whereq.newscaster.rehost.ArtifactRehoster;
import com.whereq.newscaster.store.JobRecordStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

/**
 * Out-of-band access to tracked jobs: inspection, one-off refresh and
 * resuming jobs whose polling budget ran out
 */
@Slf4j
@Service
public class JobTrackingService {

    private static final String VIDEO_CONTENT_TYPE = "video/mp4";

    private final JobRecordStore store;
    private final JobPoller poller;
    private final ArtifactRehoster rehoster;
    private final PollingPolicy policy;

    public JobTrackingService(JobRecordStore store, JobPoller poller,
                              @Qualifier("videoRehoster") ArtifactRehoster rehoster,
                              NewscasterProperties properties) {
        this.store = store;
        this.poller = poller;
        this.rehoster = rehoster;
        this.policy = properties.getPolling().toPolicy();
    }

    public Job get(String jobId) {
        return store.load(jobId);
    }

    /**
     * All tracked jobs, newest first
     */
    public List<Job> list() {
        return store.list().stream()
            .sorted(Comparator.comparing(Job::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder())))
            .toList();
    }

    /**
     * Check the remote status once and persist it
     */
    public Job refresh(String jobId) {
        return poller.refresh(jobId, policy.getPerCallTimeout());
    }

    /**
     * Continue polling a job with the configured policy
     */
    public Job resume(String jobId, CancellationToken token) {
        return resume(jobId, policy, token);
    }

    /**
     * Continue polling a job, e.g. after a polling timeout, and copy the
     * output to our storage if it completed without having been rehosted
     */
    public Job resume(String jobId, PollingPolicy resumePolicy, CancellationToken token) {
        log.info("Resuming job {}", jobId);
        Job job = poller.run(jobId, resumePolicy, token);
        if (job.getStatus() != JobStatus.COMPLETED || job.getRehostedUrl() != null || job.getRemoteOutputUrl() == null) {
            return job;
        }
        try {
            String stableUrl = rehoster.rehost(job.getRemoteOutputUrl(), VIDEO_CONTENT_TYPE);
            return store.update(jobId, j -> j.setRehostedUrl(stableUrl));
        } catch (RehostException e) {
            log.warn("Job {} completed but rehost failed, keeping remote output URL: {}", jobId, e.getMessage());
            return job;
        }
    }
}
