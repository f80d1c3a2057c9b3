package com.whereq.newscaster.support;

import com.whereq.newscaster.client.RenderJobClient;
import com.whereq.newscaster.exception.RenderJobException;
import com.whereq.newscaster.model.JobStatus;
import com.whereq.newscaster.model.RenderRequest;
import com.whereq.newscaster.model.StatusPayload;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Render client answering status checks from a script of payloads and errors.
 * The last scripted answer repeats once the script is exhausted.
 */
public class ScriptedRenderJobClient implements RenderJobClient {

    private final Deque<Object> answers = new ArrayDeque<>();
    private final List<RenderRequest> submitted = new ArrayList<>();
    private final AtomicInteger statusCalls = new AtomicInteger();
    private final String jobId;
    private RenderJobException submitError;
    private Object last;

    public ScriptedRenderJobClient(String jobId) {
        this.jobId = jobId;
    }

    public ScriptedRenderJobClient thenStatus(JobStatus status) {
        return thenStatus(status, null, null);
    }

    public ScriptedRenderJobClient thenStatus(JobStatus status, String outputUrl, String error) {
        answers.add(StatusPayload.builder()
            .jobId(jobId)
            .status(status)
            .rawStatus(status.name())
            .outputUrl(outputUrl)
            .error(error)
            .build());
        return this;
    }

    public ScriptedRenderJobClient thenFail(RenderJobException error) {
        answers.add(error);
        return this;
    }

    public ScriptedRenderJobClient failSubmit(RenderJobException error) {
        this.submitError = error;
        return this;
    }

    @Override
    public synchronized String submit(RenderRequest request) {
        request.validate();
        submitted.add(request);
        if (submitError != null) {
            throw submitError;
        }
        return jobId;
    }

    @Override
    public synchronized StatusPayload fetchStatus(String id, Duration timeout) {
        statusCalls.incrementAndGet();
        Object answer = answers.isEmpty() ? last : answers.poll();
        last = answer;
        if (answer instanceof RenderJobException) {
            throw (RenderJobException) answer;
        }
        if (answer == null) {
            throw new IllegalStateException("No status scripted for job " + id);
        }
        StatusPayload payload = (StatusPayload) answer;
        return payload.toBuilder().jobId(id).build();
    }

    public int statusCalls() {
        return statusCalls.get();
    }

    public List<RenderRequest> submitted() {
        return submitted;
    }
}
