package com.whereq.newscaster.client;

import com.whereq.newscaster.model.RenderRequest;
import com.whereq.newscaster.model.StatusPayload;

import java.time.Duration;

/**
 * Transport to the remote render service. Implementations never retry;
 * retry policy belongs to the caller.
 */
public interface RenderJobClient {

    /**
     * Submit a render request
     *
     * @param request render request
     * @return non-empty job id assigned by the service
     * @throws com.whereq.newscaster.exception.ValidationException malformed request (fatal)
     * @throws com.whereq.newscaster.exception.AuthException rejected credentials (fatal)
     * @throws com.whereq.newscaster.exception.TransientNetworkException timeout, connection error or 5xx
     * @throws com.whereq.newscaster.exception.UnexpectedResponseException 2xx without a job id
     */
    String submit(RenderRequest request);

    /**
     * Fetch the current status of a job
     *
     * @param jobId job identifier
     * @param timeout transport timeout of this call
     * @return parsed status
     * @throws com.whereq.newscaster.exception.JobNotFoundException unknown id (fatal for that id)
     */
    StatusPayload fetchStatus(String jobId, Duration timeout);
}
