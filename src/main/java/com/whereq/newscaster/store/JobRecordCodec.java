package com.whereq.newscaster.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.whereq.newscaster.exception.JobStoreException;
import com.whereq.newscaster.model.Job;

/**
 * JSON form of a job record:
 * {@code {id, kind, created_at, last_checked, status, attempts, inputs, remote_output_url, rehosted_url, error, data}}
 */
public class JobRecordCodec {

    private final ObjectMapper objectMapper;

    public JobRecordCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public String encode(Job job) {
        try {
            return objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new JobStoreException("Failed to serialize job " + job.getId(), e);
        }
    }

    public Job decode(String json) {
        try {
            return objectMapper.readValue(json, Job.class);
        } catch (JsonProcessingException e) {
            throw new JobStoreException("Failed to deserialize job record", e);
        }
    }
}
