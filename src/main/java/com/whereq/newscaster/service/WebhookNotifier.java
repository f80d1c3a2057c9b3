package com.whereq.newscaster.service;

import com.whereq.newscaster.config.NewscasterProperties;
import com.whereq.newscaster.model.Job;
import com.whereq.newscaster.model.JobStatus;
import com.whereq.newscaster.polling.PollListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Posts a notification to the configured webhook when a job reaches a terminal status
 */
@Slf4j
@Service
public class WebhookNotifier implements PollListener {

    private final WebClient.Builder webClientBuilder;

    private final NewscasterProperties.NotificationConfig config;

    public WebhookNotifier(WebClient.Builder webClientBuilder, NewscasterProperties properties) {
        this.webClientBuilder = webClientBuilder;
        this.config = properties.getNotifications();
    }

    @Override
    public void onTerminal(Job job) {
        notify(job).subscribe();
    }

    /**
     * Notify webhook about a finished job
     *
     * @param job job in terminal status
     * @return Mono that completes when the notification was sent or failed
     */
    public Mono<Void> notify(Job job) {
        String webhookUrl = config.getWebhook();
        if (webhookUrl == null || webhookUrl.isEmpty()) {
            return Mono.empty();
        }

        return webClientBuilder.build()
            .post()
            .uri(webhookUrl)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(buildPayload(job))
            .retrieve()
            .toBodilessEntity()
            .timeout(config.getTimeout())
            .doOnSuccess(response -> log.info("Webhook notification sent for job {}: {} - {}",
                job.getId(), job.getStatus(), response.getStatusCode()))
            .doOnError(error -> log.error("Failed to send webhook notification for job {}: {}",
                job.getId(), error.getMessage()))
            .onErrorResume(e -> Mono.empty()) // the job outcome does not depend on the webhook
            .then();
    }

    Map<String, Object> buildPayload(Job job) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("jobId", job.getId());
        payload.put("status", job.getStatus() != null ? job.getStatus().name() : null);
        payload.put("stage", job.getStage());
        payload.put("itemId", job.getItemId());
        if (job.getStatus() == JobStatus.COMPLETED) {
            payload.put("outputUrl", job.bestOutputUrl());
        }
        if (job.getError() != null) {
            payload.put("error", job.getError().getMessage());
        }
        payload.put("timestamp", System.currentTimeMillis());
        return payload;
    }
}
