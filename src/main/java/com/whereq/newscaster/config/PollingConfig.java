package com.whereq.newscaster.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.whereq.newscaster.client.HttpRenderJobClient;
import com.whereq.newscaster.client.RenderJobClient;
import com.whereq.newscaster.polling.CompositePollListener;
import com.whereq.newscaster.polling.JobPoller;
import com.whereq.newscaster.polling.MetricsPollListener;
import com.whereq.newscaster.polling.PollListener;
import com.whereq.newscaster.polling.Sleeper;
import com.whereq.newscaster.store.JobRecordStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.List;

/**
 * Render client, poller and its listeners
 */
@Configuration
public class PollingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RenderJobClient renderJobClient(@Qualifier("renderWebClient") WebClient renderWebClient,
                                           ObjectMapper objectMapper, NewscasterProperties properties) {
        return new HttpRenderJobClient(renderWebClient, objectMapper, properties.getRender().getSubmitTimeout());
    }

    @Bean
    public MetricsPollListener metricsPollListener(MeterRegistry meterRegistry) {
        return new MetricsPollListener(meterRegistry);
    }

    @Bean
    public JobPoller jobPoller(RenderJobClient renderJobClient, JobRecordStore jobRecordStore,
                               List<PollListener> listeners, Clock clock) {
        return new JobPoller(renderJobClient, jobRecordStore, Sleeper.cancellable(), clock,
            new CompositePollListener(listeners));
    }
}
