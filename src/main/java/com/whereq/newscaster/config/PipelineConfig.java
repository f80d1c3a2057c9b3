package com.whereq.newscaster.config;

import com.whereq.newscaster.client.RenderJobClient;
import com.whereq.newscaster.pipeline.ContentScriptGenerator;
import com.whereq.newscaster.pipeline.PipelineOrchestrator;
import com.whereq.newscaster.pipeline.PrerecordedSpeechSynthesizer;
import com.whereq.newscaster.pipeline.ScriptGenerator;
import com.whereq.newscaster.pipeline.SpeechSynthesizer;
import com.whereq.newscaster.pipeline.Stage;
import com.whereq.newscaster.pipeline.stage.AudioStage;
import com.whereq.newscaster.pipeline.stage.ScriptStage;
import com.whereq.newscaster.pipeline.stage.VideoRenderStage;
import com.whereq.newscaster.polling.JobPoller;
import com.whereq.newscaster.polling.Sleeper;
import com.whereq.newscaster.rehost.ArtifactRehoster;
import com.whereq.newscaster.store.JobRecordStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.List;

/**
 * Stage chain and orchestrator wiring. Script and speech collaborators are
 * optional beans; without them the built-in fallbacks are used.
 */
@Slf4j
@Configuration
public class PipelineConfig {

    @Bean
    public PipelineOrchestrator pipelineOrchestrator(@Qualifier("itemExecutor") ThreadPoolTaskExecutor itemExecutor,
                                                     NewscasterProperties properties, Clock clock) {
        boolean parallel = properties.getPipeline().getParallelism() > 1;
        return new PipelineOrchestrator(parallel ? itemExecutor : null, Sleeper.cancellable(), clock);
    }

    @Bean(name = "stageChain")
    public List<Stage> stageChain(ObjectProvider<ScriptGenerator> scriptGenerator,
                                  ObjectProvider<SpeechSynthesizer> speechSynthesizer,
                                  RenderJobClient renderJobClient,
                                  JobRecordStore jobRecordStore,
                                  JobPoller jobPoller,
                                  @Qualifier("videoRehoster") ArtifactRehoster videoRehoster,
                                  @Qualifier("audioPublisher") ArtifactRehoster audioPublisher,
                                  NewscasterProperties properties,
                                  Clock clock) {
        ScriptGenerator generator = scriptGenerator.getIfAvailable(() -> {
            log.info("No script generator configured, narrating article content as is");
            return new ContentScriptGenerator();
        });
        SpeechSynthesizer synthesizer = speechSynthesizer.getIfAvailable(() -> {
            log.info("No speech synthesizer configured, expecting pre-recorded audio on each item");
            return new PrerecordedSpeechSynthesizer();
        });

        return List.of(
            new ScriptStage(generator),
            new AudioStage(synthesizer, audioPublisher),
            new VideoRenderStage(renderJobClient, jobRecordStore, jobPoller, videoRehoster,
                properties.getRender(), properties.getPolling().toPolicy(), clock));
    }
}
