package com.whereq.newscaster.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient configuration for the render service, artifact downloads and webhook notifications
 */
@Configuration
public class WebClientConfig {

    @Bean
    public WebClient.Builder webClientBuilder() {
        return WebClient.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(16 * 1024 * 1024)); // 16MB
    }

    /**
     * Client bound to the render API, authenticated with x-api-key
     */
    @Bean
    public WebClient renderWebClient(WebClient.Builder webClientBuilder, NewscasterProperties properties) {
        NewscasterProperties.RenderConfig render = properties.getRender();
        WebClient.Builder builder = webClientBuilder.clone().baseUrl(render.getBaseUrl());
        if (render.getApiKey() != null && !render.getApiKey().isBlank()) {
            builder.defaultHeader("x-api-key", render.getApiKey());
        }
        return builder.build();
    }

    /**
     * Client for artifact downloads; artifacts are streamed, never buffered in memory
     */
    @Bean
    public WebClient artifactWebClient(WebClient.Builder webClientBuilder) {
        return webClientBuilder.clone().build();
    }
}
