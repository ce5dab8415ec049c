package com.autoheal.config;

import com.autoheal.llm.LLMClientFactory;
import com.autoheal.llm.ModelClient;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

@Configuration
public class AutoHealConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder.build();
    }

    /** The backend chain is resolved once here; nothing re-selects it per call. */
    @Bean
    public ModelClient modelClient(AutoHealProperties properties,
                                   WebClient.Builder webClientBuilder,
                                   RestTemplate restTemplate,
                                   ObjectMapper objectMapper) {
        return new LLMClientFactory(
                properties.getModel(), webClientBuilder, restTemplate, objectMapper, System::getenv
        ).create();
    }
}
