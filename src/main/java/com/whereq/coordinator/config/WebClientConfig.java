package com.whereq.coordinator.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient configuration for the execution engine and the Kubernetes API
 */
@Configuration
public class WebClientConfig {

    @Bean
    public WebClient.Builder webClientBuilder() {
        return WebClient.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(16 * 1024 * 1024)); // 16MB, workflow status with many nodes
    }

    @Bean
    @Qualifier("engineWebClient")
    public WebClient engineWebClient(WebClient.Builder builder, CoordinatorProperties properties) {
        CoordinatorProperties.EngineConfig engine = properties.getEngine();
        return configure(builder.clone(), engine.getBaseUrl(), engine.getAuthToken());
    }

    @Bean
    @Qualifier("clusterWebClient")
    public WebClient clusterWebClient(WebClient.Builder builder, CoordinatorProperties properties) {
        CoordinatorProperties.ClusterConfig cluster = properties.getCluster();
        return configure(builder.clone(), cluster.getBaseUrl(), cluster.getAuthToken());
    }

    private WebClient configure(WebClient.Builder builder, String baseUrl, String authToken) {
        builder.baseUrl(baseUrl)
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        if (authToken != null && !authToken.isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + authToken);
        }
        return builder.build();
    }
}
