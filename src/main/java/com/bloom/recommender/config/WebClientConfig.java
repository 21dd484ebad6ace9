package com.bloom.recommender.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class WebClientConfig {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    @Bean(name = "githubClient")
    public WebClient githubClient(SourceProperties sourceProperties) {
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .build();
        SourceProperties.Github github = sourceProperties.getGithub();
        WebClient.Builder builder = WebClient.builder()
                .baseUrl(github.getBaseUrl())
                .exchangeStrategies(strategies)
                .defaultHeader("User-Agent", "bloom-recommender")
                .defaultHeaders(headers -> headers.setAccept(MediaType.parseMediaTypes("application/vnd.github+json")));
        if (github.getToken() != null && !github.getToken().isBlank()) {
            builder.defaultHeader("Authorization", "Bearer " + github.getToken());
        }
        return builder.build();
    }

    @Bean(name = "clawhubClient")
    public WebClient clawhubClient(SourceProperties sourceProperties) {
        return WebClient.builder()
                .baseUrl(sourceProperties.getClawhub().getBaseUrl())
                .defaultHeader("User-Agent", "bloom-recommender")
                .defaultHeaders(headers -> headers.setAccept(MediaType.parseMediaTypes("application/json")))
                .build();
    }
}
