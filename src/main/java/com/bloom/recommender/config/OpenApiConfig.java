package com.bloom.recommender.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Bloom Recommender API")
                        .version("0.1.0")
                        .description("Spring Boot WebFlux API for behavioural profiles and personalised multi-source recommendations."));
    }
}
