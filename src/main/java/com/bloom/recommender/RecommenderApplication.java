package com.bloom.recommender;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RecommenderApplication {
    public static void main(String[] args) {
        SpringApplication.run(RecommenderApplication.class, args);
    }
}
