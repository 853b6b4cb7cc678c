package com.hockey.prediction;

import com.hockey.prediction.config.PredictionProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(PredictionProperties.class)
public class PredictionApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(PredictionApiApplication.class, args);
    }
}
