package com.hockey.prediction.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI predictionOpenApi(@Value("${server.port:8082}") int port) {
        return new OpenAPI()
                .info(new Info()
                        .title("Hockey Prediction API")
                        .version("1.0.0")
                        .description("Ranks the players most likely to score on a slate of games. "
                                + "Each forecast carries a composite score, a confidence tier and the six factor scores behind it.")
                        .contact(new Contact().name("Hockey Prediction").email("prediction@example.com")))
                .tags(List.of(
                        new Tag().name("Predictions").description("Slate, matchup and player rankings; scoring models"),
                        new Tag().name("Health").description("API health and status")
                ))
                .servers(List.of(
                        new Server().url("http://localhost:" + port).description("Local Development"),
                        new Server().url("http://prediction-api:8080").description("Docker")
                ));
    }
}
