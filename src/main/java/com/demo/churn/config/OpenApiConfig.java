package com.demo.churn.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI churnOpenAPI() {
        return new OpenAPI().info(new Info()
                .title("Churn AI Monitor API")
                .description("Scoring, explanations, batch jobs, model health and alerts")
                .version("v1"));
    }
}
