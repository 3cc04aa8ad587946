package com.goormthonuniv.credibility.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Source Credibility API")
                        .description("매체별 베이지안 신뢰도 등급/추세 조회 API")
                        .version("v0.1.0"));
    }
}
