package com.example.Lily.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI lilyOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Lily API")
                        .version("v1")
                        .description("""
                                PartSelect assistant for refrigerator and dishwasher parts.
                                /api/chat and /api/regenerate stream Server-Sent Events named after the turn stage:
                                start, analysis, retrieval, answer_delta, validation, retry, answer_final or error.
                                """))
                .addTagsItem(new Tag().name("chat").description("Conversation turns, regenerate and reset"));
    }
}
