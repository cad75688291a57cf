package com.example.Lily;

import com.example.Lily.agent.SessionRegistry;
import com.example.Lily.config.LilyProperties;
import com.example.Lily.tools.ToolRegistry;
import io.swagger.v3.oas.models.OpenAPI;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(
        properties = {
                "spring.ai.model.chat=none",
                "spring.ai.model.embedding=none",
                "spring.ai.openai.api-key=test",
                "spring.datasource.url=jdbc:h2:mem:testdb;DB_CLOSE_DELAY=-1;MODE=PostgreSQL",
                "spring.datasource.driver-class-name=org.h2.Driver",
                "spring.datasource.username=sa",
                "spring.datasource.password=",
                "spring.sql.init.mode=never"
        }
)
@ActiveProfiles("test")
@Import(LilyApplicationTests.TestAiConfiguration.class)
class LilyApplicationTests {

    @Autowired
    private ToolRegistry toolRegistry;

    @Autowired
    private SessionRegistry sessionRegistry;

    @Autowired
    private LilyProperties properties;

    @Autowired
    private OpenAPI openApi;

    @Test
    void contextLoads() {
        assertTrue(toolRegistry.findByName("searchRAG").isPresent());
        assertTrue(toolRegistry.findByName("queryParts").isPresent());
        assertEquals("default", sessionRegistry.getOrCreate("default").id());
        assertEquals(2, properties.getAgent().getMaxRetries());
        assertEquals("Lily API", openApi.getInfo().getTitle());
    }

    @TestConfiguration
    static class TestAiConfiguration {
        @Bean
        EmbeddingModel embeddingModel() {
            return Mockito.mock(EmbeddingModel.class);
        }

        @Bean
        OpenAiChatModel openAiChatModel() {
            return Mockito.mock(OpenAiChatModel.class);
        }
    }
}
