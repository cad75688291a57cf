package com.example.Lily.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "lily")
public class LilyProperties {

    private Agent agent = new Agent();
    private History history = new History();
    private Retrieval retrieval = new Retrieval();

    @Data
    public static class Agent {
        /** Extra draft attempts allowed after the first rejected draft. */
        private int maxRetries = 2;
        private Duration toolTimeout = Duration.ofSeconds(10);
        private Duration modelTimeout = Duration.ofSeconds(60);
        private Duration turnTimeout = Duration.ofSeconds(120);
        private int maxToolCalls = 4;
        private String analyzerModel = "deepseek";
        private String drafterModel = "deepseek";
        private String judgeModel = "deepseek";
        private String introduction = "Hi, I'm Lily! I can help you find refrigerator and dishwasher parts, "
                + "check compatibility, and walk you through repairs. What can I help you with today?";
    }

    @Data
    public static class History {
        /** "memory" or "redis". */
        private String store = "memory";
        private Duration ttl = Duration.ofDays(7);
        /** Sessions without traffic for this long are dropped from the registry. */
        private Duration sessionIdle = Duration.ofHours(2);
        /** Max number of messages rendered into a model prompt. */
        private int promptWindow = 8;
    }

    @Data
    public static class Retrieval {
        private int topK = 5;
        private double minScore = 0.60;
        private int catalogLimit = 5;
    }
}
