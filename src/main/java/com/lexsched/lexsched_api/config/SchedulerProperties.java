package com.lexsched.lexsched_api.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

/**
 * Every option the scheduler recognizes, bound from {@code lexsched.*}.
 */
@Data
@ConfigurationProperties(prefix = "lexsched")
public class SchedulerProperties {

    /**
     * Minutes before a slot's start during which a running class still counts as overlapping.
     */
    private int overlapBufferMinutes = 15;

    private Solver solver = new Solver();

    private Cors cors = new Cors();

    @Data
    public static class Solver {
        /** Wall-clock budget for one solve call (one lexicographic stage). */
        private Duration timeLimit = Duration.ofSeconds(60);
        private int numWorkers = 8;
        private boolean logSearchProgress = false;
    }

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000", "http://127.0.0.1:3000"));
    }
}
