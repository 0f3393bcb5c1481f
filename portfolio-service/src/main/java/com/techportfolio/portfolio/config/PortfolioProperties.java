package com.techportfolio.portfolio.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tuning knobs of the read, streaming, recovery and dispatch stages.
 */
@Data
@ConfigurationProperties(prefix = "portfolio")
public class PortfolioProperties {

    private Stream stream = new Stream();
    private Storage storage = new Storage();
    private Dispatch dispatch = new Dispatch();

    @Data
    public static class Stream {
        /** Re-evaluation cadence of a live summary subscription. */
        private Duration tickInterval = Duration.ofSeconds(5);
        /** Capacity of the default {@code buffer} backpressure policy. */
        private int defaultBufferCapacity = 16;
        /** Largest capacity a subscriber may request with {@code buffer:n}. */
        private int maxBufferCapacity = 1024;
    }

    @Data
    public static class Storage {
        /** Retries after the first failed attempt; 0 disables retrying. */
        private int maxRetries = 3;
        private Duration minBackoff = Duration.ofMillis(100);
        private Duration maxBackoff = Duration.ofSeconds(2);
        /** Maximum summaries computed concurrently for one listing request. */
        private int aggregationConcurrency = 8;
    }

    @Data
    public static class Dispatch {
        private boolean enabled = true;
        private Duration timeout = Duration.ofSeconds(2);
        private Duration connectTimeout = Duration.ofSeconds(1);
    }
}
