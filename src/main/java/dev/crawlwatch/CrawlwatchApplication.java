package dev.crawlwatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Entry point for the crawlwatch service.
 *
 * <p>Hosts the extraction engine (jobs, page records, engine API) and the job tracker (launching,
 * polling, progress streaming, MCP tools over SSE) in one process. With {@code
 * crawlwatch.engine.mode=remote} the tracker talks to another instance's engine API instead.
 */
@SpringBootApplication
@EnableRetry
@ConfigurationPropertiesScan
public class CrawlwatchApplication {
    public static void main(String[] args) {
        SpringApplication.run(CrawlwatchApplication.class, args);
    }
}
