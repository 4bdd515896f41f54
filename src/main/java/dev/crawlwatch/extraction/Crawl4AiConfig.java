package dev.crawlwatch.extraction;

import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} used to communicate with the Crawl4AI sidecar.
 *
 * <p>Timeouts are externalized via {@code crawlwatch.crawl4ai.*} properties.
 * The client defaults to JSON content type and is qualified as {@code "crawl4AiRestClient"}.
 */
@Configuration
public class Crawl4AiConfig {

    /**
     * Creates a pre-configured {@link RestClient} targeting the Crawl4AI sidecar.
     *
     * @param builder Spring-provided builder with common defaults
     * @param props   sidecar base URL and timeouts
     * @return a named REST client bean for injection into {@link Crawl4AiExtractionStrategy}
     */
    @Bean
    public RestClient crawl4AiRestClient(RestClient.Builder builder, Crawl4AiProperties props) {
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofMillis(props.connectTimeoutMs()));
        requestFactory.setReadTimeout(Duration.ofMillis(props.readTimeoutMs()));

        return builder.clone()
                .baseUrl(props.baseUrl())
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
