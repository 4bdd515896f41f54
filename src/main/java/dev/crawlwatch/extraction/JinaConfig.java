package dev.crawlwatch.extraction;

import java.time.Duration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/** Configures the {@link RestClient} used by {@link JinaExtractionStrategy}. */
@Configuration
public class JinaConfig {

  @Bean
  public RestClient jinaRestClient(RestClient.Builder builder, JinaProperties props) {
    var requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(Duration.ofSeconds(10));
    requestFactory.setReadTimeout(Duration.ofMillis(props.readTimeoutMs()));

    RestClient.Builder configured =
        builder
            .clone()
            .baseUrl(props.baseUrl())
            .requestFactory(requestFactory)
            .defaultHeader(HttpHeaders.ACCEPT, "text/plain")
            .defaultHeader("X-Return-Format", "markdown");
    if (props.apiKey() != null && !props.apiKey().isBlank()) {
      configured.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.apiKey());
    }
    return configured.build();
  }
}
