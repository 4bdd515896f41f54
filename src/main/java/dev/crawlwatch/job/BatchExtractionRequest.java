package dev.crawlwatch.job;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import java.util.UUID;

/**
 * Request to extract an explicit list of pages with a given method.
 *
 * @param clientId owner of the pages
 * @param urls pages to extract, created as page records when unknown
 * @param extractionMethod name of a registered extraction strategy
 * @param force re-extract pages even if they are still fresh
 */
public record BatchExtractionRequest(
    @NotNull @JsonProperty("client_id") UUID clientId,
    @NotEmpty @JsonProperty("urls") List<String> urls,
    @NotBlank @JsonProperty("extraction_method") String extractionMethod,
    @JsonProperty("force") boolean force) {

  public BatchExtractionRequest {
    urls = urls == null ? List.of() : List.copyOf(urls);
  }
}
