package dev.crawlwatch.job;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Checks start requests before any job is registered. Bean Validation constraints first, then the
 * rules that depend on several fields.
 */
@Component
public class JobRequestValidator {

  private final Validator validator;

  public JobRequestValidator(Validator validator) {
    this.validator = validator;
  }

  public void validate(StartSetupRequest request) {
    requireValid(request);
    if (request.isSitemapSetup()) {
      if (request.sitemapUrl() == null || request.sitemapUrl().isBlank()) {
        throw new JobValidationException("sitemap_url is required for sitemap setup");
      }
    } else if (request.manualUrls().isEmpty()) {
      throw new JobValidationException("manual_urls must not be empty for manual setup");
    }
  }

  public void validate(StartCrawlRequest request) {
    requireValid(request);
  }

  public void validate(BatchExtractionRequest request) {
    requireValid(request);
  }

  private <T> void requireValid(T request) {
    if (request == null) {
      throw new JobValidationException("Request body is required");
    }
    Set<ConstraintViolation<T>> violations = validator.validate(request);
    if (!violations.isEmpty()) {
      String messages =
          violations.stream()
              .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
              .map(v -> v.getPropertyPath() + ": " + v.getMessage())
              .collect(Collectors.joining(", "));
      throw new JobValidationException("Invalid request: " + messages);
    }
  }
}
