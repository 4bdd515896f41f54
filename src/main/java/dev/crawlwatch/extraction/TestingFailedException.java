package dev.crawlwatch.extraction;

import java.util.List;

/**
 * Thrown when no strategy managed to extract any page of the testing sample, or when there was
 * nothing to test. The job fails before reaching the extraction phase.
 */
public class TestingFailedException extends RuntimeException {

  private final List<ExtractionTrialResult> trialResults;

  public TestingFailedException(String message, List<ExtractionTrialResult> trialResults) {
    super(message);
    this.trialResults = List.copyOf(trialResults);
  }

  public List<ExtractionTrialResult> getTrialResults() {
    return trialResults;
  }
}
