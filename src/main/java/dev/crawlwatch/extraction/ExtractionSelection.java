package dev.crawlwatch.extraction;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/** The winning extraction method together with every strategy's trial result, best first. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ExtractionSelection(String winningMethod, List<ExtractionTrialResult> trialResults) {
  public ExtractionSelection {
    trialResults = trialResults == null ? List.of() : List.copyOf(trialResults);
  }
}
