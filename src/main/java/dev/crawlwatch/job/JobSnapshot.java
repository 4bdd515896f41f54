package dev.crawlwatch.job;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.crawlwatch.extraction.ExtractionTrialResult;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.jspecify.annotations.Nullable;

/**
 * Immutable view of a job at one point in time.
 *
 * <p>Created and replaced by {@link PhaseStateMachine}; every event produces a new record. The
 * counters always satisfy {@code successful + failed + skipped <= total}.
 *
 * @param id job id
 * @param jobType what kind of job this is
 * @param phase current phase of work
 * @param status lifecycle status
 * @param progressPercentage 0-100, never decreases
 * @param currentUrl page most recently classified, null outside page processing
 * @param total pages the job expects to process
 * @param successful pages processed successfully
 * @param failed pages that failed
 * @param skipped pages skipped (already known or still fresh)
 * @param errorMessage reason of a failed job
 * @param winningMethod extraction method chosen during testing
 * @param trialResults every strategy's testing result, empty until testing completes
 * @param clientId owner of the pages
 * @param createdAt when the job was registered
 * @param startedAt when work began
 * @param completedAt when the job reached a terminal status
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobSnapshot(
    UUID id,
    JobType jobType,
    JobPhase phase,
    JobStatus status,
    int progressPercentage,
    @Nullable String currentUrl,
    int total,
    int successful,
    int failed,
    int skipped,
    @Nullable String errorMessage,
    @Nullable String winningMethod,
    List<ExtractionTrialResult> trialResults,
    UUID clientId,
    Instant createdAt,
    @Nullable Instant startedAt,
    @Nullable Instant completedAt) {

  public JobSnapshot {
    trialResults = trialResults == null ? List.of() : List.copyOf(trialResults);
  }

  @JsonIgnore
  public boolean isTerminal() {
    return status.isTerminal();
  }

  @JsonIgnore
  public int processed() {
    return successful + failed + skipped;
  }
}
