package dev.crawlwatch.job;

import dev.crawlwatch.extraction.ExtractionSelection;
import dev.crawlwatch.extraction.PageOutcome;

/**
 * Something the engine reports about a running job. Applied in order by {@link
 * PhaseStateMachine#apply(java.util.UUID, JobEvent)}.
 */
public interface JobEvent {

  /** Work began. */
  record Started() implements JobEvent {}

  /** The set of pages to process is known. */
  record DiscoveryCompleted(int total) implements JobEvent {}

  /** An extraction method was selected. */
  record TestingCompleted(ExtractionSelection selection) implements JobEvent {}

  /** One page was processed. */
  record PageClassified(PageOutcome outcome) implements JobEvent {}

  record Completed() implements JobEvent {}

  record Failed(String message) implements JobEvent {}

  record Cancelled() implements JobEvent {}
}
