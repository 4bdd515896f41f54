package dev.crawlwatch.job;

import dev.crawlwatch.extraction.ExtractionSelection;
import dev.crawlwatch.extraction.ExtractionTrialResult;
import dev.crawlwatch.extraction.PageOutcome;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Thread-safe in-memory owner of every job record.
 *
 * <p>Maintains a {@link ConcurrentHashMap} of {@link JobSnapshot}s keyed by job id. Each event
 * atomically reads the current snapshot, builds a new immutable one and writes it back using
 * {@code computeIfPresent()}, so concurrent page classifications never lose a count and readers
 * always see a coherent record.
 *
 * <p>Transitions: {@code PENDING -> RUNNING -> COMPLETED | FAILED | CANCELLED}. While running, a
 * {@link JobType#CRAWL} job moves {@code DISCOVERING -> TESTING -> EXTRACTING}; extraction jobs
 * start in {@code EXTRACTING}, setup jobs stay in {@code DISCOVERING}. A terminal snapshot is
 * final: every later event returns it unchanged.
 *
 * <p>Job records are transient and lost on restart.
 */
@Component
public class PhaseStateMachine {

  private static final Logger log = LoggerFactory.getLogger(PhaseStateMachine.class);

  static final int CRAWL_DISCOVERING_PROGRESS = 10;
  static final int CRAWL_TESTING_PROGRESS = 30;

  private final ConcurrentHashMap<UUID, JobSnapshot> jobs = new ConcurrentHashMap<>();
  private final Set<UUID> cancelRequests = ConcurrentHashMap.newKeySet();
  private final Clock clock;

  public PhaseStateMachine(Clock clock) {
    this.clock = clock;
  }

  /**
   * Start tracking a new job in {@link JobStatus#PENDING}.
   *
   * @param jobId new job id
   * @param jobType kind of job
   * @param clientId owner of the pages
   * @param initialTotal pages known up front, 0 if discovery has not run yet
   * @return the pending snapshot
   * @throws IllegalStateException if the id is already registered
   */
  public JobSnapshot register(UUID jobId, JobType jobType, UUID clientId, int initialTotal) {
    JobSnapshot pending =
        new JobSnapshot(
            jobId,
            jobType,
            initialPhase(jobType),
            JobStatus.PENDING,
            0,
            null,
            Math.max(0, initialTotal),
            0,
            0,
            0,
            null,
            null,
            List.of(),
            clientId,
            clock.instant(),
            null,
            null);
    if (jobs.putIfAbsent(jobId, pending) != null) {
      throw new IllegalStateException("Job " + jobId + " is already registered");
    }
    log.debug("Registered {} job {} for client {}", jobType, jobId, clientId);
    return pending;
  }

  /**
   * Apply one event atomically.
   *
   * @return the snapshot after the event (the unchanged snapshot if the job was already terminal)
   * @throws JobNotFoundException if the job is unknown
   */
  public JobSnapshot apply(UUID jobId, JobEvent event) {
    JobSnapshot updated = jobs.computeIfPresent(jobId, (id, current) -> next(current, event));
    if (updated == null) {
      throw new JobNotFoundException(jobId);
    }
    return updated;
  }

  public Optional<JobSnapshot> getSnapshot(UUID jobId) {
    return Optional.ofNullable(jobs.get(jobId));
  }

  /**
   * Flag a job for cooperative cancellation. The job keeps running until its worker observes the
   * flag and reports {@link JobEvent.Cancelled}.
   *
   * @return the current snapshot, unchanged
   * @throws JobNotFoundException if the job is unknown
   */
  public JobSnapshot requestCancel(UUID jobId) {
    JobSnapshot current = jobs.get(jobId);
    if (current == null) {
      throw new JobNotFoundException(jobId);
    }
    if (!current.isTerminal() && cancelRequests.add(jobId)) {
      log.info("Cancellation requested for job {}", jobId);
    }
    return current;
  }

  public boolean isCancelRequested(UUID jobId) {
    return cancelRequests.contains(jobId);
  }

  /**
   * Forget jobs that reached a terminal status before the cutoff. Running and pending jobs are
   * kept whatever their age.
   *
   * @return number of jobs forgotten
   */
  public int evictFinishedBefore(Instant cutoff) {
    int evicted = 0;
    for (JobSnapshot snapshot : List.copyOf(jobs.values())) {
      Instant completedAt = snapshot.completedAt();
      if (snapshot.isTerminal()
          && completedAt != null
          && completedAt.isBefore(cutoff)
          && jobs.remove(snapshot.id(), snapshot)) {
        cancelRequests.remove(snapshot.id());
        evicted++;
      }
    }
    if (evicted > 0) {
      log.debug("Evicted {} finished jobs older than {}", evicted, cutoff);
    }
    return evicted;
  }

  private JobSnapshot next(JobSnapshot current, JobEvent event) {
    if (current.isTerminal()) {
      log.debug("Ignoring {} for terminal job {}", event, current.id());
      return current;
    }
    Instant now = clock.instant();
    JobSnapshot next;
    if (event instanceof JobEvent.Started) {
      next = running(current, now);
    } else if (event instanceof JobEvent.DiscoveryCompleted discovered) {
      JobSnapshot started = running(current, now);
      JobPhase phase =
          started.jobType() == JobType.CRAWL ? JobPhase.TESTING : started.phase();
      next =
          copy(
              started,
              phase,
              started.status(),
              started.currentUrl(),
              Math.max(discovered.total(), started.processed()),
              started.successful(),
              started.failed(),
              started.skipped(),
              null,
              started.winningMethod(),
              started.trialResults(),
              null);
    } else if (event instanceof JobEvent.TestingCompleted tested) {
      JobSnapshot started = running(current, now);
      ExtractionSelection selection = tested.selection();
      next =
          copy(
              started,
              JobPhase.EXTRACTING,
              started.status(),
              null,
              started.total(),
              started.successful(),
              started.failed(),
              started.skipped(),
              null,
              selection.winningMethod(),
              selection.trialResults(),
              null);
    } else if (event instanceof JobEvent.PageClassified classified) {
      next = classify(running(current, now), classified.outcome());
    } else if (event instanceof JobEvent.Completed) {
      next =
          copy(
              current,
              JobPhase.COMPLETED,
              JobStatus.COMPLETED,
              null,
              current.total(),
              current.successful(),
              current.failed(),
              current.skipped(),
              null,
              current.winningMethod(),
              current.trialResults(),
              now);
      log.info(
          "Job {} completed: {} successful, {} failed, {} skipped of {}",
          current.id(),
          current.successful(),
          current.failed(),
          current.skipped(),
          current.total());
    } else if (event instanceof JobEvent.Failed failedEvent) {
      next =
          copy(
              current,
              JobPhase.FAILED,
              JobStatus.FAILED,
              null,
              current.total(),
              current.successful(),
              current.failed(),
              current.skipped(),
              failedEvent.message(),
              current.winningMethod(),
              current.trialResults(),
              now);
      log.info("Job {} failed: {}", current.id(), failedEvent.message());
    } else if (event instanceof JobEvent.Cancelled) {
      next =
          copy(
              current,
              current.phase(),
              JobStatus.CANCELLED,
              null,
              current.total(),
              current.successful(),
              current.failed(),
              current.skipped(),
              null,
              current.winningMethod(),
              current.trialResults(),
              now);
      log.info("Job {} cancelled after {} pages", current.id(), current.processed());
    } else {
      throw new IllegalArgumentException("Unsupported job event: " + event);
    }
    if (next.isTerminal()) {
      cancelRequests.remove(current.id());
    }
    return withProgress(current, next);
  }

  private JobSnapshot running(JobSnapshot current, Instant now) {
    if (current.status() != JobStatus.PENDING) {
      return current;
    }
    log.info("Job {} ({}) started", current.id(), current.jobType());
    return new JobSnapshot(
        current.id(),
        current.jobType(),
        initialPhase(current.jobType()),
        JobStatus.RUNNING,
        current.progressPercentage(),
        current.currentUrl(),
        current.total(),
        current.successful(),
        current.failed(),
        current.skipped(),
        current.errorMessage(),
        current.winningMethod(),
        current.trialResults(),
        current.clientId(),
        current.createdAt(),
        now,
        current.completedAt());
  }

  private JobSnapshot classify(JobSnapshot current, PageOutcome outcome) {
    int successful = current.successful();
    int failed = current.failed();
    int skipped = current.skipped();
    if (outcome.type() == PageOutcome.Type.SUCCESS) {
      successful++;
    } else if (outcome.type() == PageOutcome.Type.FAILED) {
      failed++;
    } else {
      skipped++;
    }
    int total = Math.max(current.total(), successful + failed + skipped);
    return copy(
        current,
        current.phase(),
        current.status(),
        outcome.url(),
        total,
        successful,
        failed,
        skipped,
        null,
        current.winningMethod(),
        current.trialResults(),
        null);
  }

  private static JobSnapshot copy(
      JobSnapshot base,
      JobPhase phase,
      JobStatus status,
      String currentUrl,
      int total,
      int successful,
      int failed,
      int skipped,
      String errorMessage,
      String winningMethod,
      List<ExtractionTrialResult> trialResults,
      Instant completedAt) {
    return new JobSnapshot(
        base.id(),
        base.jobType(),
        phase,
        status,
        base.progressPercentage(),
        currentUrl,
        total,
        successful,
        failed,
        skipped,
        errorMessage,
        winningMethod,
        trialResults,
        base.clientId(),
        base.createdAt(),
        base.startedAt(),
        completedAt);
  }

  private static JobSnapshot withProgress(JobSnapshot previous, JobSnapshot next) {
    int progress = Math.max(previous.progressPercentage(), computeProgress(next));
    if (progress == next.progressPercentage()) {
      return next;
    }
    return new JobSnapshot(
        next.id(),
        next.jobType(),
        next.phase(),
        next.status(),
        Math.min(100, progress),
        next.currentUrl(),
        next.total(),
        next.successful(),
        next.failed(),
        next.skipped(),
        next.errorMessage(),
        next.winningMethod(),
        next.trialResults(),
        next.clientId(),
        next.createdAt(),
        next.startedAt(),
        next.completedAt());
  }

  /**
   * Progress implied by phase and counters, before the monotonic clamp. Failed and cancelled jobs
   * keep the progress they had.
   */
  static int computeProgress(JobSnapshot snapshot) {
    if (snapshot.status() == JobStatus.COMPLETED) {
      return 100;
    }
    if (snapshot.status() != JobStatus.RUNNING) {
      return 0;
    }
    int processedShare = snapshot.total() == 0 ? 0 : 100 * snapshot.processed() / snapshot.total();
    if (snapshot.jobType() != JobType.CRAWL) {
      return processedShare;
    }
    if (snapshot.phase() == JobPhase.DISCOVERING) {
      return CRAWL_DISCOVERING_PROGRESS;
    }
    if (snapshot.phase() == JobPhase.TESTING) {
      return CRAWL_TESTING_PROGRESS;
    }
    int extractingShare =
        snapshot.total() == 0 ? 0 : 70 * snapshot.processed() / snapshot.total();
    return CRAWL_TESTING_PROGRESS + extractingShare;
  }

  private static JobPhase initialPhase(JobType jobType) {
    return jobType == JobType.EXTRACTION ? JobPhase.EXTRACTING : JobPhase.DISCOVERING;
  }
}
