package dev.crawlwatch.tracker;

import dev.crawlwatch.job.BatchExtractionRequest;
import dev.crawlwatch.job.JobSnapshot;
import dev.crawlwatch.job.StartCrawlRequest;
import dev.crawlwatch.job.StartJobResponse;
import dev.crawlwatch.job.StartSetupRequest;
import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Client-facing job API: launches jobs, serves their latest snapshot, streams progress as
 * server-sent events and forwards cancellations.
 */
@RestController
@RequestMapping("/api/jobs")
public class TrackerController {

  private static final Logger log = LoggerFactory.getLogger(TrackerController.class);

  static final String SNAPSHOT_EVENT = "snapshot";

  private final JobLauncher launcher;
  private final JobStatusPoller poller;
  private final ProgressObserverBridge bridge;
  private final CancellationHandler cancellationHandler;
  private final ExtractionEngine engine;
  private final Executor sseExecutor;

  public TrackerController(
      JobLauncher launcher,
      JobStatusPoller poller,
      ProgressObserverBridge bridge,
      CancellationHandler cancellationHandler,
      ExtractionEngine engine,
      @Qualifier("sseTaskExecutor") Executor sseExecutor) {
    this.launcher = launcher;
    this.poller = poller;
    this.bridge = bridge;
    this.cancellationHandler = cancellationHandler;
    this.engine = engine;
    this.sseExecutor = sseExecutor;
  }

  @PostMapping("/setup")
  public ResponseEntity<StartJobResponse> launchSetup(@RequestBody StartSetupRequest request) {
    return ResponseEntity.accepted().body(launcher.launchSetup(request).response());
  }

  @PostMapping("/crawl")
  public ResponseEntity<StartJobResponse> launchCrawl(@RequestBody StartCrawlRequest request) {
    return ResponseEntity.accepted().body(launcher.launchCrawl(request).response());
  }

  @PostMapping("/extraction")
  public ResponseEntity<StartJobResponse> launchExtraction(
      @RequestBody BatchExtractionRequest request) {
    return ResponseEntity.accepted().body(launcher.launchExtraction(request).response());
  }

  /** Latest snapshot delivered to observers, or the engine's answer if none was delivered yet. */
  @GetMapping("/{jobId}")
  public JobSnapshot getJob(@PathVariable UUID jobId) {
    return bridge.lastDelivered(jobId).orElseGet(() -> engine.getStatus(jobId));
  }

  /**
   * Streams one {@code snapshot} event per delivered snapshot and completes after the terminal
   * one. Starts polling the job if nothing polls it yet.
   *
   * <p>Writes to the client run on the SSE executor, one at a time and in delivery order, so a
   * slow client never blocks the thread that publishes snapshots.
   */
  @GetMapping(path = "/{jobId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public SseEmitter streamJob(@PathVariable UUID jobId) {
    boolean finished = bridge.isTerminalDelivered(jobId);
    if (!finished && bridge.lastDelivered(jobId).isEmpty()) {
      engine.getStatus(jobId);
    }

    SseEmitter emitter = new SseEmitter(0L);
    OrderedWrites writes = new OrderedWrites(sseExecutor);
    AtomicReference<Subscription> subscription = new AtomicReference<>();
    Subscription created =
        bridge.subscribe(
            jobId,
            new JobObserver() {
              @Override
              public void onSnapshot(JobSnapshot snapshot) {
                writes.submit(() -> send(jobId, emitter, snapshot, subscription.get()));
              }

              @Override
              public void onTerminal(JobSnapshot snapshot) {
                writes.submit(emitter::complete);
              }
            });
    subscription.set(created);
    emitter.onCompletion(created::close);
    emitter.onTimeout(created::close);
    emitter.onError(error -> created.close());

    if (!finished) {
      poller.startPolling(jobId);
    }
    return emitter;
  }

  @PostMapping("/{jobId}/cancel")
  public JobSnapshot cancel(@PathVariable UUID jobId) {
    return cancellationHandler.cancel(jobId);
  }

  private static void send(
      UUID jobId, SseEmitter emitter, JobSnapshot snapshot, Subscription subscription) {
    try {
      emitter.send(
          SseEmitter.event().name(SNAPSHOT_EVENT).data(snapshot, MediaType.APPLICATION_JSON));
    } catch (IOException | IllegalStateException e) {
      log.debug("Event stream of job {} closed: {}", jobId, e.getMessage());
      emitter.completeWithError(e);
      closeSubscription(subscription);
    }
  }

  private static void closeSubscription(Subscription subscription) {
    if (subscription != null) {
      subscription.close();
    }
  }

  /** Chains writes of one stream so they run in submission order on the executor. */
  private static final class OrderedWrites {
    private final Executor executor;
    private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

    OrderedWrites(Executor executor) {
      this.executor = executor;
    }

    synchronized void submit(Runnable write) {
      tail = tail.thenRunAsync(write, executor);
    }
  }
}
