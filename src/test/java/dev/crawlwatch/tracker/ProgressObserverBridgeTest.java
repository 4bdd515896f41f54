package dev.crawlwatch.tracker;

import static org.assertj.core.api.Assertions.assertThat;

import dev.crawlwatch.fixture.JobSnapshots;
import dev.crawlwatch.job.JobSnapshot;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ProgressObserverBridgeTest {

  private ProgressObserverBridge bridge;
  private UUID jobId;
  private RecordingObserver observer;

  @BeforeEach
  void setUp() {
    bridge = new ProgressObserverBridge();
    jobId = UUID.randomUUID();
    observer = new RecordingObserver();
  }

  @Nested
  class Ordering {

    @Test
    void deliversSnapshotsInPublishOrder() {
      bridge.subscribe(jobId, observer);
      JobSnapshot at10 = JobSnapshots.running(jobId, 10);
      JobSnapshot at40 = JobSnapshots.running(jobId, 40);

      bridge.publish(at10);
      bridge.publish(at40);

      assertThat(observer.snapshots).containsExactly(at10, at40);
    }

    @Test
    void dropsDuplicateSnapshot() {
      bridge.subscribe(jobId, observer);
      JobSnapshot at10 = JobSnapshots.running(jobId, 10);

      assertThat(bridge.publish(at10)).isTrue();
      assertThat(bridge.publish(at10)).isFalse();

      assertThat(observer.snapshots).hasSize(1);
    }

    @Test
    void samePercentageWithNewCountersIsDelivered() {
      bridge.subscribe(jobId, observer);

      bridge.publish(JobSnapshots.running(jobId, 40, 3));
      bridge.publish(JobSnapshots.running(jobId, 40, 4));

      assertThat(observer.snapshots).hasSize(2);
    }

    @Test
    void dropsSnapshotWithLowerProgress() {
      bridge.subscribe(jobId, observer);
      bridge.publish(JobSnapshots.running(jobId, 60));

      assertThat(bridge.publish(JobSnapshots.running(jobId, 30))).isFalse();

      assertThat(observer.snapshots)
          .extracting(JobSnapshot::progressPercentage)
          .containsExactly(60);
      assertThat(bridge.lastDelivered(jobId))
          .map(JobSnapshot::progressPercentage)
          .contains(60);
    }

    @Test
    void cancelledSnapshotWithLowerProgressIsStillDelivered() {
      bridge.subscribe(jobId, observer);
      bridge.publish(JobSnapshots.running(jobId, 60));

      assertThat(bridge.publish(JobSnapshots.cancelled(jobId, 0))).isTrue();
      assertThat(bridge.isTerminalDelivered(jobId)).isTrue();
    }
  }

  @Nested
  class Terminal {

    @Test
    void terminalIsDeliveredOnceAndEndsTheStream() {
      bridge.subscribe(jobId, observer);
      JobSnapshot completed = JobSnapshots.completed(jobId);

      bridge.publish(completed);
      boolean afterTerminal = bridge.publish(JobSnapshots.running(jobId, 100, 11));

      assertThat(afterTerminal).isFalse();
      assertThat(observer.snapshots).containsExactly(completed);
      assertThat(observer.terminals).containsExactly(completed);
    }

    @Test
    void lateSubscriberGetsTerminalReplayed() {
      JobSnapshot completed = JobSnapshots.completed(jobId);
      bridge.publish(JobSnapshots.running(jobId, 50));
      bridge.publish(completed);

      bridge.subscribe(jobId, observer);

      assertThat(observer.snapshots).containsExactly(completed);
      assertThat(observer.terminals).containsExactly(completed);
    }

    @Test
    void subscriberAfterRunningSnapshotWaitsForTheNextOne() {
      bridge.publish(JobSnapshots.running(jobId, 50));

      bridge.subscribe(jobId, observer);

      assertThat(observer.snapshots).isEmpty();
    }
  }

  @Nested
  class Subscriptions {

    @Test
    void closedSubscriptionStopsDelivery() {
      Subscription subscription = bridge.subscribe(jobId, observer);
      bridge.publish(JobSnapshots.running(jobId, 10));

      subscription.close();
      subscription.close();
      bridge.publish(JobSnapshots.running(jobId, 20));

      assertThat(observer.snapshots).hasSize(1);
    }

    @Test
    void observersOfOtherJobsSeeNothing() {
      bridge.subscribe(UUID.randomUUID(), observer);

      bridge.publish(JobSnapshots.running(jobId, 10));

      assertThat(observer.snapshots).isEmpty();
    }

    @Test
    void globalObserverSeesEveryJob() {
      bridge.subscribeAll(observer);
      UUID otherJob = UUID.randomUUID();

      bridge.publish(JobSnapshots.running(jobId, 10));
      bridge.publish(JobSnapshots.completed(otherJob));

      assertThat(observer.snapshots).extracting(JobSnapshot::id).containsExactly(jobId, otherJob);
      assertThat(observer.terminals).extracting(JobSnapshot::id).containsExactly(otherJob);
    }

    @Test
    void failingObserverDoesNotStopOthers() {
      bridge.subscribe(
          jobId,
          snapshot -> {
            throw new IllegalStateException("observer down");
          });
      bridge.subscribe(jobId, observer);

      boolean delivered = bridge.publish(JobSnapshots.running(jobId, 10));

      assertThat(delivered).isTrue();
      assertThat(observer.snapshots).hasSize(1);
    }
  }

  @Nested
  class SlowObservers {

    private final ExecutorService threads = Executors.newFixedThreadPool(3);

    @AfterEach
    void tearDown() {
      threads.shutdownNow();
    }

    @Test
    void blockedObserverDoesNotBlockReadersOrPublishers() throws Exception {
      CountDownLatch entered = new CountDownLatch(1);
      CountDownLatch release = new CountDownLatch(1);
      List<JobSnapshot> seen = new ArrayList<>();
      bridge.subscribe(
          jobId,
          snapshot -> {
            seen.add(snapshot);
            entered.countDown();
            awaitQuietly(release);
          });
      JobSnapshot at10 = JobSnapshots.running(jobId, 10);
      JobSnapshot at40 = JobSnapshots.running(jobId, 40);

      CompletableFuture<Boolean> slowPublish =
          CompletableFuture.supplyAsync(() -> bridge.publish(at10), threads);
      assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

      assertThat(
              CompletableFuture.supplyAsync(() -> bridge.lastDelivered(jobId), threads)
                  .get(1, TimeUnit.SECONDS))
          .contains(at10);
      assertThat(
              CompletableFuture.supplyAsync(() -> bridge.publish(at40), threads)
                  .get(1, TimeUnit.SECONDS))
          .isTrue();

      release.countDown();
      assertThat(slowPublish.get(5, TimeUnit.SECONDS)).isTrue();
      assertThat(seen).containsExactly(at10, at40);
    }

    private void awaitQuietly(CountDownLatch latch) {
      try {
        latch.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  @Test
  void forgottenJobStartsOver() {
    bridge.publish(JobSnapshots.completed(jobId));

    bridge.forget(jobId);
    bridge.subscribe(jobId, observer);

    assertThat(bridge.lastDelivered(jobId)).isEmpty();
    assertThat(observer.snapshots).isEmpty();
  }

  @Test
  void nothingDeliveredForUnknownJob() {
    assertThat(bridge.lastDelivered(jobId)).isEmpty();
    assertThat(bridge.isTerminalDelivered(jobId)).isFalse();
  }

  private static final class RecordingObserver implements JobObserver {

    private final List<JobSnapshot> snapshots = new ArrayList<>();
    private final List<JobSnapshot> terminals = new ArrayList<>();

    @Override
    public void onSnapshot(JobSnapshot snapshot) {
      snapshots.add(snapshot);
    }

    @Override
    public void onTerminal(JobSnapshot snapshot) {
      terminals.add(snapshot);
    }
  }
}
