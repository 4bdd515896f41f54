package dev.crawlwatch.tracker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.crawlwatch.fixture.JobSnapshots;
import dev.crawlwatch.job.EngineUnavailableException;
import dev.crawlwatch.job.JobNotFoundException;
import dev.crawlwatch.job.JobSnapshot;
import dev.crawlwatch.job.JobStatus;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CancellationHandlerTest {

  @Mock private ExtractionEngine engine;
  @Mock private JobStatusPoller poller;

  private ProgressObserverBridge bridge;
  private CancellationHandler handler;
  private UUID jobId;

  @BeforeEach
  void setUp() {
    bridge = new ProgressObserverBridge();
    handler = new CancellationHandler(engine, poller, bridge);
    jobId = UUID.randomUUID();
  }

  @Test
  void registersForPollTicks() {
    verify(poller).addTickListener(any());
  }

  @Test
  void returnsEngineSnapshotWithoutWaitingForCancellation() {
    bridge.publish(JobSnapshots.running(jobId, 40));
    JobSnapshot stillRunning = JobSnapshots.running(jobId, 45);
    when(engine.cancel(jobId)).thenReturn(stillRunning);

    JobSnapshot result = handler.cancel(jobId);

    assertThat(result.status()).isEqualTo(JobStatus.RUNNING);
    assertThat(handler.isCancelPending(jobId)).isFalse();
    verify(poller).startPolling(jobId);
  }

  @Test
  void terminalJobIsReturnedWithoutContactingEngine() {
    JobSnapshot completed = JobSnapshots.completed(jobId);
    bridge.publish(completed);

    JobSnapshot result = handler.cancel(jobId);

    assertThat(result).isEqualTo(completed);
    verify(engine, never()).cancel(any());
    verify(poller, never()).startPolling(any());
  }

  @Test
  void cancellingACancelledJobTwiceReturnsTheSameSnapshot() {
    JobSnapshot cancelled = JobSnapshots.cancelled(jobId, 40);
    bridge.publish(cancelled);

    JobSnapshot first = handler.cancel(jobId);
    JobSnapshot second = handler.cancel(jobId);

    assertThat(first).isEqualTo(cancelled);
    assertThat(second).isEqualTo(first);
    assertThat(second.status()).isEqualTo(JobStatus.CANCELLED);
    assertThat(handler.isCancelPending(jobId)).isFalse();
    verify(engine, never()).cancel(any());
    verify(poller, never()).startPolling(any());
  }

  @Test
  void secondCancelAfterConfirmationDoesNotReachTheEngine() {
    when(engine.cancel(jobId)).thenReturn(JobSnapshots.running(jobId, 40));
    handler.cancel(jobId);
    JobSnapshot confirmed = JobSnapshots.cancelled(jobId, 40);
    bridge.publish(confirmed);

    JobSnapshot again = handler.cancel(jobId);

    assertThat(again).isEqualTo(confirmed);
    verify(engine, times(1)).cancel(jobId);
  }

  @Test
  void unreachableEngineQueuesCancelAndReturnsLastKnownSnapshot() {
    JobSnapshot at40 = JobSnapshots.running(jobId, 40);
    bridge.publish(at40);
    when(engine.cancel(jobId)).thenThrow(unreachable());

    JobSnapshot result = handler.cancel(jobId);

    assertThat(result).isEqualTo(at40);
    assertThat(handler.isCancelPending(jobId)).isTrue();
    verify(poller).startPolling(jobId);
  }

  @Test
  void unreachableEngineWithNothingKnownRethrows() {
    when(engine.cancel(jobId)).thenThrow(unreachable());

    assertThatThrownBy(() -> handler.cancel(jobId))
        .isInstanceOf(EngineUnavailableException.class);
    assertThat(handler.isCancelPending(jobId)).isTrue();
  }

  @Test
  void unknownJobPropagates() {
    when(engine.cancel(jobId)).thenThrow(new JobNotFoundException(jobId));

    assertThatThrownBy(() -> handler.cancel(jobId)).isInstanceOf(JobNotFoundException.class);
    assertThat(handler.isCancelPending(jobId)).isFalse();
  }

  @Test
  void queuedCancelIsDeliveredOnNextTick() {
    JobSnapshot at40 = JobSnapshots.running(jobId, 40);
    bridge.publish(at40);
    when(engine.cancel(jobId))
        .thenThrow(unreachable())
        .thenReturn(at40);
    handler.cancel(jobId);

    handler.retryPendingCancel(JobSnapshots.running(jobId, 50));

    verify(engine, times(2)).cancel(jobId);
    assertThat(handler.isCancelPending(jobId)).isFalse();
  }

  @Test
  void queuedCancelStaysWhileEngineIsDown() {
    bridge.publish(JobSnapshots.running(jobId, 40));
    when(engine.cancel(jobId)).thenThrow(unreachable());
    handler.cancel(jobId);

    handler.retryPendingCancel(JobSnapshots.running(jobId, 50));

    assertThat(handler.isCancelPending(jobId)).isTrue();
  }

  @Test
  void tickWithoutPendingCancelDoesNothing() {
    handler.retryPendingCancel(JobSnapshots.running(jobId, 50));

    verify(engine, never()).cancel(any());
  }

  @Test
  void terminalSnapshotClearsQueuedCancel() {
    bridge.publish(JobSnapshots.running(jobId, 40));
    when(engine.cancel(jobId)).thenThrow(unreachable());
    handler.cancel(jobId);

    bridge.publish(JobSnapshots.completed(jobId));

    assertThat(handler.isCancelPending(jobId)).isFalse();
  }

  private static EngineUnavailableException unreachable() {
    return new EngineUnavailableException("Engine unreachable", null);
  }
}
