package dev.crawlwatch.tracker;

import dev.crawlwatch.job.JobSnapshot;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fans job snapshots out to subscribed observers.
 *
 * <p>Per job, delivery is ordered and filtered: a snapshot equal to the last delivered one, a
 * non-terminal snapshot whose progress is lower than the last delivered one, and anything after a
 * terminal snapshot are dropped. Each observer sees the terminal snapshot once, followed by
 * {@link JobObserver#onTerminal(JobSnapshot)}. Observers subscribing after the terminal snapshot
 * get it replayed immediately.
 *
 * <p>Observers are called outside the channel lock. Deliveries of one job are queued and drained
 * in order by a single thread at a time, so a slow observer holds up only the thread draining that
 * job, never readers such as {@link #lastDelivered(UUID)} or publishers of other jobs.
 *
 * <p>An observer that throws is logged and skipped; other observers and the caller are not
 * affected.
 */
@Component
public class ProgressObserverBridge {

  private static final Logger log = LoggerFactory.getLogger(ProgressObserverBridge.class);

  private final ConcurrentHashMap<UUID, JobChannel> channels = new ConcurrentHashMap<>();
  private final List<JobObserver> globalObservers = new CopyOnWriteArrayList<>();

  /** Observe one job. */
  public Subscription subscribe(UUID jobId, JobObserver observer) {
    JobChannel channel = channels.computeIfAbsent(jobId, id -> new JobChannel());
    JobSnapshot replay;
    synchronized (channel) {
      replay = channel.terminalDelivered ? channel.last : null;
      if (replay == null) {
        channel.observers.add(observer);
      }
    }
    if (replay != null) {
      deliver(observer, replay);
      return () -> {};
    }
    return () -> channel.observers.remove(observer);
  }

  /** Observe every job, including ones started later. */
  public Subscription subscribeAll(JobObserver observer) {
    globalObservers.add(observer);
    return () -> globalObservers.remove(observer);
  }

  /**
   * Offer a snapshot for delivery.
   *
   * @return true if it was delivered, false if it was dropped
   */
  public boolean publish(JobSnapshot snapshot) {
    JobChannel channel = channels.computeIfAbsent(snapshot.id(), id -> new JobChannel());
    synchronized (channel) {
      if (channel.terminalDelivered) {
        log.debug("Dropping snapshot of job {} after terminal", snapshot.id());
        return false;
      }
      JobSnapshot last = channel.last;
      if (last != null) {
        if (last.equals(snapshot)) {
          return false;
        }
        if (!snapshot.isTerminal()
            && snapshot.progressPercentage() < last.progressPercentage()) {
          log.debug(
              "Dropping out-of-order snapshot of job {} ({}% < {}%)",
              snapshot.id(),
              snapshot.progressPercentage(),
              last.progressPercentage());
          return false;
        }
      }
      channel.last = snapshot;
      channel.terminalDelivered = snapshot.isTerminal();

      List<JobObserver> recipients = new ArrayList<>(channel.observers);
      recipients.addAll(globalObservers);
      channel.pending.add(new Delivery(snapshot, recipients));
      if (snapshot.isTerminal()) {
        channel.observers.clear();
      }
      if (channel.draining) {
        return true;
      }
      channel.draining = true;
    }
    drain(channel);
    return true;
  }

  /** Drop everything known about a job. Later snapshots of it start a fresh channel. */
  public void forget(UUID jobId) {
    channels.remove(jobId);
  }

  int channelCount() {
    return channels.size();
  }

  public Optional<JobSnapshot> lastDelivered(UUID jobId) {
    JobChannel channel = channels.get(jobId);
    if (channel == null) {
      return Optional.empty();
    }
    synchronized (channel) {
      return Optional.ofNullable(channel.last);
    }
  }

  public boolean isTerminalDelivered(UUID jobId) {
    return lastDelivered(jobId).map(JobSnapshot::isTerminal).orElse(false);
  }

  private static void drain(JobChannel channel) {
    while (true) {
      Delivery next;
      synchronized (channel) {
        next = channel.pending.poll();
        if (next == null) {
          channel.draining = false;
          return;
        }
      }
      for (JobObserver observer : next.recipients()) {
        deliver(observer, next.snapshot());
      }
    }
  }

  private static void deliver(JobObserver observer, JobSnapshot snapshot) {
    try {
      observer.onSnapshot(snapshot);
      if (snapshot.isTerminal()) {
        observer.onTerminal(snapshot);
      }
    } catch (RuntimeException e) {
      log.warn("Observer failed on snapshot of job {}: {}", snapshot.id(), e.getMessage(), e);
    }
  }

  private static final class JobChannel {
    private final List<JobObserver> observers = new CopyOnWriteArrayList<>();
    private final ArrayDeque<Delivery> pending = new ArrayDeque<>();
    private JobSnapshot last;
    private boolean terminalDelivered;
    private boolean draining;
  }

  private record Delivery(JobSnapshot snapshot, List<JobObserver> recipients) {}
}
