package dev.crawlwatch.tracker;

/** Handle returned by {@link ProgressObserverBridge}; closing it stops delivery. Idempotent. */
public interface Subscription extends AutoCloseable {

  @Override
  void close();
}
