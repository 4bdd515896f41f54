package dev.crawlwatch.tracker;

import dev.crawlwatch.job.StartJobResponse;

/** A started job and the session polling it. */
public record LaunchedJob(StartJobResponse response, PollingSession session) {}
