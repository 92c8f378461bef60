package com.acme.fleetlink.watch;

import java.time.Instant;

/** Point-in-time view of one watcher's most recent attempt. */
public record WatcherEntry(String name, Instant lastAttempt) {}
