package com.acme.fleetlink.watch;

public class DuplicateWatcherException extends IllegalStateException {
  private final String watcherName;

  public DuplicateWatcherException(String watcherName) {
    super("Watcher already registered: " + watcherName);
    this.watcherName = watcherName;
  }

  public String getWatcherName() {
    return watcherName;
  }
}
