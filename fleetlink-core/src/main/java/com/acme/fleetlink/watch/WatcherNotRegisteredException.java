package com.acme.fleetlink.watch;

public class WatcherNotRegisteredException extends IllegalStateException {
  private final String watcherName;

  public WatcherNotRegisteredException(String watcherName) {
    super("Watcher not registered: " + watcherName);
    this.watcherName = watcherName;
  }

  public String getWatcherName() {
    return watcherName;
  }
}
