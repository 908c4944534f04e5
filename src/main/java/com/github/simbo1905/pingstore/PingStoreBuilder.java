package com.github.simbo1905.pingstore;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Builder for [JsonFilePingStore] instances.
///
/// Example usage:
/// <pre>
/// JsonFilePingStore store = new PingStoreBuilder()
///     .path("/data/telemetry/pings")
///     .maxPingCount(40)
///     .malformedPingPolicy(MalformedPingPolicy.QUARANTINE)
///     .open();
/// </pre>
public class PingStoreBuilder {

  private static final Logger logger = Logger.getLogger(PingStoreBuilder.class.getName());

  /// Default maximum number of pings kept before [PingStore#prune()] starts evicting.
  public static final int DEFAULT_MAX_PING_COUNT = 40;

  /// Name of the default quarantine directory, created inside the root directory on demand.
  public static final String DEFAULT_QUARANTINE_DIR_NAME = "quarantine";

  /// System property, or environment variable, overriding [#DEFAULT_MAX_PING_COUNT].
  public static final String MAX_PING_COUNT_PROPERTY =
      String.format("%s.%s", JsonFilePingStore.class.getName(), "MAX_PING_COUNT");

  private Path path;
  private Integer maxPingCount;
  private MalformedPingPolicy malformedPingPolicy = MalformedPingPolicy.SKIP;
  private Path quarantineDirectory;
  private PingFileOperations fileOperations = new NioPingFileOperations();

  /// Sets the directory that holds the ping files. Created, with its parents, on open.
  ///
  /// @param path the root directory
  /// @return this builder for chaining
  public PingStoreBuilder path(Path path) {
    this.path = path;
    return this;
  }

  /// Sets the root directory using a string, which is converted to a normalised Path.
  ///
  /// @param path the root directory
  /// @return this builder for chaining
  public PingStoreBuilder path(String path) {
    this.path = Paths.get(path).normalize();
    return this;
  }

  /// Sets the maximum number of pings [PingStore#prune()] keeps.
  ///
  /// @param maxPingCount a positive count
  /// @return this builder for chaining
  public PingStoreBuilder maxPingCount(int maxPingCount) {
    if (maxPingCount <= 0) {
      throw new IllegalArgumentException("maxPingCount must be positive, got " + maxPingCount);
    }
    this.maxPingCount = maxPingCount;
    return this;
  }

  /// Sets how enumeration treats files with a ping name but bad content. Default is SKIP.
  ///
  /// @param malformedPingPolicy the policy
  /// @return this builder for chaining
  public PingStoreBuilder malformedPingPolicy(MalformedPingPolicy malformedPingPolicy) {
    this.malformedPingPolicy = Objects.requireNonNull(malformedPingPolicy, "malformedPingPolicy");
    return this;
  }

  /// Sets where [MalformedPingPolicy#QUARANTINE] moves bad files. Defaults to a
  /// `quarantine` directory inside the root directory.
  ///
  /// @param quarantineDirectory the quarantine directory
  /// @return this builder for chaining
  public PingStoreBuilder quarantineDirectory(Path quarantineDirectory) {
    this.quarantineDirectory = quarantineDirectory;
    return this;
  }

  /// Replaces the filesystem calls; used by tests to inject failures.
  PingStoreBuilder fileOperations(PingFileOperations fileOperations) {
    this.fileOperations = Objects.requireNonNull(fileOperations, "fileOperations");
    return this;
  }

  /// Opens the store, creating the root directory if needed.
  ///
  /// @return the opened store
  /// @throws StorageUnavailableException if the root directory cannot be used
  /// @throws IllegalStateException if no path was set
  public JsonFilePingStore open() throws StorageUnavailableException {
    if (path == null) {
      throw new IllegalStateException("path must be set before open()");
    }
    final int resolvedMaxPingCount =
        maxPingCount != null ? maxPingCount : getMaxPingCountOrDefault();
    final Path resolvedQuarantine =
        quarantineDirectory != null
            ? quarantineDirectory
            : path.resolve(DEFAULT_QUARANTINE_DIR_NAME);
    logger.log(
        Level.FINE,
        () ->
            String.format(
                "open path=%s maxPingCount=%d malformedPingPolicy=%s",
                path, resolvedMaxPingCount, malformedPingPolicy));
    return new JsonFilePingStore(
        path, resolvedMaxPingCount, malformedPingPolicy, resolvedQuarantine, fileOperations);
  }

  /// Resolves the default maximum ping count: the system property wins over the environment
  /// variable, which wins over [#DEFAULT_MAX_PING_COUNT]. A setting that is not a positive
  /// integer is logged at WARNING and the default is used instead.
  static int getMaxPingCountOrDefault() {
    String source = "system property";
    String maxPingCount = System.getProperty(MAX_PING_COUNT_PROPERTY);
    if (maxPingCount == null) {
      source = "environment variable";
      maxPingCount = System.getenv(MAX_PING_COUNT_PROPERTY);
    }
    if (maxPingCount == null) {
      return DEFAULT_MAX_PING_COUNT;
    }
    try {
      final int parsed = Integer.parseInt(maxPingCount.trim());
      if (parsed > 0) {
        return parsed;
      }
    } catch (NumberFormatException e) {
      // reported below
    }
    logger.log(
        Level.WARNING,
        String.format(
            "ignoring %s %s='%s', expected a positive integer; using %d",
            source, MAX_PING_COUNT_PROPERTY, maxPingCount, DEFAULT_MAX_PING_COUNT));
    return DEFAULT_MAX_PING_COUNT;
  }
}
