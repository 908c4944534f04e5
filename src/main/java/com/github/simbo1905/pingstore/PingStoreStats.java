package com.github.simbo1905.pingstore;

/// Counters for one [JsonFilePingStore] instance since it was opened.
/// Immutable value object capturing the counters at a point in time; nothing here is
/// persisted.
public class PingStoreStats {
  private final long storedCount;
  private final long replacedCount;
  private final long prunedCount;
  private final long acknowledgedCount;
  private final long alreadyAbsentCount;
  private final long deleteFailureCount;
  private final long malformedSkippedCount;
  private final long malformedQuarantinedCount;

  public PingStoreStats(
      long storedCount,
      long replacedCount,
      long prunedCount,
      long acknowledgedCount,
      long alreadyAbsentCount,
      long deleteFailureCount,
      long malformedSkippedCount,
      long malformedQuarantinedCount) {
    this.storedCount = storedCount;
    this.replacedCount = replacedCount;
    this.prunedCount = prunedCount;
    this.acknowledgedCount = acknowledgedCount;
    this.alreadyAbsentCount = alreadyAbsentCount;
    this.deleteFailureCount = deleteFailureCount;
    this.malformedSkippedCount = malformedSkippedCount;
    this.malformedQuarantinedCount = malformedQuarantinedCount;
  }

  public long getStoredCount() {
    return storedCount;
  }

  public long getReplacedCount() {
    return replacedCount;
  }

  /// Files removed by oldest-first eviction.
  public long getPrunedCount() {
    return prunedCount;
  }

  /// Files removed because an upload confirmed them.
  public long getAcknowledgedCount() {
    return acknowledgedCount;
  }

  public long getAlreadyAbsentCount() {
    return alreadyAbsentCount;
  }

  public long getDeleteFailureCount() {
    return deleteFailureCount;
  }

  public long getMalformedSkippedCount() {
    return malformedSkippedCount;
  }

  public long getMalformedQuarantinedCount() {
    return malformedQuarantinedCount;
  }

  @Override
  public String toString() {
    return String.format(
        "PingStoreStats[stored=%d, replaced=%d, pruned=%d, acked=%d, absent=%d, deleteFailures=%d, skipped=%d, quarantined=%d]",
        storedCount,
        replacedCount,
        prunedCount,
        acknowledgedCount,
        alreadyAbsentCount,
        deleteFailureCount,
        malformedSkippedCount,
        malformedQuarantinedCount);
  }
}
