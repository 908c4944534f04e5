package com.github.simbo1905.pingstore;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import lombok.Getter;
import lombok.ToString;

/// Aggregate outcome of a batch delete ([PingStore#prune()] or [PingStore#acknowledge(Set)]).
///
/// Batch deletes are best effort: every requested id lands in exactly one of the three
/// buckets and a failure for one id never stops the others.
@ToString
public final class DeletionResult {

  private static final DeletionResult EMPTY = new Collector().build();

  /// Ids whose file this call removed.
  @Getter private final Set<Long> deleted;

  /// Ids that had no file, either never stored or removed concurrently.
  @Getter private final Set<Long> alreadyAbsent;

  /// Ids whose file could not be removed, with the I/O error.
  @Getter private final Map<Long, IOException> failed;

  private DeletionResult(Set<Long> deleted, Set<Long> alreadyAbsent, Map<Long, IOException> failed) {
    this.deleted = Collections.unmodifiableSet(deleted);
    this.alreadyAbsent = Collections.unmodifiableSet(alreadyAbsent);
    this.failed = Collections.unmodifiableMap(failed);
  }

  static DeletionResult empty() {
    return EMPTY;
  }

  public int removedCount() {
    return deleted.size();
  }

  public int requestedCount() {
    return deleted.size() + alreadyAbsent.size() + failed.size();
  }

  /// True when no id failed.
  public boolean isComplete() {
    return failed.isEmpty();
  }

  public DeleteOutcome outcomeFor(long id) {
    if (deleted.contains(id)) return DeleteOutcome.DELETED;
    if (failed.containsKey(id)) return DeleteOutcome.FAILED;
    if (alreadyAbsent.contains(id)) return DeleteOutcome.ALREADY_ABSENT;
    throw new IllegalArgumentException("Id was not part of this deletion: " + id);
  }

  /// Mutable accumulator used while a batch is in progress.
  static final class Collector {
    private final Set<Long> deleted = new TreeSet<>();
    private final Set<Long> alreadyAbsent = new TreeSet<>();
    private final Map<Long, IOException> failed = new TreeMap<>();

    void record(long id, DeleteOutcome outcome, IOException error) {
      switch (outcome) {
        case DELETED:
          deleted.add(id);
          break;
        case ALREADY_ABSENT:
          alreadyAbsent.add(id);
          break;
        case FAILED:
          failed.put(id, error);
          break;
        default:
          throw new AssertionError(outcome);
      }
    }

    DeletionResult build() {
      return new DeletionResult(new TreeSet<>(deleted), new TreeSet<>(alreadyAbsent), new TreeMap<>(failed));
    }
  }
}
