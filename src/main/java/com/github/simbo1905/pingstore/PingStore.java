package com.github.simbo1905.pingstore;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/// Durable, capacity-bounded store of pings awaiting upload.
///
/// A producer [#store(Ping)]s pings as they are created. An upload task reads them back with
/// [#getAll()], tries to deliver each one and then calls [#acknowledge(Set)] with the ids the
/// server accepted. A maintenance task calls [#prune()] to evict the oldest pings once the
/// store holds more than its maximum count. Storing never prunes by itself.
public interface PingStore {

  /// Persists a new ping. Once this returns the ping is visible to [#getAll()].
  ///
  /// @throws IllegalArgumentException if a ping with the same id is already stored
  /// @throws StorageWriteFailedException if the ping could not be written; nothing is left
  /// on disk in that case
  void store(Ping ping) throws IOException;

  /// Returns every readable ping in no particular order.
  List<Ping> getAll() throws IOException;

  /// [#getAll()] sorted by ascending id.
  default List<Ping> getAllSortedById() throws IOException {
    final List<Ping> pings = new ArrayList<>(getAll());
    pings.sort(Comparator.comparingLong(Ping::getId));
    return pings;
  }

  /// Evicts the oldest pings beyond the store's configured maximum count.
  DeletionResult prune() throws IOException;

  /// Evicts the pings with the smallest ids until at most `maxCount` remain.
  DeletionResult prune(int maxCount) throws IOException;

  /// Removes exactly the pings with the given ids. Unknown ids are ignored.
  DeletionResult acknowledge(Set<Long> succeededIds) throws IOException;

  /// Number of pings currently stored.
  int count() throws IOException;
}
