package com.github.simbo1905.pingstore;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;
import lombok.Getter;
import lombok.Synchronized;

/// A [PingStore] that keeps one JSON file per ping in a single directory.
///
/// The directory is the table: a ping with id `n` is the file `ping-n.json` (see
/// [PingFileNames]) and its content is the JSON document produced by [PingCodec]. Ordering
/// for eviction comes from the ids in the file names, never from file timestamps.
///
/// Files are published by writing a temporary file in the same directory and atomically
/// renaming it into place, so a concurrent reader sees either the whole ping or nothing.
/// Mutating calls are serialised on this instance; reads take no lock. No file handle or
/// lock is held between calls so the store needs no close.
public class JsonFilePingStore implements PingStore {

  private static final Logger logger = Logger.getLogger(JsonFilePingStore.class.getName());

  @Getter private final Path rootDir;

  @Getter private final int maxPingCount;

  @Getter private final MalformedPingPolicy malformedPingPolicy;

  @Getter private final Path quarantineDir;

  /*default*/ final PingFileOperations fileOperations;

  private final PingCodec codec = new PingCodec();

  private final AtomicLong storedCount = new AtomicLong();
  private final AtomicLong replacedCount = new AtomicLong();
  private final AtomicLong prunedCount = new AtomicLong();
  private final AtomicLong acknowledgedCount = new AtomicLong();
  private final AtomicLong alreadyAbsentCount = new AtomicLong();
  private final AtomicLong deleteFailureCount = new AtomicLong();
  private final AtomicLong malformedSkippedCount = new AtomicLong();
  private final AtomicLong malformedQuarantinedCount = new AtomicLong();

  /// Opens a store in `rootDir` with the default settings of [PingStoreBuilder].
  ///
  /// @throws StorageUnavailableException if the directory cannot be created or used
  public JsonFilePingStore(Path rootDir) throws StorageUnavailableException {
    this(
        rootDir,
        PingStoreBuilder.getMaxPingCountOrDefault(),
        MalformedPingPolicy.SKIP,
        rootDir.resolve(PingStoreBuilder.DEFAULT_QUARANTINE_DIR_NAME),
        new NioPingFileOperations());
  }

  JsonFilePingStore(
      Path rootDir,
      int maxPingCount,
      MalformedPingPolicy malformedPingPolicy,
      Path quarantineDir,
      PingFileOperations fileOperations)
      throws StorageUnavailableException {
    Objects.requireNonNull(rootDir, "rootDir");
    if (maxPingCount <= 0) {
      throw new IllegalArgumentException("maxPingCount must be positive, got " + maxPingCount);
    }
    this.rootDir = rootDir;
    this.maxPingCount = maxPingCount;
    this.malformedPingPolicy = Objects.requireNonNull(malformedPingPolicy, "malformedPingPolicy");
    this.quarantineDir = Objects.requireNonNull(quarantineDir, "quarantineDir");
    this.fileOperations = Objects.requireNonNull(fileOperations, "fileOperations");

    if (fileOperations.exists(rootDir) && !Files.isDirectory(rootDir)) {
      throw new StorageUnavailableException(rootDir, "path exists and is not a directory");
    }
    try {
      fileOperations.createDirectories(rootDir);
    } catch (IOException e) {
      throw new StorageUnavailableException(rootDir, "cannot create directory", e);
    }
    if (!Files.isWritable(rootDir)) {
      throw new StorageUnavailableException(rootDir, "directory is not writable");
    }

    logger.log(
        Level.FINE,
        () ->
            String.format(
                "opened rootDir=%s maxPingCount=%d malformedPingPolicy=%s quarantineDir=%s",
                rootDir, maxPingCount, malformedPingPolicy, quarantineDir));
  }

  /// The file that holds, or would hold, the ping with the given id.
  ///
  /// @throws IllegalArgumentException if the id is negative
  public Path getFileFor(long id) {
    return rootDir.resolve(PingFileNames.filenameFor(id));
  }

  /// Inverse of [#getFileFor(long)] applied to the bare file name.
  ///
  /// @see PingFileNames#idFromFilename(String)
  public static long idFromFilename(String filename) {
    return PingFileNames.idFromFilename(filename);
  }

  @Override
  @Synchronized
  public void store(Ping ping) throws StorageWriteFailedException {
    Objects.requireNonNull(ping, "ping");
    final Path target = getFileFor(ping.getId());
    if (fileOperations.exists(target)) {
      throw new IllegalArgumentException("Ping exists: " + ping.getId());
    }
    publish(ping, target, false);
    storedCount.incrementAndGet();
    logger.log(Level.FINE, () -> String.format("stored ping id:%d file:%s", ping.getId(), target));
  }

  /// Stores a new ping built from its parts.
  ///
  /// @see #store(Ping)
  public void store(long id, String destination, JsonObject payload)
      throws StorageWriteFailedException {
    store(new Ping(id, destination, payload));
  }

  /// Writes the ping whether or not one with the same id exists. The old content is
  /// replaced as a whole, never merged.
  @Synchronized
  public void replace(Ping ping) throws StorageWriteFailedException {
    Objects.requireNonNull(ping, "ping");
    final Path target = getFileFor(ping.getId());
    publish(ping, target, true);
    replacedCount.incrementAndGet();
    logger.log(Level.FINE, () -> String.format("replaced ping id:%d file:%s", ping.getId(), target));
  }

  /// Writes to a temporary file next to the target and then gives it the target's name. A
  /// new ping is hard linked into place so that a file published under the same id by
  /// another instance or process is never overwritten; a replacement is renamed over the
  /// target. On failure the temporary file is removed before the exception is thrown.
  ///
  /// @throws IllegalArgumentException if `replaceExisting` is false and the target exists
  private void publish(Ping ping, Path target, boolean replaceExisting)
      throws StorageWriteFailedException {
    final byte[] bytes = codec.encode(ping);
    Path temporary = null;
    boolean collided = false;
    try {
      temporary =
          fileOperations.createTempFile(rootDir, PingFileNames.TEMP_PREFIX, PingFileNames.TEMP_SUFFIX);
      fileOperations.write(temporary, bytes);
      if (replaceExisting) {
        fileOperations.move(temporary, target, ATOMIC_MOVE, REPLACE_EXISTING);
      } else {
        try {
          fileOperations.createLink(target, temporary);
        } catch (FileAlreadyExistsException exists) {
          collided = true;
        }
      }
    } catch (IOException e) {
      final StorageWriteFailedException failure =
          new StorageWriteFailedException(ping.getId(), target, e);
      if (temporary != null) {
        try {
          fileOperations.deleteIfExists(temporary);
        } catch (IOException cleanup) {
          failure.addSuppressed(cleanup);
        }
      }
      logger.log(Level.WARNING, failure.getMessage(), e);
      throw failure;
    }
    final Path written = temporary;
    if (!replaceExisting) {
      discardTemporary(written);
    }
    if (collided) {
      logger.log(
          Level.FINE,
          () -> String.format("ping id:%d was published first by another writer", ping.getId()));
      throw new IllegalArgumentException("Ping exists: " + ping.getId());
    }
    logger.log(
        Level.FINEST,
        () -> String.format("published %d bytes %s -> %s", bytes.length, written, target));
  }

  /// Removes the temporary name left after linking. The ping itself is already in place, so
  /// a failure here only leaves work for [#purgeTemporaryFiles(Duration)].
  private void discardTemporary(Path temporary) {
    try {
      fileOperations.deleteIfExists(temporary);
    } catch (IOException e) {
      logger.log(Level.WARNING, String.format("could not remove temporary file %s", temporary), e);
    }
  }

  @Override
  public List<Ping> getAll() throws IOException {
    final List<Ping> pings = new ArrayList<>();
    for (Map.Entry<Long, Path> entry : pingFilesById().entrySet()) {
      final Path file = entry.getValue();
      try {
        pings.add(readPing(entry.getKey(), file));
      } catch (NoSuchFileException gone) {
        // acknowledged or pruned after the directory was listed
        logger.log(Level.FINEST, () -> String.format("ping file vanished during read %s", file));
      } catch (IOException | JsonParseException e) {
        handleMalformed(new StorageReadException(file, e));
      }
    }
    logger.log(Level.FINE, () -> String.format("getAll read %d pings from %s", pings.size(), rootDir));
    return pings;
  }

  private Ping readPing(long id, Path file) throws IOException {
    final byte[] bytes = fileOperations.readAllBytes(file);
    return codec.decode(id, bytes);
  }

  private void handleMalformed(StorageReadException malformed) throws StorageReadException {
    switch (malformedPingPolicy) {
      case FAIL:
        throw malformed;
      case QUARANTINE:
        if (quarantine(malformed.getFile())) {
          malformedQuarantinedCount.incrementAndGet();
          logger.log(
              Level.WARNING,
              () -> String.format("quarantined %s into %s", malformed.getMessage(), quarantineDir));
          return;
        }
        malformedSkippedCount.incrementAndGet();
        return;
      case SKIP:
        malformedSkippedCount.incrementAndGet();
        logger.log(Level.WARNING, () -> "skipping " + malformed.getMessage());
        return;
      default:
        throw new AssertionError(malformedPingPolicy);
    }
  }

  /// @return false if the file could not be moved; it is then left in place
  private boolean quarantine(Path file) {
    try {
      fileOperations.createDirectories(quarantineDir);
      fileOperations.move(file, quarantineTargetFor(file));
      return true;
    } catch (IOException e) {
      logger.log(
          Level.WARNING,
          String.format("could not quarantine %s, skipping it instead", file),
          e);
      return false;
    }
  }

  /// A name in the quarantine directory not yet taken: `ping-2.json`, then `ping-2.json.1`,
  /// `ping-2.json.2` and so on, so an earlier quarantined file is never overwritten.
  private Path quarantineTargetFor(Path file) {
    final String name = file.getFileName().toString();
    Path target = quarantineDir.resolve(name);
    for (int n = 1; fileOperations.exists(target); n++) {
      target = quarantineDir.resolve(name + "." + n);
    }
    return target;
  }

  @Override
  public DeletionResult prune() throws IOException {
    return prune(maxPingCount);
  }

  /// Deletes the pings with the smallest ids until `maxCount` remain. Only file names are
  /// inspected, so malformed pings are evicted like any other.
  @Override
  @Synchronized
  public DeletionResult prune(int maxCount) throws IOException {
    if (maxCount < 0) {
      throw new IllegalArgumentException("maxCount must be non-negative, got " + maxCount);
    }
    final NavigableMap<Long, Path> files = pingFilesById();
    final int excess = files.size() - maxCount;
    if (excess <= 0) {
      logger.log(
          Level.FINE,
          () -> String.format("prune not needed count:%d maxCount:%d", files.size(), maxCount));
      return DeletionResult.empty();
    }

    final DeletionResult.Collector collector = new DeletionResult.Collector();
    final Iterator<Map.Entry<Long, Path>> oldestFirst = files.entrySet().iterator();
    for (int i = 0; i < excess; i++) {
      final Map.Entry<Long, Path> entry = oldestFirst.next();
      delete(entry.getKey(), entry.getValue(), collector);
    }
    final DeletionResult result = collector.build();
    prunedCount.addAndGet(result.removedCount());
    logger.log(
        Level.FINE,
        () ->
            String.format(
                "pruned count:%d maxCount:%d removed:%d absent:%d failed:%d",
                files.size(),
                maxCount,
                result.removedCount(),
                result.getAlreadyAbsent().size(),
                result.getFailed().size()));
    return result;
  }

  @Override
  @Synchronized
  public DeletionResult acknowledge(Set<Long> succeededIds) {
    Objects.requireNonNull(succeededIds, "succeededIds");
    if (succeededIds.isEmpty()) {
      return DeletionResult.empty();
    }
    final DeletionResult.Collector collector = new DeletionResult.Collector();
    for (long id : new TreeSet<>(succeededIds)) {
      if (id < 0) {
        // cannot have been stored
        collector.record(id, DeleteOutcome.ALREADY_ABSENT, null);
        alreadyAbsentCount.incrementAndGet();
        continue;
      }
      delete(id, getFileFor(id), collector);
    }
    final DeletionResult result = collector.build();
    acknowledgedCount.addAndGet(result.removedCount());
    logger.log(
        Level.FINE,
        () ->
            String.format(
                "acknowledged requested:%d removed:%d absent:%d failed:%d",
                result.requestedCount(),
                result.removedCount(),
                result.getAlreadyAbsent().size(),
                result.getFailed().size()));
    return result;
  }

  /// Idempotent delete of one ping file. An I/O error is recorded, never thrown.
  private void delete(long id, Path file, DeletionResult.Collector collector) {
    try {
      if (fileOperations.deleteIfExists(file)) {
        collector.record(id, DeleteOutcome.DELETED, null);
        logger.log(Level.FINEST, () -> String.format("deleted ping id:%d", id));
      } else {
        collector.record(id, DeleteOutcome.ALREADY_ABSENT, null);
        alreadyAbsentCount.incrementAndGet();
        logger.log(Level.FINEST, () -> String.format("ping id:%d already absent", id));
      }
    } catch (IOException e) {
      collector.record(id, DeleteOutcome.FAILED, e);
      deleteFailureCount.incrementAndGet();
      logger.log(Level.WARNING, String.format("failed to delete ping id:%d file:%s", id, file), e);
    }
  }

  @Override
  public int count() throws IOException {
    return pingFilesById().size();
  }

  /// Removes temporary files left behind by a process that died between writing a ping and
  /// renaming it into place. Only files last modified before `olderThan` ago are touched so
  /// that a write in flight in another process is left alone.
  ///
  /// @return the number of temporary files removed
  @Synchronized
  public int purgeTemporaryFiles(Duration olderThan) throws IOException {
    Objects.requireNonNull(olderThan, "olderThan");
    if (olderThan.isNegative()) {
      throw new IllegalArgumentException("olderThan must not be negative, got " + olderThan);
    }
    final long cutoffMillis = System.currentTimeMillis() - olderThan.toMillis();
    int removed = 0;
    for (Path file : fileOperations.list(rootDir)) {
      if (!PingFileNames.isTemporaryFilename(file.getFileName().toString())) {
        continue;
      }
      try {
        if (fileOperations.getLastModifiedTime(file).toMillis() <= cutoffMillis
            && fileOperations.deleteIfExists(file)) {
          removed++;
          logger.log(Level.FINEST, () -> String.format("purged temporary file %s", file));
        }
      } catch (NoSuchFileException gone) {
        logger.log(Level.FINEST, () -> String.format("temporary file vanished %s", file));
      } catch (IOException e) {
        deleteFailureCount.incrementAndGet();
        logger.log(Level.WARNING, String.format("failed to purge temporary file %s", file), e);
      }
    }
    final int purged = removed;
    logger.log(Level.FINE, () -> String.format("purged %d temporary files", purged));
    return purged;
  }

  public PingStoreStats getStats() {
    return new PingStoreStats(
        storedCount.get(),
        replacedCount.get(),
        prunedCount.get(),
        acknowledgedCount.get(),
        alreadyAbsentCount.get(),
        deleteFailureCount.get(),
        malformedSkippedCount.get(),
        malformedQuarantinedCount.get());
  }

  /// Snapshot of the ping files in the directory keyed by id, smallest first. Only regular
  /// files count; a directory with a ping name is ignored like any foreign entry.
  private NavigableMap<Long, Path> pingFilesById() throws IOException {
    final NavigableMap<Long, Path> files = new TreeMap<>();
    for (Path file : fileOperations.list(rootDir)) {
      final OptionalLong id = PingFileNames.tryParseId(file.getFileName().toString());
      if (id.isPresent() && fileOperations.isRegularFile(file)) {
        files.put(id.getAsLong(), file);
      }
    }
    return files;
  }

  @Override
  public String toString() {
    return String.format("JsonFilePingStore[rootDir=%s, maxPingCount=%d]", rootDir, maxPingCount);
  }
}
