package com.github.simbo1905.pingstore;

import java.io.IOException;
import java.nio.file.CopyOption;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.List;

/// The filesystem calls the ping store makes. Kept narrow so that tests can wrap the real
/// implementation and inject failures at a chosen call.
interface PingFileOperations {

  void createDirectories(Path dir) throws IOException;

  /// Creates a new empty file with a fresh name in `dir`. The file gets the same permissions
  /// as any other file the process creates there.
  Path createTempFile(Path dir, String prefix, String suffix) throws IOException;

  /// Writes the bytes, forces them to the storage device and closes the file. No handle or
  /// lock is held once this returns.
  void write(Path file, byte[] bytes) throws IOException;

  void move(Path source, Path target, CopyOption... options) throws IOException;

  /// Adds a second name for an existing file.
  ///
  /// @throws java.nio.file.FileAlreadyExistsException if `link` exists; the check and the
  /// creation are one atomic step
  void createLink(Path link, Path existing) throws IOException;

  /// Idempotent delete.
  ///
  /// @return true if this call removed the file, false if it was already absent
  boolean deleteIfExists(Path file) throws IOException;

  boolean exists(Path file);

  boolean isRegularFile(Path file);

  /// Lists the direct children of a directory. The result is a snapshot; entries may vanish
  /// before the caller gets to them.
  List<Path> list(Path dir) throws IOException;

  byte[] readAllBytes(Path file) throws IOException;

  FileTime getLastModifiedTime(Path file) throws IOException;
}
