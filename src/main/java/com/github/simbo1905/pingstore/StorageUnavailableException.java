package com.github.simbo1905.pingstore;

import java.nio.file.Path;
import lombok.Getter;

/// The root directory cannot be used: it is a regular file, it cannot be created, or it is
/// not writable. Raised only while opening a store.
public class StorageUnavailableException extends PingStoreException {

  @Getter private final Path rootDir;

  public StorageUnavailableException(Path rootDir, String reason) {
    super(String.format("Ping store directory %s is unavailable: %s", rootDir, reason));
    this.rootDir = rootDir;
  }

  public StorageUnavailableException(Path rootDir, String reason, Throwable cause) {
    super(String.format("Ping store directory %s is unavailable: %s", rootDir, reason), cause);
    this.rootDir = rootDir;
  }
}
