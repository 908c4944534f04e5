package com.github.simbo1905.pingstore;

import java.nio.file.Path;
import lombok.Getter;

/// A single ping could not be published. When this is thrown neither the ping file nor its
/// temporary file is left behind.
public class StorageWriteFailedException extends PingStoreException {

  @Getter private final long pingId;

  @Getter private final Path target;

  public StorageWriteFailedException(long pingId, Path target, Throwable cause) {
    super(String.format("Failed to write ping %d to %s: %s", pingId, target, cause), cause);
    this.pingId = pingId;
    this.target = target;
  }
}
