package com.github.simbo1905.pingstore;

import java.nio.file.Path;
import lombok.Getter;

/// A ping file whose name is valid but whose content could not be read or parsed.
///
/// How enumeration reacts is decided by the store's [MalformedPingPolicy]; only under
/// [MalformedPingPolicy#FAIL] does this reach the caller.
public class StorageReadException extends PingStoreException {

  @Getter private final Path file;

  public StorageReadException(Path file, Throwable cause) {
    super(String.format("Malformed ping file %s: %s", file, cause.getMessage()), cause);
    this.file = file;
  }
}
