package com.github.simbo1905.pingstore;

import java.io.IOException;

/// Base class of the I/O failures reported by a [PingStore].
public class PingStoreException extends IOException {

  public PingStoreException(String message) {
    super(message);
  }

  public PingStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
