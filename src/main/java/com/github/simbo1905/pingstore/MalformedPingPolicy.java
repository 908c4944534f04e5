package com.github.simbo1905.pingstore;

/// What [PingStore#getAll()] does with a ping file that has a valid name but unreadable or
/// unparsable content.
public enum MalformedPingPolicy {
  /// Log a warning, count it in the stats and leave the file where it is.
  SKIP,

  /// Log a warning, count it and move the file into the quarantine directory so it is not
  /// read again.
  QUARANTINE,

  /// Abort the enumeration with a [StorageReadException].
  FAIL
}
