package com.github.simbo1905.pingstore;

/// Result of deleting a single ping file. A file that is already gone is a success, so that
/// racing prune and acknowledge calls never report an error for each other.
public enum DeleteOutcome {
  DELETED,
  ALREADY_ABSENT,
  FAILED
}
