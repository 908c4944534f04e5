package com.github.simbo1905.pingstore;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Throws an IOException whenever the given operation is applied to a path whose file name
/// is in the target set, or to any path when the set is empty. Simulates a full disk, a
/// permission problem or a file held open by another process.
class DelegatingExceptionPingFileOperations extends AbstractDelegatingPingFileOperations {

  private static final Logger logger =
      Logger.getLogger(DelegatingExceptionPingFileOperations.class.getName());

  private final Operation failingOperation;
  private final Set<String> failingFileNames;
  private int throwCount = 0;

  DelegatingExceptionPingFileOperations(
      PingFileOperations delegate, Operation failingOperation, Set<String> failingFileNames) {
    super(delegate);
    this.failingOperation = failingOperation;
    this.failingFileNames = failingFileNames;
  }

  DelegatingExceptionPingFileOperations(PingFileOperations delegate, Operation failingOperation) {
    this(delegate, failingOperation, Set.of());
  }

  @Override
  protected void beforeOperation(Operation operation, Path path) throws IOException {
    if (operation != failingOperation) {
      return;
    }
    if (!failingFileNames.isEmpty()
        && !failingFileNames.contains(path.getFileName().toString())) {
      return;
    }
    throwCount++;
    logger.log(
        Level.FINE, () -> String.format("THROWING EXCEPTION at %s %s", operation, path));
    throw new IOException("Simulated " + operation + " failure on " + path.getFileName());
  }

  boolean didThrow() {
    return throwCount > 0;
  }

  int getThrowCount() {
    return throwCount;
  }
}
