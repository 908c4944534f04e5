package com.github.simbo1905.pingstore;

import static org.junit.Assert.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

/// Cleanup of temporary files abandoned by a crash between write and rename.
public class PurgeTemporaryFilesTest extends JulLoggingConfig {

  @Rule public TemporaryFolder tempFolder = new TemporaryFolder();

  private Path storeDir;
  private JsonFilePingStore store;

  @Before
  public void setUp() throws IOException {
    storeDir = tempFolder.newFolder("pings").toPath();
    store = new JsonFilePingStore(storeDir);
  }

  private Path abandonedTemporary(String name, Duration age) throws IOException {
    final Path file = storeDir.resolve(name);
    Files.write(file, "{\"path\":".getBytes(StandardCharsets.UTF_8));
    Files.setLastModifiedTime(file, FileTime.from(Instant.now().minus(age)));
    return file;
  }

  @Test
  public void testOldTemporaryFilesAreRemoved() throws Exception {
    store.store(new Ping(1, "url", JsonFilePingStoreTest.generatePayload()));
    final Path stale = abandonedTemporary(".ping-4711.tmp", Duration.ofHours(2));
    final Path fresh = abandonedTemporary(".ping-4712.tmp", Duration.ZERO);

    assertEquals(1, store.purgeTemporaryFiles(Duration.ofMinutes(10)));

    assertFalse(Files.exists(stale));
    assertTrue("a write that may still be in flight is kept", Files.exists(fresh));
    assertTrue(Files.exists(store.getFileFor(1)));
  }

  @Test
  public void testPingAndForeignFilesAreNeverPurged() throws Exception {
    final Path foreign = storeDir.resolve("other.tmp");
    Files.write(foreign, new byte[0]);
    Files.setLastModifiedTime(foreign, FileTime.from(Instant.now().minus(Duration.ofDays(3))));
    store.store(new Ping(2, "url", JsonFilePingStoreTest.generatePayload()));
    Files.setLastModifiedTime(
        store.getFileFor(2), FileTime.from(Instant.now().minus(Duration.ofDays(3))));

    assertEquals(0, store.purgeTemporaryFiles(Duration.ZERO));

    assertTrue(Files.exists(foreign));
    assertEquals(1, store.count());
  }

  @Test
  public void testTemporaryFilesAreInvisibleToEnumeration() throws Exception {
    abandonedTemporary(".ping-99.tmp", Duration.ofHours(1));
    assertTrue(store.getAll().isEmpty());
    assertEquals(0, store.count());
    assertEquals(0, store.getStats().getMalformedSkippedCount());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeAgeRejected() throws Exception {
    store.purgeTemporaryFiles(Duration.ofSeconds(-1));
  }
}
