package org.waabox.filedex.sqlite;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link SqliteWriterActor}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class SqliteWriterActorTest {

  @TempDir
  Path dir;

  @Test
  void whenClosing_givenConcurrentWriters_shouldAnswerEveryCaller()
      throws Exception {
    final SqliteWriterActor actor = new SqliteWriterActor(
        SqliteConfig.create(dir.resolve("race.sqlite"), 4,
            Duration.ofSeconds(5)));
    final ExecutorService pool = Executors.newFixedThreadPool(8);
    final CountDownLatch started = new CountDownLatch(8);
    final List<Future<Integer>> results = new ArrayList<>();
    try {
      for (int t = 0; t < 8; t++) {
        results.add(pool.submit(() -> {
          started.countDown();
          int done = 0;
          try {
            while (true) {
              actor.write(conn -> 1);
              done++;
            }
          } catch (final IllegalStateException e) {
            return done;
          }
        }));
      }
      started.await();
      Thread.sleep(50);
      actor.close();

      for (final Future<Integer> result : results) {
        assertTrue(result.get(10, TimeUnit.SECONDS) >= 0);
      }
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void whenWriting_givenFailingWork_shouldRethrowItsError() {
    final SqliteWriterActor actor = new SqliteWriterActor(
        SqliteConfig.create(dir.resolve("error.sqlite")));
    try {
      final IllegalArgumentException error = assertThrows(
          IllegalArgumentException.class, () -> actor.write(conn -> {
            throw new IllegalArgumentException("bad write");
          }));
      assertEquals("bad write", error.getMessage());
    } finally {
      actor.close();
    }
  }
}
