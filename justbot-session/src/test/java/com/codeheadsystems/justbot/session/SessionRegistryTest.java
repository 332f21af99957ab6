package com.codeheadsystems.justbot.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.justbot.session.config.SessionConfig;
import com.codeheadsystems.justbot.session.exceptions.MaskConflictException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SessionRegistryTest {

  private MutableClock clock;
  private SessionRegistry<String> registry;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
    registry = new SessionRegistry<>(SessionConfig.DEFAULT, clock);
  }

  @ParameterizedTest
  @ValueSource(strings = {"alice!~a@host", "bob!bob@irc.example.org", "x", " mask with spaces "})
  void create_thenLookup_returnsSameSession(String mask) {
    Session<String> session = registry.create("user", mask);

    assertThat(registry.lookup(mask)).containsSame(session);
  }

  @Test
  void lookup_byIdentity_usesMask() {
    Session<String> session = registry.create("alice", "alice!~a@host");
    MaskedIdentity identity = () -> "alice!~a@host";

    assertThat(registry.lookup(identity)).containsSame(session);
  }

  @Test
  void lookup_unknown_isEmpty() {
    assertThat(registry.lookup("nobody")).isEmpty();
  }

  @Test
  void lookup_isExactMatchOnly() {
    registry.create("alice", "alice!~a@host");

    assertThat(registry.lookup("alice")).isEmpty();
    assertThat(registry.lookup("ALICE!~a@host")).isEmpty();
  }

  @Test
  void create_sameMask_replacesEntry() {
    Session<String> first = registry.create("alice", "mask");
    first.start();
    Session<String> second = registry.create("alice", "mask");

    assertThat(registry.lookup("mask")).containsSame(second);
    assertThat(registry.size()).isEqualTo(1);
    assertThat(first.active()).as("displaced session is not mutated").isTrue();
  }

  @Test
  void migrate_movesEntryAndMask() {
    Session<String> session = registry.create("alice", "old");

    assertThat(registry.migrate("old", "new")).containsSame(session);

    assertThat(registry.lookup("old")).isEmpty();
    assertThat(registry.lookup("new")).containsSame(session);
    assertThat(session.mask()).isEqualTo("new");
  }

  @Test
  void migrate_unknownMask_isEmptyAndCreatesNothing() {
    assertThat(registry.migrate("old", "new")).isEmpty();
    assertThat(registry.all()).isEmpty();
  }

  @Test
  void migrate_sameMask_isNoop() {
    Session<String> session = registry.create("alice", "mask");

    assertThat(registry.migrate("mask", "mask")).containsSame(session);
    assertThat(registry.lookup("mask")).containsSame(session);
  }

  @Test
  void migrate_ontoOccupiedMask_isRejected() {
    Session<String> alice = registry.create("alice", "alice-mask");
    Session<String> bob = registry.create("bob", "bob-mask");

    assertThatThrownBy(() -> registry.migrate("alice-mask", "bob-mask"))
        .isInstanceOf(MaskConflictException.class)
        .hasMessageContaining("bob-mask");

    assertThat(registry.lookup("alice-mask")).containsSame(alice);
    assertThat(registry.lookup("bob-mask")).containsSame(bob);
    assertThat(alice.mask()).isEqualTo("alice-mask");
  }

  @Test
  void setMask_ontoOccupiedMask_isRejected() {
    Session<String> alice = registry.create("alice", "alice-mask");
    registry.create("bob", "bob-mask");

    assertThatThrownBy(() -> alice.setMask("bob-mask"))
        .isInstanceOfSatisfying(MaskConflictException.class, e -> {
          assertThat(e.oldMask()).isEqualTo("alice-mask");
          assertThat(e.newMask()).isEqualTo("bob-mask");
        });
    assertThat(registry.lookup("alice-mask")).containsSame(alice);
  }

  @Test
  void setMask_afterStop_isRejected() {
    Session<String> session = registry.create("alice", "mask");
    session.stop();

    assertThatThrownBy(() -> session.setMask("new"))
        .isInstanceOf(IllegalStateException.class)
        .isNotInstanceOf(MaskConflictException.class);
    assertThat(registry.lookup("new")).isEmpty();
  }

  @Test
  void setMask_displacedSession_isRejected() {
    Session<String> first = registry.create("alice", "mask");
    Session<String> second = registry.create("alice", "mask");

    assertThatThrownBy(() -> first.setMask("x"))
        .isInstanceOf(IllegalStateException.class)
        .isNotInstanceOf(MaskConflictException.class);

    assertThat(registry.lookup("mask")).containsSame(second);
    assertThat(registry.lookup("x")).isEmpty();
    assertThat(first.mask()).isEqualTo("mask");
  }

  @Test
  void setMask_sameMask_isNoop() {
    Session<String> session = registry.create("alice", "mask");

    session.setMask("mask");

    assertThat(session.mask()).isEqualTo("mask");
    assertThat(registry.lookup("mask")).containsSame(session);
    assertThat(registry.size()).isEqualTo(1);
  }

  @Test
  void stop_concurrentWithSetMask_alwaysUnregisters() throws Exception {
    ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      for (int i = 0; i < 2000; i++) {
        Session<String> session = registry.create("user", "a" + i);
        String newMask = "b" + i;
        CyclicBarrier barrier = new CyclicBarrier(2);
        Future<?> rename = executor.submit(() -> {
          barrier.await();
          try {
            session.setMask(newMask);
          } catch (IllegalStateException e) {
            // stopped first
          }
          return null;
        });
        Future<Boolean> stop = executor.submit(() -> {
          barrier.await();
          return session.stop();
        });
        rename.get();

        assertThat(stop.get()).as("stop in round %d", i).isTrue();
        assertThat(registry.lookup(session.mask())).as("lookup in round %d", i).isEmpty();
      }
    } finally {
      executor.shutdown();
    }
    assertThat(registry.all()).isEmpty();
  }

  @Test
  void stop_displacedSession_keepsReplacement() {
    Session<String> first = registry.create("alice", "mask");
    Session<String> second = registry.create("alice", "mask");

    assertThat(first.stop()).isFalse();
    assertThat(registry.lookup("mask")).containsSame(second);
  }

  @Test
  void stop_removesCurrentMask() {
    Session<String> session = registry.create("alice", "old");
    session.setMask("new");
    session.stop();

    assertThat(registry.lookup("new")).isEmpty();
    assertThat(registry.lookup("old")).isEmpty();
  }

  @Test
  void expiredSessions_remainUntilStopped() {
    Session<String> session = registry.create("alice", "mask");
    session.start();
    clock.advance(Duration.ofDays(3));

    assertThat(registry.lookup("mask")).containsSame(session);
    assertThat(session.active()).isFalse();
  }

  @Test
  void removeExpired_removesOnlyStartedAndExpired() {
    Session<String> expired = registry.create("a", "expired");
    expired.start();
    clock.advance(Duration.ofHours(25));
    Session<String> active = registry.create("b", "active");
    active.start();
    Session<String> neverStarted = registry.create("c", "never-started");

    assertThat(registry.removeExpired()).isEqualTo(1);

    assertThat(registry.all()).containsOnlyKeys("active", "never-started");
    assertThat(registry.lookup("active")).containsSame(active);
    assertThat(registry.lookup("never-started")).containsSame(neverStarted);
  }

  @Test
  void all_isReadOnlySnapshot() {
    Session<String> session = registry.create("alice", "mask");
    Map<String, Session<String>> all = registry.all();
    registry.create("bob", "other");

    assertThat(all).containsOnlyKeys("mask").containsValue(session);
    assertThatThrownBy(all::clear).isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void registries_areIsolated() {
    SessionRegistry<String> other = new SessionRegistry<>(SessionConfig.DEFAULT, clock);
    registry.create("alice", "mask");

    assertThat(other.lookup("mask")).isEmpty();
  }

  @Test
  void concurrentCreatesAndMigrations_keepOneEntryPerSession() throws Exception {
    int threads = 8;
    int perThread = 200;
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      List<Callable<Void>> tasks = new ArrayList<>();
      for (int t = 0; t < threads; t++) {
        final int thread = t;
        tasks.add(() -> {
          for (int i = 0; i < perThread; i++) {
            String mask = "user" + thread + "-" + i;
            Session<String> session = registry.create("user", mask);
            session.setMask(mask + "-renamed");
          }
          return null;
        });
      }
      for (Future<Void> future : executor.invokeAll(tasks)) {
        future.get();
      }
    } finally {
      executor.shutdown();
    }

    Map<String, Session<String>> all = registry.all();
    assertThat(all).hasSize(threads * perThread);
    all.forEach((mask, session) -> {
      assertThat(mask).endsWith("-renamed");
      assertThat(session.mask()).isEqualTo(mask);
    });
  }
}
