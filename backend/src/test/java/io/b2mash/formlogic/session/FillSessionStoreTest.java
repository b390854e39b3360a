package io.b2mash.formlogic.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.benmanes.caffeine.cache.Ticker;
import io.b2mash.formlogic.config.FormLogicProperties;
import io.b2mash.formlogic.exception.ResourceNotFoundException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class FillSessionStoreTest {

  private final AtomicLong nanos = new AtomicLong();
  private final Ticker ticker = nanos::get;

  private final FillSessionStore store =
      new FillSessionStore(
          new FormLogicProperties(
              "classpath*:form-packs/*.json", false, Duration.ofMinutes(30), 100, 10),
          ticker);

  @Test
  void createdSessionIsFound() {
    var session = new FillSession("s-1", 1, Instant.now());

    assertThat(store.getOrCreate("s-1", id -> session)).isSameAs(session);

    assertThat(store.find("s-1")).containsSame(session);
    assertThat(store.require("s-1")).isSameAs(session);
  }

  @Test
  void getOrCreateReturnsLiveSessionWithoutBuildingAnother() {
    var first = store.getOrCreate("s-1", id -> new FillSession(id, 1, Instant.now()));

    var second =
        store.getOrCreate(
            "s-1",
            id -> {
              throw new AssertionError("factory must not run for a live session");
            });

    assertThat(second).isSameAs(first);
  }

  @Test
  void unknownSessionIsNotFound() {
    assertThat(store.find("missing")).isEmpty();
    assertThatThrownBy(() -> store.require("missing"))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  @Test
  void idleSessionsExpire() {
    store.getOrCreate("s-1", id -> new FillSession(id, 1, Instant.now()));

    nanos.addAndGet(Duration.ofMinutes(31).toNanos());

    assertThat(store.find("s-1")).isEmpty();
  }

  @Test
  void accessKeepsSessionAlive() {
    store.getOrCreate("s-1", id -> new FillSession(id, 1, Instant.now()));

    nanos.addAndGet(Duration.ofMinutes(20).toNanos());
    assertThat(store.find("s-1")).isPresent();
    nanos.addAndGet(Duration.ofMinutes(20).toNanos());

    assertThat(store.find("s-1")).isPresent();
  }
}
