package io.b2mash.formlogic.session;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.b2mash.formlogic.config.FormLogicProperties;
import io.b2mash.formlogic.exception.ResourceNotFoundException;
import java.util.Optional;
import java.util.function.Function;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** In-memory session store. Sessions idle longer than the configured timeout are evicted. */
@Component
public class FillSessionStore {

  private final Cache<String, FillSession> sessions;

  @Autowired
  public FillSessionStore(FormLogicProperties properties) {
    this(properties, Ticker.systemTicker());
  }

  FillSessionStore(FormLogicProperties properties, Ticker ticker) {
    this.sessions =
        Caffeine.newBuilder()
            .expireAfterAccess(properties.sessionIdleTimeout())
            .maximumSize(properties.maxSessions())
            .ticker(ticker)
            .build();
  }

  /**
   * Returns the live session with this id, or atomically stores the one built by {@code factory}.
   * Concurrent callers with the same id all receive the same instance.
   */
  public FillSession getOrCreate(String sessionId, Function<String, FillSession> factory) {
    return sessions.get(sessionId, factory);
  }

  public Optional<FillSession> find(String sessionId) {
    return Optional.ofNullable(sessions.getIfPresent(sessionId));
  }

  public FillSession require(String sessionId) {
    return find(sessionId).orElseThrow(() -> new ResourceNotFoundException("Session", sessionId));
  }
}
