package com.codeheadsystems.justbot.session.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.ValueInstantiationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Objects;

/**
 * Session timing configuration.
 * <p>
 * Hosts embedding this in a YAML or JSON configuration supply
 * {@code sessionDurationSeconds} and {@code reapIntervalSeconds}; omitted values fall
 * back to {@link #DEFAULT}.
 *
 * @param sessionDuration how long a started session stays active
 * @param reapInterval    how often the expired-session reaper runs
 */
public record SessionConfig(Duration sessionDuration, Duration reapInterval) {

  /**
   * 24 hour sessions, reaped every 15 minutes.
   */
  public static final SessionConfig DEFAULT = new SessionConfig(Duration.ofHours(24), Duration.ofMinutes(15));

  private static final ObjectMapper MAPPER = new ObjectMapper();

  public SessionConfig {
    Objects.requireNonNull(sessionDuration, "sessionDuration");
    Objects.requireNonNull(reapInterval, "reapInterval");
    if (sessionDuration.isZero() || sessionDuration.isNegative()) {
      throw new IllegalArgumentException("sessionDuration must be positive: " + sessionDuration);
    }
    if (reapInterval.isZero() || reapInterval.isNegative()) {
      throw new IllegalArgumentException("reapInterval must be positive: " + reapInterval);
    }
  }

  /**
   * Binds the configuration from its serialized form.
   *
   * @param sessionDurationSeconds session duration, or null for the default
   * @param reapIntervalSeconds    reap interval, or null for the default
   * @return the session config
   */
  @JsonCreator
  public static SessionConfig fromSeconds(
      @JsonProperty("sessionDurationSeconds") Long sessionDurationSeconds,
      @JsonProperty("reapIntervalSeconds") Long reapIntervalSeconds) {
    return new SessionConfig(
        sessionDurationSeconds == null ? DEFAULT.sessionDuration() : Duration.ofSeconds(sessionDurationSeconds),
        reapIntervalSeconds == null ? DEFAULT.reapInterval() : Duration.ofSeconds(reapIntervalSeconds));
  }

  /**
   * Reads a configuration from JSON.
   *
   * @param json the json stream, not closed by this method
   * @return the session config
   * @throws IllegalArgumentException if a configured duration is not positive
   * @throws UncheckedIOException     if the json cannot be read or parsed
   */
  public static SessionConfig fromJson(InputStream json) {
    try {
      return MAPPER.readValue(json, SessionConfig.class);
    } catch (ValueInstantiationException e) {
      if (e.getCause() instanceof IllegalArgumentException invalid) {
        throw invalid;
      }
      throw new UncheckedIOException("Unable to read session config", e);
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read session config", e);
    }
  }

  /**
   * Short-lived sessions for tests.
   *
   * @param sessionDuration the session duration
   * @return the session config
   */
  public static SessionConfig forTesting(Duration sessionDuration) {
    return new SessionConfig(sessionDuration, DEFAULT.reapInterval());
  }
}
