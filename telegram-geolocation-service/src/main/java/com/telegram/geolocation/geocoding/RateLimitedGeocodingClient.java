package com.telegram.geolocation.geocoding;

import java.time.Duration;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.telegram.geolocation.dto.GeocodingMatch;

/**
 * Decorator that enforces a fixed pause after every geocoding call.
 *
 * <p>The pause is paid whether the call matched, found nothing or failed, so consecutive calls are
 * never closer together than the configured delay.
 */
public class RateLimitedGeocodingClient implements GeocodingClient {

  private static final Logger logger = LoggerFactory.getLogger(RateLimitedGeocodingClient.class);

  /** Blocking pause, injectable so tests do not sleep. */
  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }

  private final GeocodingClient delegate;
  private final Duration delay;
  private final Sleeper sleeper;

  public RateLimitedGeocodingClient(GeocodingClient delegate, Duration delay) {
    this(delegate, delay, duration -> Thread.sleep(duration.toMillis()));
  }

  public RateLimitedGeocodingClient(GeocodingClient delegate, Duration delay, Sleeper sleeper) {
    if (delegate == null) {
      throw new IllegalArgumentException("Delegate GeocodingClient cannot be null");
    }
    if (delay == null || delay.isNegative()) {
      throw new IllegalArgumentException("Rate limit delay must be zero or positive");
    }
    this.delegate = delegate;
    this.delay = delay;
    this.sleeper = sleeper;
  }

  @Override
  public Optional<GeocodingMatch> geocode(String query, String countryHint) {
    try {
      return delegate.geocode(query, countryHint);
    } finally {
      pause();
    }
  }

  private void pause() {
    if (delay.isZero()) {
      return;
    }
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException e) {
      logger.warn("Interrupted during geocoding rate limit pause");
      Thread.currentThread().interrupt();
    }
  }
}
