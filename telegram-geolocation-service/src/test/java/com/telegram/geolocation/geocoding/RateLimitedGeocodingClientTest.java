package com.telegram.geolocation.geocoding;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.telegram.geolocation.dto.GeocodingMatch;

@DisplayName("Rate Limited Geocoding Client Tests")
class RateLimitedGeocodingClientTest {

  private static final Duration DELAY = Duration.ofMillis(100);

  private final List<Duration> pauses = new ArrayList<>();

  @Test
  @DisplayName("should pause after a successful call")
  void shouldPauseAfterMatch() {
    GeocodingClient delegate =
        (query, hint) -> Optional.of(new GeocodingMatch(50.45, 30.52, "Kyiv", 1.0, "place"));
    RateLimitedGeocodingClient client =
        new RateLimitedGeocodingClient(delegate, DELAY, pauses::add);

    assertThat(client.geocode("Kyiv")).isPresent();
    assertThat(pauses).containsExactly(DELAY);
  }

  @Test
  @DisplayName("should pause after an empty result")
  void shouldPauseAfterNoMatch() {
    RateLimitedGeocodingClient client =
        new RateLimitedGeocodingClient((query, hint) -> Optional.empty(), DELAY, pauses::add);

    client.geocode("Nowhere");
    client.geocode("Nowhere else");

    assertThat(pauses).containsExactly(DELAY, DELAY);
  }

  @Test
  @DisplayName("should pause even when the delegate throws")
  void shouldPauseAfterFailure() {
    GeocodingClient failing =
        (query, hint) -> {
          throw new IllegalStateException("boom");
        };
    RateLimitedGeocodingClient client =
        new RateLimitedGeocodingClient(failing, DELAY, pauses::add);

    assertThatThrownBy(() -> client.geocode("Kyiv")).isInstanceOf(IllegalStateException.class);
    assertThat(pauses).containsExactly(DELAY);
  }

  @Test
  @DisplayName("should not pause when the delay is zero")
  void shouldSkipZeroDelay() {
    RateLimitedGeocodingClient client =
        new RateLimitedGeocodingClient(
            (query, hint) -> Optional.empty(), Duration.ZERO, pauses::add);

    client.geocode("Kyiv");

    assertThat(pauses).isEmpty();
  }

  @Test
  @DisplayName("should restore the interrupt flag when interrupted")
  void shouldRestoreInterruptFlag() {
    RateLimitedGeocodingClient client =
        new RateLimitedGeocodingClient(
            (query, hint) -> Optional.empty(),
            DELAY,
            duration -> {
              throw new InterruptedException("stop");
            });

    assertThat(client.geocode("Kyiv")).isEmpty();
    assertThat(Thread.interrupted()).isTrue();
  }

  @Test
  @DisplayName("should reject a negative delay")
  void shouldRejectNegativeDelay() {
    assertThatThrownBy(
            () ->
                new RateLimitedGeocodingClient(
                    (query, hint) -> Optional.empty(), Duration.ofMillis(-1)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
