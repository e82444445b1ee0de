package com.telegram.geolocation.scoring;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.telegram.geolocation.dto.Coordinate;
import com.telegram.geolocation.dto.GeolocationResult;

@DisplayName("Confidence Scorer Tests")
class ConfidenceScorerTest {

  private final ConfidenceScorer scorer = new ConfidenceScorer();

  @ParameterizedTest(name = "{0} at {1} scores {2}")
  @CsvSource({
    "coordinates_regex, 0.5, 0.95",
    "flag_emoji, 0.3, 0.85",
    "llm_geocoding_city_country, 0.4, 0.7",
    "llm_geocoding_city_only, 0.9, 0.9",
    "country_centroid, 0.8, 0.5",
    "channel_fallback, 0.6, 0.3",
    "channel_fallback, 0.2, 0.2",
    "place_name_geocoding, 0.4, 0.4"
  })
  @DisplayName("should apply floors and caps by source family")
  void shouldApplyRules(String source, double confidence, double expected) {
    assertThat(scorer.score(result(source, confidence))).isEqualTo(expected);
  }

  @Test
  @DisplayName("should leave fixed coordinate and flag confidences unchanged")
  void shouldBeNoOpForFixedConfidences() {
    assertThat(scorer.score(result("coordinates_regex", 0.95))).isEqualTo(0.95);
    assertThat(scorer.score(result("flag_emoji", 0.85))).isEqualTo(0.85);
  }

  @Test
  @DisplayName("apply should return a copy with the scored confidence")
  void applyShouldReturnCopy() {
    GeolocationResult original = result("llm_geocoding_city_in_country", 0.35);

    GeolocationResult scored = scorer.apply(original);

    assertThat(scored.confidence()).isEqualTo(0.7);
    assertThat(scored.source()).isEqualTo(original.source());
    assertThat(scored.geocodingAttempts()).isEqualTo(original.geocodingAttempts());
    assertThat(original.confidence()).isEqualTo(0.35);
  }

  private static GeolocationResult result(String source, double confidence) {
    return GeolocationResult.located(
        new Coordinate(50.0, 30.0), null, confidence, source, null, List.of("test"));
  }
}
