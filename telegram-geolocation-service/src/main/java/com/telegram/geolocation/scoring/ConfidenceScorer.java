package com.telegram.geolocation.scoring;

import org.springframework.stereotype.Component;

import com.telegram.geolocation.dto.GeolocationResult;
import com.telegram.geolocation.dto.GeolocationSource;

/**
 * Normalises a result's confidence according to the strategy that produced it.
 *
 * <p>Floors and caps per source family:
 *
 * <ul>
 *   <li>{@code coordinates*}: at least {@value #COORDINATES_FLOOR}
 *   <li>{@code flag*}: at least {@value #FLAG_FLOOR}
 *   <li>{@code llm_geocoding*}: at least {@value #LLM_GEOCODING_FLOOR}
 *   <li>{@code country_centroid*}: at most {@value #COUNTRY_CENTROID_CAP}
 *   <li>{@code channel_fallback*}: at most {@value #CHANNEL_FALLBACK_CAP}
 * </ul>
 *
 * <p>The final value is clamped to 1.0. The pipeline only routes entity geocoding results through
 * here; coordinate and flag results keep their fixed confidence, which already satisfies their
 * floors, so re-applying the rules to them is a no-op.
 */
@Component
public class ConfidenceScorer {

  static final double COORDINATES_FLOOR = 0.95;
  static final double FLAG_FLOOR = 0.85;
  static final double LLM_GEOCODING_FLOOR = 0.7;
  static final double COUNTRY_CENTROID_CAP = 0.5;
  static final double CHANNEL_FALLBACK_CAP = 0.3;
  private static final double MAX_CONFIDENCE = 1.0;

  public double score(GeolocationResult result) {
    double confidence = result.confidence();
    String source = result.source();

    if (GeolocationSource.COORDINATES_REGEX.matches(source)) {
      confidence = Math.max(confidence, COORDINATES_FLOOR);
    }
    if (GeolocationSource.FLAG_EMOJI.matches(source)) {
      confidence = Math.max(confidence, FLAG_FLOOR);
    }
    if (GeolocationSource.LLM_GEOCODING.matches(source)) {
      confidence = Math.max(confidence, LLM_GEOCODING_FLOOR);
    }
    if (GeolocationSource.COUNTRY_CENTROID.matches(source)) {
      confidence = Math.min(confidence, COUNTRY_CENTROID_CAP);
    }
    if (GeolocationSource.CHANNEL_FALLBACK.matches(source)) {
      confidence = Math.min(confidence, CHANNEL_FALLBACK_CAP);
    }
    return Math.min(confidence, MAX_CONFIDENCE);
  }

  /** Returns a copy of the result carrying the scored confidence. */
  public GeolocationResult apply(GeolocationResult result) {
    return result.withConfidence(score(result));
  }
}
