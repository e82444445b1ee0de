package com.telegram.geolocation.pipeline.strategy;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.telegram.geolocation.config.properties.PipelineConfigurationProperties;
import com.telegram.geolocation.dto.GeolocationResult;
import com.telegram.geolocation.dto.LocationCandidate;
import com.telegram.geolocation.dto.MessageRecord;
import com.telegram.geolocation.extraction.LocationEntityExtractor;
import com.telegram.geolocation.geocoding.CandidateGeocoder;
import com.telegram.geolocation.pipeline.AttemptLog;
import com.telegram.geolocation.pipeline.GeolocationStrategy;
import com.telegram.geolocation.scoring.ConfidenceScorer;

/**
 * Stage 3: entity extraction followed by geocoding of every candidate.
 *
 * <p>Runs only for texts longer than {@code pipeline.min-text-length} code points. The most
 * confident candidate result is accepted if it exceeds {@code
 * pipeline.entity-confidence-threshold}, and is then passed through the {@link ConfidenceScorer}.
 */
@Component
public class EntityGeocodingStrategy implements GeolocationStrategy {

  private static final Logger logger = LoggerFactory.getLogger(EntityGeocodingStrategy.class);

  static final int PRIORITY = 30;

  private final LocationEntityExtractor entityExtractor;
  private final CandidateGeocoder candidateGeocoder;
  private final ConfidenceScorer confidenceScorer;
  private final PipelineConfigurationProperties pipelineConfig;

  public EntityGeocodingStrategy(
      LocationEntityExtractor entityExtractor,
      CandidateGeocoder candidateGeocoder,
      ConfidenceScorer confidenceScorer,
      PipelineConfigurationProperties pipelineConfig) {
    this.entityExtractor = entityExtractor;
    this.candidateGeocoder = candidateGeocoder;
    this.confidenceScorer = confidenceScorer;
    this.pipelineConfig = pipelineConfig;
  }

  @Override
  public String getName() {
    return "entity_geocoding";
  }

  @Override
  public int getPriority() {
    return PRIORITY;
  }

  @Override
  public Optional<GeolocationResult> attempt(MessageRecord message, AttemptLog attempts) {
    String text = message.text();
    int length = text.codePointCount(0, text.length());
    if (length <= pipelineConfig.minTextLength()) {
      attempts.record("Text too short for entity extraction: " + length + " chars");
      return Optional.empty();
    }

    List<LocationCandidate> candidates = entityExtractor.extract(text);
    if (candidates.isEmpty()) {
      attempts.record("No location entities extracted");
      return Optional.empty();
    }

    List<GeolocationResult> results = candidateGeocoder.geocodeAll(candidates);
    results.forEach(result -> attempts.recordAll(result.geocodingAttempts()));

    Optional<GeolocationResult> best = candidateGeocoder.selectBest(results);
    double threshold = pipelineConfig.entityConfidenceThreshold();
    if (best.isEmpty() || best.get().confidence() <= threshold) {
      double bestConfidence = best.map(GeolocationResult::confidence).orElse(0.0);
      attempts.record(
          String.format(
              Locale.ROOT,
              "Best entity confidence %.2f not above threshold %.2f",
              bestConfidence,
              threshold));
      return Optional.empty();
    }

    GeolocationResult scored = confidenceScorer.apply(best.get());
    logger.debug(
        "Accepted {} for '{}' with confidence {} (raw {})",
        scored.source(),
        scored.placeName(),
        scored.confidence(),
        best.get().confidence());
    attempts.record(
        String.format(
            Locale.ROOT, "Selected %s: %s", scored.source(), scored.placeName()));
    return Optional.of(scored.withAttempts(attempts.snapshot()));
  }
}
