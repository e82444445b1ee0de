package com.telegram.geolocation.pipeline;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.telegram.geolocation.dto.GeolocationResult;
import com.telegram.geolocation.dto.MessageRecord;

/**
 * Orchestrates the geolocation strategy cascade for one message at a time.
 *
 * <p>Strategies run in ascending {@link GeolocationStrategy#getPriority()} order. The first one
 * that returns a result determines the output and the remaining strategies are skipped. If none
 * does, a terminal {@code none} result with zero confidence is produced.
 *
 * <p><strong>Cascade:</strong>
 *
 * <ol>
 *   <li>Exact coordinates (0.95)
 *   <li>Flag symbol centroid (0.85)
 *   <li>Entity extraction and geocoding, scored (at least 0.7 when accepted)
 *   <li>Place-name geocoding (0.4)
 *   <li>Channel fallback centroid (0.2)
 *   <li>No location found (0.0)
 * </ol>
 *
 * <p>Every stage appends to the message's {@link AttemptLog}, so the result's attempts trail is
 * never empty. The pipeline holds no per-message state and is safe to share, but calls into the
 * geocoding service block and are paced, so throughput is bounded by those calls.
 */
@Service
public class GeolocationPipeline {

  private static final Logger logger = LoggerFactory.getLogger(GeolocationPipeline.class);

  static final String NO_LOCATION_FOUND = "No geolocation found";

  private final List<GeolocationStrategy> strategies;

  public GeolocationPipeline(List<GeolocationStrategy> strategies) {
    if (strategies == null || strategies.isEmpty()) {
      throw new IllegalArgumentException("At least one GeolocationStrategy is required");
    }
    this.strategies =
        strategies.stream()
            .sorted(Comparator.comparingInt(GeolocationStrategy::getPriority))
            .toList();
    logger.info(
        "GeolocationPipeline initialized with strategies: {}",
        this.strategies.stream().map(GeolocationStrategy::getName).toList());
  }

  /**
   * Runs the cascade for one message.
   *
   * @param message the message to locate
   * @return a fresh, fully determined result
   */
  public GeolocationResult locate(MessageRecord message) {
    AttemptLog attempts = new AttemptLog();

    for (GeolocationStrategy strategy : strategies) {
      Optional<GeolocationResult> result = strategy.attempt(message, attempts);
      if (result.isPresent()) {
        logger.debug(
            "Message {} located by {} with confidence {}",
            message.id(),
            strategy.getName(),
            result.get().confidence());
        return result.get();
      }
    }

    attempts.record(NO_LOCATION_FOUND);
    logger.debug("No geolocation found for message {}", message.id());
    return GeolocationResult.none(attempts.snapshot());
  }

  public List<String> getStrategyNames() {
    return strategies.stream().map(GeolocationStrategy::getName).toList();
  }
}
