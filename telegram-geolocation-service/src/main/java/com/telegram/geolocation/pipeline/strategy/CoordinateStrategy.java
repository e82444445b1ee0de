package com.telegram.geolocation.pipeline.strategy;

import java.util.Optional;

import org.springframework.stereotype.Component;

import com.telegram.geolocation.dto.Coordinate;
import com.telegram.geolocation.dto.GeolocationResult;
import com.telegram.geolocation.dto.GeolocationSource;
import com.telegram.geolocation.dto.MessageRecord;
import com.telegram.geolocation.extraction.CoordinateExtractor;
import com.telegram.geolocation.pipeline.AttemptLog;
import com.telegram.geolocation.pipeline.GeolocationStrategy;

/** Stage 1: literal coordinates in the text. Accepted unconditionally at fixed confidence. */
@Component
public class CoordinateStrategy implements GeolocationStrategy {

  public static final double CONFIDENCE = 0.95;
  static final int PRIORITY = 10;

  private final CoordinateExtractor coordinateExtractor;

  public CoordinateStrategy(CoordinateExtractor coordinateExtractor) {
    this.coordinateExtractor = coordinateExtractor;
  }

  @Override
  public String getName() {
    return "coordinates";
  }

  @Override
  public int getPriority() {
    return PRIORITY;
  }

  @Override
  public Optional<GeolocationResult> attempt(MessageRecord message, AttemptLog attempts) {
    Optional<Coordinate> coordinate = coordinateExtractor.extract(message.text());
    if (coordinate.isEmpty()) {
      attempts.record("No coordinates found");
      return Optional.empty();
    }

    attempts.record("Found coordinates: " + coordinate.get());
    return Optional.of(
        GeolocationResult.located(
            coordinate.get(),
            null,
            CONFIDENCE,
            GeolocationSource.COORDINATES_REGEX.tag(),
            null,
            attempts.snapshot()));
  }
}
