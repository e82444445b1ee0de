package com.telegram.geolocation.pipeline.strategy;

import java.util.Optional;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.telegram.geolocation.dto.GeocodingMatch;
import com.telegram.geolocation.dto.GeolocationResult;
import com.telegram.geolocation.dto.GeolocationSource;
import com.telegram.geolocation.dto.MessageRecord;
import com.telegram.geolocation.extraction.PlaceNameExtractor;
import com.telegram.geolocation.geocoding.GeocodingClient;
import com.telegram.geolocation.pipeline.AttemptLog;
import com.telegram.geolocation.pipeline.GeolocationStrategy;

/**
 * Stage 4: geocode the first extracted place name.
 *
 * <p>Any match is accepted at a fixed confidence, independent of the service's relevance.
 */
@Component
public class PlaceNameGeocodingStrategy implements GeolocationStrategy {

  public static final double CONFIDENCE = 0.4;
  static final int PRIORITY = 40;

  private final PlaceNameExtractor placeNameExtractor;
  private final GeocodingClient geocodingClient;

  public PlaceNameGeocodingStrategy(
      PlaceNameExtractor placeNameExtractor, GeocodingClient geocodingClient) {
    this.placeNameExtractor = placeNameExtractor;
    this.geocodingClient = geocodingClient;
  }

  @Override
  public String getName() {
    return "place_name";
  }

  @Override
  public int getPriority() {
    return PRIORITY;
  }

  @Override
  public Optional<GeolocationResult> attempt(MessageRecord message, AttemptLog attempts) {
    Set<String> placeNames = placeNameExtractor.extract(message.text());
    if (placeNames.isEmpty()) {
      attempts.record("No place names extracted");
      return Optional.empty();
    }

    String placeName = placeNames.iterator().next();
    Optional<GeocodingMatch> match = geocodingClient.geocode(placeName);
    if (match.isEmpty()) {
      attempts.record("Place name geocoding failed: " + placeName);
      return Optional.empty();
    }

    attempts.record("Geocoded place: " + placeName);
    return Optional.of(
        GeolocationResult.located(
            match.get().coordinate(),
            null,
            CONFIDENCE,
            GeolocationSource.PLACE_NAME_GEOCODING.tag(),
            match.get().placeName(),
            attempts.snapshot()));
  }
}
