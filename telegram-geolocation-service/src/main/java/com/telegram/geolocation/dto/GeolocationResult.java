package com.telegram.geolocation.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Immutable outcome of the geolocation pipeline for one message.
 *
 * <p>Created once per accepted stage and never updated afterwards. {@code geocodingAttempts} is
 * the ordered diagnostic trail of everything tried for the message; its order matters for
 * debugging only.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonPropertyOrder({
  "lat",
  "lon",
  "country_code",
  "confidence",
  "source",
  "place_name",
  "geocoding_attempts"
})
public record GeolocationResult(
    @JsonProperty("lat") Double lat,
    @JsonProperty("lon") Double lon,
    @JsonProperty("country_code") String countryCode,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("source") String source,
    @JsonProperty("place_name") String placeName,
    @JsonProperty("geocoding_attempts") List<String> geocodingAttempts) {

  public GeolocationResult {
    if ((lat == null) != (lon == null)) {
      throw new IllegalArgumentException("Latitude and longitude must be set together");
    }
    if (lat != null && !Coordinate.isValid(lat, lon)) {
      throw new IllegalArgumentException("Invalid coordinates: " + lat + ", " + lon);
    }
    if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
      throw new IllegalArgumentException("Confidence must be between 0 and 1: " + confidence);
    }
    if (source == null || source.isBlank()) {
      throw new IllegalArgumentException("Source is required");
    }
    geocodingAttempts = geocodingAttempts == null ? List.of() : List.copyOf(geocodingAttempts);
  }

  public static GeolocationResult located(
      Coordinate coordinate,
      String countryCode,
      double confidence,
      String source,
      String placeName,
      List<String> attempts) {
    return new GeolocationResult(
        coordinate.lat(), coordinate.lon(), countryCode, confidence, source, placeName, attempts);
  }

  /** Terminal "no location found" result. */
  public static GeolocationResult none(List<String> attempts) {
    return new GeolocationResult(
        null, null, null, 0.0, GeolocationSource.NONE.tag(), null, attempts);
  }

  public GeolocationResult withConfidence(double newConfidence) {
    return new GeolocationResult(
        lat, lon, countryCode, newConfidence, source, placeName, geocodingAttempts);
  }

  public GeolocationResult withAttempts(List<String> attempts) {
    return new GeolocationResult(lat, lon, countryCode, confidence, source, placeName, attempts);
  }

  @JsonIgnore
  public boolean isLocated() {
    return lat != null && lon != null;
  }
}
