package com.telegram.geolocation.geocoding;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.telegram.geolocation.dto.GeocodingMatch;
import com.telegram.geolocation.dto.GeolocationResult;
import com.telegram.geolocation.dto.GeolocationSource;
import com.telegram.geolocation.dto.LocationCandidate;

/**
 * Geocodes location candidates one after another and selects the most confident result.
 *
 * <p>Each candidate yields exactly one result. A match scores {@code candidate.confidence ×
 * match.relevance} with source {@code llm_geocoding_<type>}; no match scores zero with source
 * {@code none}. Every result carries its own attempts trail.
 */
@Service
public class CandidateGeocoder {

  private static final Logger logger = LoggerFactory.getLogger(CandidateGeocoder.class);

  private final GeocodingClient geocodingClient;

  public CandidateGeocoder(GeocodingClient geocodingClient) {
    this.geocodingClient = geocodingClient;
  }

  /**
   * Geocodes every candidate sequentially, in the given order.
   *
   * @param candidates candidates from entity extraction
   * @return one result per candidate, in candidate order
   */
  public List<GeolocationResult> geocodeAll(List<LocationCandidate> candidates) {
    List<GeolocationResult> results = new ArrayList<>(candidates.size());
    for (LocationCandidate candidate : candidates) {
      results.add(geocode(candidate));
    }
    return results;
  }

  GeolocationResult geocode(LocationCandidate candidate) {
    List<String> attempts = new ArrayList<>();
    attempts.add("LLM extracted: " + candidate.query());

    Optional<GeocodingMatch> match = geocodingClient.geocode(candidate.query());
    if (match.isEmpty()) {
      attempts.add("Geocoding failed");
      return GeolocationResult.none(attempts);
    }

    GeocodingMatch geocoded = match.get();
    attempts.add("Geocoded successfully: " + geocoded.placeName());
    double confidence = candidate.confidence() * geocoded.relevance();
    logger.debug(
        "Candidate '{}' ({}) geocoded to {} with confidence {}",
        candidate.query(),
        candidate.type().tag(),
        geocoded.placeName(),
        confidence);
    return GeolocationResult.located(
        geocoded.coordinate(),
        null,
        confidence,
        GeolocationSource.llmGeocoding(candidate.type()),
        geocoded.placeName(),
        attempts);
  }

  /**
   * Picks the result with the highest confidence. Ties go to the earliest result.
   *
   * @param results results in candidate order
   * @return best result, or empty if there are none
   */
  public Optional<GeolocationResult> selectBest(List<GeolocationResult> results) {
    GeolocationResult best = null;
    for (GeolocationResult result : results) {
      if (best == null || result.confidence() > best.confidence()) {
        best = result;
      }
    }
    return Optional.ofNullable(best);
  }
}
