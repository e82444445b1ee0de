package com.telegram.geolocation.geocoding;

import java.util.Optional;

import com.telegram.geolocation.dto.GeocodingMatch;

/**
 * Resolves a free-text place description to coordinates.
 *
 * <p>Implementations are fail-soft: network failures, error responses and malformed bodies are
 * reported as an empty {@link Optional}, never as an exception. Callers treat empty as "no match",
 * not as a transient error, and do not retry.
 */
public interface GeocodingClient {

  /**
   * Geocodes a query.
   *
   * @param query place description, e.g. {@code "Kharkiv, Ukraine"}
   * @param countryHint optional country restriction passed to the service, may be null
   * @return best match, or empty if there is none
   */
  Optional<GeocodingMatch> geocode(String query, String countryHint);

  default Optional<GeocodingMatch> geocode(String query) {
    return geocode(query, null);
  }
}
