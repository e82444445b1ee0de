package com.telegram.geolocation.reference;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.telegram.geolocation.dto.Coordinate;

/**
 * Immutable country reference data: flag symbol to country code, and country code to centroid.
 *
 * <p>Both maps keep the iteration order of the source file. Flag resolution depends on that
 * order.
 */
public final class CountryReferenceData {

  private static final CountryReferenceData EMPTY =
      new CountryReferenceData(Map.of(), Map.of());

  private final Map<String, String> flagToCountry;
  private final Map<String, Coordinate> countryCentroids;

  public CountryReferenceData(
      Map<String, String> flagToCountry, Map<String, Coordinate> countryCentroids) {
    this.flagToCountry = Collections.unmodifiableMap(new LinkedHashMap<>(flagToCountry));
    this.countryCentroids = Collections.unmodifiableMap(new LinkedHashMap<>(countryCentroids));
  }

  public static CountryReferenceData empty() {
    return EMPTY;
  }

  public Map<String, String> flagToCountry() {
    return flagToCountry;
  }

  public Map<String, Coordinate> countryCentroids() {
    return countryCentroids;
  }

  public Optional<Coordinate> centroidOf(String countryCode) {
    if (countryCode == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(countryCentroids.get(countryCode));
  }

  public boolean isEmpty() {
    return flagToCountry.isEmpty() && countryCentroids.isEmpty();
  }
}
