package com.telegram.geolocation.dto;

/**
 * A place-name phrase surfaced from message text, ready to be geocoded.
 *
 * @param type pattern class that produced the candidate
 * @param city first (or only) capitalized phrase
 * @param country second phrase for two-part patterns, null for {@link CandidateType#CITY_ONLY}
 * @param query string sent to the geocoder
 * @param confidence weight of the pattern class
 */
public record LocationCandidate(
    CandidateType type, String city, String country, String query, double confidence) {

  public static LocationCandidate of(CandidateType type, String city, String country) {
    String trimmedCity = city.strip();
    String trimmedCountry = country == null ? null : country.strip();
    String query = trimmedCountry == null ? trimmedCity : trimmedCity + ", " + trimmedCountry;
    return new LocationCandidate(type, trimmedCity, trimmedCountry, query, type.weight());
  }
}
