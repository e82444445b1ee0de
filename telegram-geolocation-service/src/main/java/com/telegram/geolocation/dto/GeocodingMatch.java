package com.telegram.geolocation.dto;

/**
 * Best match returned by the geocoding service for one query.
 *
 * @param lat latitude of the match
 * @param lon longitude of the match
 * @param placeName human readable name of the match
 * @param relevance service-reported relevance in [0, 1]
 * @param placeType first place type reported for the match, or {@code unknown}
 */
public record GeocodingMatch(
    double lat, double lon, String placeName, double relevance, String placeType) {

  public Coordinate coordinate() {
    return new Coordinate(lat, lon);
  }
}
