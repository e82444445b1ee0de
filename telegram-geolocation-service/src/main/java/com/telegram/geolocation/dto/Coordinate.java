package com.telegram.geolocation.dto;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A WGS84 point in decimal degrees. */
public record Coordinate(@JsonProperty("lat") double lat, @JsonProperty("lon") double lon) {

  public Coordinate {
    if (!isValid(lat, lon)) {
      throw new IllegalArgumentException(
          String.format(Locale.ROOT, "Invalid coordinate (%s, %s)", lat, lon));
    }
  }

  /**
   * Checks the WGS84 bounds: latitude in [-90, 90], longitude in [-180, 180].
   *
   * @return true if both values are finite and inside their range
   */
  public static boolean isValid(double lat, double lon) {
    return !Double.isNaN(lat)
        && !Double.isNaN(lon)
        && lat >= -90.0
        && lat <= 90.0
        && lon >= -180.0
        && lon <= 180.0;
  }

  @Override
  public String toString() {
    return "(" + lat + ", " + lon + ")";
  }
}
