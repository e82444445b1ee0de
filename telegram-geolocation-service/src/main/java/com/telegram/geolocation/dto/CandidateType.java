package com.telegram.geolocation.dto;

/**
 * Syntactic pattern a location candidate was recognised by, with the weight given to it before
 * geocoding relevance is applied.
 */
public enum CandidateType {
  /** "Capitalized Words, Capitalized Words" */
  CITY_COUNTRY("city_country", 0.8),
  /** "Capitalized Words in Capitalized Words" */
  CITY_IN_COUNTRY("city_in_country", 0.7),
  /** Any standalone capitalized phrase. */
  CITY_ONLY("city_only", 0.4);

  private final String tag;
  private final double weight;

  CandidateType(String tag, double weight) {
    this.tag = tag;
    this.weight = weight;
  }

  public String tag() {
    return tag;
  }

  public double weight() {
    return weight;
  }
}
