package com.telegram.geolocation.dto;

/** Tags identifying which strategy produced a {@link GeolocationResult}. */
public enum GeolocationSource {
  COORDINATES_REGEX("coordinates_regex"),
  FLAG_EMOJI("flag_emoji"),
  LLM_GEOCODING("llm_geocoding"),
  PLACE_NAME_GEOCODING("place_name_geocoding"),
  COUNTRY_CENTROID("country_centroid"),
  CHANNEL_FALLBACK("channel_fallback"),
  NONE("none");

  private final String tag;

  GeolocationSource(String tag) {
    this.tag = tag;
  }

  public String tag() {
    return tag;
  }

  /** Source tag for an entity geocoding result, e.g. {@code llm_geocoding_city_country}. */
  public static String llmGeocoding(CandidateType candidateType) {
    return LLM_GEOCODING.tag + "_" + candidateType.tag();
  }

  /** True if {@code source} is this tag or one of its subtypes. */
  public boolean matches(String source) {
    return source != null && source.startsWith(tag);
  }
}
