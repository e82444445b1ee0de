package com.telegram.geolocation.extraction;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

/**
 * Low-precision fallback that treats any capitalized phrase as a place name.
 *
 * <p>Results are deduplicated. Callers must not rely on the iteration order of the returned set;
 * the current implementation happens to return capitalized phrases before "City, Country" pairs,
 * each in text order.
 */
@Component
public class PlaceNameExtractor {

  private static final Pattern CAPITALIZED_WORDS =
      Pattern.compile("\\b([A-Z][a-z]+(?:\\s+[A-Z][a-z]+)*)\\b");

  private static final Pattern CITY_COUNTRY =
      Pattern.compile("\\b([A-Z][a-z]+(?:\\s+[A-Z][a-z]+)*),\\s*([A-Z][a-z]+)\\b");

  public Set<String> extract(String text) {
    Set<String> places = new LinkedHashSet<>();
    if (text == null || text.isEmpty()) {
      return places;
    }

    Matcher words = CAPITALIZED_WORDS.matcher(text);
    while (words.find()) {
      places.add(words.group(1));
    }

    Matcher pairs = CITY_COUNTRY.matcher(text);
    while (pairs.find()) {
      places.add(pairs.group(1) + ", " + pairs.group(2));
    }
    return places;
  }
}
