package com.telegram.geolocation.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.telegram.geolocation.dto.CandidateType;
import com.telegram.geolocation.dto.LocationCandidate;

/**
 * Surfaces candidate place-name phrases from text using capitalization heuristics.
 *
 * <p>Three pattern classes are evaluated independently and all of their matches are returned, in
 * pattern order and then match order. The same phrase can therefore appear more than once with
 * different {@link CandidateType}s; each copy carries its own provenance.
 */
@Component
public class LocationEntityExtractor {

  private static final Logger logger = LoggerFactory.getLogger(LocationEntityExtractor.class);

  private static final String CAPITALIZED_PHRASE = "[A-Z][a-z]+(?:\\s+[A-Z][a-z]+)*";

  private static final Pattern CITY_COUNTRY =
      Pattern.compile("(" + CAPITALIZED_PHRASE + "),\\s*(" + CAPITALIZED_PHRASE + ")");

  private static final Pattern CITY_IN_COUNTRY =
      Pattern.compile("(" + CAPITALIZED_PHRASE + ")\\s+in\\s+(" + CAPITALIZED_PHRASE + ")");

  private static final Pattern CITY_ONLY = Pattern.compile("\\b(" + CAPITALIZED_PHRASE + ")\\b");

  static final Set<String> STOP_WORDS =
      Set.of("the", "and", "for", "with", "from", "this", "that");

  private static final int MIN_CITY_LENGTH = 3;

  /**
   * Extracts location candidates from the text.
   *
   * @param text message text, may be null
   * @return candidates of all three pattern classes, possibly empty
   */
  public List<LocationCandidate> extract(String text) {
    List<LocationCandidate> candidates = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return candidates;
    }

    collectPairs(CITY_COUNTRY.matcher(text), CandidateType.CITY_COUNTRY, candidates);
    collectPairs(CITY_IN_COUNTRY.matcher(text), CandidateType.CITY_IN_COUNTRY, candidates);

    Matcher matcher = CITY_ONLY.matcher(text);
    while (matcher.find()) {
      String city = matcher.group(1);
      if (city.length() >= MIN_CITY_LENGTH && !STOP_WORDS.contains(city.toLowerCase(Locale.ROOT))) {
        candidates.add(LocationCandidate.of(CandidateType.CITY_ONLY, city, null));
      }
    }

    logger.debug("Extracted {} location candidates", candidates.size());
    return candidates;
  }

  private static void collectPairs(
      Matcher matcher, CandidateType type, List<LocationCandidate> candidates) {
    while (matcher.find()) {
      candidates.add(LocationCandidate.of(type, matcher.group(1), matcher.group(2)));
    }
  }
}
