package com.telegram.geolocation.extraction;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.telegram.geolocation.dto.Coordinate;

/**
 * Recognises literal coordinate notations in free text.
 *
 * <p>Notations are tried in a fixed order and the first one that matches wins:
 *
 * <ol>
 *   <li>Decimal degrees: {@code 40.7128, -74.0060}
 *   <li>Degrees, minutes, seconds with hemisphere: {@code 40°42'51"N, 74°00'21"W}
 *   <li>Labelled form: {@code lat: 40.7128 ... lon: -74.0060}
 * </ol>
 *
 * <p>Only the first match of a notation is considered. If it is out of range the extractor moves
 * on to the next notation instead of scanning further matches of the same one.
 */
@Component
public class CoordinateExtractor {

  private static final Logger logger = LoggerFactory.getLogger(CoordinateExtractor.class);

  private static final Pattern DECIMAL_DEGREES =
      Pattern.compile("(-?\\d+\\.\\d+),\\s*(-?\\d+\\.\\d+)");

  private static final Pattern DEGREES_MINUTES_SECONDS =
      Pattern.compile(
          "(\\d+)\u00B0(\\d+)'(\\d+\\.?\\d*)\"([NS]),\\s*(\\d+)\u00B0(\\d+)'(\\d+\\.?\\d*)\"([EW])");

  private static final Pattern LABELLED =
      Pattern.compile("lat:\\s*(-?\\d+\\.\\d+).*?lon:\\s*(-?\\d+\\.\\d+)");

  private record Notation(String name, Pattern pattern, Function<Matcher, Coordinate> parser) {}

  private static final List<Notation> NOTATIONS =
      List.of(
          new Notation("decimal", DECIMAL_DEGREES, CoordinateExtractor::parsePair),
          new Notation("dms", DEGREES_MINUTES_SECONDS, CoordinateExtractor::parseDms),
          new Notation("labelled", LABELLED, CoordinateExtractor::parsePair));

  /**
   * Extracts the first valid coordinate from the text.
   *
   * @param text message text, may be null
   * @return the coordinate, or empty if no notation yields a valid one
   */
  public Optional<Coordinate> extract(String text) {
    if (text == null || text.isEmpty()) {
      return Optional.empty();
    }
    for (Notation notation : NOTATIONS) {
      Matcher matcher = notation.pattern().matcher(text);
      if (!matcher.find()) {
        continue;
      }
      try {
        Coordinate coordinate = notation.parser().apply(matcher);
        if (coordinate != null) {
          return Optional.of(coordinate);
        }
        logger.debug("Discarding out-of-range {} coordinate: {}", notation.name(), matcher.group());
      } catch (NumberFormatException e) {
        logger.debug("Unparseable {} coordinate '{}': {}", notation.name(), matcher.group(), e.getMessage());
      }
    }
    return Optional.empty();
  }

  private static Coordinate parsePair(Matcher matcher) {
    return validOrNull(Double.parseDouble(matcher.group(1)), Double.parseDouble(matcher.group(2)));
  }

  private static Coordinate parseDms(Matcher matcher) {
    double lat = toDecimal(matcher.group(1), matcher.group(2), matcher.group(3));
    double lon = toDecimal(matcher.group(5), matcher.group(6), matcher.group(7));
    if ("S".equals(matcher.group(4))) {
      lat = -lat;
    }
    if ("W".equals(matcher.group(8))) {
      lon = -lon;
    }
    return validOrNull(lat, lon);
  }

  private static double toDecimal(String degrees, String minutes, String seconds) {
    return Integer.parseInt(degrees)
        + Integer.parseInt(minutes) / 60.0
        + Double.parseDouble(seconds) / 3600.0;
  }

  private static Coordinate validOrNull(double lat, double lon) {
    return Coordinate.isValid(lat, lon) ? new Coordinate(lat, lon) : null;
  }
}
