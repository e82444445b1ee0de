package com.telegram.geolocation.geocoding;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telegram.geolocation.config.properties.GeocodingConfigurationProperties;
import com.telegram.geolocation.dto.Coordinate;
import com.telegram.geolocation.dto.GeocodingMatch;

import lombok.RequiredArgsConstructor;

/**
 * Client for the Mapbox forward geocoding API.
 *
 * <p>Issues {@code GET {base-url}/{query}.json} with the access token, place types and result
 * limit, and maps the first feature of the response to a {@link GeocodingMatch}. HTTP errors,
 * connection failures, timeouts and malformed bodies are logged and reported as no match.
 *
 * <p>This client does not pace its calls; wrap it in {@link RateLimitedGeocodingClient}.
 */
@RequiredArgsConstructor
public class MapboxGeocodingClient implements GeocodingClient {

  private static final Logger logger = LoggerFactory.getLogger(MapboxGeocodingClient.class);

  private static final String UNKNOWN_PLACE_TYPE = "unknown";

  private final WebClient webClient;
  private final GeocodingConfigurationProperties properties;
  private final ObjectMapper objectMapper;

  @Override
  public Optional<GeocodingMatch> geocode(String query, String countryHint) {
    if (query == null || query.isBlank()) {
      return Optional.empty();
    }
    logger.debug("Geocoding query '{}' (country hint: {})", query, countryHint);

    try {
      String body =
          webClient
              .get()
              .uri(buildUri(query, countryHint))
              .retrieve()
              .bodyToMono(String.class)
              .timeout(Duration.ofMillis(properties.readTimeoutMs()))
              .block();

      Optional<GeocodingMatch> match = parseFirstFeature(query, body);
      if (match.isEmpty()) {
        logger.debug("No geocoding match for '{}'", query);
      }
      return match;

    } catch (WebClientResponseException e) {
      logger.warn(
          "Geocoding failed for '{}': HTTP {} {}",
          query,
          e.getStatusCode().value(),
          e.getStatusText());
      return Optional.empty();

    } catch (WebClientRequestException e) {
      logger.warn("Geocoding failed for '{}': connection failed: {}", query, e.getMessage());
      return Optional.empty();

    } catch (Exception e) {
      // Timeouts surface here as well as unexpected reactor errors
      if (e.getCause() instanceof InterruptedException) {
        logger.warn("Interrupted while geocoding '{}'", query);
        Thread.currentThread().interrupt();
        return Optional.empty();
      }
      logger.warn("Geocoding failed for '{}': {}", query, e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Maps the first feature of a Mapbox response to a match.
   *
   * @param query original query, used as the place name when the feature has none
   * @param body raw response body
   * @return match, or empty if the body has no usable feature
   */
  Optional<GeocodingMatch> parseFirstFeature(String query, String body) {
    if (body == null || body.isBlank()) {
      return Optional.empty();
    }
    try {
      JsonNode features = objectMapper.readTree(body).path("features");
      if (!features.isArray() || features.isEmpty()) {
        return Optional.empty();
      }

      JsonNode feature = features.get(0);
      JsonNode coordinates = feature.path("geometry").path("coordinates");
      if (!coordinates.isArray()
          || coordinates.size() < 2
          || !coordinates.get(0).isNumber()
          || !coordinates.get(1).isNumber()) {
        logger.warn("Geocoding response for '{}' has no usable coordinates", query);
        return Optional.empty();
      }
      double lon = coordinates.get(0).asDouble();
      double lat = coordinates.get(1).asDouble();
      if (!Coordinate.isValid(lat, lon)) {
        logger.warn("Geocoding response for '{}' is out of range: {}, {}", query, lat, lon);
        return Optional.empty();
      }

      String placeName = feature.path("place_name").asText(query);
      double relevance = Math.max(0.0, Math.min(1.0, feature.path("relevance").asDouble(0.0)));
      JsonNode placeTypes = feature.path("place_type");
      String placeType =
          placeTypes.isArray() && !placeTypes.isEmpty()
              ? placeTypes.get(0).asText(UNKNOWN_PLACE_TYPE)
              : UNKNOWN_PLACE_TYPE;

      return Optional.of(new GeocodingMatch(lat, lon, placeName, relevance, placeType));

    } catch (Exception e) {
      logger.warn("Malformed geocoding response for '{}': {}", query, e.getMessage());
      return Optional.empty();
    }
  }

  private URI buildUri(String query, String countryHint) {
    UriComponentsBuilder builder =
        UriComponentsBuilder.fromUriString(properties.baseUrl())
            .pathSegment(query + ".json")
            .queryParam("access_token", properties.accessToken())
            .queryParam("types", properties.types())
            .queryParam("limit", properties.limit());
    if (countryHint != null && !countryHint.isBlank()) {
      builder.queryParam("country", countryHint);
    }
    return builder.encode().build().toUri();
  }
}
