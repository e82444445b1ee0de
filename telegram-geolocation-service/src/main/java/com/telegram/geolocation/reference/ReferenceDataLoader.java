package com.telegram.geolocation.reference;

import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.telegram.geolocation.dto.Coordinate;

/**
 * Loads {@link CountryReferenceData} from a YAML document with two top-level keys, {@code
 * flag_to_country} and {@code country_centroids}.
 *
 * <p>A missing or unreadable document never fails the caller: the condition is logged and empty
 * reference data is returned, so flag and channel fallback resolution simply never match.
 * Individual malformed entries are skipped with a warning.
 */
@Service
public class ReferenceDataLoader {

  private static final Logger logger = LoggerFactory.getLogger(ReferenceDataLoader.class);

  static final String FLAG_TO_COUNTRY = "flag_to_country";
  static final String COUNTRY_CENTROIDS = "country_centroids";

  private final ResourceLoader resourceLoader;
  private final ObjectMapper yamlMapper = new YAMLMapper();

  public ReferenceDataLoader(ResourceLoader resourceLoader) {
    this.resourceLoader = resourceLoader;
  }

  /**
   * Loads reference data from a Spring resource location.
   *
   * @param location e.g. {@code classpath:countries.yml}
   * @return loaded data, or empty data if the resource is missing or malformed
   */
  public CountryReferenceData load(String location) {
    Resource resource = resourceLoader.getResource(location);
    if (!resource.exists()) {
      logger.error("Reference data not found at {}, flag and channel fallback disabled", location);
      return CountryReferenceData.empty();
    }

    try (InputStream inputStream = resource.getInputStream()) {
      CountryReferenceData data = parse(yamlMapper.readTree(inputStream));
      logger.info(
          "Loaded reference data from {}: {} flags, {} country centroids",
          location,
          data.flagToCountry().size(),
          data.countryCentroids().size());
      return data;
    } catch (IOException | IllegalArgumentException e) {
      logger.error("Error loading reference data from {}: {}", location, e.getMessage());
      return CountryReferenceData.empty();
    }
  }

  private CountryReferenceData parse(JsonNode root) {
    if (root == null || !root.isObject()) {
      throw new IllegalArgumentException("Reference data must be a mapping");
    }
    JsonNode flags = root.get(FLAG_TO_COUNTRY);
    JsonNode centroids = root.get(COUNTRY_CENTROIDS);
    if (flags == null || !flags.isObject() || centroids == null || !centroids.isObject()) {
      throw new IllegalArgumentException(
          "Reference data requires '" + FLAG_TO_COUNTRY + "' and '" + COUNTRY_CENTROIDS + "'");
    }
    return new CountryReferenceData(parseFlags(flags), parseCentroids(centroids));
  }

  private Map<String, String> parseFlags(JsonNode flags) {
    Map<String, String> flagToCountry = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = flags.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (!field.getValue().isTextual() || field.getValue().asText().isBlank()) {
        logger.warn("Skipping flag entry '{}' without a country code", field.getKey());
        continue;
      }
      flagToCountry.put(field.getKey(), field.getValue().asText());
    }
    return flagToCountry;
  }

  private Map<String, Coordinate> parseCentroids(JsonNode centroids) {
    Map<String, Coordinate> countryCentroids = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = centroids.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      JsonNode lat = field.getValue().get("lat");
      JsonNode lon = field.getValue().get("lon");
      if (lat == null
          || lon == null
          || !lat.isNumber()
          || !lon.isNumber()
          || !Coordinate.isValid(lat.asDouble(), lon.asDouble())) {
        logger.warn("Skipping centroid for '{}': invalid lat/lon", field.getKey());
        continue;
      }
      countryCentroids.put(field.getKey(), new Coordinate(lat.asDouble(), lon.asDouble()));
    }
    return countryCentroids;
  }
}
