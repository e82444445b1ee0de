package com.telegram.geolocation.export;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.telegram.geolocation.config.properties.BatchConfigurationProperties;
import com.telegram.geolocation.config.properties.BatchConfigurationProperties.GeoJsonConfiguration;
import com.telegram.geolocation.exception.GeolocationProcessingException;

/**
 * Converts processed JSONL files into GeoJSON {@code FeatureCollection}s for map display.
 *
 * <p>Every message whose {@code geolocation} carries both {@code lat} and {@code lon} becomes a
 * {@code Point} feature with coordinates in {@code [lon, lat]} order. Messages without
 * coordinates are counted but not exported. Each input file gets its own collection, and one
 * combined collection covers all files of the export.
 */
@Service
public class GeoJsonExportService {

  private static final Logger logger = LoggerFactory.getLogger(GeoJsonExportService.class);

  private static final String JSONL_EXTENSION = ".jsonl";
  private static final String GEOJSON_EXTENSION = ".geojson";

  private final ObjectMapper objectMapper;
  private final BatchConfigurationProperties batchConfig;
  private final Clock clock;

  public GeoJsonExportService(
      ObjectMapper objectMapper, BatchConfigurationProperties batchConfig, Clock clock) {
    this.objectMapper = objectMapper;
    this.batchConfig = batchConfig;
    this.clock = clock;
  }

  /**
   * Exports each processed file and the combined collection.
   *
   * @param processedFiles augmented JSONL files
   * @return path of the combined GeoJSON file
   * @throws GeolocationProcessingException if a file cannot be read or written
   */
  public Path exportAll(List<Path> processedFiles) {
    GeoJsonConfiguration config = batchConfig.geojson();
    Path outputDirectory = Paths.get(config.outputDirectory());

    ArrayNode allFeatures = objectMapper.createArrayNode();
    ArrayNode sourceFiles = objectMapper.createArrayNode();
    long totalMessages = 0;
    long geolocatedMessages = 0;

    for (Path processedFile : processedFiles) {
      ObjectNode collection = toFeatureCollection(processedFile);
      write(outputDirectory.resolve(geoJsonFileName(processedFile)), collection);

      ArrayNode features = (ArrayNode) collection.get("features");
      allFeatures.addAll(features);
      sourceFiles.add(processedFile.getFileName().toString());
      totalMessages += collection.get("properties").get("total_messages").asLong();
      geolocatedMessages += features.size();
    }

    ObjectNode combined = featureCollection(allFeatures);
    ObjectNode properties = summaryProperties(totalMessages, geolocatedMessages);
    properties.set("source_files", sourceFiles);
    combined.set("properties", properties);

    Path combinedFile = outputDirectory.resolve(config.combinedFileName());
    write(combinedFile, combined);
    logger.info(
        "GeoJSON export completed: {} messages, {} geolocated, combined file {}",
        totalMessages,
        geolocatedMessages,
        combinedFile);
    return combinedFile;
  }

  /**
   * Exports a single processed file next to the other GeoJSON outputs.
   *
   * @param processedFile augmented JSONL file
   * @return path of the written GeoJSON file
   */
  public Path exportFile(Path processedFile) {
    Path outputFile =
        Paths.get(batchConfig.geojson().outputDirectory())
            .resolve(geoJsonFileName(processedFile));
    write(outputFile, toFeatureCollection(processedFile));
    return outputFile;
  }

  /**
   * Builds the feature collection of one processed file. Lines that are not JSON objects are
   * logged and ignored.
   */
  public ObjectNode toFeatureCollection(Path processedFile) {
    ArrayNode features = objectMapper.createArrayNode();
    long totalMessages = 0;

    try (BufferedReader reader = Files.newBufferedReader(processedFile, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        if (line.isBlank()) {
          continue;
        }
        JsonNode message;
        try {
          message = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
          logger.warn("Ignoring unparseable line in {}: {}", processedFile, e.getOriginalMessage());
          continue;
        }
        if (!message.isObject()) {
          continue;
        }

        totalMessages++;
        JsonNode geolocation = message.path("geolocation");
        if (hasCoordinates(geolocation)) {
          features.add(toFeature(message, geolocation));
        }
      }
    } catch (IOException e) {
      throw new GeolocationProcessingException("Failed to read " + processedFile, e);
    }

    ObjectNode collection = featureCollection(features);
    ObjectNode properties = summaryProperties(totalMessages, features.size());
    properties.put("source_file", processedFile.toString());
    collection.set("properties", properties);

    logger.debug(
        "Converted {}: {} messages, {} features", processedFile, totalMessages, features.size());
    return collection;
  }

  ObjectNode toFeature(JsonNode message, JsonNode geolocation) {
    ObjectNode feature = objectMapper.createObjectNode();
    feature.put("type", "Feature");

    ObjectNode geometry = feature.putObject("geometry");
    geometry.put("type", "Point");
    ArrayNode coordinates = geometry.putArray("coordinates");
    coordinates.add(geolocation.get("lon").asDouble());
    coordinates.add(geolocation.get("lat").asDouble());

    ObjectNode properties = feature.putObject("properties");
    copy(properties, "id", message);
    copy(properties, "timestamp", message);
    copy(properties, "channel", message);
    copy(properties, "link", message);
    properties.put("text", truncate(message.path("text").asText("")));

    ObjectNode summary = properties.putObject("geolocation");
    summary.put("confidence", geolocation.path("confidence").asDouble(0.0));
    summary.put("source", geolocation.path("source").asText("none"));
    copy(summary, "place_name", geolocation);
    copy(summary, "country_code", geolocation);
    JsonNode attempts = geolocation.get("geocoding_attempts");
    summary.set(
        "geocoding_attempts",
        attempts != null && attempts.isArray() ? attempts.deepCopy() : objectMapper.createArrayNode());

    copy(properties, "processed_at", message);
    copy(properties, "processing_version", message);
    return feature;
  }

  String geoJsonFileName(Path processedFile) {
    String name = processedFile.getFileName().toString();
    String prefix = batchConfig.outputPrefix();
    if (name.startsWith(prefix)) {
      name = name.substring(prefix.length());
    }
    if (name.endsWith(JSONL_EXTENSION)) {
      name = name.substring(0, name.length() - JSONL_EXTENSION.length());
    }
    return name + GEOJSON_EXTENSION;
  }

  private String truncate(String text) {
    int maxLength = batchConfig.geojson().maxTextLength();
    if (text.codePointCount(0, text.length()) <= maxLength) {
      return text;
    }
    return text.substring(0, text.offsetByCodePoints(0, maxLength));
  }

  private ObjectNode featureCollection(ArrayNode features) {
    ObjectNode collection = objectMapper.createObjectNode();
    collection.put("type", "FeatureCollection");
    collection.set("features", features);
    return collection;
  }

  private ObjectNode summaryProperties(long totalMessages, long geolocatedMessages) {
    ObjectNode properties = objectMapper.createObjectNode();
    properties.put("processed_at", LocalDateTime.now(clock).toString());
    properties.put("total_messages", totalMessages);
    properties.put("geolocated_messages", geolocatedMessages);
    properties.put("geolocation_rate", formatRate(geolocatedMessages, totalMessages));
    return properties;
  }

  static String formatRate(long geolocated, long total) {
    if (total == 0) {
      return "0%";
    }
    return String.format(Locale.ROOT, "%.1f%%", geolocated * 100.0 / total);
  }

  private static boolean hasCoordinates(JsonNode geolocation) {
    return geolocation.isObject()
        && geolocation.path("lat").isNumber()
        && geolocation.path("lon").isNumber();
  }

  private static void copy(ObjectNode target, String field, JsonNode source) {
    JsonNode value = source.get(field);
    if (value == null) {
      target.putNull(field);
    } else {
      target.set(field, value.deepCopy());
    }
  }

  private void write(Path file, ObjectNode collection) {
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), collection);
    } catch (IOException e) {
      throw new GeolocationProcessingException("Failed to write " + file, e);
    }
  }
}
