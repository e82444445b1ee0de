package com.telegram.geolocation.export;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telegram.geolocation.config.properties.BatchConfigurationProperties;
import com.telegram.geolocation.config.properties.BatchConfigurationProperties.GeoJsonConfiguration;

@DisplayName("GeoJSON Export Service Tests")
class GeoJsonExportServiceTest {

  private static final String LOCATED =
      "{\"id\":1,\"channel\":\"militarysummary\",\"link\":\"https://t.me/militarysummary/1\","
          + "\"timestamp\":\"2024-05-01T10:00:00Z\",\"text\":\"Вибухи у Харкові сьогодні вночі\","
          + "\"geolocation\":{\"lat\":49.9935,\"lon\":36.2304,\"country_code\":null,"
          + "\"confidence\":0.72,\"source\":\"llm_geocoding_city_country\","
          + "\"place_name\":\"Kharkiv, Ukraine\",\"geocoding_attempts\":[\"LLM extracted: Kharkiv\"]},"
          + "\"processed_at\":\"2024-05-01T12:00:00Z\",\"processing_version\":\"enhanced_v1\"}";

  private static final String NOT_LOCATED =
      "{\"id\":2,\"channel\":\"c\",\"text\":\"hi\","
          + "\"geolocation\":{\"lat\":null,\"lon\":null,\"country_code\":null,\"confidence\":0.0,"
          + "\"source\":\"none\",\"place_name\":null,\"geocoding_attempts\":[\"No geolocation found\"]},"
          + "\"processed_at\":\"2024-05-01T12:00:00Z\",\"processing_version\":\"enhanced_v1\"}";

  @TempDir Path tempDir;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private Path geoJsonDirectory;
  private GeoJsonExportService exportService;

  @BeforeEach
  void setUp() {
    geoJsonDirectory = tempDir.resolve("geojson");
    BatchConfigurationProperties config =
        new BatchConfigurationProperties(
            false,
            tempDir.resolve("unprocessed").toString(),
            tempDir.resolve("processed").toString(),
            "*.jsonl",
            "enhanced_",
            new GeoJsonConfiguration(
                true, geoJsonDirectory.toString(), "combined_telegram_data.geojson", 10));
    exportService =
        new GeoJsonExportService(
            objectMapper,
            config,
            Clock.fixed(Instant.parse("2024-05-01T12:30:00Z"), ZoneOffset.UTC));
  }

  @Test
  @DisplayName("should export located messages as points in lon, lat order")
  void shouldExportFeatures() throws IOException {
    Path processed = writeProcessed("enhanced_militarysummary.jsonl", LOCATED, NOT_LOCATED);

    JsonNode collection = exportService.toFeatureCollection(processed);

    assertThat(collection.get("type").asText()).isEqualTo("FeatureCollection");
    assertThat(collection.get("features").size()).isEqualTo(1);

    JsonNode feature = collection.get("features").get(0);
    assertThat(feature.get("geometry").get("type").asText()).isEqualTo("Point");
    assertThat(feature.get("geometry").get("coordinates").get(0).asDouble()).isEqualTo(36.2304);
    assertThat(feature.get("geometry").get("coordinates").get(1).asDouble()).isEqualTo(49.9935);

    JsonNode properties = feature.get("properties");
    assertThat(properties.get("id").asInt()).isEqualTo(1);
    assertThat(properties.get("channel").asText()).isEqualTo("militarysummary");
    assertThat(properties.get("text").asText()).isEqualTo("Вибухи у Х");
    assertThat(properties.get("geolocation").get("source").asText())
        .isEqualTo("llm_geocoding_city_country");
    assertThat(properties.get("geolocation").get("geocoding_attempts").size()).isEqualTo(1);
    assertThat(properties.get("processing_version").asText()).isEqualTo("enhanced_v1");

    JsonNode summary = collection.get("properties");
    assertThat(summary.get("total_messages").asInt()).isEqualTo(2);
    assertThat(summary.get("geolocated_messages").asInt()).isEqualTo(1);
    assertThat(summary.get("geolocation_rate").asText()).isEqualTo("50.0%");
    assertThat(summary.get("processed_at").asText()).isEqualTo("2024-05-01T12:30");
  }

  @Test
  @DisplayName("should write per-file and combined collections")
  void shouldWriteCombinedCollection() throws IOException {
    Path first = writeProcessed("enhanced_a.jsonl", LOCATED);
    Path second = writeProcessed("enhanced_b.jsonl", NOT_LOCATED, LOCATED, "garbage");

    Path combined = exportService.exportAll(List.of(first, second));

    assertThat(geoJsonDirectory.resolve("a.geojson")).exists();
    assertThat(geoJsonDirectory.resolve("b.geojson")).exists();
    assertThat(combined).isEqualTo(geoJsonDirectory.resolve("combined_telegram_data.geojson"));

    String content = Files.readString(combined, StandardCharsets.UTF_8);
    assertThat(content).contains("Вибухи");
    JsonNode collection = objectMapper.readTree(content);
    assertThat(collection.get("features").size()).isEqualTo(2);
    assertThat(collection.get("properties").get("total_messages").asInt()).isEqualTo(3);
    assertThat(collection.get("properties").get("geolocation_rate").asText()).isEqualTo("66.7%");
    JsonNode sourceFiles = collection.get("properties").get("source_files");
    assertThat(sourceFiles.size()).isEqualTo(2);
    assertThat(sourceFiles.get(0).asText()).isEqualTo("enhanced_a.jsonl");
    assertThat(sourceFiles.get(1).asText()).isEqualTo("enhanced_b.jsonl");
  }

  @Test
  @DisplayName("should report a zero rate for a file without messages")
  void shouldHandleEmptyFile() throws IOException {
    Path processed = writeProcessed("enhanced_empty.jsonl");

    Path output = exportService.exportFile(processed);

    JsonNode collection = objectMapper.readTree(output.toFile());
    assertThat(output.getFileName().toString()).isEqualTo("empty.geojson");
    assertThat(collection.get("features").size()).isZero();
    assertThat(collection.get("properties").get("geolocation_rate").asText()).isEqualTo("0%");
  }

  private Path writeProcessed(String name, String... lines) throws IOException {
    return Files.write(tempDir.resolve(name), List.of(lines), StandardCharsets.UTF_8);
  }
}
