package com.telegram.geolocation.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.telegram.geolocation.config.properties.PipelineConfigurationProperties;
import com.telegram.geolocation.dto.Coordinate;
import com.telegram.geolocation.dto.GeolocationResult;
import com.telegram.geolocation.dto.MessageRecord;
import com.telegram.geolocation.extraction.ChannelFallbackResolver;
import com.telegram.geolocation.extraction.CoordinateExtractor;
import com.telegram.geolocation.extraction.FlagSymbolResolver;
import com.telegram.geolocation.extraction.LocationEntityExtractor;
import com.telegram.geolocation.extraction.PlaceNameExtractor;
import com.telegram.geolocation.geocoding.CandidateGeocoder;
import com.telegram.geolocation.geocoding.FakeGeocodingClient;
import com.telegram.geolocation.pipeline.strategy.ChannelFallbackStrategy;
import com.telegram.geolocation.pipeline.strategy.CoordinateStrategy;
import com.telegram.geolocation.pipeline.strategy.EntityGeocodingStrategy;
import com.telegram.geolocation.pipeline.strategy.FlagSymbolStrategy;
import com.telegram.geolocation.pipeline.strategy.PlaceNameGeocodingStrategy;
import com.telegram.geolocation.reference.CountryReferenceData;
import com.telegram.geolocation.scoring.ConfidenceScorer;

/**
 * End-to-end tests of the strategy cascade with real extractors and a deterministic in-memory
 * geocoder.
 */
@DisplayName("Geolocation Pipeline Tests")
class GeolocationPipelineTest {

  private static final String UKRAINE_FLAG = "🇺🇦";
  private static final String FRANCE_FLAG = "🇫🇷";

  private FakeGeocodingClient geocodingClient;
  private GeolocationPipeline pipeline;

  @BeforeEach
  void setUp() {
    Map<String, String> flags = new LinkedHashMap<>();
    flags.put(UKRAINE_FLAG, "UKR");
    flags.put(FRANCE_FLAG, "FRA");
    Map<String, Coordinate> centroids = new LinkedHashMap<>();
    centroids.put("UKR", new Coordinate(49.0, 32.0));
    CountryReferenceData referenceData = new CountryReferenceData(flags, centroids);

    geocodingClient =
        new FakeGeocodingClient()
            .with("Kharkiv, Ukraine", 49.9935, 36.2304, "Kharkiv, Kharkiv Oblast, Ukraine", 0.9)
            .with("Mariupol", 47.0971, 37.5434, "Mariupol, Donetsk Oblast, Ukraine", 0.5);

    pipeline = createPipeline(referenceData, geocodingClient);
  }

  static GeolocationPipeline createPipeline(
      CountryReferenceData referenceData, FakeGeocodingClient geocodingClient) {
    return new GeolocationPipeline(
        List.of(
            new ChannelFallbackStrategy(new ChannelFallbackResolver(), referenceData),
            new PlaceNameGeocodingStrategy(new PlaceNameExtractor(), geocodingClient),
            new EntityGeocodingStrategy(
                new LocationEntityExtractor(),
                new CandidateGeocoder(geocodingClient),
                new ConfidenceScorer(),
                PipelineConfigurationProperties.defaults()),
            new FlagSymbolStrategy(new FlagSymbolResolver(referenceData), referenceData),
            new CoordinateStrategy(new CoordinateExtractor())));
  }

  @Nested
  @DisplayName("Reference Examples")
  class ReferenceExamples {

    @Test
    @DisplayName("decimal coordinates are accepted at 0.95")
    void coordinatesExample() {
      GeolocationResult result =
          pipeline.locate(
              MessageRecord.of("unknown", "Explosion reported at 50.4501, 30.5234 in Kyiv"));

      assertThat(result.source()).isEqualTo("coordinates_regex");
      assertThat(result.lat()).isEqualTo(50.4501);
      assertThat(result.lon()).isEqualTo(30.5234);
      assertThat(result.confidence()).isEqualTo(0.95);
      assertThat(result.geocodingAttempts()).containsExactly("Found coordinates: (50.4501, 30.5234)");
      assertThat(geocodingClient.getQueries()).isEmpty();
    }

    @Test
    @DisplayName("flag symbol resolves to the country centroid at 0.85")
    void flagExample() {
      GeolocationResult result =
          pipeline.locate(MessageRecord.of("unknown", "Air raid alert " + UKRAINE_FLAG));

      assertThat(result.source()).isEqualTo("flag_emoji");
      assertThat(result.countryCode()).isEqualTo("UKR");
      assertThat(result.lat()).isEqualTo(49.0);
      assertThat(result.lon()).isEqualTo(32.0);
      assertThat(result.confidence()).isEqualTo(0.85);
      assertThat(result.geocodingAttempts())
          .containsExactly("No coordinates found", "Found flag: UKR");
    }

    @Test
    @DisplayName("known channel falls back to its country at 0.2")
    void channelFallbackExample() {
      GeolocationResult result =
          pipeline.locate(
              MessageRecord.of("militarysummary", "something happened overnight, details later"));

      assertThat(result.source()).isEqualTo("channel_fallback");
      assertThat(result.countryCode()).isEqualTo("UKR");
      assertThat(result.confidence()).isEqualTo(0.2);
      assertThat(result.geocodingAttempts())
          .containsExactly(
              "No coordinates found",
              "No flag found",
              "No location entities extracted",
              "No place names extracted",
              "Channel fallback: UKR");
    }

    @Test
    @DisplayName("short text from an unknown channel yields none")
    void noneExample() {
      GeolocationResult result = pipeline.locate(MessageRecord.of("unknown_channel", "hi"));

      assertThat(result.source()).isEqualTo("none");
      assertThat(result.confidence()).isZero();
      assertThat(result.isLocated()).isFalse();
      assertThat(result.geocodingAttempts())
          .containsExactly(
              "No coordinates found",
              "No flag found",
              "Text too short for entity extraction: 2 chars",
              "No place names extracted",
              "No channel fallback for: unknown_channel",
              "No geolocation found");
    }
  }

  @Nested
  @DisplayName("Stage Priority")
  class StagePriority {

    @Test
    @DisplayName("coordinates win over a flag in the same message")
    void coordinatesBeatFlag() {
      GeolocationResult result =
          pipeline.locate(MessageRecord.of("unknown", UKRAINE_FLAG + " strike at 48.0, 37.8"));

      assertThat(result.source()).isEqualTo("coordinates_regex");
    }

    @Test
    @DisplayName("flag without centroid falls through to later stages")
    void flagWithoutCentroidFallsThrough() {
      GeolocationResult result =
          pipeline.locate(MessageRecord.of("militarysummary", FRANCE_FLAG + " statement"));

      assertThat(result.source()).isEqualTo("channel_fallback");
      assertThat(result.geocodingAttempts()).contains("Found flag without centroid: FRA");
    }

    @Test
    @DisplayName("strategies run in priority order regardless of registration order")
    void strategiesAreSorted() {
      assertThat(pipeline.getStrategyNames())
          .containsExactly(
              "coordinates", "flag", "entity_geocoding", "place_name", "channel_fallback");
    }

    @Test
    @DisplayName("pipeline requires at least one strategy")
    void requiresStrategies() {
      assertThatThrownBy(() -> new GeolocationPipeline(List.of()))
          .isInstanceOf(IllegalArgumentException.class);
    }
  }

  @Nested
  @DisplayName("Entity and Place Name Geocoding")
  class Geocoding {

    @Test
    @DisplayName("accepted entity result is scored and keeps the full attempts trail")
    void entityResultIsScored() {
      GeolocationResult result =
          pipeline.locate(
              MessageRecord.of("unknown", "Shelling reported in Kharkiv, Ukraine overnight"));

      assertThat(result.source()).isEqualTo("llm_geocoding_city_country");
      assertThat(result.confidence()).isCloseTo(0.72, within(1e-9));
      assertThat(result.placeName()).isEqualTo("Kharkiv, Kharkiv Oblast, Ukraine");
      assertThat(result.geocodingAttempts())
          .startsWith("No coordinates found", "No flag found", "LLM extracted: Kharkiv, Ukraine")
          .contains("Geocoded successfully: Kharkiv, Kharkiv Oblast, Ukraine")
          .endsWith("Selected llm_geocoding_city_country: Kharkiv, Kharkiv Oblast, Ukraine");
      assertThat(geocodingClient.getQueries())
          .containsExactly("Kharkiv, Ukraine", "Shelling", "Kharkiv", "Ukraine");
    }

    @Test
    @DisplayName("entity result below threshold falls through to place-name geocoding")
    void lowConfidenceEntityFallsThrough() {
      GeolocationResult result =
          pipeline.locate(MessageRecord.of("unknown", "Mariupol port under fire again tonight"));

      assertThat(result.source()).isEqualTo("place_name_geocoding");
      assertThat(result.confidence()).isEqualTo(0.4);
      assertThat(result.placeName()).isEqualTo("Mariupol, Donetsk Oblast, Ukraine");
      assertThat(result.geocodingAttempts())
          .contains(
              "Best entity confidence 0.20 not above threshold 0.30", "Geocoded place: Mariupol");
      assertThat(geocodingClient.getQueries()).containsExactly("Mariupol", "Mariupol");
    }
  }

  @Nested
  @DisplayName("Invariants")
  class Invariants {

    private final List<MessageRecord> messages =
        List.of(
            MessageRecord.of("unknown", "Explosion reported at 50.4501, 30.5234 in Kyiv"),
            MessageRecord.of("unknown", "Air raid alert " + UKRAINE_FLAG),
            MessageRecord.of("unknown", "Shelling reported in Kharkiv, Ukraine overnight"),
            MessageRecord.of("unknown", "Mariupol port under fire again tonight"),
            MessageRecord.of("militarysummary", "something happened overnight"),
            MessageRecord.of("unknown", ""),
            MessageRecord.of("", "Nothing Useful Here At All"));

    @Test
    @DisplayName("confidence is in range and attempts are never empty")
    void confidenceAndAttempts() {
      for (MessageRecord message : messages) {
        GeolocationResult result = pipeline.locate(message);

        assertThat(result.confidence()).isBetween(0.0, 1.0);
        assertThat(result.geocodingAttempts()).isNotEmpty();
        assertThat(result.isLocated()).isEqualTo(result.confidence() > 0.0);
      }
    }

    @Test
    @DisplayName("re-running a message yields an identical serialized result")
    void idempotent() throws Exception {
      ObjectMapper objectMapper = new ObjectMapper();
      for (MessageRecord message : messages) {
        GeolocationResult first = pipeline.locate(message);
        GeolocationResult second = pipeline.locate(message);

        assertThat(second).isEqualTo(first);
        assertThat(objectMapper.writeValueAsString(second))
            .isEqualTo(objectMapper.writeValueAsString(first));
      }
    }
  }
}
