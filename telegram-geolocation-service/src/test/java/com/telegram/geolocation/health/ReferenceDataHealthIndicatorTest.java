package com.telegram.geolocation.health;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import com.telegram.geolocation.config.properties.ReferenceDataConfigurationProperties;
import com.telegram.geolocation.dto.Coordinate;
import com.telegram.geolocation.reference.CountryReferenceData;

@DisplayName("Reference Data Health Indicator Tests")
class ReferenceDataHealthIndicatorTest {

  private final ReferenceDataConfigurationProperties properties =
      new ReferenceDataConfigurationProperties("classpath:countries.yml");

  @Test
  @DisplayName("should report UP with mapping counts when data is loaded")
  void shouldReportUp() {
    CountryReferenceData data =
        new CountryReferenceData(
            Map.of("🇺🇦", "UKR"), Map.of("UKR", new Coordinate(49.0, 32.0)));

    Health health = new ReferenceDataHealthIndicator(data, properties).health();

    assertThat(health.getStatus()).isEqualTo(Status.UP);
    assertThat(health.getDetails())
        .containsEntry("flags", 1)
        .containsEntry("centroids", 1)
        .containsEntry("location", "classpath:countries.yml");
  }

  @Test
  @DisplayName("should report DOWN when data degraded to empty")
  void shouldReportDown() {
    Health health =
        new ReferenceDataHealthIndicator(CountryReferenceData.empty(), properties).health();

    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
    assertThat(health.getDetails()).containsKey("reason");
  }
}
