package com.telegram.geolocation.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.telegram.geolocation.config.properties.ReferenceDataConfigurationProperties;
import com.telegram.geolocation.reference.CountryReferenceData;

/**
 * Health indicator for the country reference data.
 *
 * <p><strong>Health Status Criteria:</strong>
 *
 * <ul>
 *   <li><strong>UP:</strong> flag and centroid mappings were loaded
 *   <li><strong>DOWN:</strong> the reference file was missing or malformed and the pipeline runs
 *       with empty mappings, so flag and channel fallback stages never match
 * </ul>
 */
@Component("referenceData")
public class ReferenceDataHealthIndicator implements HealthIndicator {

  private final CountryReferenceData referenceData;
  private final ReferenceDataConfigurationProperties properties;

  public ReferenceDataHealthIndicator(
      CountryReferenceData referenceData, ReferenceDataConfigurationProperties properties) {
    this.referenceData = referenceData;
    this.properties = properties;
  }

  @Override
  public Health health() {
    Health.Builder builder =
        referenceData.isEmpty()
            ? Health.down().withDetail("reason", "Reference data is empty or failed to load")
            : Health.up();

    return builder
        .withDetail("location", properties.location())
        .withDetail("flags", referenceData.flagToCountry().size())
        .withDetail("centroids", referenceData.countryCentroids().size())
        .build();
  }
}
