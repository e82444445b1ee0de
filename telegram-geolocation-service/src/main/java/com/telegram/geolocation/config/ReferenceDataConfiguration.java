package com.telegram.geolocation.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.telegram.geolocation.config.properties.ReferenceDataConfigurationProperties;
import com.telegram.geolocation.reference.CountryReferenceData;
import com.telegram.geolocation.reference.ReferenceDataLoader;

/**
 * Loads the country reference data once per application lifetime and shares it read-only with
 * every strategy that needs it.
 */
@Configuration
public class ReferenceDataConfiguration {

  @Bean
  public CountryReferenceData countryReferenceData(
      ReferenceDataLoader loader, ReferenceDataConfigurationProperties properties) {
    return loader.load(properties.location());
  }

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
