package com.telegram.geolocation.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.NotBlank;

/**
 * Location of the country reference data (flag symbols and centroids).
 *
 * <p>Accepts any Spring resource location, e.g. {@code classpath:countries.yml} or {@code
 * file:/etc/geolocation/countries.yml}.
 */
@ConfigurationProperties(prefix = "reference-data")
@Validated
public record ReferenceDataConfigurationProperties(
    @NotBlank(message = "Reference data location is required") String location) {}
