package com.telegram.geolocation.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Configuration properties for the remote geocoding service.
 *
 * <p>The access token is mandatory. A run without it cannot reach the geocoding stages, so the
 * application context refuses to start.
 */
@ConfigurationProperties(prefix = "geocoding")
@Validated
public record GeocodingConfigurationProperties(
    @NotBlank(message = "Geocoding access token is required (set MAPBOX_ACCESS_TOKEN)")
        String accessToken,
    @NotBlank(message = "Geocoding base URL is required") String baseUrl,
    @NotBlank(message = "Geocoding place types are required") String types,
    @NotNull(message = "Geocoding result limit is required")
        @Min(value = 1, message = "Geocoding result limit must be at least 1")
        @Max(value = 10, message = "Geocoding result limit cannot exceed 10")
        Integer limit,
    @NotNull(message = "Rate limit delay is required")
        @Min(value = 0, message = "Rate limit delay cannot be negative")
        Long rateLimitDelayMs,
    @NotNull(message = "Connect timeout is required")
        @Min(value = 100, message = "Connect timeout must be at least 100ms")
        Long connectTimeoutMs,
    @NotNull(message = "Read timeout is required")
        @Min(value = 100, message = "Read timeout must be at least 100ms")
        Long readTimeoutMs) {}
