package com.telegram.geolocation.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Configuration properties for the geolocation strategy cascade.
 *
 * @param minTextLength texts must be strictly longer than this (in code points) to reach entity
 *     extraction
 * @param entityConfidenceThreshold best entity result must exceed this to be accepted
 * @param processingVersion tag written to every output record
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public record PipelineConfigurationProperties(
    @NotNull(message = "Minimum text length is required")
        @Min(value = 0, message = "Minimum text length cannot be negative")
        Integer minTextLength,
    @NotNull(message = "Entity confidence threshold is required")
        @DecimalMin(value = "0.0", message = "Entity confidence threshold must be at least 0.0")
        @DecimalMax(value = "1.0", message = "Entity confidence threshold cannot exceed 1.0")
        Double entityConfidenceThreshold,
    @NotBlank(message = "Processing version is required") String processingVersion) {

  public static PipelineConfigurationProperties defaults() {
    return new PipelineConfigurationProperties(10, 0.3, "enhanced_v1");
  }
}
