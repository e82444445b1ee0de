package com.telegram.geolocation.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Configuration properties for directory-based batch processing and GeoJSON export.
 *
 * <p>Input files matching {@code inputPattern} are read from {@code inputDirectory} and written to
 * {@code outputDirectory} under {@code outputPrefix + originalName}.
 */
@ConfigurationProperties(prefix = "batch")
@Validated
public record BatchConfigurationProperties(
    @NotNull(message = "Run-on-startup flag is required") Boolean runOnStartup,
    @NotBlank(message = "Input directory is required") String inputDirectory,
    @NotBlank(message = "Output directory is required") String outputDirectory,
    @NotBlank(message = "Input file pattern is required") String inputPattern,
    @NotBlank(message = "Output file prefix is required") String outputPrefix,
    @NestedConfigurationProperty @Valid @NotNull(message = "GeoJSON configuration is required")
        GeoJsonConfiguration geojson) {

  /** Configuration for GeoJSON export of processed files. */
  public record GeoJsonConfiguration(
      @NotNull(message = "GeoJSON enabled flag is required") Boolean enabled,
      @NotBlank(message = "GeoJSON output directory is required") String outputDirectory,
      @NotBlank(message = "Combined GeoJSON file name is required") String combinedFileName,
      @NotNull(message = "Maximum text length is required")
          @Min(value = 1, message = "Maximum text length must be at least 1")
          Integer maxTextLength) {}
}
