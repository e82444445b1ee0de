package com.telegram.geolocation.processor;

import java.nio.file.Path;

/**
 * Summary of processing one message file.
 *
 * @param inputFile the source JSONL file
 * @param outputFile the augmented JSONL file
 * @param processed messages run through the pipeline and written
 * @param geolocated processed messages that received coordinates
 * @param skipped malformed lines that were skipped
 * @param failed lines that failed with an unexpected error
 */
public record FileProcessingResult(
    Path inputFile, Path outputFile, int processed, int geolocated, int skipped, int failed) {

  /** Share of processed messages that were geolocated, in percent. Zero for an empty file. */
  public double geolocationRate() {
    return rate(geolocated, processed);
  }

  static double rate(long geolocated, long processed) {
    return processed == 0 ? 0.0 : geolocated * 100.0 / processed;
  }
}
