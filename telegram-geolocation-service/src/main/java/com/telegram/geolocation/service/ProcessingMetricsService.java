package com.telegram.geolocation.service;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Metrics for message geolocation and file processing.
 *
 * <p><strong>Metric Categories:</strong>
 *
 * <ul>
 *   <li><strong>Messages:</strong> processed, geolocated, skipped as malformed, failed
 *   <li><strong>Results:</strong> accepted results per {@code source} tag
 *   <li><strong>Geocoding:</strong> calls to the geocoding service by outcome
 *   <li><strong>Files:</strong> files processed and failed, per-file processing time
 * </ul>
 */
@Service
public class ProcessingMetricsService {

  private static final Logger logger = LoggerFactory.getLogger(ProcessingMetricsService.class);

  private final MeterRegistry meterRegistry;

  private final Counter messagesProcessedCounter;
  private final Counter messagesGeolocatedCounter;
  private final Counter messagesSkippedCounter;
  private final Counter messagesFailedCounter;
  private final Counter geocodingMatchedCounter;
  private final Counter geocodingUnmatchedCounter;
  private final Counter filesProcessedCounter;
  private final Counter filesFailedCounter;
  private final Timer fileProcessingTimer;

  private final AtomicLong totalMessagesProcessed = new AtomicLong(0);
  private final AtomicLong totalMessagesGeolocated = new AtomicLong(0);

  public ProcessingMetricsService(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;

    this.messagesProcessedCounter =
        Counter.builder("geolocation.messages.processed.total")
            .description("Total number of messages run through the geolocation pipeline")
            .register(meterRegistry);

    this.messagesGeolocatedCounter =
        Counter.builder("geolocation.messages.geolocated.total")
            .description("Total number of messages that received coordinates")
            .register(meterRegistry);

    this.messagesSkippedCounter =
        Counter.builder("geolocation.messages.skipped.total")
            .description("Total number of malformed input lines skipped")
            .register(meterRegistry);

    this.messagesFailedCounter =
        Counter.builder("geolocation.messages.failed.total")
            .description("Total number of messages that failed with an unexpected error")
            .register(meterRegistry);

    this.geocodingMatchedCounter =
        Counter.builder("geolocation.geocoding.calls.total")
            .description("Total number of geocoding service calls")
            .tag("outcome", "matched")
            .register(meterRegistry);

    this.geocodingUnmatchedCounter =
        Counter.builder("geolocation.geocoding.calls.total")
            .description("Total number of geocoding service calls")
            .tag("outcome", "unmatched")
            .register(meterRegistry);

    this.filesProcessedCounter =
        Counter.builder("geolocation.files.processed.total")
            .description("Total number of message files processed")
            .register(meterRegistry);

    this.filesFailedCounter =
        Counter.builder("geolocation.files.failed.total")
            .description("Total number of message files that failed processing")
            .register(meterRegistry);

    this.fileProcessingTimer =
        Timer.builder("geolocation.files.duration")
            .description("Time taken to process individual message files")
            .register(meterRegistry);

    logger.debug("ProcessingMetricsService initialized");
  }

  /**
   * Records the outcome of one message run through the pipeline.
   *
   * @param source the accepted result's source tag
   * @param located whether the result carries coordinates
   */
  public void recordMessageProcessed(String source, boolean located) {
    messagesProcessedCounter.increment();
    totalMessagesProcessed.incrementAndGet();
    if (located) {
      messagesGeolocatedCounter.increment();
      totalMessagesGeolocated.incrementAndGet();
    }
    meterRegistry.counter("geolocation.results.total", "source", source).increment();
  }

  public void recordMessageSkipped() {
    messagesSkippedCounter.increment();
  }

  public void recordMessageFailed() {
    messagesFailedCounter.increment();
  }

  public void recordGeocodingCall(boolean matched) {
    if (matched) {
      geocodingMatchedCounter.increment();
    } else {
      geocodingUnmatchedCounter.increment();
    }
  }

  public void recordFileProcessed(Duration duration) {
    filesProcessedCounter.increment();
    fileProcessingTimer.record(duration);
  }

  public void recordFileFailed() {
    filesFailedCounter.increment();
  }

  public long getTotalMessagesProcessed() {
    return totalMessagesProcessed.get();
  }

  public long getTotalMessagesGeolocated() {
    return totalMessagesGeolocated.get();
  }
}
