package com.telegram.geolocation.pipeline.strategy;

import java.util.Optional;

import org.springframework.stereotype.Component;

import com.telegram.geolocation.dto.Coordinate;
import com.telegram.geolocation.dto.GeolocationResult;
import com.telegram.geolocation.dto.GeolocationSource;
import com.telegram.geolocation.dto.MessageRecord;
import com.telegram.geolocation.extraction.FlagSymbolResolver;
import com.telegram.geolocation.pipeline.AttemptLog;
import com.telegram.geolocation.pipeline.GeolocationStrategy;
import com.telegram.geolocation.reference.CountryReferenceData;

/**
 * Stage 2: flag symbols resolved to a country centroid.
 *
 * <p>Only the authoritative flag is considered. If its country has no registered centroid the
 * stage yields nothing, even when other flags in the message would have one.
 */
@Component
public class FlagSymbolStrategy implements GeolocationStrategy {

  public static final double CONFIDENCE = 0.85;
  static final int PRIORITY = 20;

  private final FlagSymbolResolver flagSymbolResolver;
  private final CountryReferenceData referenceData;

  public FlagSymbolStrategy(
      FlagSymbolResolver flagSymbolResolver, CountryReferenceData referenceData) {
    this.flagSymbolResolver = flagSymbolResolver;
    this.referenceData = referenceData;
  }

  @Override
  public String getName() {
    return "flag";
  }

  @Override
  public int getPriority() {
    return PRIORITY;
  }

  @Override
  public Optional<GeolocationResult> attempt(MessageRecord message, AttemptLog attempts) {
    Optional<String> countryCode = flagSymbolResolver.resolve(message.text());
    if (countryCode.isEmpty()) {
      attempts.record("No flag found");
      return Optional.empty();
    }

    Optional<Coordinate> centroid = referenceData.centroidOf(countryCode.get());
    if (centroid.isEmpty()) {
      attempts.record("Found flag without centroid: " + countryCode.get());
      return Optional.empty();
    }

    attempts.record("Found flag: " + countryCode.get());
    return Optional.of(
        GeolocationResult.located(
            centroid.get(),
            countryCode.get(),
            CONFIDENCE,
            GeolocationSource.FLAG_EMOJI.tag(),
            null,
            attempts.snapshot()));
  }
}
