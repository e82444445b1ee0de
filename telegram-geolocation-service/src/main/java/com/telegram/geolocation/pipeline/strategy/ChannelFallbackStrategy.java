package com.telegram.geolocation.pipeline.strategy;

import java.util.Optional;

import org.springframework.stereotype.Component;

import com.telegram.geolocation.dto.Coordinate;
import com.telegram.geolocation.dto.GeolocationResult;
import com.telegram.geolocation.dto.GeolocationSource;
import com.telegram.geolocation.dto.MessageRecord;
import com.telegram.geolocation.extraction.ChannelFallbackResolver;
import com.telegram.geolocation.pipeline.AttemptLog;
import com.telegram.geolocation.pipeline.GeolocationStrategy;
import com.telegram.geolocation.reference.CountryReferenceData;

/** Stage 5: the source channel's default country, placed at its centroid. */
@Component
public class ChannelFallbackStrategy implements GeolocationStrategy {

  public static final double CONFIDENCE = 0.2;
  static final int PRIORITY = 50;

  private final ChannelFallbackResolver channelFallbackResolver;
  private final CountryReferenceData referenceData;

  public ChannelFallbackStrategy(
      ChannelFallbackResolver channelFallbackResolver, CountryReferenceData referenceData) {
    this.channelFallbackResolver = channelFallbackResolver;
    this.referenceData = referenceData;
  }

  @Override
  public String getName() {
    return "channel_fallback";
  }

  @Override
  public int getPriority() {
    return PRIORITY;
  }

  @Override
  public Optional<GeolocationResult> attempt(MessageRecord message, AttemptLog attempts) {
    Optional<String> countryCode = channelFallbackResolver.resolve(message.channel());
    if (countryCode.isEmpty()) {
      attempts.record("No channel fallback for: " + message.channel());
      return Optional.empty();
    }

    Optional<Coordinate> centroid = referenceData.centroidOf(countryCode.get());
    if (centroid.isEmpty()) {
      attempts.record("Channel fallback without centroid: " + countryCode.get());
      return Optional.empty();
    }

    attempts.record("Channel fallback: " + countryCode.get());
    return Optional.of(
        GeolocationResult.located(
            centroid.get(),
            countryCode.get(),
            CONFIDENCE,
            GeolocationSource.CHANNEL_FALLBACK.tag(),
            null,
            attempts.snapshot()));
  }
}
