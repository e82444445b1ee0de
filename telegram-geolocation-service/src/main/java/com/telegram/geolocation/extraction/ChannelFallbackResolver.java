package com.telegram.geolocation.extraction;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Component;

/** Maps known source channels to the country they predominantly report on. */
@Component
public class ChannelFallbackResolver {

  static final Map<String, String> DEFAULT_CHANNEL_COUNTRIES = defaultChannelCountries();

  private final Map<String, String> channelCountries;

  public ChannelFallbackResolver() {
    this(DEFAULT_CHANNEL_COUNTRIES);
  }

  ChannelFallbackResolver(Map<String, String> channelCountries) {
    this.channelCountries = Map.copyOf(channelCountries);
  }

  /**
   * Resolves the default country for a channel. Channel identifiers are matched exactly.
   *
   * @param channel channel identifier, may be null
   * @return country code, or empty for unknown channels
   */
  public Optional<String> resolve(String channel) {
    if (channel == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(channelCountries.get(channel));
  }

  private static Map<String, String> defaultChannelCountries() {
    Map<String, String> channels = new LinkedHashMap<>();
    channels.put("militarysummary", "UKR");
    channels.put("ClashReport", "UKR");
    channels.put("ukraine_world", "UKR");
    channels.put("russia_news", "RUS");
    channels.put("middle_east_news", "ISR");
    return Map.copyOf(channels);
  }
}
