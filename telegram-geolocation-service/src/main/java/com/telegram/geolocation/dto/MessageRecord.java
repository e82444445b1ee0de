package com.telegram.geolocation.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Read-only view of one raw Telegram message as produced by the extractor.
 *
 * <p>Missing {@code channel} and {@code text} are normalised to empty strings; the remaining
 * fields are passed through untouched.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MessageRecord(
    @JsonProperty("channel") String channel,
    @JsonProperty("link") String link,
    @JsonProperty("text") String text,
    @JsonProperty("timestamp") String timestamp,
    @JsonProperty("id") Long id) {

  public MessageRecord {
    channel = channel == null ? "" : channel;
    text = text == null ? "" : text;
  }

  public static MessageRecord of(String channel, String text) {
    return new MessageRecord(channel, null, text, null, null);
  }
}
