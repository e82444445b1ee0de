package com.telegram.geolocation.processor;

import java.time.Clock;
import java.time.Instant;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.telegram.geolocation.config.properties.PipelineConfigurationProperties;
import com.telegram.geolocation.dto.GeolocationResult;
import com.telegram.geolocation.dto.MessageRecord;
import com.telegram.geolocation.exception.MalformedMessageException;
import com.telegram.geolocation.pipeline.GeolocationPipeline;

/**
 * Turns one raw JSON line into an augmented output record.
 *
 * <p>All fields of the input object are carried over unchanged. The pipeline result is added
 * under {@code geolocation}, together with {@code processed_at} (ISO-8601 UTC) and {@code
 * processing_version}.
 */
@Component
public class MessageProcessor {

  static final String GEOLOCATION_FIELD = "geolocation";
  static final String PROCESSED_AT_FIELD = "processed_at";
  static final String PROCESSING_VERSION_FIELD = "processing_version";

  private final ObjectMapper objectMapper;
  private final GeolocationPipeline pipeline;
  private final PipelineConfigurationProperties pipelineConfig;
  private final Clock clock;

  public MessageProcessor(
      ObjectMapper objectMapper,
      GeolocationPipeline pipeline,
      PipelineConfigurationProperties pipelineConfig,
      Clock clock) {
    this.objectMapper = objectMapper;
    this.pipeline = pipeline;
    this.pipelineConfig = pipelineConfig;
    this.clock = clock;
  }

  /**
   * Parses, geolocates and augments one line.
   *
   * @param line a single JSON object
   * @return the augmented record
   * @throws MalformedMessageException if the line is not a JSON object or {@code text} or {@code
   *     channel} is present with a non-string value
   */
  public ProcessedMessage process(String line) {
    ObjectNode source = parse(line);
    MessageRecord message = toMessageRecord(source);

    GeolocationResult geolocation = pipeline.locate(message);

    ObjectNode output = source.deepCopy();
    output.set(GEOLOCATION_FIELD, objectMapper.valueToTree(geolocation));
    output.put(PROCESSED_AT_FIELD, Instant.now(clock).toString());
    output.put(PROCESSING_VERSION_FIELD, pipelineConfig.processingVersion());
    return new ProcessedMessage(output, geolocation);
  }

  private ObjectNode parse(String line) {
    JsonNode node;
    try {
      node = objectMapper.readTree(line);
    } catch (JsonProcessingException e) {
      throw new MalformedMessageException("Invalid JSON: " + e.getOriginalMessage(), e);
    }
    if (node == null || !node.isObject()) {
      throw new MalformedMessageException("Expected a JSON object");
    }
    return (ObjectNode) node;
  }

  MessageRecord toMessageRecord(ObjectNode node) {
    String channel = requireTextOrAbsent(node, "channel");
    String text = requireTextOrAbsent(node, "text");
    JsonNode id = node.get("id");

    return new MessageRecord(
        channel,
        textOrNull(node.get("link")),
        text,
        textOrNull(node.get("timestamp")),
        id != null && id.canConvertToLong() ? id.asLong() : null);
  }

  private static String requireTextOrAbsent(ObjectNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      return null;
    }
    if (!value.isTextual()) {
      throw new MalformedMessageException(
          "Field '" + field + "' must be a string but was " + value.getNodeType());
    }
    return value.asText();
  }

  private static String textOrNull(JsonNode value) {
    return value == null || value.isNull() ? null : value.asText();
  }
}
