package com.telegram.geolocation.processor;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.telegram.geolocation.dto.GeolocationResult;

/**
 * Output of processing one input line.
 *
 * @param record the original message with {@code geolocation}, {@code processed_at} and {@code
 *     processing_version} added
 * @param geolocation the pipeline result stored under {@code geolocation}
 */
public record ProcessedMessage(ObjectNode record, GeolocationResult geolocation) {}
