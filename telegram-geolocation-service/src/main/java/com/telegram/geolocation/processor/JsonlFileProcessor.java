package com.telegram.geolocation.processor;

import java.io.BufferedInputStream;
import java.io.BufferedWriter;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telegram.geolocation.exception.GeolocationProcessingException;
import com.telegram.geolocation.exception.MalformedMessageException;
import com.telegram.geolocation.service.ProcessingMetricsService;

/**
 * Processes one JSONL message file line by line into an augmented JSONL file.
 *
 * <p>Lines are handled independently: a malformed line is skipped with a warning, a line that
 * fails unexpectedly is logged with its position and skipped, and every other line yields exactly
 * one output line. Each line is decoded as UTF-8 on its own, so a line with invalid bytes is
 * skipped as malformed without affecting its neighbours. Output is UTF-8 with non-ASCII characters
 * written as-is and {@code \n} line endings. Blank lines are ignored.
 */
@Service
public class JsonlFileProcessor {

  private static final Logger logger = LoggerFactory.getLogger(JsonlFileProcessor.class);

  private static final int LINE_FEED = '\n';
  private static final int CARRIAGE_RETURN = '\r';

  private final MessageProcessor messageProcessor;
  private final ObjectMapper objectMapper;
  private final ProcessingMetricsService metricsService;

  public JsonlFileProcessor(
      MessageProcessor messageProcessor,
      ObjectMapper objectMapper,
      ProcessingMetricsService metricsService) {
    this.messageProcessor = messageProcessor;
    this.objectMapper = objectMapper;
    this.metricsService = metricsService;
  }

  /**
   * Processes {@code inputFile} into {@code outputFile}, replacing any existing output.
   *
   * @param inputFile JSONL file with one message object per line
   * @param outputFile destination for the augmented records
   * @return per-file counts
   * @throws GeolocationProcessingException if either file cannot be read or written
   */
  public FileProcessingResult processFile(Path inputFile, Path outputFile) {
    logger.info("Processing {} -> {}", inputFile, outputFile);
    Instant start = Instant.now();

    int processed = 0;
    int geolocated = 0;
    int skipped = 0;
    int failed = 0;

    try {
      Path parent = outputFile.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }

      CharsetDecoder decoder =
          StandardCharsets.UTF_8
              .newDecoder()
              .onMalformedInput(CodingErrorAction.REPORT)
              .onUnmappableCharacter(CodingErrorAction.REPORT);

      try (InputStream input = new BufferedInputStream(Files.newInputStream(inputFile));
          BufferedWriter writer = Files.newBufferedWriter(outputFile, StandardCharsets.UTF_8)) {
        ByteArrayOutputStream lineBytes = new ByteArrayOutputStream();
        int lineNumber = 0;
        while (readLine(input, lineBytes)) {
          lineNumber++;

          String output;
          ProcessedMessage message;
          try {
            String line = decodeLine(decoder, lineBytes);
            if (line.isBlank()) {
              continue;
            }
            message = messageProcessor.process(line);
            output = objectMapper.writeValueAsString(message.record());
          } catch (MalformedMessageException e) {
            skipped++;
            metricsService.recordMessageSkipped();
            logger.warn(
                "Skipping malformed line {} of {}: {}", lineNumber, inputFile, e.getMessage());
            continue;
          } catch (JsonProcessingException | RuntimeException e) {
            failed++;
            metricsService.recordMessageFailed();
            logger.error(
                "Failed to process line {} of {}: {}", lineNumber, inputFile, e.getMessage(), e);
            continue;
          }

          writer.write(output);
          writer.write(LINE_FEED);
          processed++;

          boolean located = message.geolocation().isLocated();
          if (located) {
            geolocated++;
          }
          metricsService.recordMessageProcessed(message.geolocation().source(), located);
        }
      }
    } catch (IOException e) {
      metricsService.recordFileFailed();
      throw new GeolocationProcessingException(
          "Failed to process " + inputFile + ": " + e.getMessage(), e);
    }

    metricsService.recordFileProcessed(Duration.between(start, Instant.now()));
    FileProcessingResult result =
        new FileProcessingResult(inputFile, outputFile, processed, geolocated, skipped, failed);
    logger.info(
        "Completed {}: {} processed, {} geolocated ({}%), {} skipped, {} failed",
        inputFile.getFileName(),
        processed,
        geolocated,
        String.format(Locale.ROOT, "%.1f", result.geolocationRate()),
        skipped,
        failed);
    return result;
  }

  /**
   * Reads the next line's raw bytes into {@code lineBytes}, without the terminating line feed.
   *
   * @return false once the stream is exhausted and no bytes were read
   */
  private static boolean readLine(InputStream input, ByteArrayOutputStream lineBytes)
      throws IOException {
    lineBytes.reset();
    int next = input.read();
    if (next == -1) {
      return false;
    }
    while (next != -1 && next != LINE_FEED) {
      lineBytes.write(next);
      next = input.read();
    }
    return true;
  }

  private static String decodeLine(CharsetDecoder decoder, ByteArrayOutputStream lineBytes) {
    byte[] bytes = lineBytes.toByteArray();
    int length = bytes.length;
    if (length > 0 && bytes[length - 1] == CARRIAGE_RETURN) {
      length--;
    }
    try {
      return decoder.decode(ByteBuffer.wrap(bytes, 0, length)).toString();
    } catch (CharacterCodingException e) {
      throw new MalformedMessageException("Line is not valid UTF-8", e);
    }
  }
}
