package com.telegram.geolocation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Telegram Geolocation Service.
 *
 * <p>This service reads Telegram channel messages stored as JSON Lines, infers where each message
 * refers to, and writes the augmented records back out. Location inference is an ordered cascade
 * of extraction strategies with a confidence score and an attempts trail per message.
 *
 * <p><strong>Data Flow:</strong>
 *
 * <ol>
 *   <li>Raw message files land in the configured input directory
 *   <li>Each line is parsed into a message record
 *   <li>The geolocation pipeline runs its strategies in priority order
 *   <li>The augmented record is written to the output directory
 *   <li>Optionally, processed files are exported as GeoJSON feature collections
 * </ol>
 *
 * @author Telegram Geolocation Team
 * @version 1.0
 * @since 2025
 */
@SpringBootApplication
@ConfigurationPropertiesScan("com.telegram.geolocation.config.properties")
public class TelegramGeolocationApplication {

  /**
   * Main entry point for the Telegram Geolocation Service.
   *
   * @param args Command line arguments passed to the application
   */
  public static void main(String[] args) {
    SpringApplication.run(TelegramGeolocationApplication.class, args);
  }
}
