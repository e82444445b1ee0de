package com.telegram.geolocation.processor;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.telegram.geolocation.config.properties.BatchConfigurationProperties;
import com.telegram.geolocation.export.GeoJsonExportService;

/**
 * Runs one batch over the input directory when the application starts, followed by the GeoJSON
 * export if it is enabled.
 */
@Component
@ConditionalOnProperty(prefix = "batch", name = "run-on-startup", havingValue = "true")
public class BatchProcessingRunner implements ApplicationRunner {

  private static final Logger logger = LoggerFactory.getLogger(BatchProcessingRunner.class);

  private final BatchProcessingService batchProcessingService;
  private final GeoJsonExportService geoJsonExportService;
  private final BatchConfigurationProperties batchConfig;

  public BatchProcessingRunner(
      BatchProcessingService batchProcessingService,
      GeoJsonExportService geoJsonExportService,
      BatchConfigurationProperties batchConfig) {
    this.batchProcessingService = batchProcessingService;
    this.geoJsonExportService = geoJsonExportService;
    this.batchConfig = batchConfig;
  }

  @Override
  public void run(ApplicationArguments args) {
    List<FileProcessingResult> results = batchProcessingService.processAll();

    if (!batchConfig.geojson().enabled()) {
      logger.debug("GeoJSON export disabled");
      return;
    }
    if (results.isEmpty()) {
      logger.info("Nothing to export as GeoJSON");
      return;
    }

    geoJsonExportService.exportAll(
        results.stream().map(FileProcessingResult::outputFile).toList());
  }
}
