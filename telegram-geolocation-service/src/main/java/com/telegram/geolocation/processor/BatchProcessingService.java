package com.telegram.geolocation.processor;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.telegram.geolocation.config.properties.BatchConfigurationProperties;
import com.telegram.geolocation.exception.GeolocationProcessingException;

/**
 * Processes every message file of the input directory, one file at a time.
 *
 * <p>Input files are matched with {@code batch.input-pattern} (a glob) and processed in file name
 * order. Each output is written to the output directory as {@code batch.output-prefix} followed
 * by the input file name. A file that cannot be read or written is logged and the batch moves on
 * to the next one.
 */
@Service
public class BatchProcessingService {

  private static final Logger logger = LoggerFactory.getLogger(BatchProcessingService.class);

  private final JsonlFileProcessor fileProcessor;
  private final BatchConfigurationProperties batchConfig;

  public BatchProcessingService(
      JsonlFileProcessor fileProcessor, BatchConfigurationProperties batchConfig) {
    this.fileProcessor = fileProcessor;
    this.batchConfig = batchConfig;
  }

  /**
   * Processes all matching files of the configured input directory.
   *
   * @return one result per successfully processed file, in processing order
   */
  public List<FileProcessingResult> processAll() {
    Path inputDirectory = Paths.get(batchConfig.inputDirectory());
    Path outputDirectory = Paths.get(batchConfig.outputDirectory());

    List<Path> inputFiles = findInputFiles(inputDirectory);
    if (inputFiles.isEmpty()) {
      logger.warn(
          "No files matching '{}' found in {}", batchConfig.inputPattern(), inputDirectory);
      return List.of();
    }

    logger.info("Processing {} files from {}", inputFiles.size(), inputDirectory);
    List<FileProcessingResult> results = new ArrayList<>();
    for (Path inputFile : inputFiles) {
      Path outputFile =
          outputDirectory.resolve(batchConfig.outputPrefix() + inputFile.getFileName());
      try {
        results.add(fileProcessor.processFile(inputFile, outputFile));
      } catch (GeolocationProcessingException e) {
        logger.error("Skipping file {}: {}", inputFile, e.getMessage(), e);
      }
    }

    logSummary(results, inputFiles.size());
    return results;
  }

  List<Path> findInputFiles(Path inputDirectory) {
    if (!Files.isDirectory(inputDirectory)) {
      logger.warn("Input directory does not exist: {}", inputDirectory);
      return List.of();
    }

    List<Path> files = new ArrayList<>();
    try (DirectoryStream<Path> stream =
        Files.newDirectoryStream(inputDirectory, batchConfig.inputPattern())) {
      for (Path file : stream) {
        if (Files.isRegularFile(file)) {
          files.add(file);
        }
      }
    } catch (IOException e) {
      throw new GeolocationProcessingException(
          "Failed to list input directory " + inputDirectory, e);
    }
    files.sort(Path::compareTo);
    return files;
  }

  private static void logSummary(List<FileProcessingResult> results, int fileCount) {
    long processed = results.stream().mapToLong(FileProcessingResult::processed).sum();
    long geolocated = results.stream().mapToLong(FileProcessingResult::geolocated).sum();
    logger.info(
        "Batch completed: {}/{} files, {} messages, {} geolocated ({}%)",
        results.size(),
        fileCount,
        processed,
        geolocated,
        String.format(Locale.ROOT, "%.1f", FileProcessingResult.rate(geolocated, processed)));
  }
}
