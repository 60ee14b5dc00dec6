package com.ospicorp.creditforecast.forecast.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.creditforecast.forecast.model.ResultBundle;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Persists the result bundle as pretty-printed JSON. The bundle is written to a temporary file
 * next to the target and moved into place, so readers never see a partial artifact.
 */
@Component
public class ForecastResultWriter {

  private static final Logger log = LoggerFactory.getLogger(ForecastResultWriter.class);

  private final ObjectMapper objectMapper;

  public ForecastResultWriter(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public long write(ResultBundle bundle, Path target) {
    Path absolute = target.toAbsolutePath();
    Path directory = absolute.getParent();
    Path temp = null;
    try {
      Files.createDirectories(directory);
      temp = Files.createTempFile(directory, absolute.getFileName().toString(), ".tmp");
      try (OutputStream out = Files.newOutputStream(temp)) {
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(out, bundle);
      }
      move(temp, absolute);
      long size = Files.size(absolute);
      log.info("Saved forecasts to {} ({} KB)", absolute, String.format("%.1f", size / 1024d));
      return size;
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to write forecasts to " + absolute, ex);
    } finally {
      deleteQuietly(temp);
    }
  }

  private static void move(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
    } catch (AtomicMoveNotSupportedException ex) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static void deleteQuietly(Path temp) {
    if (temp == null) {
      return;
    }
    try {
      Files.deleteIfExists(temp);
    } catch (IOException ex) {
      log.warn("Failed to remove temporary file {}: {}", temp, ex.getMessage());
    }
  }
}
