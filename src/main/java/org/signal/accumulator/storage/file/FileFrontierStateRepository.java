/*
 * Copyright 2026 Signal Messenger, LLC
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package org.signal.accumulator.storage.file;

import io.micronaut.context.annotation.Property;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.signal.accumulator.storage.FrontierStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A frontier state repository that uses a file as its backing store. New state is written to a sibling temporary file
 * and moved into place, so readers never observe a partially written frontier.
 */
@Singleton
@Requires(property = "storage.file.name")
public class FileFrontierStateRepository implements FrontierStateRepository {

  private static final Logger logger = LoggerFactory.getLogger(FileFrontierStateRepository.class);
  private final Path path;

  public FileFrontierStateRepository(@Property(name = "storage.file.name") String fileName) {
    this.path = Paths.get(fileName);
  }

  @Override
  public Optional<byte[]> getSerializedFrontierState() throws IOException {
    try {
      return Optional.of(Files.readAllBytes(path));
    } catch (final NoSuchFileException e) {
      logger.info("Frontier state not found at {}", path);
      return Optional.empty();
    } catch (final IOException e) {
      logger.error("Unexpected error reading frontier state", e);
      throw e;
    }
  }

  @Override
  public void storeSerializedFrontierState(final byte[] serializedFrontierState) throws IOException {
    try {
      // recursively create parent directories if they don't already exist
      final Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      final Path temporaryFile = Files.createTempFile(parent, path.getFileName().toString(), ".tmp");
      try {
        Files.write(temporaryFile, serializedFrontierState);
        Files.move(temporaryFile, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } finally {
        Files.deleteIfExists(temporaryFile);
      }
    } catch (final IOException e) {
      logger.error("Unexpected error writing frontier state", e);
      throw e;
    }
  }
}
