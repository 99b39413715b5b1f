package com.flamingo.ai.studybuddy.engine.resource;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Treats a model as present when its directory exists and contains at least one of the configured
 * model config files.
 */
@Slf4j
public class FileSystemModelResourceCheck implements ModelResourceCheck {

  private final List<String> requiredFiles;

  public FileSystemModelResourceCheck(List<String> requiredFiles) {
    if (requiredFiles == null || requiredFiles.isEmpty()) {
      throw new IllegalArgumentException("At least one required model file must be configured");
    }
    this.requiredFiles = List.copyOf(requiredFiles);
  }

  @Override
  public boolean exists(String modelPath) {
    Path directory;
    try {
      directory = Path.of(modelPath);
    } catch (InvalidPathException e) {
      log.warn("Invalid model path '{}': {}", modelPath, e.getMessage());
      return false;
    }
    if (!Files.isDirectory(directory)) {
      log.debug("Model directory {} does not exist", directory);
      return false;
    }
    for (String fileName : requiredFiles) {
      if (Files.isRegularFile(directory.resolve(fileName))) {
        log.debug("Found model config {} in {}", fileName, directory);
        return true;
      }
    }
    log.debug("None of {} found in {}", requiredFiles, directory);
    return false;
  }

  public List<String> getRequiredFiles() {
    return requiredFiles;
  }
}
