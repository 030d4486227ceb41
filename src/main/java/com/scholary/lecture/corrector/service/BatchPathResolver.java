package com.scholary.lecture.corrector.service;

import com.scholary.lecture.corrector.config.CorrectionProperties;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Resolves batch directories against {@code corrector.batch.root}.
 *
 * <p>Relative paths are resolved from the root. After normalization every directory must lie
 * strictly below the root, so the default {@code <inputDir>_corrected} sibling stays inside it
 * too. Symbolic links are not followed.
 */
@Component
public class BatchPathResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(BatchPathResolver.class);

  private final Path root;

  @Autowired
  public BatchPathResolver(CorrectionProperties properties) {
    this(Path.of(properties.batch().root()));
  }

  public BatchPathResolver(Path root) {
    this.root = root.toAbsolutePath().normalize();
    LOGGER.info("Batch directories restricted to {}", this.root);
  }

  /**
   * Resolve a requested directory.
   *
   * @param requested absolute or root-relative directory
   * @return the normalized absolute path
   * @throws InvalidBatchPathException if the path is malformed or not below the root
   */
  public Path resolve(String requested) {
    Path resolved;
    try {
      resolved = root.resolve(requested).toAbsolutePath().normalize();
    } catch (InvalidPathException e) {
      throw new InvalidBatchPathException("Invalid batch directory: " + requested);
    }

    if (!resolved.startsWith(root) || resolved.equals(root)) {
      throw new InvalidBatchPathException("Batch directory outside " + root + ": " + requested);
    }
    return resolved;
  }

  public Path getRoot() {
    return root;
  }
}
