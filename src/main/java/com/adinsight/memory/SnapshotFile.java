package com.adinsight.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Whole-document JSON snapshot on disk.
 *
 * <p>Writes go to a sibling {@code .tmp} file which is then moved over the target,
 * so a reader sees either the previous document or the new one, never a partial write.
 */
public class SnapshotFile<T> {

  private final Path path;
  private final ObjectMapper mapper;
  private final Class<T> type;

  public SnapshotFile(Path path, ObjectMapper mapper, Class<T> type) {
    this.path = path;
    this.mapper = mapper;
    this.type = type;
  }

  public Path path() {
    return path;
  }

  /**
   * @return the stored document, or empty when no file exists yet
   * @throws IOException when the file exists but cannot be read or parsed
   */
  public Optional<T> read() throws IOException {
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    return Optional.ofNullable(mapper.readValue(path.toFile(), type));
  }

  public void write(T snapshot) throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Path tmp = path.resolveSibling(path.getFileName().toString() + ".tmp");
    byte[] json = mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(snapshot);
    try {
      Files.write(tmp, json);
      try {
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      try {
        Files.deleteIfExists(tmp);
      } catch (IOException cleanup) {
        e.addSuppressed(cleanup);
      }
      throw e;
    }
  }
}
