package dev.archivist.embedding;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.stream.Stream;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Disk-backed store writing one JSON document per entry under {@code <directory>/<model>/}.
 *
 * <p>Entries are written to a temporary file and moved into place, so a reader never observes a
 * half-written vector. An unreadable entry is reported and treated as a miss; a failed write is
 * reported, leaves the cache unchanged and removes its temporary file. Neither fails the embedding
 * call.
 */
public class FileEmbeddingCacheStore implements EmbeddingCacheStore {

  private static final Logger log = LoggerFactory.getLogger(FileEmbeddingCacheStore.class);

  private final Path directory;
  private final ObjectMapper objectMapper;

  public FileEmbeddingCacheStore(Path directory, ObjectMapper objectMapper) {
    this.directory = directory;
    this.objectMapper = objectMapper;
    try {
      Files.createDirectories(directory);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot create embedding cache directory " + directory, e);
    }
  }

  @Override
  public Optional<float[]> get(CacheKey key) {
    Path file = pathFor(key);
    if (!Files.exists(file)) {
      return Optional.empty();
    }
    try {
      CachedVector entry = objectMapper.readValue(file.toFile(), CachedVector.class);
      return Optional.of(entry.vector());
    } catch (IOException e) {
      log.warn("Ignoring unreadable embedding cache entry {}: {}", file, e.getMessage());
      return Optional.empty();
    }
  }

  @Override
  public void put(CacheKey key, float[] vector) {
    Path file = pathFor(key);
    Path tmp = null;
    try {
      Files.createDirectories(file.getParent());
      tmp = Files.createTempFile(file.getParent(), key.hash(), ".tmp");
      objectMapper.writeValue(tmp.toFile(), new CachedVector(key.modelId(), vector));
      moveIntoPlace(tmp, file);
    } catch (IOException e) {
      log.warn("Failed to persist embedding cache entry {}: {}", file, e.getMessage());
      deleteQuietly(tmp);
    }
  }

  private static void deleteQuietly(@Nullable Path tmp) {
    if (tmp == null) {
      return;
    }
    try {
      Files.deleteIfExists(tmp);
    } catch (IOException e) {
      log.warn("Failed to remove temporary cache file {}: {}", tmp, e.getMessage());
    }
  }

  @Override
  public long size() {
    if (!Files.isDirectory(directory)) {
      return 0;
    }
    try (Stream<Path> files = Files.walk(directory)) {
      return files.filter(p -> p.getFileName().toString().endsWith(".json")).count();
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot list embedding cache directory " + directory, e);
    }
  }

  Path pathFor(CacheKey key) {
    return directory.resolve(safeSegment(key.modelId())).resolve(key.hash() + ".json");
  }

  private static void moveIntoPlace(Path tmp, Path target) throws IOException {
    try {
      Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static String safeSegment(String modelId) {
    return modelId.replaceAll("[^A-Za-z0-9._-]", "_");
  }

  /** On-disk layout of one entry. */
  record CachedVector(String model, float[] vector) {}
}
