package tech.yump.multipart.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import tech.yump.multipart.secrets.multipart.PartNaming;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A {@link PartStore} keeping each part as {@code <name>.json} below a base directory.
 * Names may contain '/' to place parts in subdirectories. Tags given at creation are written to
 * {@code .tags/<name>.json}, outside the namespace of part names.
 */
@Slf4j
public class FileSystemPartStore implements PartStore {

  static final String PART_EXTENSION = ".json";
  static final String TAGS_DIRECTORY = ".tags";

  private static final TypeReference<Map<String, String>> TAGS_TYPE_REFERENCE = new TypeReference<>() {};

  private final Path basePath;
  private final ObjectMapper objectMapper;

  public FileSystemPartStore(final ObjectMapper objectMapper, final String basePath) {
    if (!StringUtils.hasText(basePath)) {
      throw new IllegalArgumentException("Filesystem store path cannot be null or empty.");
    }
    this.objectMapper = objectMapper;
    this.basePath = Paths.get(basePath).toAbsolutePath().normalize();
    log.info("FileSystemPartStore initialized with base path: {}", this.basePath);
  }

  /**
   * Validates the base path after bean creation.
   */
  @PostConstruct
  void validateBasePath() {
    try {
      if (Files.exists(basePath)) {
        if (!Files.isDirectory(basePath)) {
          throw new StoreUnavailableException("Configured base path exists but is not a directory: " + basePath);
        }
        if (!Files.isReadable(basePath) || !Files.isWritable(basePath)) {
          throw new StoreUnavailableException("Configured base path directory lacks read/write permissions: " + basePath);
        }
        log.debug("Base path validation successful: {}", basePath);
      } else {
        log.warn("Base path directory does not exist, attempting to create: {}", basePath);
        Files.createDirectories(basePath);
        log.info("Successfully created base path directory: {}", basePath);
      }
    } catch (IOException e) {
      log.error("Failed to validate or create base path: {}", basePath, e);
      throw new StoreUnavailableException("Failed to initialize storage base path: " + basePath, e);
    }
  }

  @Override
  public List<Integer> listPartIndices(String baseName) throws StorageException {
    requireName(baseName);
    Path baseFile = resolveFilePath(baseName, PART_EXTENSION);
    Path directory = baseFile.getParent();
    String baseFileName = stripExtension(baseFile.getFileName().toString(), PART_EXTENSION);

    if (!Files.isDirectory(directory, LinkOption.NOFOLLOW_LINKS)) {
      log.debug("No part directory {} for base name '{}'", directory, baseName);
      return List.of();
    }

    List<Integer> indices = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + PART_EXTENSION)) {
      for (Path entry : stream) {
        String fileName = entry.getFileName().toString();
        if (!Files.isRegularFile(entry)) {
          continue;
        }
        PartNaming.parseIndex(baseFileName, stripExtension(fileName, PART_EXTENSION))
                .ifPresent(indices::add);
      }
    } catch (IOException e) {
      log.error("Failed to list parts for '{}' in {}: {}", baseName, directory, e.getMessage(), e);
      throw new StoreUnavailableException("Failed to list parts for secret: " + baseName, e);
    }
    indices.sort(null);
    log.debug("Found part indices {} for base name '{}'", indices, baseName);
    return indices;
  }

  @Override
  public Map<Integer, byte[]> fetchParts(String baseName, List<Integer> indices) throws StorageException {
    requireName(baseName);
    if (indices == null || indices.isEmpty()) {
      throw new IllegalArgumentException("No part indices provided to fetch.");
    }
    Map<Integer, byte[]> parts = new LinkedHashMap<>();
    for (Integer index : indices) {
      String name = PartNaming.partName(baseName, index);
      Path filePath = resolveFilePath(name, PART_EXTENSION);
      if (!Files.isRegularFile(filePath)) {
        throw new PartNotFoundException(name);
      }
      try {
        parts.put(index, Files.readAllBytes(filePath));
      } catch (IOException e) {
        log.error("Failed to read part '{}' from {}: {}", name, filePath, e.getMessage(), e);
        throw new StoreUnavailableException("Failed to read secret part: " + name, e);
      }
    }
    return parts;
  }

  @Override
  public void upsertPart(String name, byte[] payload, Map<String, String> tags) throws StorageException {
    requireName(name);
    if (payload == null) {
      throw new IllegalArgumentException("Payload cannot be null for upsert operation.");
    }
    Path filePath = resolveFilePath(name, PART_EXTENSION);
    boolean exists = Files.isRegularFile(filePath);
    log.debug("{} part '{}' at path: {}", exists ? "Updating" : "Creating", name, filePath);

    try {
      Files.createDirectories(filePath.getParent());
      Files.write(filePath, payload, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING);
      if (!exists && tags != null && !tags.isEmpty()) {
        Path tagsPath = resolveTagsPath(name);
        Files.createDirectories(tagsPath.getParent());
        objectMapper.writeValue(tagsPath.toFile(), tags);
      }
      log.info("Successfully {} part '{}' ({} bytes)", exists ? "updated" : "created", name, payload.length);
    } catch (IOException e) {
      log.error("Failed to write part '{}' at path {}: {}", name, filePath, e.getMessage(), e);
      throw new StoreUnavailableException("Failed to write secret part: " + name, e);
    }
  }

  /**
   * Reads the tags a part was created with.
   */
  public Optional<Map<String, String>> readTags(String name) throws StorageException {
    requireName(name);
    Path tagsPath = resolveTagsPath(name);
    if (!Files.isRegularFile(tagsPath)) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(tagsPath.toFile(), TAGS_TYPE_REFERENCE));
    } catch (IOException e) {
      throw new StoreUnavailableException("Failed to read tags of secret part: " + name, e);
    }
  }

  private static void requireName(String name) {
    if (!StringUtils.hasText(name)) {
      throw new IllegalArgumentException("Secret name cannot be null or empty.");
    }
  }

  private static String stripExtension(String fileName, String extension) {
    return fileName.substring(0, fileName.length() - extension.length());
  }

  /**
   * Tags live in {@code .tags/<name>.json}. Part names can never start with {@code .tags/}, so the
   * two namespaces cannot collide.
   */
  private Path resolveTagsPath(String name) throws StorageException {
    return resolveBelow(this.basePath.resolve(TAGS_DIRECTORY), name, sanitize(name) + PART_EXTENSION);
  }

  /**
   * Resolves a part name to a file below the base directory, rejecting anything that would
   * escape it or reach into the tags directory.
   */
  private Path resolveFilePath(String name, String extension) throws StorageException {
    String sanitized = sanitize(name);
    return resolveBelow(this.basePath, name, sanitized + extension);
  }

  private static String sanitize(String name) throws StorageException {
    String sanitized = name.replace('\\', '/').trim();
    if (sanitized.startsWith("/") || sanitized.endsWith("/") || sanitized.contains("..") || sanitized.isEmpty()
            || sanitized.equals(TAGS_DIRECTORY) || sanitized.startsWith(TAGS_DIRECTORY + "/")) {
      log.error("Invalid secret name provided: '{}'", name);
      throw new StorageException("Invalid secret name format: " + name);
    }
    return sanitized;
  }

  private Path resolveBelow(Path root, String name, String relative) throws StorageException {
    Path absolutePath = root.resolve(relative).normalize();
    if (!absolutePath.startsWith(root)) {
      log.error("Path traversal attempt detected for name '{}', resolved path '{}' is outside base path '{}'", name, absolutePath, root);
      throw new StorageException("Invalid name resulting in path traversal attempt: " + name);
    }
    return absolutePath;
  }
}
