package io.gridsync.desktop.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Durable user preferences stored as {@code [section] option = value} pairs.
 *
 * <p>Nothing is cached: every {@link #set} loads the file, changes one option and writes the whole
 * document back before returning, so a following {@link #get} (in this or a later process) sees
 * the new value. Values are plain strings; callers do their own type coercion.
 */
@Component
public class PreferenceStore {

  private static final Logger log = LoggerFactory.getLogger(PreferenceStore.class);

  private final Path file;

  @Autowired
  public PreferenceStore(
      @Value(
              "${gridsync.preferences-file:${gridsync.config-dir:${user.home}/.config/gridsync}/preferences.ini}")
          String filePath) {
    String p = Objects.toString(filePath, "").trim();
    if (p.isEmpty()) throw new IllegalArgumentException("preferences file path is required");
    this.file = Paths.get(p);
  }

  public PreferenceStore(Path file) {
    this.file = Objects.requireNonNull(file, "file");
  }

  public Path preferencesPath() {
    return file;
  }

  /**
   * Returns the stored value.
   *
   * @throws PreferenceNotFoundException if the pair was never set
   */
  public synchronized String get(String section, String option) {
    return find(section, option).orElseThrow(() -> new PreferenceNotFoundException(section, option));
  }

  public synchronized Optional<String> find(String section, String option) {
    if (section == null || option == null) return Optional.empty();
    Map<String, String> options = loadQuietly().get(section);
    if (options == null) return Optional.empty();
    return Optional.ofNullable(options.get(option));
  }

  /** Returns a copy of one section, or an empty map if it does not exist. */
  public synchronized Map<String, String> section(String section) {
    if (section == null) return Map.of();
    Map<String, String> options = loadQuietly().get(section);
    return options == null ? Map.of() : Map.copyOf(options);
  }

  /**
   * Writes one value, creating the section and the file when needed.
   *
   * @throws UncheckedIOException if the file could not be read or written
   */
  public synchronized void set(String section, String option, String value) {
    if (!IniDocumentCodec.isValidName(section)) {
      throw new IllegalArgumentException("Invalid preference section: " + section);
    }
    if (!IniDocumentCodec.isValidName(option)) {
      throw new IllegalArgumentException("Invalid preference option: " + option);
    }
    String v = Objects.toString(value, "");
    if (!IniDocumentCodec.isValidValue(v)) {
      throw new IllegalArgumentException(
          "Preference values must be single-line without surrounding whitespace");
    }

    try {
      Map<String, Map<String, String>> doc = Files.exists(file) ? loadFile() : new LinkedHashMap<>();
      doc.computeIfAbsent(section, k -> new LinkedHashMap<>()).put(option, v);
      writeFile(doc);
      log.debug("[gridsync] Set user preference: [{}] {} = {}", section, option, v);
    } catch (IOException e) {
      throw new UncheckedIOException("Could not persist preference to '" + file + "'", e);
    }
  }

  private Map<String, Map<String, String>> loadQuietly() {
    try {
      if (!Files.exists(file)) return Map.of();
      return loadFile();
    } catch (IOException e) {
      log.warn("[gridsync] Could not read preferences from '{}'", file, e);
      return Map.of();
    }
  }

  private Map<String, Map<String, String>> loadFile() throws IOException {
    return IniDocumentCodec.decode(Files.readAllLines(file, StandardCharsets.UTF_8));
  }

  private void writeFile(Map<String, Map<String, String>> doc) throws IOException {
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null && !Files.exists(parent)) {
      Files.createDirectories(parent);
    }
    Path tmp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
    try {
      Files.writeString(tmp, IniDocumentCodec.encode(doc), StandardCharsets.UTF_8);
      try {
        Files.move(
            tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(tmp);
    }
  }
}
