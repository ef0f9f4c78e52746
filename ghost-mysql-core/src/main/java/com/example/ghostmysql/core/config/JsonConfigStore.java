package com.example.ghostmysql.core.config;

import static java.lang.System.Logger.Level.DEBUG;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.function.Supplier;

/**
 * Configuration kept in a Ghost style {@code config.<environment>.json} file.
 *
 * <p>{@link #save()} writes the whole document to a temporary sibling file and moves it over the
 * original, so a crash never leaves a half-written configuration behind.
 */
public final class JsonConfigStore extends AbstractJsonConfigStore {

  private static final System.Logger LOGGER = System.getLogger(JsonConfigStore.class.getName());

  private static Supplier<ObjectMapper> mapperSupplier = ObjectMapper::new;

  private final Path file;

  private JsonConfigStore(final ObjectMapper mapper, final ObjectNode root, final Path file) {
    super(mapper, root);
    this.file = file;
  }

  /**
   * Sets the supplier of the {@link ObjectMapper} used by stores loaded afterwards.
   *
   * @param supplier the supplier of the {@link ObjectMapper} to use
   */
  public static void setMapperSupplier(final Supplier<ObjectMapper> supplier) {
    mapperSupplier = supplier;
  }

  /**
   * Resolves the configuration file of an environment inside an install directory.
   *
   * @param directory install directory
   * @param environment environment name, e.g. {@code production}
   * @return path of {@code config.<environment>.json}
   */
  public static Path fileFor(final Path directory, final String environment) {
    return directory.resolve("config." + environment + ".json");
  }

  /**
   * Loads a configuration file. A missing file yields an empty document that is created on save.
   *
   * @param file configuration file
   * @return store backed by the file
   * @throws UncheckedIOException if the file cannot be read or parsed
   */
  public static JsonConfigStore load(final Path file) {
    final var mapper = mapperSupplier.get();
    try {
      final var json = Files.exists(file) ? Files.readString(file, StandardCharsets.UTF_8) : null;
      return new JsonConfigStore(mapper, parse(mapper, json), file);
    } catch (final IOException e) {
      throw new UncheckedIOException("Failed to read configuration " + file, e);
    }
  }

  public Path file() {
    return file;
  }

  @Override
  public void save() {
    final var target = file.toAbsolutePath();
    try {
      final var tmp =
          Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
      try {
        Files.writeString(tmp, render() + System.lineSeparator(), StandardCharsets.UTF_8);
        try {
          Files.move(
              tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (final AtomicMoveNotSupportedException e) {
          Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
      } finally {
        Files.deleteIfExists(tmp);
      }
      LOGGER.log(DEBUG, "Saved configuration to {0}", target);
    } catch (final IOException e) {
      throw new UncheckedIOException("Failed to save configuration " + target, e);
    }
  }
}
