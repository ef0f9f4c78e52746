package com.example.ghostmysql.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.UncheckedIOException;
import java.util.Optional;

/**
 * {@link ConfigStore} over a JSON document held in memory as a Jackson {@link ObjectNode}.
 * Subclasses decide where the document is loaded from and saved to.
 */
public abstract class AbstractJsonConfigStore implements ConfigStore {

  protected final ObjectMapper mapper;
  private final ObjectNode root;

  protected AbstractJsonConfigStore(final ObjectMapper mapper, final ObjectNode root) {
    this.mapper = mapper;
    this.root = root;
  }

  /**
   * Parses a JSON document, treating blank input as an empty document.
   *
   * @param mapper mapper to parse with
   * @param json document text, may be {@code null}
   * @return root object
   * @throws UncheckedIOException if the text is not a JSON object
   */
  protected static ObjectNode parse(final ObjectMapper mapper, final String json) {
    if (json == null || json.isBlank()) return mapper.createObjectNode();
    try {
      final var node = mapper.readTree(json);
      if (!(node instanceof ObjectNode object)) {
        throw new IllegalArgumentException("Configuration must be a JSON object");
      }
      return object;
    } catch (final JsonProcessingException e) {
      throw new UncheckedIOException("Configuration is not valid JSON", e);
    }
  }

  @Override
  public Optional<String> get(final String key) {
    JsonNode node = root;
    for (final var part : key.split("\\.")) {
      if (node == null || !node.isObject()) return Optional.empty();
      node = node.get(part);
    }
    return Optional.ofNullable(node)
        .filter(JsonNode::isValueNode)
        .filter(n -> !n.isNull())
        .map(JsonNode::asText);
  }

  @Override
  public ConfigStore set(final String key, final String value) {
    final var parts = key.split("\\.");
    var node = root;
    for (int i = 0; i < parts.length - 1; i++) {
      final var child = node.get(parts[i]);
      node = child instanceof ObjectNode object ? object : node.putObject(parts[i]);
    }
    node.put(parts[parts.length - 1], value);
    return this;
  }

  /** Copy of the current document, pending changes included. */
  public ObjectNode snapshot() {
    return root.deepCopy();
  }

  /**
   * Serializes the current document.
   *
   * @return pretty-printed JSON
   */
  protected String render() {
    try {
      return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
    } catch (final JsonProcessingException e) {
      throw new UncheckedIOException("Failed to serialize configuration", e);
    }
  }
}
