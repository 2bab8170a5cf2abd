package io.intellixity.coframe.schema.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.intellixity.coframe.schema.error.PluginLoadException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Reads YAML files (root config, plugin manifests, declaration documents) into ordered plain maps. */
public final class YamlDocuments {
  private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
  private static final TypeReference<LinkedHashMap<String, Object>> MAP = new TypeReference<>() {};

  private YamlDocuments() {}

  /** Parse {@code file}; an empty document reads as an empty map, a non-map top level is an error. */
  public static Map<String, Object> readMap(Path file) {
    String text;
    try {
      text = Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new PluginLoadException(file, "Failed to read YAML document", e);
    }
    return parseMap(text, file);
  }

  /** Parse an in-memory YAML document (tests, inline declarations). */
  public static Map<String, Object> parse(String text) {
    return parseMap(text, Path.of("<inline>"));
  }

  static Map<String, Object> parseMap(String text, Path origin) {
    if (text == null || text.isBlank()) return new LinkedHashMap<>();
    try {
      Object parsed = YAML.readValue(text, Object.class);
      if (parsed == null) return new LinkedHashMap<>();
      if (!(parsed instanceof Map)) {
        throw new PluginLoadException(origin, "YAML document must be a mapping at the top level");
      }
      return YAML.convertValue(parsed, MAP);
    } catch (IOException e) {
      throw new PluginLoadException(origin, "Invalid YAML document", e);
    }
  }

  /** A string or a list of strings, normalized to a list. */
  public static List<String> stringList(Object value) {
    List<String> out = new ArrayList<>();
    if (value == null) return out;
    if (value instanceof Collection<?> c) {
      for (Object o : c) {
        if (o != null && !String.valueOf(o).isBlank()) out.add(String.valueOf(o).trim());
      }
      return out;
    }
    String s = String.valueOf(value).trim();
    if (!s.isEmpty()) out.add(s);
    return out;
  }

  public static String string(Map<String, Object> m, String key, String dflt) {
    Object v = m.get(key);
    return v == null ? dflt : String.valueOf(v);
  }

  public static boolean bool(Map<String, Object> m, String key, boolean dflt) {
    Object v = m.get(key);
    if (v == null) return dflt;
    if (v instanceof Boolean b) return b;
    return Boolean.parseBoolean(String.valueOf(v).trim());
  }
}
