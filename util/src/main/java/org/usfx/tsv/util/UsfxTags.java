package org.usfx.tsv.util;

import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Element name to {@link TagKind} table.
 *
 * <p>The defaults are read from the classpath resource {@value #DEFAULT_RESOURCE}. A
 * table has the JSON form
 * <pre>
 * { "defaultKind": "content", "tags": { "v": "verse", "f": "annotation" } }
 * </pre>
 * where {@code defaultKind} applies to element names not listed.
 */
public final class UsfxTags {

  public static final String DEFAULT_RESOURCE = "usfx-tags.json";

  static final String DEFAULT_KIND_LABEL = "defaultKind";

  static final String TAGS_LABEL = "tags";

  private static UsfxTags defaultTags;

  private final Map<String, TagKind> kinds;

  private final TagKind defaultKind;

  private UsfxTags(Map<String, TagKind> kinds, TagKind defaultKind) {
    this.kinds = Collections.unmodifiableMap(kinds);
    this.defaultKind = defaultKind;
    Set<TagKind> required = EnumSet.of(TagKind.BOOK, TagKind.CHAPTER, TagKind.VERSE);
    required.removeAll(kinds.values());
    if (!required.isEmpty()) {
      throw new IllegalArgumentException("Tag table without element for " + required);
    }
    if (defaultKind.isStructural()) {
      throw new IllegalArgumentException("defaultKind must be content or annotation");
    }
  }

  /**
   * Get built-in tag table.
   * @return tag table
   */
  public static synchronized UsfxTags defaults() {
    if (defaultTags == null) {
      defaultTags = fromJson(loadResource(DEFAULT_RESOURCE));
    }
    return defaultTags;
  }

  static JsonObject loadResource(String name) {
    try (InputStream stream = UsfxTags.class.getClassLoader().getResourceAsStream(name)) {
      if (stream == null) {
        throw new IllegalStateException("Missing resource " + name);
      }
      return new JsonObject(new String(stream.readAllBytes(), StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /**
   * Create tag table from JSON.
   * @param json table with "tags" and optional "defaultKind"
   * @return tag table
   * @throws IllegalArgumentException if kinds are unknown or book/chapter/verse are missing
   */
  public static UsfxTags fromJson(JsonObject json) {
    Map<String, TagKind> kinds = new HashMap<>();
    putTags(kinds, json);
    return new UsfxTags(kinds, TagKind.fromLabel(json.getString(DEFAULT_KIND_LABEL, "content")));
  }

  /**
   * Create tag table from this table with entries replaced.
   * @param overrides JSON in same form as {@link #fromJson(JsonObject)}
   * @return new tag table
   */
  public UsfxTags merge(JsonObject overrides) {
    Map<String, TagKind> merged = new HashMap<>(kinds);
    putTags(merged, overrides);
    String label = overrides.getString(DEFAULT_KIND_LABEL);
    return new UsfxTags(merged, label == null ? defaultKind : TagKind.fromLabel(label));
  }

  private static void putTags(Map<String, TagKind> kinds, JsonObject json) {
    JsonObject tags;
    try {
      tags = json.getJsonObject(TAGS_LABEL, new JsonObject());
    } catch (ClassCastException e) {
      throw new DecodeException("\"" + TAGS_LABEL + "\" must be an object");
    }
    for (String name : tags.fieldNames()) {
      kinds.put(name, TagKind.fromLabel(tags.getString(name)));
    }
  }

  public TagKind kindOf(String name) {
    return kinds.getOrDefault(name, defaultKind);
  }

  public TagKind getDefaultKind() {
    return defaultKind;
  }

  /**
   * Produce JSON form of table.
   * @return JSON that {@link #fromJson(JsonObject)} accepts
   */
  public JsonObject toJson() {
    JsonObject tags = new JsonObject();
    kinds.entrySet().stream()
        .sorted(Map.Entry.comparingByKey())
        .forEach(e -> tags.put(e.getKey(), e.getValue().label()));
    return new JsonObject()
        .put(DEFAULT_KIND_LABEL, defaultKind.label())
        .put(TAGS_LABEL, tags);
  }
}
