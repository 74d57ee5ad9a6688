package com.flamingo.ai.reindexer.service.revision;

import com.flamingo.ai.reindexer.config.ReindexerConfig;
import com.flamingo.ai.reindexer.domain.model.IndexId;
import com.flamingo.ai.reindexer.exception.ConfigurationException;
import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * The configured indices with their generation schemas, and the search preset to keep in place.
 *
 * <p>Schema and preset resources are read once at startup; a missing resource fails startup.
 */
@Component
@Slf4j
public class IndexCatalog {

  private final List<IndexDefinition> indices;
  private final SearchPreset preset;

  @Autowired
  public IndexCatalog(ReindexerConfig reindexerConfig, ResourceLoader resourceLoader) {
    List<IndexDefinition> definitions = new ArrayList<>();
    Set<String> seen = new LinkedHashSet<>();
    for (ReindexerConfig.Index index : reindexerConfig.getIndices()) {
      if (index.getId() == null || index.getId().isBlank()) {
        throw new ConfigurationException("Index id must not be blank");
      }
      if (!seen.add(index.getId())) {
        throw new ConfigurationException("Index configured twice: " + index.getId());
      }
      String schemaJson =
          index.getSchemaResource() == null
              ? null
              : readResource(resourceLoader, index.getSchemaResource());
      definitions.add(new IndexDefinition(IndexId.of(index.getId()), schemaJson));
    }
    this.indices = List.copyOf(definitions);

    ReindexerConfig.Search search = reindexerConfig.getSearch();
    this.preset =
        search.getPresetResource() == null
            ? null
            : new SearchPreset(
                search.getPresetName(), readResource(resourceLoader, search.getPresetResource()));
    log.info(
        "Index catalog loaded: indices={}, preset={}",
        seen,
        preset == null ? "none" : preset.name());
  }

  @VisibleForTesting
  public IndexCatalog(List<IndexDefinition> indices, SearchPreset preset) {
    this.indices = List.copyOf(indices);
    this.preset = preset;
  }

  public List<IndexDefinition> getIndices() {
    return indices;
  }

  public List<IndexId> getIndexIds() {
    return indices.stream().map(IndexDefinition::id).toList();
  }

  public Optional<SearchPreset> getPreset() {
    return Optional.ofNullable(preset);
  }

  private static String readResource(ResourceLoader resourceLoader, String location) {
    Resource resource = resourceLoader.getResource(location);
    if (!resource.exists()) {
      throw new ConfigurationException("Resource not found: " + location);
    }
    try (InputStream in = resource.getInputStream()) {
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new ConfigurationException("Failed to read resource " + location, e);
    }
  }

  /**
   * A configured index.
   *
   * @param id the index id
   * @param schemaJson create-index body for its generations, null for dynamic mapping
   */
  public record IndexDefinition(IndexId id, String schemaJson) {}

  /** A stored search template kept up to date on every initialize. */
  public record SearchPreset(String name, String json) {}
}
