package com.flamingo.ai.reindexer.elasticsearch;

import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import com.flamingo.ai.reindexer.exception.BackingStoreException;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Operations on the search backend needed by the revision lifecycle.
 *
 * <p>A generation is a physical index; an alias is the stable public name pointing at exactly one
 * generation. Every method throws {@link BackingStoreException} when the backend rejects the call
 * or cannot be reached.
 */
public interface GenerationStore {

  /**
   * Probes the backend.
   *
   * @throws BackingStoreException if the backend is not reachable
   */
  void checkHealth();

  /**
   * Lists the names of all generations starting with the given prefix.
   *
   * @param prefix the name prefix, e.g. {@code "www-de-"}
   * @return matching generation names, empty if none
   */
  Set<String> listGenerations(String prefix);

  /**
   * Tells whether a generation exists.
   *
   * @param name the generation name
   * @return true if it exists
   */
  boolean generationExists(String name);

  /**
   * Creates a generation.
   *
   * @param name the generation name
   * @param schemaJson create-index body with settings and mappings, or null for dynamic mapping
   */
  void createGeneration(String name, String schemaJson);

  /**
   * Deletes a generation.
   *
   * @param name the generation name
   */
  void deleteGeneration(String name);

  /**
   * Lists alias targets.
   *
   * @return alias name to generation name
   */
  Map<String, String> listAliases();

  /**
   * Makes every document written to a generation visible to search. Best effort: a failed refresh
   * is logged, not raised.
   *
   * @param generation the generation name
   */
  void refreshGeneration(String generation);

  /**
   * Points an alias at a generation, atomically detaching it from its previous target.
   *
   * @param alias the alias name
   * @param generation the generation to point at
   */
  void upsertAlias(String alias, String generation);

  /**
   * Writes documents into a generation with upsert semantics.
   *
   * <p>Per-document rejections are reported in the results; only a rejection of the whole call
   * raises.
   *
   * @param generation the target generation
   * @param documents the documents to write
   * @return one result per document, in request order
   */
  List<ImportResult> importDocuments(String generation, List<? extends IndexDocument> documents);

  /**
   * Creates or replaces a stored search template.
   *
   * @param name the template id
   * @param presetJson stored script body
   */
  void upsertSearchPreset(String name, String presetJson);

  /**
   * Runs a search.
   *
   * @param request the search request; its target is normally an alias
   * @param documentClass class hit sources are deserialized into
   * @return the raw search response
   */
  <T> SearchResponse<T> search(SearchRequest request, Class<T> documentClass);
}
