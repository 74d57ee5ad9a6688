package com.flamingo.ai.reindexer.elasticsearch;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.PutScriptRequest;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.indices.CreateIndexRequest;
import co.elastic.clients.elasticsearch.indices.DeleteIndexRequest;
import co.elastic.clients.elasticsearch.indices.ExistsRequest;
import co.elastic.clients.elasticsearch.indices.GetAliasRequest;
import co.elastic.clients.elasticsearch.indices.GetAliasResponse;
import co.elastic.clients.elasticsearch.indices.GetIndexRequest;
import co.elastic.clients.elasticsearch.indices.RefreshRequest;
import co.elastic.clients.elasticsearch.indices.UpdateAliasesRequest;
import co.elastic.clients.elasticsearch.indices.update_aliases.Action;
import com.flamingo.ai.reindexer.exception.BackingStoreException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** {@link GenerationStore} on top of the Elasticsearch Java client. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ElasticsearchGenerationStore implements GenerationStore {

  private final ElasticsearchClient elasticsearchClient;

  @Override
  public void checkHealth() {
    boolean reachable;
    try {
      reachable = elasticsearchClient.ping().value();
    } catch (IOException | ElasticsearchException e) {
      log.error("Elasticsearch health check failed: {}", e.getMessage(), e);
      throw new BackingStoreException("Elasticsearch health check failed", e);
    }
    if (!reachable) {
      log.error("Elasticsearch health check failed: ping not acknowledged");
      throw new BackingStoreException("Elasticsearch did not acknowledge ping");
    }
  }

  @Override
  public Set<String> listGenerations(String prefix) {
    try {
      GetIndexRequest request =
          GetIndexRequest.of(g -> g.index(prefix + "*").allowNoIndices(true).ignoreUnavailable(true));
      return new TreeSet<>(elasticsearchClient.indices().get(request).indices().keySet());
    } catch (IOException | ElasticsearchException e) {
      log.error("Failed to list generations with prefix '{}': {}", prefix, e.getMessage(), e);
      throw new BackingStoreException("Failed to list generations " + prefix + "*", e);
    }
  }

  @Override
  public boolean generationExists(String name) {
    try {
      return elasticsearchClient.indices().exists(ExistsRequest.of(e -> e.index(name))).value();
    } catch (IOException | ElasticsearchException e) {
      log.error("Failed to check generation '{}': {}", name, e.getMessage(), e);
      throw new BackingStoreException("Failed to check generation " + name, e);
    }
  }

  @Override
  public void createGeneration(String name, String schemaJson) {
    CreateIndexRequest request =
        schemaJson == null
            ? CreateIndexRequest.of(c -> c.index(name))
            // the body is applied first so the generation name always wins
            : CreateIndexRequest.of(c -> c.withJson(new StringReader(schemaJson)).index(name));
    try {
      elasticsearchClient.indices().create(request);
      log.info("Created generation: {}", name);
    } catch (IOException | ElasticsearchException e) {
      log.error("Failed to create generation '{}': {}", name, e.getMessage(), e);
      throw new BackingStoreException("Failed to create generation " + name, e);
    }
  }

  @Override
  public void deleteGeneration(String name) {
    try {
      elasticsearchClient.indices().delete(DeleteIndexRequest.of(d -> d.index(name)));
      log.info("Deleted generation: {}", name);
    } catch (IOException | ElasticsearchException e) {
      log.error("Failed to delete generation '{}': {}", name, e.getMessage(), e);
      throw new BackingStoreException("Failed to delete generation " + name, e);
    }
  }

  @Override
  public void refreshGeneration(String generation) {
    try {
      elasticsearchClient.indices().refresh(RefreshRequest.of(r -> r.index(generation)));
      log.debug("Refreshed generation: {}", generation);
    } catch (IOException | ElasticsearchException e) {
      log.warn("Failed to refresh generation {}: {}", generation, e.getMessage());
    }
  }

  @Override
  public Map<String, String> listAliases() {
    Map<String, String> targets = new HashMap<>();
    aliasTargets()
        .forEach(
            (alias, generations) -> {
              if (generations.size() > 1) {
                log.warn("Alias '{}' points at several generations: {}", alias, generations);
              }
              targets.put(alias, generations.last());
            });
    return targets;
  }

  private Map<String, TreeSet<String>> aliasTargets() {
    GetAliasResponse response;
    try {
      response = elasticsearchClient.indices().getAlias(GetAliasRequest.of(g -> g));
    } catch (IOException | ElasticsearchException e) {
      log.error("Failed to retrieve aliases: {}", e.getMessage(), e);
      throw new BackingStoreException("Failed to retrieve aliases", e);
    }

    Map<String, TreeSet<String>> targets = new HashMap<>();
    response
        .aliases()
        .forEach(
            (generation, indexAliases) ->
                indexAliases
                    .aliases()
                    .keySet()
                    .forEach(
                        alias ->
                            targets.computeIfAbsent(alias, a -> new TreeSet<>()).add(generation)));
    return targets;
  }

  @Override
  public void upsertAlias(String alias, String generation) {
    List<Action> actions = new ArrayList<>();
    for (String previous : aliasTargets().getOrDefault(alias, new TreeSet<>())) {
      if (!previous.equals(generation)) {
        actions.add(Action.of(a -> a.remove(r -> r.index(previous).alias(alias))));
      }
    }
    actions.add(Action.of(a -> a.add(add -> add.index(generation).alias(alias))));

    try {
      // remove and add run in one request, so the alias never resolves to nothing
      elasticsearchClient.indices().updateAliases(UpdateAliasesRequest.of(u -> u.actions(actions)));
    } catch (IOException | ElasticsearchException e) {
      log.error(
          "Failed to point alias '{}' at '{}': {}", alias, generation, e.getMessage(), e);
      throw new BackingStoreException("Failed to update alias " + alias, e);
    }
  }

  @Override
  @Timed(value = "elasticsearch.import", description = "Time to bulk import documents")
  public List<ImportResult> importDocuments(
      String generation, List<? extends IndexDocument> documents) {
    if (documents.isEmpty()) {
      return List.of();
    }

    BulkRequest.Builder bulkBuilder = new BulkRequest.Builder();
    for (IndexDocument document : documents) {
      bulkBuilder.operations(
          op -> op.index(idx -> idx.index(generation).id(document.getId()).document(document)));
    }

    BulkResponse response;
    try {
      response = elasticsearchClient.bulk(bulkBuilder.build());
    } catch (IOException | ElasticsearchException e) {
      log.error("Failed to bulk import into {}: {}", generation, e.getMessage(), e);
      throw new BackingStoreException("Failed to bulk import into " + generation, e);
    }

    List<ImportResult> results = new ArrayList<>(response.items().size());
    for (BulkResponseItem item : response.items()) {
      if (item.error() == null) {
        results.add(ImportResult.ok(item.id()));
      } else {
        results.add(ImportResult.failed(item.id(), item.error().reason()));
      }
    }
    return results;
  }

  @Override
  public void upsertSearchPreset(String name, String presetJson) {
    try {
      elasticsearchClient.putScript(
          PutScriptRequest.of(p -> p.withJson(new StringReader(presetJson)).id(name)));
      log.info("Upserted search preset: {}", name);
    } catch (IOException | ElasticsearchException e) {
      log.error("Failed to upsert search preset '{}': {}", name, e.getMessage(), e);
      throw new BackingStoreException("Failed to upsert search preset " + name, e);
    }
  }

  @Override
  @Timed(value = "elasticsearch.search", description = "Time for alias search")
  @CircuitBreaker(name = "elasticsearch")
  public <T> SearchResponse<T> search(SearchRequest request, Class<T> documentClass) {
    try {
      return elasticsearchClient.search(request, documentClass);
    } catch (IOException | ElasticsearchException e) {
      log.error("Search failed on {}: {}", request.index(), e.getMessage(), e);
      throw new BackingStoreException("Search failed on " + request.index(), e);
    }
  }
}
