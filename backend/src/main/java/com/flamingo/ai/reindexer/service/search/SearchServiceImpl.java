package com.flamingo.ai.reindexer.service.search;

import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.reindexer.config.ReindexerConfig;
import com.flamingo.ai.reindexer.domain.model.DocumentId;
import com.flamingo.ai.reindexer.domain.model.IndexId;
import com.flamingo.ai.reindexer.domain.model.Score;
import com.flamingo.ai.reindexer.elasticsearch.GenerationStore;
import com.flamingo.ai.reindexer.exception.ConfigurationException;
import com.flamingo.ai.reindexer.exception.IndexNotFoundException;
import com.flamingo.ai.reindexer.service.revision.IndexCatalog;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** {@link SearchService} backed by the generation store. */
@Service
@Slf4j
public class SearchServiceImpl implements SearchService {

  private static final String MATCH_ALL = "*";

  /** Deepest hit a from/size page may reach, the Elasticsearch default result window. */
  static final int MAX_RESULT_WINDOW = 10_000;

  private final GenerationStore generationStore;
  private final IndexCatalog indexCatalog;
  private final ObjectMapper objectMapper;
  private final List<String> queryFields;

  public SearchServiceImpl(
      GenerationStore generationStore,
      IndexCatalog indexCatalog,
      ReindexerConfig reindexerConfig,
      ObjectMapper objectMapper) {
    this.generationStore = generationStore;
    this.indexCatalog = indexCatalog;
    this.objectMapper = objectMapper;
    this.queryFields = List.copyOf(reindexerConfig.getSearch().getQueryFields());
  }

  @Override
  @Timed(value = "search.simple", description = "Time for simple search")
  public <R> SearchResult<R> simpleSearch(
      IndexId indexId,
      String query,
      Map<String, List<String>> filterBy,
      int page,
      int perPage,
      String sortBy,
      Class<R> type) {
    int size = Math.max(perPage, 1);
    long from = (long) (Math.max(page, 1) - 1) * size;
    if (from + size > MAX_RESULT_WINDOW) {
      throw new IllegalArgumentException(
          String.format(
              "Page %d of %d hits reaches past the first %d hits", page, size, MAX_RESULT_WINDOW));
    }

    SearchRequest.Builder request =
        new SearchRequest.Builder().query(buildQuery(query, filterBy)).from((int) from).size(size);
    if (sortBy != null && !sortBy.isBlank()) {
      String[] sort = parseSort(sortBy);
      SortOrder order = "desc".equals(sort[1]) ? SortOrder.Desc : SortOrder.Asc;
      request.sort(s -> s.field(f -> f.field(sort[0]).order(order)));
    }
    return expertSearch(indexId, request, type);
  }

  @Override
  @Timed(value = "search.expert", description = "Time for expert search")
  public <R> SearchResult<R> expertSearch(
      IndexId indexId, SearchRequest.Builder request, Class<R> type) {
    if (request == null) {
      throw new ConfigurationException("Search request must not be null");
    }
    if (!indexCatalog.getIndexIds().contains(indexId)) {
      throw new IndexNotFoundException(indexId);
    }
    SearchResponse<JsonNode> response =
        generationStore.search(request.index(indexId.value()).build(), JsonNode.class);

    List<SearchHit<R>> hits = new ArrayList<>();
    Map<DocumentId, Score> scores = new LinkedHashMap<>();
    for (Hit<JsonNode> hit : response.hits().hits()) {
      if (hit.id() == null || hit.source() == null) {
        log.warn("Skipping hit without id or source in {}", indexId);
        continue;
      }
      R document;
      try {
        document = objectMapper.convertValue(hit.source(), type);
      } catch (IllegalArgumentException e) {
        log.warn("Skipping hit {} in {}: {}", hit.id(), indexId, e.getMessage());
        continue;
      }
      DocumentId documentId = new DocumentId(hit.id());
      double relevance = hit.score() != null ? hit.score() : 0.0;
      Score score = new Score(documentId, hits.size(), relevance);
      if (scores.putIfAbsent(documentId, score) != null) {
        log.warn("Hit {} appears more than once in {}", documentId, indexId);
      }
      hits.add(new SearchHit<>(document, score));
    }

    long total =
        response.hits().total() != null
            ? response.hits().total().value()
            : response.hits().hits().size();
    log.debug("Search on {} returned {} of {} hits", indexId, hits.size(), total);
    return new SearchResult<>(hits, scores, total);
  }

  @VisibleForTesting
  Query buildQuery(String query, Map<String, List<String>> filterBy) {
    Query main =
        query == null || query.isBlank() || MATCH_ALL.equals(query.trim())
            ? Query.of(q -> q.matchAll(m -> m))
            : Query.of(q -> q.multiMatch(m -> m.query(query).fields(queryFields)));
    if (filterBy == null || filterBy.isEmpty()) {
      return main;
    }

    List<Query> filters = new ArrayList<>();
    for (Map.Entry<String, List<String>> filter : filterBy.entrySet()) {
      List<String> values = filter.getValue();
      if (values == null || values.isEmpty()) {
        continue;
      }
      String field = filter.getKey();
      if (values.size() == 1) {
        filters.add(Query.of(q -> q.term(t -> t.field(field).value(values.get(0)))));
      } else {
        List<FieldValue> fieldValues = values.stream().map(FieldValue::of).toList();
        filters.add(
            Query.of(q -> q.terms(t -> t.field(field).terms(v -> v.value(fieldValues)))));
      }
    }
    if (filters.isEmpty()) {
      return main;
    }
    return Query.of(q -> q.bool(b -> b.must(main).filter(filters)));
  }

  /** Splits {@code field[:asc|:desc]} into field and lower-case order, defaulting to asc. */
  @VisibleForTesting
  static String[] parseSort(String sortBy) {
    String trimmed = sortBy.trim();
    int colon = trimmed.lastIndexOf(':');
    if (colon < 0) {
      return new String[] {trimmed, "asc"};
    }
    String order = trimmed.substring(colon + 1).trim().toLowerCase(Locale.ROOT);
    if (!"asc".equals(order) && !"desc".equals(order)) {
      throw new IllegalArgumentException("Unknown sort order: " + sortBy);
    }
    return new String[] {trimmed.substring(0, colon).trim(), order};
  }
}
