package com.flamingo.ai.reindexer.service.search;

import com.flamingo.ai.reindexer.domain.model.DocumentId;
import com.flamingo.ai.reindexer.domain.model.Score;
import java.util.List;
import java.util.Map;

/**
 * One page of search hits.
 *
 * <p>{@code scores} holds one entry per document id; when several hits share an id, the best
 * ranked one wins. {@code hits} keeps every hit.
 *
 * @param hits converted hits with their scores, in rank order
 * @param scores score per document id, iterating in rank order
 * @param total total number of matching documents
 * @param <R> the result type
 */
public record SearchResult<R>(List<SearchHit<R>> hits, Map<DocumentId, Score> scores, long total) {

  public List<R> documents() {
    return hits.stream().map(SearchHit::document).toList();
  }
}
