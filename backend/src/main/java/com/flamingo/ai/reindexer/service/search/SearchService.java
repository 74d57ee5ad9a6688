package com.flamingo.ai.reindexer.service.search;

import co.elastic.clients.elasticsearch.core.SearchRequest;
import com.flamingo.ai.reindexer.domain.model.IndexId;
import com.flamingo.ai.reindexer.exception.BackingStoreException;
import com.flamingo.ai.reindexer.exception.ConfigurationException;
import com.flamingo.ai.reindexer.exception.IndexNotFoundException;
import java.util.List;
import java.util.Map;

/** Queries the live generation of an index through its alias. */
public interface SearchService {

  /**
   * Full-text search over the configured query fields.
   *
   * @param indexId the index
   * @param query the query text; blank or {@code *} matches every document
   * @param filterBy exact-match filters per field, ANDed; several values of one field are ORed
   * @param page 1-based page number
   * @param perPage page size
   * @param sortBy optional {@code field}, {@code field:asc} or {@code field:desc}
   * @param type the result type hit sources are converted to
   * @return the requested page
   * @throws IllegalArgumentException if the page reaches past the result window
   * @throws IndexNotFoundException if the index is not configured
   * @throws BackingStoreException if the backend fails
   */
  <R> SearchResult<R> simpleSearch(
      IndexId indexId,
      String query,
      Map<String, List<String>> filterBy,
      int page,
      int perPage,
      String sortBy,
      Class<R> type);

  /**
   * Runs a caller-built request against the alias of an index. The builder must leave the target
   * index unset.
   *
   * @throws ConfigurationException if {@code request} is null
   * @throws IndexNotFoundException if the index is not configured
   * @throws BackingStoreException if the backend fails
   */
  <R> SearchResult<R> expertSearch(IndexId indexId, SearchRequest.Builder request, Class<R> type);
}
