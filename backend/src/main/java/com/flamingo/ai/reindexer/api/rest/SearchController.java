package com.flamingo.ai.reindexer.api.rest;

import com.flamingo.ai.reindexer.api.dto.response.SearchResponseDto;
import com.flamingo.ai.reindexer.config.ReindexerConfig;
import com.flamingo.ai.reindexer.domain.model.IndexId;
import com.flamingo.ai.reindexer.elasticsearch.PageDocument;
import com.flamingo.ai.reindexer.service.search.SearchHit;
import com.flamingo.ai.reindexer.service.search.SearchResult;
import com.flamingo.ai.reindexer.service.search.SearchService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for simple search over the live generation of an index.
 *
 * <p>Filters are passed as repeated {@code filter=field:value} parameters. Only configured
 * indices are searchable; any other name answers 404.
 */
@RestController
@RequestMapping("/search")
@RequiredArgsConstructor
@Validated
public class SearchController {

  private final SearchService searchService;
  private final ReindexerConfig reindexerConfig;

  @GetMapping("/{index}")
  public ResponseEntity<SearchResponseDto> search(
      @PathVariable String index,
      @RequestParam(name = "q", required = false) String query,
      @RequestParam(name = "filter", required = false) List<String> filters,
      @RequestParam(defaultValue = "1") @Min(1) int page,
      @RequestParam(required = false) @Min(1) @Max(1000) Integer perPage,
      @RequestParam(required = false) String sort) {
    int size = perPage != null ? perPage : reindexerConfig.getSearch().getDefaultPerPage();
    SearchResult<PageDocument> result =
        searchService.simpleSearch(
            IndexId.of(index), query, parseFilters(filters), page, size, sort, PageDocument.class);

    List<SearchResponseDto.Hit> hits = new ArrayList<>(result.hits().size());
    for (SearchHit<PageDocument> hit : result.hits()) {
      hits.add(
          SearchResponseDto.Hit.builder()
              .document(hit.document())
              .rank(hit.score().index())
              .score(hit.score().relevance())
              .build());
    }
    return ResponseEntity.ok(
        SearchResponseDto.builder()
            .index(index)
            .total(result.total())
            .page(page)
            .perPage(size)
            .hits(hits)
            .build());
  }

  static Map<String, List<String>> parseFilters(List<String> filters) {
    MultiValueMap<String, String> parsed = new LinkedMultiValueMap<>();
    if (filters == null) {
      return parsed;
    }
    for (String filter : filters) {
      int colon = filter.indexOf(':');
      if (colon <= 0 || colon == filter.length() - 1) {
        throw new IllegalArgumentException("Filter must be field:value, got " + filter);
      }
      parsed.add(filter.substring(0, colon), filter.substring(colon + 1));
    }
    return new LinkedHashMap<>(parsed);
  }
}
