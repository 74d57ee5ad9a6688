package com.flamingo.ai.reindexer.api.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.flamingo.ai.reindexer.ReindexerApplication;
import com.flamingo.ai.reindexer.api.dto.response.HealthStatus;
import com.flamingo.ai.reindexer.config.ReindexerConfig;
import com.flamingo.ai.reindexer.domain.enums.BuildOutcome;
import com.flamingo.ai.reindexer.domain.model.DocumentId;
import com.flamingo.ai.reindexer.domain.model.IndexId;
import com.flamingo.ai.reindexer.domain.model.RevisionId;
import com.flamingo.ai.reindexer.domain.model.Score;
import com.flamingo.ai.reindexer.elasticsearch.PageDocument;
import com.flamingo.ai.reindexer.exception.ApiError;
import com.flamingo.ai.reindexer.exception.BackingStoreException;
import com.flamingo.ai.reindexer.exception.BuildInProgressException;
import com.flamingo.ai.reindexer.exception.IndexNotFoundException;
import com.flamingo.ai.reindexer.service.build.BuildReport;
import com.flamingo.ai.reindexer.service.build.BuildService;
import com.flamingo.ai.reindexer.service.build.IndexBuildResult;
import com.flamingo.ai.reindexer.service.health.HealthService;
import com.flamingo.ai.reindexer.service.search.SearchHit;
import com.flamingo.ai.reindexer.service.search.SearchResult;
import com.flamingo.ai.reindexer.service.search.SearchService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = {HealthController.class, BuildController.class, SearchController.class})
@ContextConfiguration(classes = ReindexerApplication.class)
@Import(RestControllerTest.TestConfig.class)
class RestControllerTest {

  @TestConfiguration
  static class TestConfig {

    @Bean
    MeterRegistry meterRegistry() {
      return new SimpleMeterRegistry();
    }

    @Bean
    ReindexerConfig reindexerConfig() {
      return new ReindexerConfig();
    }
  }

  @Autowired private MockMvc mockMvc;

  @MockitoBean private BuildService buildService;
  @MockitoBean private HealthService healthService;
  @MockitoBean private SearchService searchService;

  @Nested
  @DisplayName("GET /health")
  class HealthTests {

    @Test
    @DisplayName("should return 200 while the backing store is reachable")
    void shouldReturnUp() throws Exception {
      when(healthService.getHealth())
          .thenReturn(
              HealthStatus.builder()
                  .status(HealthStatus.UP)
                  .revision("2025-03-01-04-30")
                  .backingStoreReachable(true)
                  .timestamp(Instant.parse("2025-03-01T04:31:00Z"))
                  .build());

      mockMvc
          .perform(get("/health"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.status").value("UP"))
          .andExpect(jsonPath("$.revision").value("2025-03-01-04-30"));
    }

    @Test
    @DisplayName("should return 503 when the backing store is unreachable")
    void shouldReturnDown() throws Exception {
      when(healthService.getHealth())
          .thenReturn(
              HealthStatus.builder().status(HealthStatus.DOWN).backingStoreReachable(false).build());

      mockMvc
          .perform(get("/health"))
          .andExpect(status().isServiceUnavailable())
          .andExpect(jsonPath("$.status").value("DOWN"));
    }
  }

  @Nested
  @DisplayName("POST /builds")
  class BuildTests {

    @Test
    @DisplayName("should return the build report")
    void shouldReturnReport() throws Exception {
      when(buildService.run())
          .thenReturn(
              new BuildReport(
                  new RevisionId("2025-03-01-04-30"),
                  BuildOutcome.COMMITTED,
                  false,
                  false,
                  5,
                  List.of(new IndexBuildResult(IndexId.of("site"), 6, 5, 5, 0, null)),
                  Instant.parse("2025-03-01T04:30:00Z"),
                  Instant.parse("2025-03-01T04:31:00Z")));

      mockMvc
          .perform(post("/builds"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.revision").value("2025-03-01-04-30"))
          .andExpect(jsonPath("$.outcome").value("COMMITTED"))
          .andExpect(jsonPath("$.documentsIndexed").value(5))
          .andExpect(jsonPath("$.indices[0].index").value("site"))
          .andExpect(jsonPath("$.indices[0].selected").value(6));
    }

    @Test
    @DisplayName("should return 409 while another build is running")
    void shouldReturnConflict() throws Exception {
      when(buildService.run()).thenThrow(new BuildInProgressException());

      mockMvc
          .perform(post("/builds"))
          .andExpect(status().isConflict())
          .andExpect(jsonPath("$.code").value(ApiError.BUILD_IN_PROGRESS));
    }

    @Test
    @DisplayName("should return 503 when the backing store fails")
    void shouldReturnUnavailable() throws Exception {
      when(buildService.run()).thenThrow(new BackingStoreException("ping failed"));

      mockMvc
          .perform(post("/builds"))
          .andExpect(status().isServiceUnavailable())
          .andExpect(jsonPath("$.code").value(ApiError.BACKING_STORE_UNAVAILABLE))
          .andExpect(jsonPath("$.errorId").exists());
    }

    @Test
    @DisplayName("should accept a cancel request")
    void shouldCancel() throws Exception {
      mockMvc.perform(post("/builds/cancel")).andExpect(status().isAccepted());

      verify(buildService).cancel();
    }
  }

  @Nested
  @DisplayName("GET /search/{index}")
  class SearchTests {

    @Test
    @DisplayName("should pass paging, sort and filters to the search service")
    @SuppressWarnings("unchecked")
    void shouldSearch() throws Exception {
      PageDocument document =
          PageDocument.builder().id("a").index("site").documentType("text/html").uri("/a").build();
      when(searchService.simpleSearch(
              eq(IndexId.of("site")),
              eq("kontakt"),
              any(),
              eq(2),
              eq(5),
              eq("uri:desc"),
              eq(PageDocument.class)))
          .thenReturn(
              new SearchResult<>(
                  List.of(new SearchHit<>(document, new Score(new DocumentId("a"), 0, 1.25))),
                  Map.of(new DocumentId("a"), new Score(new DocumentId("a"), 0, 1.25)),
                  6));

      mockMvc
          .perform(
              get("/search/site")
                  .param("q", "kontakt")
                  .param("filter", "documentType:text/html", "documentType:application/pdf")
                  .param("page", "2")
                  .param("perPage", "5")
                  .param("sort", "uri:desc"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.total").value(6))
          .andExpect(jsonPath("$.hits[0].document.uri").value("/a"))
          .andExpect(jsonPath("$.hits[0].score").value(1.25));

      ArgumentCaptor<Map<String, List<String>>> filters = ArgumentCaptor.forClass(Map.class);
      verify(searchService)
          .simpleSearch(any(), any(), filters.capture(), anyInt(), anyInt(), any(), any());
      assertThat(filters.getValue())
          .containsEntry("documentType", List.of("text/html", "application/pdf"));
    }

    @Test
    @DisplayName("should use the configured page size when none is given")
    void shouldUseDefaultPageSize() throws Exception {
      when(searchService.simpleSearch(
              any(), isNull(), any(), eq(1), eq(10), isNull(), eq(PageDocument.class)))
          .thenReturn(new SearchResult<>(List.of(), Map.of(), 0));

      mockMvc.perform(get("/search/site")).andExpect(status().isOk());
    }

    @Test
    @DisplayName("should return every hit when two share an id")
    void shouldReturnHitsWithSharedId() throws Exception {
      PageDocument first = PageDocument.builder().id("a").uri("/a").build();
      PageDocument second = PageDocument.builder().id("a").uri("/a-old").build();
      Score best = new Score(new DocumentId("a"), 0, 2.0);
      when(searchService.simpleSearch(any(), any(), any(), anyInt(), anyInt(), any(), any()))
          .thenReturn(
              new SearchResult<>(
                  List.of(
                      new SearchHit<>(first, best),
                      new SearchHit<>(second, new Score(new DocumentId("a"), 1, 1.0))),
                  Map.of(new DocumentId("a"), best),
                  2));

      mockMvc
          .perform(get("/search/site"))
          .andExpect(status().isOk())
          .andExpect(jsonPath("$.hits.length()").value(2))
          .andExpect(jsonPath("$.hits[1].document.uri").value("/a-old"))
          .andExpect(jsonPath("$.hits[1].rank").value(1))
          .andExpect(jsonPath("$.hits[1].score").value(1.0));
    }

    @Test
    @DisplayName("should return 404 for an index that is not configured")
    void shouldReturnNotFoundForUnknownIndex() throws Exception {
      when(searchService.simpleSearch(
              eq(IndexId.of("site-*")), any(), any(), anyInt(), anyInt(), any(), any()))
          .thenThrow(new IndexNotFoundException(IndexId.of("site-*")));

      mockMvc
          .perform(get("/search/site-*"))
          .andExpect(status().isNotFound())
          .andExpect(jsonPath("$.code").value(ApiError.INDEX_NOT_FOUND));
    }

    @Test
    @DisplayName("should return 400 for a page past the result window")
    void shouldRejectDeepPage() throws Exception {
      when(searchService.simpleSearch(
              any(), any(), any(), eq(3_000_000), anyInt(), any(), any()))
          .thenThrow(new IllegalArgumentException("Page 3000000 reaches past the result window"));

      mockMvc
          .perform(get("/search/site").param("page", "3000000").param("perPage", "1000"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR));
    }

    @Test
    @DisplayName("should reject a malformed filter")
    void shouldRejectMalformedFilter() throws Exception {
      mockMvc
          .perform(get("/search/site").param("filter", "novalue"))
          .andExpect(status().isBadRequest())
          .andExpect(jsonPath("$.code").value(ApiError.VALIDATION_ERROR));
    }
  }
}
