package com.flamingo.ai.reindexer.elasticsearch;

import static org.assertj.core.api.Assertions.assertThat;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.json.jackson.JacksonJsonpMapper;
import co.elastic.clients.transport.rest5_client.Rest5ClientTransport;
import co.elastic.clients.transport.rest5_client.low_level.Rest5Client;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.reindexer.config.ReindexerConfig;
import com.flamingo.ai.reindexer.domain.model.IndexId;
import com.flamingo.ai.reindexer.domain.model.RevisionId;
import com.flamingo.ai.reindexer.service.revision.IndexCatalog;
import com.flamingo.ai.reindexer.service.revision.IndexCatalog.IndexDefinition;
import com.flamingo.ai.reindexer.service.revision.IndexCatalog.SearchPreset;
import com.flamingo.ai.reindexer.service.revision.RevisionManagerImpl;
import com.flamingo.ai.reindexer.service.search.SearchResult;
import com.flamingo.ai.reindexer.service.search.SearchServiceImpl;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.apache.hc.core5.http.HttpHost;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.elasticsearch.ElasticsearchContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Runs three revisions against a real Elasticsearch and checks the alias, the retained
 * generations and that search resolves through the alias. Skipped when Docker is unavailable.
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("Revision lifecycle integration test")
class RevisionLifecycleIntegrationTest {

  private static final IndexId SITE = IndexId.of("site");
  private static final IndexId ARCHIVE = IndexId.of("archive");
  private static final String SCHEMA =
      "{\"mappings\":{\"properties\":{"
          + "\"id\":{\"type\":\"keyword\"},"
          + "\"index\":{\"type\":\"keyword\"},"
          + "\"documentType\":{\"type\":\"keyword\"},"
          + "\"uri\":{\"type\":\"text\"}}}}";
  private static final String PRESET =
      "{\"script\":{\"lang\":\"mustache\",\"source\":"
          + "\"{\\\"query\\\":{\\\"match\\\":{\\\"uri\\\":\\\"{{query}}\\\"}}}\"}}";

  @Container
  private static final ElasticsearchContainer ELASTICSEARCH_CONTAINER =
      new ElasticsearchContainer("docker.elastic.co/elasticsearch/elasticsearch:9.0.4")
          .withEnv("xpack.security.enabled", "false")
          .withEnv("xpack.security.http.ssl.enabled", "false")
          .withStartupTimeout(Duration.ofMinutes(2));

  private Rest5Client restClient;
  private ElasticsearchGenerationStore store;

  @BeforeEach
  void setUp() {
    restClient =
        Rest5Client.builder(
                new HttpHost(
                    "http",
                    ELASTICSEARCH_CONTAINER.getHost(),
                    ELASTICSEARCH_CONTAINER.getMappedPort(9200)))
            .build();
    ElasticsearchClient client =
        new ElasticsearchClient(new Rest5ClientTransport(restClient, new JacksonJsonpMapper()));
    store = new ElasticsearchGenerationStore(client);
  }

  @AfterEach
  void tearDown() throws Exception {
    restClient.close();
  }

  private RevisionManagerImpl managerAt(IndexId indexId, String instant) {
    IndexCatalog catalog =
        new IndexCatalog(
            List.of(new IndexDefinition(indexId, SCHEMA)), new SearchPreset("page-search", PRESET));
    Clock clock = Clock.fixed(Instant.parse(instant), ZoneOffset.UTC);
    return new RevisionManagerImpl(store, catalog, new SimpleMeterRegistry(), clock);
  }

  private RevisionId build(IndexId indexId, String instant, String... ids) {
    RevisionManagerImpl manager = managerAt(indexId, instant);
    RevisionId revisionId = manager.initialize();
    List<PageDocument> documents =
        Arrays.stream(ids)
            .map(
                id ->
                    PageDocument.builder()
                        .id(id)
                        .index(indexId.value())
                        .documentType("text/html")
                        .uri("/" + id + ".html")
                        .build())
            .toList();
    manager.upsertDocuments(revisionId, indexId, documents);
    manager.commitRevision(revisionId);
    return revisionId;
  }

  @Test
  @DisplayName("should serve the newest revision and keep one previous generation")
  void shouldRotateGenerations() {
    build(SITE, "2025-03-01T01:00:00Z", "old");
    build(SITE, "2025-03-01T02:00:00Z", "previous");
    build(SITE, "2025-03-01T03:00:00Z", "a", "b");

    assertThat(store.listAliases()).containsEntry("site", "site-2025-03-01-03-00");
    assertThat(store.listGenerations("site-"))
        .containsExactly("site-2025-03-01-02-00", "site-2025-03-01-03-00");

    ReindexerConfig reindexerConfig = new ReindexerConfig();
    reindexerConfig.getSearch().setQueryFields(List.of("uri"));
    SearchServiceImpl searchService =
        new SearchServiceImpl(
            store,
            new IndexCatalog(List.of(new IndexDefinition(SITE, SCHEMA)), null),
            reindexerConfig,
            new ObjectMapper());
    SearchResult<PageDocument> result =
        searchService.simpleSearch(SITE, "*", Map.of(), 1, 10, "id", PageDocument.class);

    assertThat(result.total()).isEqualTo(2);
    assertThat(result.documents()).extracting(PageDocument::getId).containsExactly("a", "b");
  }

  @Test
  @DisplayName("should drop the generation of a reverted revision and leave the alias alone")
  void shouldRevert() {
    build(ARCHIVE, "2025-04-01T01:00:00Z", "kept");
    RevisionManagerImpl manager = managerAt(ARCHIVE, "2025-04-01T02:00:00Z");
    RevisionId revisionId = manager.initialize();

    assertThat(store.generationExists("archive-2025-04-01-02-00")).isTrue();
    manager.revertRevision(revisionId);

    assertThat(store.generationExists("archive-2025-04-01-02-00")).isFalse();
    assertThat(store.listAliases()).containsEntry("archive", "archive-2025-04-01-01-00");
  }
}
