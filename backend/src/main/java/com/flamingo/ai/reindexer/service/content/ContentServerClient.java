package com.flamingo.ai.reindexer.service.content;

import com.flamingo.ai.reindexer.config.ReindexerConfig;
import com.flamingo.ai.reindexer.exception.ContentSourceException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * HTTP client for the content server. Encapsulates all WebClient communication with the repo and
 * URI endpoints.
 */
@Component
@Slf4j
public class ContentServerClient implements ContentSourceClient {

  private static final ParameterizedTypeReference<Map<String, RepoNode>> REPO_TYPE =
      new ParameterizedTypeReference<>() {};
  private static final ParameterizedTypeReference<Map<String, String>> URI_MAP_TYPE =
      new ParameterizedTypeReference<>() {};

  private final WebClient webClient;
  private final String repoPath;
  private final String urisPath;
  private final Duration readTimeout;

  public ContentServerClient(ReindexerConfig reindexerConfig) {
    ReindexerConfig.ContentServer contentServer = reindexerConfig.getContentServer();
    this.repoPath = contentServer.getRepoPath();
    this.urisPath = contentServer.getUrisPath();
    this.readTimeout = Duration.ofMillis(contentServer.getReadTimeoutMs());
    this.webClient =
        WebClient.builder()
            .baseUrl(contentServer.getBaseUrl())
            .codecs(
                configurer ->
                    configurer.defaultCodecs().maxInMemorySize(contentServer.getMaxInMemorySize()))
            .build();
    log.info("Content server client initialized: baseUrl={}", contentServer.getBaseUrl());
  }

  @Override
  public Optional<RepoNode> fetchTree(String dimension) {
    Map<String, RepoNode> repo;
    try {
      repo =
          webClient
              .post()
              .uri(repoPath)
              .contentType(MediaType.APPLICATION_JSON)
              .bodyValue(Map.of())
              .retrieve()
              .bodyToMono(REPO_TYPE)
              .timeout(readTimeout)
              .block();
    } catch (RuntimeException e) {
      log.error("Failed to fetch content repo for {}: {}", dimension, e.getMessage(), e);
      throw new ContentSourceException(dimension, "Failed to fetch content repo", e);
    }
    return repo == null ? Optional.empty() : Optional.ofNullable(repo.get(dimension));
  }

  @Override
  public Map<String, String> resolveUris(String dimension, List<String> ids) {
    if (ids.isEmpty()) {
      return Map.of();
    }
    Map<String, String> uris;
    try {
      uris =
          webClient
              .post()
              .uri(urisPath)
              .contentType(MediaType.APPLICATION_JSON)
              .bodyValue(new UriRequest(dimension, ids))
              .retrieve()
              .bodyToMono(URI_MAP_TYPE)
              .timeout(readTimeout)
              .block();
    } catch (RuntimeException e) {
      log.error("Failed to get URIs for {}: {}", dimension, e.getMessage(), e);
      throw new ContentSourceException(dimension, "Failed to get URIs", e);
    }
    return uris == null ? Map.of() : uris;
  }

  record UriRequest(String dimension, List<String> ids) {}
}
