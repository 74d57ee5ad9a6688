package com.flamingo.ai.reindexer.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.reindexer.api.rest.BuildController;
import com.flamingo.ai.reindexer.api.rest.HealthController;
import com.flamingo.ai.reindexer.api.rest.SearchController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests for the controller mappings.
 *
 * <ul>
 *   <li>GET /health - Health check
 *   <li>POST /builds - Run a build
 *   <li>POST /builds/cancel - Cancel the running build
 *   <li>GET /search/{index} - Simple search
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("HealthController API contract")
  class HealthControllerContract {

    @Test
    @DisplayName("should be mapped to /health")
    void shouldBeMappedToHealth() {
      RequestMapping mapping = HealthController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/health");
    }
  }

  @Nested
  @DisplayName("BuildController API contract")
  class BuildControllerContract {

    @Test
    @DisplayName("should be mapped to /builds")
    void shouldBeMappedToBuilds() {
      RequestMapping mapping = BuildController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/builds");
    }
  }

  @Nested
  @DisplayName("SearchController API contract")
  class SearchControllerContract {

    @Test
    @DisplayName("should be mapped to /search")
    void shouldBeMappedToSearch() {
      RequestMapping mapping = SearchController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/search");
    }
  }
}
