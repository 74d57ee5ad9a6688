package com.flamingo.ai.reindexer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.elasticsearch.ElasticsearchClientAutoConfiguration;
import org.springframework.boot.autoconfigure.elasticsearch.ElasticsearchRestClientAutoConfiguration;

/** Entry point of the revisioned re-indexing service. */
@SpringBootApplication(
    exclude = {
      // The client is wired by ElasticsearchConfig on the Rest5Client transport.
      ElasticsearchClientAutoConfiguration.class,
      ElasticsearchRestClientAutoConfiguration.class
    })
public class ReindexerApplication {

  public static void main(String[] args) {
    SpringApplication.run(ReindexerApplication.class, args);
  }
}
