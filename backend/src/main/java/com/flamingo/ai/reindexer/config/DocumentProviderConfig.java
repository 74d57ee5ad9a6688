package com.flamingo.ai.reindexer.config;

import com.flamingo.ai.reindexer.domain.model.DocumentType;
import com.flamingo.ai.reindexer.elasticsearch.PageDocument;
import com.flamingo.ai.reindexer.service.assembly.ContentTreeDocumentProvider;
import com.flamingo.ai.reindexer.service.assembly.DocumentProvider;
import com.flamingo.ai.reindexer.service.assembly.DocumentProviderFunction;
import com.flamingo.ai.reindexer.service.assembly.PageDocumentProviderFunction;
import com.flamingo.ai.reindexer.service.content.ContentSourceClient;
import com.flamingo.ai.reindexer.service.extraction.ContentTreeExtractor;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Registers one page document provider function per supported mime type. */
@Configuration
@Slf4j
public class DocumentProviderConfig {

  @Bean
  public DocumentProvider<PageDocument> documentProvider(
      ContentTreeExtractor contentTreeExtractor,
      ContentSourceClient contentSourceClient,
      ReindexerConfig reindexerConfig,
      MeterRegistry meterRegistry) {
    Map<DocumentType, DocumentProviderFunction<PageDocument>> functions = new LinkedHashMap<>();
    for (String mimeType : reindexerConfig.getExtraction().getSupportedMimeTypes()) {
      DocumentType documentType = new DocumentType(mimeType);
      functions.put(documentType, new PageDocumentProviderFunction(documentType));
    }
    log.info("Registered document providers for types {}", functions.keySet());
    return new ContentTreeDocumentProvider<>(
        contentTreeExtractor, contentSourceClient, functions, meterRegistry);
  }
}
