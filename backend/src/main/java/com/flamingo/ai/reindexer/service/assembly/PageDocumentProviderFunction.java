package com.flamingo.ai.reindexer.service.assembly;

import com.flamingo.ai.reindexer.domain.model.DocumentId;
import com.flamingo.ai.reindexer.domain.model.DocumentType;
import com.flamingo.ai.reindexer.domain.model.IndexId;
import com.flamingo.ai.reindexer.elasticsearch.PageDocument;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/** Builds a {@link PageDocument} from the resolved URI of a node; nodes without a URI are left out. */
@Slf4j
public class PageDocumentProviderFunction implements DocumentProviderFunction<PageDocument> {

  private final DocumentType documentType;

  public PageDocumentProviderFunction(DocumentType documentType) {
    this.documentType = documentType;
  }

  @Override
  public PageDocument provide(
      IndexId indexId, DocumentId documentId, Map<String, String> uriMap) {
    String uri = uriMap.get(documentId.value());
    if (uri == null || uri.isBlank()) {
      log.debug("No URI resolved for {} in {}, skipping", documentId, indexId);
      return null;
    }
    return PageDocument.builder()
        .id(documentId.value())
        .index(indexId.value())
        .documentType(documentType.value())
        .uri(uri)
        .build();
  }
}
