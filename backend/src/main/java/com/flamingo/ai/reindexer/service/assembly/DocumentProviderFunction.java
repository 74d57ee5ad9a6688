package com.flamingo.ai.reindexer.service.assembly;

import com.flamingo.ai.reindexer.domain.model.DocumentId;
import com.flamingo.ai.reindexer.domain.model.IndexId;
import com.flamingo.ai.reindexer.elasticsearch.IndexDocument;
import java.util.Map;

/**
 * Builds the document for one content node of a given type.
 *
 * @param <D> the document type
 */
@FunctionalInterface
public interface DocumentProviderFunction<D extends IndexDocument> {

  /**
   * Builds a document.
   *
   * @param indexId the index being built
   * @param documentId the content node id
   * @param uriMap node id to URI for every node of the index
   * @return the document, or null to leave the node out
   */
  D provide(IndexId indexId, DocumentId documentId, Map<String, String> uriMap);
}
