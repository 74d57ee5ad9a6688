package com.flamingo.ai.reindexer.service.assembly;

import com.flamingo.ai.reindexer.domain.model.IndexId;
import com.flamingo.ai.reindexer.elasticsearch.IndexDocument;

/**
 * Source of the documents of one index for a build.
 *
 * @param <D> the document type
 */
public interface DocumentProvider<D extends IndexDocument> {

  /**
   * Provides every document of an index.
   *
   * @param indexId the index
   * @return the documents, one positional slot per selected content node
   */
  DocumentBatch<D> provide(IndexId indexId);

  /**
   * Provides one page of the documents of an index.
   *
   * @param indexId the index
   * @param offset position of the first document
   * @return the documents of the page
   * @throws UnsupportedOperationException if the provider cannot page
   */
  default DocumentBatch<D> providePaged(IndexId indexId, int offset) {
    throw new UnsupportedOperationException("Paged document provision is not implemented");
  }
}
