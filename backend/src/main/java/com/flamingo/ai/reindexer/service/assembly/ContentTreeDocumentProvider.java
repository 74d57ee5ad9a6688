package com.flamingo.ai.reindexer.service.assembly;

import com.flamingo.ai.reindexer.domain.model.DocumentDescriptor;
import com.flamingo.ai.reindexer.domain.model.DocumentType;
import com.flamingo.ai.reindexer.domain.model.IndexId;
import com.flamingo.ai.reindexer.elasticsearch.IndexDocument;
import com.flamingo.ai.reindexer.service.content.ContentSourceClient;
import com.flamingo.ai.reindexer.service.extraction.ContentTreeExtractor;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Assembles the documents of an index from the content tree.
 *
 * <p>URIs for every selected node are resolved in a single call. Each descriptor is then handed to
 * the provider function registered for its type. A missing provider or a failing provider leaves
 * that slot empty and the batch continues.
 *
 * @param <D> the document type
 */
@Slf4j
public class ContentTreeDocumentProvider<D extends IndexDocument> implements DocumentProvider<D> {

  private final ContentTreeExtractor contentTreeExtractor;
  private final ContentSourceClient contentSourceClient;
  private final Map<DocumentType, DocumentProviderFunction<D>> documentProviderFunctions;
  private final MeterRegistry meterRegistry;

  public ContentTreeDocumentProvider(
      ContentTreeExtractor contentTreeExtractor,
      ContentSourceClient contentSourceClient,
      Map<DocumentType, DocumentProviderFunction<D>> documentProviderFunctions,
      MeterRegistry meterRegistry) {
    this.contentTreeExtractor = contentTreeExtractor;
    this.contentSourceClient = contentSourceClient;
    this.documentProviderFunctions = Map.copyOf(documentProviderFunctions);
    this.meterRegistry = meterRegistry;
  }

  @Override
  public DocumentBatch<D> provide(IndexId indexId) {
    List<DocumentDescriptor> descriptors = contentTreeExtractor.extract(indexId);
    if (descriptors.isEmpty()) {
      return DocumentBatch.empty();
    }

    List<String> ids = new ArrayList<>(descriptors.size());
    for (DocumentDescriptor descriptor : descriptors) {
      ids.add(descriptor.documentId().value());
    }
    Map<String, String> uriMap = contentSourceClient.resolveUris(indexId.value(), ids);

    List<Optional<D>> slots = new ArrayList<>(descriptors.size());
    int missingProvider = 0;
    int failed = 0;
    for (DocumentDescriptor descriptor : descriptors) {
      DocumentProviderFunction<D> providerFunction =
          documentProviderFunctions.get(descriptor.documentType());
      if (providerFunction == null) {
        log.warn(
            "No document provider available for document type {} (document {})",
            descriptor.documentType(),
            descriptor.documentId());
        missingProvider++;
        slots.add(Optional.empty());
        continue;
      }
      try {
        slots.add(
            Optional.ofNullable(
                providerFunction.provide(indexId, descriptor.documentId(), uriMap)));
      } catch (RuntimeException e) {
        log.error(
            "Index document not created: documentId={}, documentType={}: {}",
            descriptor.documentId(),
            descriptor.documentType(),
            e.getMessage(),
            e);
        failed++;
        slots.add(Optional.empty());
      }
    }

    if (failed > 0) {
      meterRegistry.counter("reindexer.documents.assembly.failed").increment(failed);
    }
    DocumentBatch<D> batch = new DocumentBatch<>(slots, missingProvider, failed);
    log.info(
        "Assembled {} of {} documents for {} ({} without provider, {} failed)",
        batch.provided(),
        batch.size(),
        indexId,
        missingProvider,
        failed);
    return batch;
  }
}
