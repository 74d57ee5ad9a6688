package com.flamingo.ai.reindexer.service.assembly;

import com.flamingo.ai.reindexer.elasticsearch.IndexDocument;
import java.util.List;
import java.util.Optional;

/**
 * Documents assembled for one index.
 *
 * <p>{@code slots} keeps one entry per descriptor in descriptor order. A slot is empty when no
 * provider is registered for the descriptor's type, when the provider failed, or when it produced
 * nothing; empty slots are skipped, never indexed as blank documents.
 *
 * @param slots positional documents
 * @param missingProvider slots left empty for lack of a provider
 * @param failed slots left empty because the provider threw
 * @param <D> the document type
 */
public record DocumentBatch<D extends IndexDocument>(
    List<Optional<D>> slots, int missingProvider, int failed) {

  public static <D extends IndexDocument> DocumentBatch<D> empty() {
    return new DocumentBatch<>(List.of(), 0, 0);
  }

  /** Number of descriptors the batch was assembled from. */
  public int size() {
    return slots.size();
  }

  /** Present documents, in slot order. */
  public List<D> documents() {
    return slots.stream().flatMap(Optional::stream).toList();
  }

  public int provided() {
    return (int) slots.stream().filter(Optional::isPresent).count();
  }
}
