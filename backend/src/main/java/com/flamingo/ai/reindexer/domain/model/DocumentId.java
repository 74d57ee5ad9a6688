package com.flamingo.ai.reindexer.domain.model;

import java.util.Objects;

/** Identity of a content node, reused as the document {@code _id}. */
public record DocumentId(String value) implements Comparable<DocumentId> {

  public DocumentId {
    Objects.requireNonNull(value, "document id");
  }

  @Override
  public int compareTo(DocumentId other) {
    return value.compareTo(other.value);
  }

  @Override
  public String toString() {
    return value;
  }
}
