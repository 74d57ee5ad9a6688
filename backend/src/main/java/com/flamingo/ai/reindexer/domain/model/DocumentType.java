package com.flamingo.ai.reindexer.domain.model;

import java.util.Objects;

/** Content type tag of a node (its mime type); selects the document provider function. */
public record DocumentType(String value) {

  public DocumentType {
    Objects.requireNonNull(value, "document type");
  }

  @Override
  public String toString() {
    return value;
  }
}
