package com.flamingo.ai.reindexer.domain.model;

import java.util.Objects;

/**
 * Stable logical name of one searchable collection family, e.g. a site/language combination.
 *
 * <p>The value doubles as the public alias name and as the content-source dimension.
 */
public record IndexId(String value) {

  public IndexId {
    Objects.requireNonNull(value, "index id");
    if (value.isBlank()) {
      throw new IllegalArgumentException("index id must not be blank");
    }
  }

  public static IndexId of(String value) {
    return new IndexId(value);
  }

  @Override
  public String toString() {
    return value;
  }
}
