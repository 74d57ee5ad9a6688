package com.flamingo.ai.reindexer.elasticsearch;

/** An engine-ready document; its id becomes the Elasticsearch {@code _id}. */
public interface IndexDocument {

  String getId();
}
