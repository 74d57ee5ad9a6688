package com.flamingo.ai.reindexer.domain.model;

/** A node selected for indexing; lives only for one build pass. */
public record DocumentDescriptor(DocumentType documentType, DocumentId documentId) {}
