package com.flamingo.ai.reindexer.domain.model;

/**
 * Relevance of one search hit.
 *
 * @param id the document id
 * @param index rank position of the hit in the returned page, starting at 0
 * @param relevance the engine's score for the hit, 0 when the engine reported none
 */
public record Score(DocumentId id, int index, double relevance) {}
