package com.flamingo.ai.reindexer.service.search;

import com.flamingo.ai.reindexer.domain.model.Score;

/**
 * A converted hit with its own score.
 *
 * @param document the converted hit source
 * @param score rank and relevance of this hit
 * @param <R> the result type
 */
public record SearchHit<R>(R document, Score score) {}
