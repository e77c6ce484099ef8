package com.flamingo.ai.sectionranker.exception;

import java.util.function.Predicate;

/** Resilience4j retry predicate: only model-side embedding failures are retried. */
public class EmbeddingRetryPredicate implements Predicate<Throwable> {

  @Override
  public boolean test(Throwable throwable) {
    return throwable instanceof EmbeddingException embeddingException
        && embeddingException.isRetryable();
  }
}
