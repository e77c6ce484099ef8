package com.flamingo.ai.sectionranker.exception;

/** Exception thrown when a collection directory or its task input file does not exist. */
public class CollectionNotFoundException extends RuntimeException {

  private final String collection;

  public CollectionNotFoundException(String collection, String message) {
    super(message);
    this.collection = collection;
  }

  public String getCollection() {
    return collection;
  }
}
