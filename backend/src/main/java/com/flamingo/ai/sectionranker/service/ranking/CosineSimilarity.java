package com.flamingo.ai.sectionranker.service.ranking;

/** Cosine similarity between two embedding vectors. */
public final class CosineSimilarity {

  private CosineSimilarity() {}

  /**
   * Returns {@code dot(a, b) / (|a| * |b|)}, in [-1, 1]. A zero vector scores 0.
   *
   * @throws IllegalArgumentException if the vectors differ in dimension
   */
  public static double of(float[] a, float[] b) {
    if (a.length != b.length) {
      throw new IllegalArgumentException(
          "Embedding dimensions differ: " + a.length + " vs " + b.length);
    }
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.length; i++) {
      dot += (double) a[i] * b[i];
      normA += (double) a[i] * a[i];
      normB += (double) b[i] * b[i];
    }
    if (normA == 0.0 || normB == 0.0) {
      return 0.0;
    }
    double similarity = dot / (Math.sqrt(normA) * Math.sqrt(normB));
    // rounding can push identical vectors just past 1
    return Math.max(-1.0, Math.min(1.0, similarity));
  }
}
