package com.flamingo.ai.chatarchive.service.search;

/**
 * Okapi BM25 term weighting.
 *
 * <p>IDF is {@code ln((N - n + 0.5) / (n + 0.5) + 1)}, which stays positive even for terms that
 * occur in most documents, so a matching term never lowers a score.
 */
public final class Bm25Scorer {

  private final double k1;
  private final double b;

  public Bm25Scorer(double k1, double b) {
    if (k1 < 0 || b < 0 || b > 1) {
      throw new IllegalArgumentException("Invalid BM25 parameters k1=" + k1 + ", b=" + b);
    }
    this.k1 = k1;
    this.b = b;
  }

  /**
   * @param corpusSize number of documents in the corpus ({@code N})
   * @param documentFrequency number of documents containing the term ({@code n})
   */
  public double idf(long corpusSize, long documentFrequency) {
    return Math.log((corpusSize - documentFrequency + 0.5) / (documentFrequency + 0.5) + 1.0);
  }

  /** Contribution of one term to a document's score. */
  public double termScore(double idf, int termFrequency, int documentLength, double avgLength) {
    if (termFrequency <= 0) {
      return 0.0;
    }
    double relativeLength = avgLength > 0 ? documentLength / avgLength : 1.0;
    double saturation = termFrequency + k1 * (1 - b + b * relativeLength);
    return idf * (termFrequency * (k1 + 1)) / saturation;
  }

  /** Maps a non-negative raw score into {@code [0, 1)}. */
  public static double normalize(double rawScore) {
    return rawScore <= 0 ? 0.0 : rawScore / (rawScore + 1.0);
  }
}
