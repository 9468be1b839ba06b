package com.flamingo.ai.docrag.index;

/** Vector arithmetic shared by the in-process index and similarity scoring. */
public final class VectorMath {

  /** Norms below this are treated as zero. */
  public static final double NORM_EPSILON = 1e-12;

  private VectorMath() {}

  public static double squaredEuclidean(float[] a, float[] b) {
    requireSameLength(a, b);
    double sum = 0.0;
    for (int i = 0; i < a.length; i++) {
      double diff = (double) a[i] - b[i];
      sum += diff * diff;
    }
    return sum;
  }

  public static double norm(float[] v) {
    double sum = 0.0;
    for (float x : v) {
      sum += (double) x * x;
    }
    return Math.sqrt(sum);
  }

  /**
   * Cosine similarity of two vectors.
   *
   * <p>When either norm is below {@link #NORM_EPSILON} the similarity is reported as 0 with the
   * degenerate flag set.
   */
  public static Cosine cosine(float[] a, float[] b) {
    requireSameLength(a, b);
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.length; i++) {
      dot += (double) a[i] * b[i];
      normA += (double) a[i] * a[i];
      normB += (double) b[i] * b[i];
    }
    normA = Math.sqrt(normA);
    normB = Math.sqrt(normB);
    if (normA < NORM_EPSILON || normB < NORM_EPSILON) {
      return new Cosine(0.0, true);
    }
    return new Cosine(clamp(dot / (normA * normB)), false);
  }

  /**
   * Approximates cosine similarity from a squared Euclidean distance, exact for unit vectors:
   * {@code cos = 1 - d / 2}.
   */
  public static double cosineFromSquaredDistance(double squaredDistance) {
    return clamp(1.0 - squaredDistance / 2.0);
  }

  private static double clamp(double value) {
    return Math.max(-1.0, Math.min(1.0, value));
  }

  private static void requireSameLength(float[] a, float[] b) {
    if (a.length != b.length) {
      throw new IllegalArgumentException(
          "Vector length mismatch: " + a.length + " vs " + b.length);
    }
  }

  /** A cosine value and whether it was computed from a zero-norm vector. */
  public record Cosine(double value, boolean degenerate) {}
}
