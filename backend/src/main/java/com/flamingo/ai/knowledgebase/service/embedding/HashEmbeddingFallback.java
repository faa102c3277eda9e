package com.flamingo.ai.knowledgebase.service.embedding;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic stand-in vectors derived from a SHA-256 hash of each text.
 *
 * <p>Similarity between fallback vectors carries no meaning beyond exact text equality.
 */
public final class HashEmbeddingFallback {

  public static final int DIMENSION = 384;
  public static final String MODEL_NAME = "hash-fallback";

  private static final HashFunction SHA_256 = Hashing.sha256();
  private static final int FLOATS_PER_HASH = 8;

  private HashEmbeddingFallback() {}

  public static EmbeddingBatch embed(List<String> texts) {
    List<float[]> vectors = new ArrayList<>(texts.size());
    for (String text : texts) {
      vectors.add(vectorOf(text));
    }
    return new EmbeddingBatch(vectors, EmbeddingSource.FALLBACK, MODEL_NAME);
  }

  static float[] vectorOf(String text) {
    float[] vector = new float[DIMENSION];
    for (int block = 0; block * FLOATS_PER_HASH < DIMENSION; block++) {
      byte[] digest =
          SHA_256
              .newHasher()
              .putInt(block)
              .putString(text, StandardCharsets.UTF_8)
              .hash()
              .asBytes();
      ByteBuffer buffer = ByteBuffer.wrap(digest);
      for (int i = 0; i < FLOATS_PER_HASH && block * FLOATS_PER_HASH + i < DIMENSION; i++) {
        vector[block * FLOATS_PER_HASH + i] = buffer.getInt() / (float) Integer.MAX_VALUE;
      }
    }
    return normalize(vector);
  }

  private static float[] normalize(float[] vector) {
    double norm = 0;
    for (float v : vector) {
      norm += v * v;
    }
    norm = Math.sqrt(norm);
    if (norm > 0) {
      for (int i = 0; i < vector.length; i++) {
        vector[i] = (float) (vector[i] / norm);
      }
    }
    return vector;
  }
}
