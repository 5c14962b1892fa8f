package com.studysnap.layout.model;

/** Outcome of classifying a single fragment. */
public record Classification(ObjectType type, double confidence, String ruleName) {

  public Classification {
    confidence = Math.max(0.0d, Math.min(1.0d, confidence));
  }

  public static Classification fallback(double confidence) {
    return new Classification(ObjectType.PARAGRAPH, confidence, null);
  }
}
