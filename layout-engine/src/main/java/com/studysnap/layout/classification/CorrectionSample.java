package com.studysnap.layout.classification;

import com.studysnap.layout.model.ObjectType;
import com.studysnap.layout.model.TextStyle;
import java.time.Instant;

/**
 * A reviewer's correction of a classification, kept for offline analysis.
 *
 * @param textSample at most {@link #MAX_SAMPLE_LENGTH} characters of the fragment text
 */
public record CorrectionSample(
    ObjectType originalType,
    ObjectType correctedType,
    String textSample,
    int textLength,
    TextStyle style,
    Instant recordedAt) {

  public static final int MAX_SAMPLE_LENGTH = 200;

  static CorrectionSample of(
      ObjectType originalType, ObjectType correctedType, String text, TextStyle style, Instant now) {
    String safeText = text != null ? text : "";
    String sample =
        safeText.length() > MAX_SAMPLE_LENGTH ? safeText.substring(0, MAX_SAMPLE_LENGTH) : safeText;
    return new CorrectionSample(originalType, correctedType, sample, safeText.length(), style, now);
  }
}
