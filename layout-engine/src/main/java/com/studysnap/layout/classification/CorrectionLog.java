package com.studysnap.layout.classification;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Append-only sink for {@link CorrectionSample}s. Safe for concurrent writers; nothing here is
 * read back by the classifier.
 */
public class CorrectionLog {

  private final ConcurrentLinkedQueue<CorrectionSample> samples = new ConcurrentLinkedQueue<>();

  public void append(CorrectionSample sample) {
    samples.add(Objects.requireNonNull(sample, "sample"));
  }

  public List<CorrectionSample> snapshot() {
    return List.copyOf(samples);
  }

  public int size() {
    return samples.size();
  }
}
