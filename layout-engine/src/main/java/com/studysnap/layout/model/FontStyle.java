package com.studysnap.layout.model;

import java.util.Locale;

public enum FontStyle {
  REGULAR,
  BOLD,
  ITALIC,
  BOLD_ITALIC;

  /** Lenient lookup used for extractor output; unknown or blank values map to {@link #REGULAR}. */
  public static FontStyle fromValue(String value) {
    if (value == null || value.isBlank()) {
      return REGULAR;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      return REGULAR;
    }
  }

  public boolean isBold() {
    return this == BOLD || this == BOLD_ITALIC;
  }
}
