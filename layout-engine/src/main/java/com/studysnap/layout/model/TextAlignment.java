package com.studysnap.layout.model;

import java.util.Locale;

public enum TextAlignment {
  LEFT,
  CENTER,
  RIGHT,
  JUSTIFY;

  public static TextAlignment fromValue(String value) {
    if (value == null || value.isBlank()) {
      return LEFT;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      return LEFT;
    }
  }
}
