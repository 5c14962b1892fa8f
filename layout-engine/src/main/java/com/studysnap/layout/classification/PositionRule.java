package com.studysnap.layout.classification;

/** Vertical band a rule expects its fragment in, relative to page height. */
public enum PositionRule {
  TOP,
  CENTER,
  BOTTOM;

  static final double TOP_LIMIT = 0.2d;
  static final double BOTTOM_LIMIT = 0.8d;
  static final double CENTER_LOWER = 0.3d;
  static final double CENTER_UPPER = 0.7d;

  boolean matches(double relativeY) {
    return switch (this) {
      case TOP -> relativeY < TOP_LIMIT;
      case BOTTOM -> relativeY > BOTTOM_LIMIT;
      case CENTER -> relativeY > CENTER_LOWER && relativeY < CENTER_UPPER;
    };
  }

  /** Confidence multiplier applied when the position matches. */
  double bonus() {
    return this == CENTER ? 1.0d : 1.1d;
  }
}
