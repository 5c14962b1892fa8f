package com.studysnap.layout.classification;

import com.studysnap.layout.model.FontStyle;
import com.studysnap.layout.model.ObjectType;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Declarative classification rule. Every constraint is optional; {@code contentPattern} and
 * {@code colorPattern} act as gates, the remaining constraints only adjust confidence.
 */
public record ClassificationRule(
    String name,
    ObjectType targetType,
    int priority,
    Double minFontSize,
    Double maxFontSize,
    FontStyle fontStyle,
    Pattern colorPattern,
    Pattern contentPattern,
    PositionRule positionRule,
    double baseConfidence) {

  public ClassificationRule {
    if (name == null || name.isBlank()) {
      throw new IllegalStateException("Classification rule name must not be blank");
    }
    Objects.requireNonNull(targetType, "targetType");
    if (baseConfidence <= 0 || baseConfidence > 1) {
      throw new IllegalStateException(
          "baseConfidence for rule '%s' must be in (0, 1] but was %s".formatted(name, baseConfidence));
    }
    if (minFontSize != null && minFontSize < 0) {
      throw new IllegalStateException(
          "minFontSize for rule '%s' must not be negative".formatted(name));
    }
    if (minFontSize != null && maxFontSize != null && minFontSize > maxFontSize) {
      throw new IllegalStateException(
          "minFontSize (%s) exceeds maxFontSize (%s) for rule '%s'"
              .formatted(minFontSize, maxFontSize, name));
    }
  }

  public static Builder builder(String name, ObjectType targetType, int priority) {
    return new Builder(name, targetType, priority);
  }

  public static final class Builder {
    private final String name;
    private final ObjectType targetType;
    private final int priority;
    private Double minFontSize;
    private Double maxFontSize;
    private FontStyle fontStyle;
    private Pattern colorPattern;
    private Pattern contentPattern;
    private PositionRule positionRule;
    private double baseConfidence = 0.8d;

    private Builder(String name, ObjectType targetType, int priority) {
      this.name = name;
      this.targetType = targetType;
      this.priority = priority;
    }

    public Builder minFontSize(double value) {
      this.minFontSize = value;
      return this;
    }

    public Builder maxFontSize(double value) {
      this.maxFontSize = value;
      return this;
    }

    public Builder fontStyle(FontStyle value) {
      this.fontStyle = value;
      return this;
    }

    public Builder colorPattern(String regex) {
      this.colorPattern = compile(regex, "colorPattern");
      return this;
    }

    public Builder contentPattern(String regex) {
      this.contentPattern = compile(regex, "contentPattern");
      return this;
    }

    public Builder position(PositionRule value) {
      this.positionRule = value;
      return this;
    }

    public Builder baseConfidence(double value) {
      this.baseConfidence = value;
      return this;
    }

    public ClassificationRule build() {
      return new ClassificationRule(
          name,
          targetType,
          priority,
          minFontSize,
          maxFontSize,
          fontStyle,
          colorPattern,
          contentPattern,
          positionRule,
          baseConfidence);
    }

    private Pattern compile(String regex, String field) {
      try {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
      } catch (PatternSyntaxException ex) {
        throw new IllegalStateException(
            "Invalid %s for rule '%s': %s".formatted(field, name, ex.getDescription()), ex);
      }
    }
  }
}
