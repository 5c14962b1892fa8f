package com.studysnap.layout.classification;

import com.studysnap.layout.config.LayoutEngineProperties;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, ordered set of classification rules. Validated once on creation and shared
 * read-only between classifications.
 */
public final class RuleTable {

  private final List<ClassificationRule> rules;

  private RuleTable(List<ClassificationRule> rules) {
    this.rules = rules;
  }

  public static RuleTable of(List<ClassificationRule> rules) {
    Objects.requireNonNull(rules, "rules");
    if (rules.isEmpty()) {
      throw new IllegalStateException("Rule table must contain at least one rule");
    }
    Set<String> names = new HashSet<>();
    for (ClassificationRule rule : rules) {
      Objects.requireNonNull(rule, "rule");
      if (!names.add(rule.name().toLowerCase(Locale.ROOT))) {
        throw new IllegalStateException("Duplicate classification rule name: " + rule.name());
      }
    }
    return new RuleTable(List.copyOf(rules));
  }

  public static RuleTable defaults() {
    return of(DefaultRules.rules());
  }

  /** Uses the configured rule definitions when present, the built-in table otherwise. */
  public static RuleTable fromProperties(LayoutEngineProperties.Classifier classifier) {
    Objects.requireNonNull(classifier, "classifier");
    if (classifier.getRules().isEmpty()) {
      return defaults();
    }
    return of(
        classifier.getRules().stream().map(LayoutEngineProperties.RuleDefinition::toRule).toList());
  }

  public List<ClassificationRule> rules() {
    return rules;
  }

  public int size() {
    return rules.size();
  }
}
