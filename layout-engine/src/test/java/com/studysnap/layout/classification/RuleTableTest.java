package com.studysnap.layout.classification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.studysnap.layout.config.LayoutEngineProperties;
import com.studysnap.layout.model.ObjectType;
import java.util.List;
import org.junit.jupiter.api.Test;

class RuleTableTest {

  @Test
  void defaultTableKeepsListMarkersAbovePledgeCardNumbers() {
    RuleTable table = RuleTable.defaults();

    assertThat(priorityOf(table, "numbered_list"))
        .isGreaterThan(priorityOf(table, "promise_card_number"));
    assertThat(priorityOf(table, "party_info")).isGreaterThan(priorityOf(table, "candidate_name"));
    assertThat(priorityOf(table, "candidate_name")).isEqualTo(100);
    assertThat(priorityOf(table, "pledge_number")).isEqualTo(98);
    assertThat(priorityOf(table, "bullet_list")).isEqualTo(95);
    assertThat(table.rules().get(table.size() - 1).name()).isEqualTo("paragraph_default");
  }

  @Test
  void styleOnlyRulesShareCatchAllPriority() {
    RuleTable table = RuleTable.defaults();
    int catchAll = priorityOf(table, "paragraph_default");

    assertThat(
            List.of(
                "main_title_large",
                "main_title_center",
                "section_title_blue",
                "section_title_size",
                "header",
                "footer"))
        .allSatisfy(name -> assertThat(priorityOf(table, name)).isEqualTo(catchAll));
    assertThat(priorityOf(table, "numbered_list"))
        .isGreaterThan(priorityOf(table, "main_title_large"));
  }

  @Test
  void rejectsInvalidContentPatternAtLoadTime() {
    assertThatThrownBy(
            () ->
                ClassificationRule.builder("broken", ObjectType.PARAGRAPH, 10)
                    .contentPattern("([가-힣")
                    .build())
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Invalid contentPattern for rule 'broken'");
  }

  @Test
  void rejectsInvertedFontBounds() {
    assertThatThrownBy(
            () ->
                ClassificationRule.builder("inverted", ObjectType.SUB_TITLE, 10)
                    .minFontSize(20)
                    .maxFontSize(10)
                    .build())
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("exceeds maxFontSize");
  }

  @Test
  void rejectsBaseConfidenceOutsideUnitInterval() {
    assertThatThrownBy(
            () ->
                ClassificationRule.builder("zero", ObjectType.PARAGRAPH, 1)
                    .baseConfidence(0.0)
                    .build())
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("must be in (0, 1]");
  }

  @Test
  void rejectsDuplicateRuleNamesIgnoringCase() {
    ClassificationRule first = ClassificationRule.builder("title", ObjectType.MAIN_TITLE, 5).build();
    ClassificationRule second =
        ClassificationRule.builder("TITLE", ObjectType.SECTION_TITLE, 4).build();

    assertThatThrownBy(() -> RuleTable.of(List.of(first, second)))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("Duplicate classification rule name");
  }

  @Test
  void usesConfiguredRulesInsteadOfDefaults() {
    LayoutEngineProperties.RuleDefinition definition = new LayoutEngineProperties.RuleDefinition();
    definition.setName("only_quotes");
    definition.setTargetType(ObjectType.QUOTE);
    definition.setPriority(10);
    definition.setContentPattern("^\".*\"$");
    LayoutEngineProperties.Classifier classifier = new LayoutEngineProperties.Classifier();
    classifier.setRules(List.of(definition));

    RuleTable table = RuleTable.fromProperties(classifier);

    assertThat(table.size()).isEqualTo(1);
    assertThat(table.rules().get(0).targetType()).isEqualTo(ObjectType.QUOTE);
    assertThat(RuleTable.fromProperties(new LayoutEngineProperties.Classifier()).size())
        .isEqualTo(RuleTable.defaults().size());
  }

  private static int priorityOf(RuleTable table, String name) {
    return table.rules().stream()
        .filter(rule -> rule.name().equals(name))
        .findFirst()
        .orElseThrow()
        .priority();
  }
}
