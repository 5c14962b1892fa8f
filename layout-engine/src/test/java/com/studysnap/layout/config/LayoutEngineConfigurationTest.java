package com.studysnap.layout.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.studysnap.layout.classification.ObjectClassifier;
import com.studysnap.layout.classification.RuleTable;
import com.studysnap.layout.io.FragmentJsonCodec;
import com.studysnap.layout.model.ObjectType;
import com.studysnap.layout.model.TextFragment;
import com.studysnap.layout.pipeline.DocumentLayoutPipeline;
import com.studysnap.layout.pipeline.LayoutResult;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class LayoutEngineConfigurationTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(LayoutEngineConfiguration.class);

  @Test
  void wiresPipelineWithDefaults() {
    contextRunner.run(
        context -> {
          assertThat(context).hasSingleBean(DocumentLayoutPipeline.class);
          assertThat(context).hasSingleBean(FragmentJsonCodec.class);
          assertThat(context.getBean(RuleTable.class).size())
              .isEqualTo(RuleTable.defaults().size());

          LayoutResult result =
              context
                  .getBean(DocumentLayoutPipeline.class)
                  .process(List.of(TextFragment.of("국민의힘"), TextFragment.of("이재명")));
          assertThat(result.mobileLayout().hero().candidate()).isEqualTo("이재명");
          assertThat(result.objects().get(0).type()).isEqualTo(ObjectType.PARTY_INFO);
        });
  }

  @Test
  void usesConfiguredRuleTable() {
    contextRunner
        .withPropertyValues(
            "layout.engine.classifier.rules[0].name=everything_is_a_quote",
            "layout.engine.classifier.rules[0].target-type=QUOTE",
            "layout.engine.classifier.rules[0].priority=1")
        .run(
            context ->
                assertThat(context.getBean(ObjectClassifier.class).classify("아무 글").type())
                    .isEqualTo(ObjectType.QUOTE));
  }

  @Test
  void failsFastOnInvalidThresholds() {
    contextRunner
        .withPropertyValues("layout.engine.layout.column-threshold=-10")
        .run(
            context -> {
              assertThat(context).hasFailed();
              assertThat(context.getStartupFailure())
                  .hasRootCauseInstanceOf(IllegalStateException.class);
            });
  }
}
