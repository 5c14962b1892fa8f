package com.studysnap.layout.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.studysnap.layout.cards.CardDetector;
import com.studysnap.layout.classification.CorrectionLog;
import com.studysnap.layout.classification.ObjectClassifier;
import com.studysnap.layout.classification.RuleTable;
import com.studysnap.layout.io.FragmentJsonCodec;
import com.studysnap.layout.layout.LayoutAnalyzer;
import com.studysnap.layout.mobile.MobileLayoutSynthesizer;
import com.studysnap.layout.pipeline.DocumentLayoutPipeline;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Composition root of the layout engine. */
@Configuration
@EnableConfigurationProperties(LayoutEngineProperties.class)
public class LayoutEngineConfiguration {

  @Bean
  RuleTable layoutRuleTable(LayoutEngineProperties properties) {
    return RuleTable.fromProperties(properties.getClassifier());
  }

  @Bean
  CorrectionLog layoutCorrectionLog() {
    return new CorrectionLog();
  }

  @Bean
  ObjectClassifier objectClassifier(
      RuleTable ruleTable,
      CorrectionLog correctionLog,
      LayoutEngineProperties properties,
      ObjectProvider<MeterRegistry> meterRegistry) {
    return new ObjectClassifier(
        ruleTable, correctionLog, properties.getClassifier(), meterRegistry.getIfAvailable());
  }

  @Bean
  LayoutAnalyzer layoutAnalyzer(LayoutEngineProperties properties) {
    return new LayoutAnalyzer(properties.getLayout());
  }

  @Bean
  CardDetector cardDetector(LayoutEngineProperties properties) {
    return new CardDetector(properties.getCards());
  }

  @Bean
  MobileLayoutSynthesizer mobileLayoutSynthesizer(LayoutEngineProperties properties) {
    return new MobileLayoutSynthesizer(properties.getSynthesis());
  }

  @Bean
  DocumentLayoutPipeline documentLayoutPipeline(
      ObjectClassifier classifier,
      LayoutAnalyzer layoutAnalyzer,
      CardDetector cardDetector,
      MobileLayoutSynthesizer synthesizer,
      LayoutEngineProperties properties,
      ObjectProvider<MeterRegistry> meterRegistry) {
    return new DocumentLayoutPipeline(
        classifier,
        layoutAnalyzer,
        cardDetector,
        synthesizer,
        properties.getClassifier(),
        meterRegistry.getIfAvailable());
  }

  @Bean
  FragmentJsonCodec fragmentJsonCodec(ObjectProvider<ObjectMapper> objectMapper) {
    return new FragmentJsonCodec(objectMapper.getIfAvailable(ObjectMapper::new));
  }
}
