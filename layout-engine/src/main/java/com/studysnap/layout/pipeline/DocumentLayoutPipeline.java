package com.studysnap.layout.pipeline;

import com.studysnap.layout.cards.Card;
import com.studysnap.layout.cards.CardDetector;
import com.studysnap.layout.classification.ClassificationStatistics;
import com.studysnap.layout.classification.ObjectClassifier;
import com.studysnap.layout.config.LayoutEngineProperties;
import com.studysnap.layout.layout.DocumentLayout;
import com.studysnap.layout.layout.LayoutAnalyzer;
import com.studysnap.layout.mobile.MobileLayout;
import com.studysnap.layout.mobile.MobileLayoutSynthesizer;
import com.studysnap.layout.model.ClassifiedObject;
import com.studysnap.layout.model.TextFragment;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

/**
 * Runs classification, layout analysis, card detection and mobile synthesis for one document.
 * Keeps no state between calls.
 */
public class DocumentLayoutPipeline {

  private static final Logger log = LoggerFactory.getLogger(DocumentLayoutPipeline.class);

  private final ObjectClassifier classifier;
  private final LayoutAnalyzer layoutAnalyzer;
  private final CardDetector cardDetector;
  private final MobileLayoutSynthesizer synthesizer;
  private final int maxFragments;
  private final MeterRegistry meterRegistry;
  private final Timer pipelineTimer;

  public DocumentLayoutPipeline(
      ObjectClassifier classifier,
      LayoutAnalyzer layoutAnalyzer,
      CardDetector cardDetector,
      MobileLayoutSynthesizer synthesizer,
      LayoutEngineProperties.Classifier properties,
      @Nullable MeterRegistry meterRegistry) {
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.layoutAnalyzer = Objects.requireNonNull(layoutAnalyzer, "layoutAnalyzer");
    this.cardDetector = Objects.requireNonNull(cardDetector, "cardDetector");
    this.synthesizer = Objects.requireNonNull(synthesizer, "synthesizer");
    Objects.requireNonNull(properties, "properties").validate();
    this.maxFragments = properties.getMaxFragments();
    this.meterRegistry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
    this.pipelineTimer = this.meterRegistry.timer("layout_pipeline_duration");
  }

  public LayoutResult process(List<TextFragment> fragments) {
    return process(fragments, Map.of());
  }

  /**
   * @param pageHeights page height per page number for position rules; missing pages use the
   *     configured default
   * @throws IllegalArgumentException when {@code fragments} is null or exceeds the configured
   *     maximum
   */
  public LayoutResult process(List<TextFragment> fragments, Map<Integer, Double> pageHeights) {
    if (fragments == null) {
      throw new IllegalArgumentException("fragments must not be null");
    }
    if (fragments.size() > maxFragments) {
      log.warn(
          "Rejecting document with {} fragments (limit {})", fragments.size(), maxFragments);
      throw new IllegalArgumentException(
          "Document has %d fragments, more than the allowed %d"
              .formatted(fragments.size(), maxFragments));
    }
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      List<ClassifiedObject> classified = classifier.classifyBatch(fragments, pageHeights);
      DocumentLayout layout = layoutAnalyzer.analyzeLayout(classified);
      List<Card> cards = cardDetector.detectCards(layout.readingOrder());
      MobileLayout mobileLayout = synthesizer.synthesize(layout.objects(), cards);
      ClassificationStatistics statistics = ClassificationStatistics.of(layout.objects());
      log.info(
          "Processed document: {} fragments, {} pages, {} cards, {} pledge cards",
          fragments.size(),
          layout.documentStructure().pageCount(),
          cards.size(),
          mobileLayout.pledgeCards().size());
      return new LayoutResult(layout.objects(), layout, cards, mobileLayout, statistics);
    } finally {
      sample.stop(pipelineTimer);
    }
  }
}
