package com.studysnap.layout.classification;

import com.studysnap.layout.config.LayoutEngineProperties;
import com.studysnap.layout.model.BoundingBox;
import com.studysnap.layout.model.Classification;
import com.studysnap.layout.model.ClassifiedObject;
import com.studysnap.layout.model.ObjectType;
import com.studysnap.layout.model.TextFragment;
import com.studysnap.layout.model.TextStyle;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

/**
 * Assigns a semantic type and confidence to text fragments by evaluating a {@link RuleTable}.
 *
 * <p>Each rule is scored independently. {@code contentPattern} and {@code colorPattern} are
 * gates: a mismatch removes the rule. Font size, font style and position only scale the
 * confidence, and conditions whose input is missing are skipped. Every rule that no gate removed
 * is a candidate. The highest priority candidate wins; equal priorities fall back to confidence,
 * then to table order.
 */
public class ObjectClassifier {

  private static final Logger log = LoggerFactory.getLogger(ObjectClassifier.class);

  static final double CONTENT_MATCH_BONUS = 1.2d;
  static final double COLOR_MATCH_BONUS = 1.3d;
  static final double FONT_SIZE_PENALTY = 0.5d;
  static final double FONT_STYLE_BONUS = 1.1d;
  static final double FONT_STYLE_PENALTY = 0.7d;
  static final double NO_MATCH_CONFIDENCE = 0.5d;

  private static final Comparator<Candidate> BEST_FIRST =
      Comparator.comparingInt((Candidate candidate) -> candidate.rule().priority())
          .reversed()
          .thenComparing(Comparator.comparingDouble(Candidate::confidence).reversed())
          .thenComparingInt(Candidate::order);

  private final RuleTable ruleTable;
  private final CorrectionLog correctionLog;
  private final double defaultPageHeight;
  private final MeterRegistry meterRegistry;
  private final Counter fallbackCounter;
  private final Counter correctionCounter;
  private final Clock clock;

  public ObjectClassifier(
      RuleTable ruleTable,
      CorrectionLog correctionLog,
      LayoutEngineProperties.Classifier properties,
      @Nullable MeterRegistry meterRegistry) {
    this(ruleTable, correctionLog, properties, meterRegistry, Clock.systemUTC());
  }

  ObjectClassifier(
      RuleTable ruleTable,
      CorrectionLog correctionLog,
      LayoutEngineProperties.Classifier properties,
      @Nullable MeterRegistry meterRegistry,
      Clock clock) {
    this.ruleTable = Objects.requireNonNull(ruleTable, "ruleTable");
    this.correctionLog = Objects.requireNonNull(correctionLog, "correctionLog");
    Objects.requireNonNull(properties, "properties").validate();
    this.defaultPageHeight = properties.getPageHeight();
    this.meterRegistry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
    this.fallbackCounter = this.meterRegistry.counter("layout_classifier_fallback_total");
    this.correctionCounter = this.meterRegistry.counter("layout_classifier_corrections_total");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public Classification classify(String text) {
    return classify(text, null, null, defaultPageHeight);
  }

  public Classification classify(
      String text, @Nullable TextStyle style, @Nullable BoundingBox boundingBox) {
    return classify(text, style, boundingBox, defaultPageHeight);
  }

  public Classification classify(
      String text,
      @Nullable TextStyle style,
      @Nullable BoundingBox boundingBox,
      double pageHeight) {
    if (text == null || text.isBlank()) {
      return Classification.fallback(0.0d);
    }
    String normalized = text.strip();
    double effectivePageHeight = pageHeight > 0 ? pageHeight : defaultPageHeight;

    Candidate best = null;
    List<ClassificationRule> rules = ruleTable.rules();
    for (int i = 0; i < rules.size(); i++) {
      Candidate candidate =
          evaluate(rules.get(i), i, normalized, style, boundingBox, effectivePageHeight);
      if (candidate != null && (best == null || BEST_FIRST.compare(candidate, best) < 0)) {
        best = candidate;
      }
    }
    if (best == null) {
      fallbackCounter.increment();
      return Classification.fallback(NO_MATCH_CONFIDENCE);
    }
    if (log.isDebugEnabled()) {
      log.debug(
          "Classified '{}' as {} via rule {} (confidence={})",
          abbreviate(normalized),
          best.rule().targetType(),
          best.rule().name(),
          best.confidence());
    }
    return new Classification(best.rule().targetType(), best.confidence(), best.rule().name());
  }

  public List<ClassifiedObject> classifyBatch(List<TextFragment> fragments) {
    return classifyBatch(fragments, Map.of());
  }

  /**
   * Classifies fragments in order and attaches a markup hint per type.
   *
   * @param pageHeights page height per 1-based page number; pages missing here use the
   *     configured default
   */
  public List<ClassifiedObject> classifyBatch(
      List<TextFragment> fragments, Map<Integer, Double> pageHeights) {
    if (fragments == null || fragments.isEmpty()) {
      return List.of();
    }
    Map<Integer, Double> heights = pageHeights != null ? pageHeights : Map.of();
    List<ClassifiedObject> results = new ArrayList<>(fragments.size());
    int withoutGeometry = 0;
    for (int index = 0; index < fragments.size(); index++) {
      TextFragment fragment = fragments.get(index);
      if (fragment == null) {
        throw new IllegalArgumentException("fragment at index " + index + " is null");
      }
      BoundingBox box = fragment.boundingBox();
      if (box == null) {
        withoutGeometry++;
      }
      double pageHeight =
          box != null ? heights.getOrDefault(box.page(), defaultPageHeight) : defaultPageHeight;
      Classification classification =
          classify(fragment.text(), fragment.style(), box, pageHeight);
      String id = fragment.id() != null && !fragment.id().isBlank() ? fragment.id() : "obj_" + index;
      results.add(
          new ClassifiedObject(
              id,
              classification.type(),
              classification.confidence(),
              fragment.text().strip(),
              fragment.style(),
              box,
              null,
              HtmlHints.forType(classification.type())));
      meterRegistry
          .counter("layout_classifier_fragments_total", "type", classification.type().name())
          .increment();
    }
    if (withoutGeometry > 0) {
      log.warn(
          "{} of {} fragments carry no geometry; position rules were skipped for them",
          withoutGeometry,
          fragments.size());
    }
    return List.copyOf(results);
  }

  /**
   * Records a reviewer correction for offline analysis. The rule table is never changed, so
   * later {@code classify} calls are unaffected.
   */
  public void recordCorrection(
      ObjectType originalType, ObjectType correctedType, String text, @Nullable TextStyle style) {
    Objects.requireNonNull(originalType, "originalType");
    Objects.requireNonNull(correctedType, "correctedType");
    correctionLog.append(CorrectionSample.of(originalType, correctedType, text, style, clock.instant()));
    correctionCounter.increment();
    log.info(
        "Recorded classification correction {} -> {}: {}",
        originalType,
        correctedType,
        abbreviate(text));
  }

  public RuleTable ruleTable() {
    return ruleTable;
  }

  public CorrectionLog correctionLog() {
    return correctionLog;
  }

  private Candidate evaluate(
      ClassificationRule rule,
      int order,
      String text,
      @Nullable TextStyle style,
      @Nullable BoundingBox box,
      double pageHeight) {
    double confidence = rule.baseConfidence();
    int met = 0;
    int total = 0;

    if (rule.contentPattern() != null) {
      total++;
      if (!rule.contentPattern().matcher(text).find()) {
        return null;
      }
      met++;
      confidence *= CONTENT_MATCH_BONUS;
    }

    if (style != null) {
      if (rule.colorPattern() != null) {
        total++;
        if (!rule.colorPattern().matcher(style.color()).find()) {
          return null;
        }
        met++;
        confidence *= COLOR_MATCH_BONUS;
      }
      if (rule.minFontSize() != null) {
        total++;
        if (style.fontSize() >= rule.minFontSize()) {
          met++;
        } else {
          confidence *= FONT_SIZE_PENALTY;
        }
      }
      if (rule.maxFontSize() != null) {
        total++;
        if (style.fontSize() <= rule.maxFontSize()) {
          met++;
        } else {
          confidence *= FONT_SIZE_PENALTY;
        }
      }
      if (rule.fontStyle() != null) {
        total++;
        if (style.fontStyle() == rule.fontStyle()) {
          met++;
          confidence *= FONT_STYLE_BONUS;
        } else {
          confidence *= FONT_STYLE_PENALTY;
        }
      }
    }

    if (box != null && rule.positionRule() != null) {
      total++;
      double relativeY = box.y() / pageHeight;
      if (rule.positionRule().matches(relativeY)) {
        met++;
        confidence *= rule.positionRule().bonus();
      }
    }

    if (total > 0) {
      confidence *= 0.5d + 0.5d * ((double) met / total);
    }

    return new Candidate(rule, Math.min(confidence, 1.0d), order);
  }

  private static String abbreviate(String text) {
    if (text == null) {
      return "";
    }
    return text.length() > 50 ? text.substring(0, 50) + "..." : text;
  }

  private record Candidate(ClassificationRule rule, double confidence, int order) {}
}
