package com.studysnap.layout.cards;

import com.studysnap.layout.config.LayoutEngineProperties;
import com.studysnap.layout.model.ClassifiedObject;
import com.studysnap.layout.model.ObjectType;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a reading-ordered object list into cards.
 *
 * <p>A card opens at every object of an opening type and collects the objects after it until the
 * next opener, a page change, or an object further than the span threshold from the opener.
 * Objects after such a break and before the next opener belong to no card.
 */
public class CardDetector {

  private static final Logger log = LoggerFactory.getLogger(CardDetector.class);

  private final Set<ObjectType> openingTypes;
  private final double spanThreshold;
  private final Map<CardCategory, List<String>> categoryKeywords;

  public CardDetector(LayoutEngineProperties.Cards properties) {
    Objects.requireNonNull(properties, "properties").validate();
    this.openingTypes = EnumSet.copyOf(properties.getOpeningTypes());
    this.spanThreshold = properties.getSpanThreshold();
    Map<CardCategory, List<String>> keywords = new LinkedHashMap<>();
    properties
        .getCategoryKeywords()
        .forEach(
            (category, values) ->
                keywords.put(
                    category,
                    values.stream()
                        .map(value -> value.toLowerCase(Locale.ROOT))
                        .collect(Collectors.toUnmodifiableList())));
    this.categoryKeywords = keywords;
  }

  public List<Card> detectCards(List<ClassifiedObject> readingOrder) {
    if (readingOrder == null || readingOrder.isEmpty()) {
      return List.of();
    }
    List<Card> cards = new ArrayList<>();
    ClassifiedObject header = null;
    List<ClassifiedObject> content = new ArrayList<>();
    int orphans = 0;
    for (ClassifiedObject object : readingOrder) {
      if (openingTypes.contains(object.type())) {
        if (header != null) {
          cards.add(newCard(cards.size() + 1, header, content));
        }
        header = object;
        content = new ArrayList<>();
        continue;
      }
      if (header != null && !withinSpan(header, object)) {
        cards.add(newCard(cards.size() + 1, header, content));
        header = null;
        content = new ArrayList<>();
      }
      if (header != null) {
        content.add(object);
      } else {
        orphans++;
      }
    }
    if (header != null) {
      cards.add(newCard(cards.size() + 1, header, content));
    }
    log.debug("Detected {} cards, {} objects outside any card", cards.size(), orphans);
    return List.copyOf(cards);
  }

  /** First category whose keyword occurs in the text, {@link CardCategory#GENERAL} otherwise. */
  public CardCategory categorize(String text) {
    if (text == null || text.isBlank()) {
      return CardCategory.GENERAL;
    }
    String normalized = text.toLowerCase(Locale.ROOT);
    for (Map.Entry<CardCategory, List<String>> entry : categoryKeywords.entrySet()) {
      for (String keyword : entry.getValue()) {
        if (normalized.contains(keyword)) {
          return entry.getKey();
        }
      }
    }
    return CardCategory.GENERAL;
  }

  private boolean withinSpan(ClassifiedObject header, ClassifiedObject object) {
    return header.page() == object.page() && Math.abs(object.y() - header.y()) <= spanThreshold;
  }

  private Card newCard(int number, ClassifiedObject header, List<ClassifiedObject> content) {
    return new Card("card_" + number, header, content, categorize(header.content()));
  }
}
