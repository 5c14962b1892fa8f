package com.studysnap.layout.pipeline;

import com.studysnap.layout.cards.Card;
import com.studysnap.layout.classification.ClassificationStatistics;
import com.studysnap.layout.layout.DocumentLayout;
import com.studysnap.layout.mobile.MobileLayout;
import com.studysnap.layout.model.ClassifiedObject;
import java.util.List;

/**
 * Everything produced for one document.
 *
 * @param objects classified objects in input order, with group ids assigned
 */
public record LayoutResult(
    List<ClassifiedObject> objects,
    DocumentLayout layout,
    List<Card> cards,
    MobileLayout mobileLayout,
    ClassificationStatistics statistics) {

  public LayoutResult {
    objects = List.copyOf(objects);
    cards = List.copyOf(cards);
  }
}
