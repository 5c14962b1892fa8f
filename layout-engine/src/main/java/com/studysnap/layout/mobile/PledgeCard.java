package com.studysnap.layout.mobile;

import com.studysnap.layout.cards.CardCategory;
import java.util.List;

/**
 * A pledge as rendered in the mobile layout.
 *
 * @param number 1-based position among the kept pledges
 * @param details contents of the card body, in reading order
 * @param highlighted whether the title contains a highlight keyword
 */
public record PledgeCard(
    int number, String title, CardCategory category, List<String> details, boolean highlighted) {

  public PledgeCard {
    details = details != null ? List.copyOf(details) : List.of();
  }
}
