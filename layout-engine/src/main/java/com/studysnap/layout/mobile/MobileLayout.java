package com.studysnap.layout.mobile;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mobile-first aggregate handed to the renderer. Built once per document and never changed.
 *
 * @param districtPledges district name to the entries mentioning it, in document order
 */
public record MobileLayout(
    Hero hero,
    List<PledgeCard> quickHighlights,
    List<PledgeCard> pledgeCards,
    List<TimelineItem> timelineItems,
    List<String> achievements,
    List<ContactEntry> contactSection,
    Map<String, List<String>> districtPledges) {

  public static final MobileLayout EMPTY =
      new MobileLayout(Hero.EMPTY, List.of(), List.of(), List.of(), List.of(), List.of(), Map.of());

  public MobileLayout {
    hero = hero != null ? hero : Hero.EMPTY;
    quickHighlights = List.copyOf(quickHighlights);
    pledgeCards = List.copyOf(pledgeCards);
    timelineItems = List.copyOf(timelineItems);
    achievements = List.copyOf(achievements);
    contactSection = List.copyOf(contactSection);
    Map<String, List<String>> districts = new LinkedHashMap<>();
    districtPledges.forEach((district, entries) -> districts.put(district, List.copyOf(entries)));
    districtPledges = Collections.unmodifiableMap(districts);
  }
}
