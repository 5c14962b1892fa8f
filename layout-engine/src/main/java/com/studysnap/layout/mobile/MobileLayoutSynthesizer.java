package com.studysnap.layout.mobile;

import com.studysnap.layout.cards.Card;
import com.studysnap.layout.cards.CardCategory;
import com.studysnap.layout.config.LayoutEngineProperties;
import com.studysnap.layout.model.ClassifiedObject;
import com.studysnap.layout.model.ObjectType;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns classified objects and cards into the {@link MobileLayout} aggregate.
 *
 * <p>Every section is an explicit heuristic driven by {@link LayoutEngineProperties.Synthesis}.
 */
public class MobileLayoutSynthesizer {

  private static final Logger log = LoggerFactory.getLogger(MobileLayoutSynthesizer.class);

  private static final Pattern NAME_PATTERN = Pattern.compile("^[가-힣]{2,4}$");
  private static final Pattern YEAR_PREFIX = Pattern.compile("^(\\d{4})[\\s.년:~\\-]*(.*)$");

  private final List<String> knownNames;
  private final Set<ObjectType> nameTypes;
  private final Set<String> nameExclusions;
  private final String nameInitials;
  private final List<String> organizationNames;
  private final List<String> pledgeExclusionKeywords;
  private final List<String> highlightKeywords;
  private final int maxHighlights;
  private final int minPledgeTitleLength;
  private final int sloganMinLength;
  private final int sloganMaxLength;
  private final Pattern districtPattern;

  public MobileLayoutSynthesizer(LayoutEngineProperties.Synthesis properties) {
    Objects.requireNonNull(properties, "properties").validate();
    this.knownNames = List.copyOf(properties.getKnownNames());
    this.nameTypes = EnumSet.copyOf(properties.getNameTypes());
    this.nameExclusions = Set.copyOf(properties.getNameExclusions());
    this.nameInitials = properties.getNameInitials();
    this.organizationNames = List.copyOf(properties.getOrganizationNames());
    this.pledgeExclusionKeywords = List.copyOf(properties.getPledgeExclusionKeywords());
    this.highlightKeywords = List.copyOf(properties.getHighlightKeywords());
    this.maxHighlights = properties.getMaxHighlights();
    this.minPledgeTitleLength = properties.getMinPledgeTitleLength();
    this.sloganMinLength = properties.getSloganMinLength();
    this.sloganMaxLength = properties.getSloganMaxLength();
    this.districtPattern = properties.compileDistrictPattern();
  }

  public MobileLayout synthesize(List<ClassifiedObject> objects, List<Card> cards) {
    List<ClassifiedObject> safeObjects = objects != null ? objects : List.of();
    List<Card> safeCards = cards != null ? cards : List.of();
    if (safeObjects.isEmpty() && safeCards.isEmpty()) {
      return MobileLayout.EMPTY;
    }

    Hero hero =
        new Hero(findCandidate(safeObjects), findSlogan(safeObjects), findParty(safeObjects));
    List<PledgeCard> pledgeCards = buildPledgeCards(safeCards);
    MobileLayout layout =
        new MobileLayout(
            hero,
            quickHighlights(pledgeCards),
            pledgeCards,
            timelineItems(safeObjects),
            contentsOf(safeObjects, ObjectType.ACHIEVEMENT),
            contactSection(safeObjects),
            districtPledges(safeObjects));
    log.info(
        "Synthesized mobile layout: candidate={}, {} pledge cards, {} highlights, {} districts",
        hero.candidate(),
        layout.pledgeCards().size(),
        layout.quickHighlights().size(),
        layout.districtPledges().size());
    return layout;
  }

  /** Literal known names win over pattern matches, wherever they appear in the document. */
  String findCandidate(List<ClassifiedObject> objects) {
    for (ClassifiedObject object : objects) {
      String content = object.content().strip();
      if (knownNames.contains(content)) {
        return content;
      }
    }
    for (ClassifiedObject object : objects) {
      if (!nameTypes.contains(object.type())) {
        continue;
      }
      String content = object.content().strip();
      if (NAME_PATTERN.matcher(content).matches()
          && !nameExclusions.contains(content)
          && nameInitials.indexOf(content.charAt(0)) >= 0) {
        return content;
      }
    }
    return null;
  }

  private String findSlogan(List<ClassifiedObject> objects) {
    for (ClassifiedObject object : objects) {
      if (object.type() != ObjectType.SLOGAN) {
        continue;
      }
      String content = object.content().strip();
      int length = content.codePointCount(0, content.length());
      if (length >= sloganMinLength
          && length <= sloganMaxLength
          && (content.indexOf('!') >= 0 || content.indexOf('！') >= 0)) {
        return content;
      }
    }
    return null;
  }

  private String findParty(List<ClassifiedObject> objects) {
    for (ClassifiedObject object : objects) {
      for (String organization : organizationNames) {
        if (object.content().contains(organization)) {
          return organization;
        }
      }
    }
    return null;
  }

  private List<PledgeCard> buildPledgeCards(List<Card> cards) {
    List<PledgeCard> pledges = new ArrayList<>();
    Set<String> seenTitles = new HashSet<>();
    for (Card card : cards) {
      String title = card.title().strip();
      if (card.category() == CardCategory.GENERAL
          || containsAny(title, pledgeExclusionKeywords)
          || title.codePointCount(0, title.length()) < minPledgeTitleLength
          || !seenTitles.add(title)) {
        continue;
      }
      List<String> details = card.content().stream().map(ClassifiedObject::content).toList();
      pledges.add(
          new PledgeCard(
              pledges.size() + 1,
              title,
              card.category(),
              details,
              containsAny(title, highlightKeywords)));
    }
    return pledges;
  }

  private List<PledgeCard> quickHighlights(List<PledgeCard> pledgeCards) {
    List<PledgeCard> ordered = new ArrayList<>(pledgeCards.size());
    pledgeCards.stream().filter(PledgeCard::highlighted).forEach(ordered::add);
    pledgeCards.stream().filter(card -> !card.highlighted()).forEach(ordered::add);
    return ordered.subList(0, Math.min(maxHighlights, ordered.size()));
  }

  private List<TimelineItem> timelineItems(List<ClassifiedObject> objects) {
    List<TimelineItem> items = new ArrayList<>();
    for (ClassifiedObject object : objects) {
      if (object.type() != ObjectType.TIMELINE) {
        continue;
      }
      String content = object.content().strip();
      Matcher matcher = YEAR_PREFIX.matcher(content);
      if (matcher.matches() && !matcher.group(2).isBlank()) {
        items.add(new TimelineItem(matcher.group(1), matcher.group(2).strip()));
      } else {
        items.add(new TimelineItem(matcher.matches() ? matcher.group(1) : null, content));
      }
    }
    return items;
  }

  private List<ContactEntry> contactSection(List<ClassifiedObject> objects) {
    List<ContactEntry> entries = new ArrayList<>();
    for (ClassifiedObject object : objects) {
      if (object.type() == ObjectType.CONTACT || object.type() == ObjectType.SNS) {
        entries.add(new ContactEntry(object.type(), object.content().strip()));
      }
    }
    return entries;
  }

  private Map<String, List<String>> districtPledges(List<ClassifiedObject> objects) {
    Map<String, List<String>> districts = new LinkedHashMap<>();
    for (ClassifiedObject object : objects) {
      if (object.type() != ObjectType.DISTRICT_INFO) {
        continue;
      }
      Matcher matcher = districtPattern.matcher(object.content());
      if (matcher.find()) {
        String district = matcher.groupCount() > 0 ? matcher.group(1) : matcher.group();
        districts.computeIfAbsent(district, key -> new ArrayList<>()).add(object.content().strip());
      }
    }
    return districts;
  }

  private static List<String> contentsOf(List<ClassifiedObject> objects, ObjectType type) {
    return objects.stream()
        .filter(object -> object.type() == type)
        .map(object -> object.content().strip())
        .toList();
  }

  private static boolean containsAny(String text, List<String> keywords) {
    for (String keyword : keywords) {
      if (text.contains(keyword)) {
        return true;
      }
    }
    return false;
  }
}
