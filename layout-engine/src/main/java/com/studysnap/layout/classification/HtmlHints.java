package com.studysnap.layout.classification;

import com.studysnap.layout.model.HtmlHint;
import com.studysnap.layout.model.ObjectType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** Fixed type to markup lookup attached to classified objects. */
public final class HtmlHints {

  private static final Map<ObjectType, HtmlHint> HINTS;

  static {
    Map<ObjectType, HtmlHint> hints = new EnumMap<>(ObjectType.class);
    hints.put(ObjectType.MAIN_TITLE, new HtmlHint("h2", "main-title"));
    hints.put(ObjectType.SECTION_TITLE, new HtmlHint("h3", "section-title"));
    hints.put(ObjectType.SUB_TITLE, new HtmlHint("h4", "sub-title"));
    hints.put(ObjectType.PARAGRAPH, new HtmlHint("p", "paragraph"));
    hints.put(ObjectType.BULLET_LIST, new HtmlHint("ul", "bullet-list"));
    hints.put(ObjectType.NUMBERED_LIST, new HtmlHint("ol", "numbered-list"));
    hints.put(ObjectType.QUOTE, new HtmlHint("blockquote", "quote"));
    hints.put(ObjectType.CAPTION, new HtmlHint("figcaption", "caption"));
    hints.put(ObjectType.TABLE, new HtmlHint("table", "data-table"));
    hints.put(ObjectType.IMAGE, new HtmlHint("figure", "image-container"));
    hints.put(ObjectType.PHOTO, new HtmlHint("figure", "photo"));
    hints.put(ObjectType.SIGNATURE, new HtmlHint("div", "signature-section"));
    hints.put(ObjectType.CANDIDATE_NAME, new HtmlHint("h1", "candidate-name"));
    hints.put(ObjectType.PARTY_INFO, new HtmlHint("span", "party"));
    hints.put(ObjectType.SLOGAN, new HtmlHint("div", "slogan"));
    hints.put(ObjectType.PLEDGE, new HtmlHint("div", "promise-card"));
    hints.put(ObjectType.PROMISE_NUMBER, new HtmlHint("span", "promise-number"));
    hints.put(ObjectType.PROMISE_TITLE, new HtmlHint("div", "promise-title"));
    hints.put(ObjectType.ACHIEVEMENT, new HtmlHint("li", "achievement"));
    hints.put(ObjectType.ACHIEVEMENT_TITLE, new HtmlHint("h3", "achievement-group-title"));
    hints.put(ObjectType.PLEDGE_SECTION_TITLE, new HtmlHint("h3", "section-title"));
    hints.put(ObjectType.PROFILE_TITLE, new HtmlHint("h3", "profile-title"));
    hints.put(ObjectType.CAREER, new HtmlHint("li", "career-item"));
    hints.put(ObjectType.DISTRICT_INFO, new HtmlHint("div", "district-item"));
    hints.put(ObjectType.CONTACT, new HtmlHint("address", "contact-info"));
    hints.put(ObjectType.SNS, new HtmlHint("a", "sns-link"));
    hints.put(ObjectType.TIMELINE, new HtmlHint("div", "timeline-item"));
    hints.put(ObjectType.PAGE_NUMBER, new HtmlHint("span", "page-number"));
    HINTS = Collections.unmodifiableMap(hints);
  }

  private HtmlHints() {}

  public static HtmlHint forType(ObjectType type) {
    if (type == null) {
      return HtmlHint.DEFAULT;
    }
    return HINTS.getOrDefault(type, HtmlHint.DEFAULT);
  }
}
