package com.studysnap.layout.layout;

import com.studysnap.layout.config.LayoutEngineProperties;
import com.studysnap.layout.model.ClassifiedObject;
import com.studysnap.layout.model.ObjectType;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/** Infers the purpose of a page from its keywords and the types of its objects. */
class PageTypeResolver {

  private final LayoutEngineProperties.Layout properties;

  PageTypeResolver(LayoutEngineProperties.Layout properties) {
    this.properties = properties;
  }

  PageType resolve(List<ClassifiedObject> objects, boolean firstPage, boolean lastPage) {
    if (firstPage && objects.size() <= properties.getCoverMaxFragments()) {
      return PageType.COVER;
    }
    String text =
        objects.stream()
            .map(ClassifiedObject::content)
            .collect(Collectors.joining("\n"))
            .toLowerCase(Locale.ROOT);
    if (lastPage && containsAny(text, properties.getContactKeywords())) {
      return PageType.CONTACT;
    }
    for (PageType type : properties.getPageTypeOrder()) {
      List<String> keywords = properties.getPageTypeKeywords().get(type);
      if (keywords != null && countHits(text, keywords) >= properties.getMinKeywordHits()) {
        return type;
      }
    }
    Set<ObjectType> present = EnumSet.noneOf(ObjectType.class);
    objects.forEach(object -> present.add(object.type()));
    if (present.contains(ObjectType.TABLE)) {
      return PageType.PROFILE;
    }
    if (present.contains(ObjectType.PROMISE_NUMBER) || present.contains(ObjectType.PROMISE_TITLE)) {
      return PageType.PLEDGE;
    }
    if (present.contains(ObjectType.ACHIEVEMENT)) {
      return PageType.ACHIEVEMENT;
    }
    return PageType.CONTENT;
  }

  private static boolean containsAny(String text, List<String> keywords) {
    return countHits(text, keywords) > 0;
  }

  private static int countHits(String text, List<String> keywords) {
    int hits = 0;
    for (String keyword : keywords) {
      if (text.contains(keyword.toLowerCase(Locale.ROOT))) {
        hits++;
      }
    }
    return hits;
  }
}
