package com.studysnap.layout.layout;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Document-level summary: page count, object count and the inferred type of every page. */
public record DocumentStructure(int pageCount, int totalObjects, Map<Integer, PageType> pageTypes) {

  public static final DocumentStructure EMPTY = new DocumentStructure(0, 0, Map.of());

  public DocumentStructure {
    pageTypes = Collections.unmodifiableMap(new LinkedHashMap<>(pageTypes));
  }

  public PageType pageType(int pageNumber) {
    return pageTypes.getOrDefault(pageNumber, PageType.CONTENT);
  }
}
