package com.studysnap.layout.layout;

import com.studysnap.layout.model.ClassifiedObject;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of layout analysis.
 *
 * @param pages per-page layouts keyed by page number, ascending
 * @param objects every input object, in input order, with its group id assigned
 */
public record DocumentLayout(
    Map<Integer, PageLayout> pages, DocumentStructure documentStructure, List<ClassifiedObject> objects) {

  public static final DocumentLayout EMPTY =
      new DocumentLayout(Map.of(), DocumentStructure.EMPTY, List.of());

  public DocumentLayout {
    pages = Collections.unmodifiableMap(new LinkedHashMap<>(pages));
    objects = List.copyOf(objects);
  }

  /** Reading order of the whole document: pages ascending, each in its own reading order. */
  public List<ClassifiedObject> readingOrder() {
    List<ClassifiedObject> ordered = new ArrayList<>(objects.size());
    for (PageLayout page : pages.values()) {
      ordered.addAll(page.readingOrder());
    }
    return ordered;
  }

  public int columnCount() {
    return pages.values().stream().mapToInt(PageLayout::columnCount).max().orElse(1);
  }
}
