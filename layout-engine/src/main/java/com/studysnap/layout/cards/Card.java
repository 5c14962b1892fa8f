package com.studysnap.layout.cards;

import com.studysnap.layout.model.BoundingBox;
import com.studysnap.layout.model.ClassifiedObject;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A run of fragments anchored by a heading-like fragment.
 *
 * @param header the opening fragment
 * @param content fragments following the header, possibly empty
 */
public record Card(
    String id, ClassifiedObject header, List<ClassifiedObject> content, CardCategory category) {

  public Card {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(header, "header");
    content = content != null ? List.copyOf(content) : List.of();
    category = category != null ? category : CardCategory.GENERAL;
  }

  public String title() {
    return header.content();
  }

  /** Header followed by content, in reading order. */
  public List<ClassifiedObject> members() {
    List<ClassifiedObject> members = new ArrayList<>(content.size() + 1);
    members.add(header);
    members.addAll(content);
    return members;
  }

  public BoundingBox bounds() {
    BoundingBox bounds = header.boundingBox();
    for (ClassifiedObject object : content) {
      bounds = bounds.union(object.boundingBox());
    }
    return bounds;
  }

  public boolean isEmpty() {
    return content.isEmpty();
  }
}
