package com.studysnap.layout.layout;

import com.studysnap.layout.model.BoundingBox;
import com.studysnap.layout.model.ClassifiedObject;
import java.util.List;

/**
 * Vertically adjacent objects of one page.
 *
 * @param layoutHint rendering hint: {@code hero}, {@code list}, {@code grid}, {@code accordion}
 *     or {@code stack}
 * @param overlapping whether two consecutive members overlap each other
 */
public record ObjectGroup(
    String groupId,
    int page,
    List<ClassifiedObject> members,
    BoundingBox bounds,
    String layoutHint,
    boolean overlapping) {

  public ObjectGroup {
    members = members != null ? List.copyOf(members) : List.of();
  }

  public int size() {
    return members.size();
  }
}
