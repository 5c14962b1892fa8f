package com.studysnap.layout.layout;

import com.studysnap.layout.model.ClassifiedObject;
import java.util.List;

/** Split of a page into header, body and footer bands relative to the page's own y-range. */
public record ContentZones(
    List<ClassifiedObject> header, List<ClassifiedObject> body, List<ClassifiedObject> footer) {

  public static final ContentZones EMPTY = new ContentZones(List.of(), List.of(), List.of());

  public ContentZones {
    header = List.copyOf(header);
    body = List.copyOf(body);
    footer = List.copyOf(footer);
  }
}
