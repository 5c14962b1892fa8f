package com.studysnap.layout.layout;

import com.studysnap.layout.model.ClassifiedObject;
import java.util.List;

/**
 * Geometry-derived structure of a single page.
 *
 * @param columnPositions left edge of each detected column, ascending
 * @param readingOrder every object of the page in the order it should be read
 */
public record PageLayout(
    int pageNumber,
    List<Double> columnPositions,
    List<ObjectGroup> groups,
    List<ClassifiedObject> readingOrder,
    ContentZones zones) {

  public PageLayout {
    columnPositions = List.copyOf(columnPositions);
    groups = List.copyOf(groups);
    readingOrder = List.copyOf(readingOrder);
    zones = zones != null ? zones : ContentZones.EMPTY;
  }

  public static PageLayout empty(int pageNumber) {
    return new PageLayout(pageNumber, List.of(), List.of(), List.of(), ContentZones.EMPTY);
  }

  public int columnCount() {
    return Math.max(1, columnPositions.size());
  }

  public int objectCount() {
    return readingOrder.size();
  }
}
