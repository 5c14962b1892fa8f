package com.studysnap.layout.layout;

import com.studysnap.layout.config.LayoutEngineProperties;
import com.studysnap.layout.model.BoundingBox;
import com.studysnap.layout.model.ClassifiedObject;
import com.studysnap.layout.model.ObjectType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups classified objects per page by geometry: columns, proximity groups, reading order and
 * header/body/footer zones. Also infers a {@link PageType} for every page.
 *
 * <p>All grouping is sort based; no pairwise comparison over a whole page is made.
 */
public class LayoutAnalyzer {

  private static final Logger log = LoggerFactory.getLogger(LayoutAnalyzer.class);

  private static final Comparator<ClassifiedObject> TOP_TO_BOTTOM =
      Comparator.comparingDouble(ClassifiedObject::y).thenComparingDouble(ClassifiedObject::x);

  private static final Set<ObjectType> HERO_TYPES =
      EnumSet.of(ObjectType.CANDIDATE_NAME, ObjectType.PARTY_INFO, ObjectType.SLOGAN);
  private static final Set<ObjectType> LIST_LIKE_TYPES =
      EnumSet.of(
          ObjectType.BULLET_LIST,
          ObjectType.NUMBERED_LIST,
          ObjectType.TIMELINE,
          ObjectType.ACHIEVEMENT,
          ObjectType.CAREER);

  private final LayoutEngineProperties.Layout properties;
  private final PageTypeResolver pageTypeResolver;

  public LayoutAnalyzer(LayoutEngineProperties.Layout properties) {
    this.properties = Objects.requireNonNull(properties, "properties");
    properties.validate();
    this.pageTypeResolver = new PageTypeResolver(properties);
  }

  public DocumentLayout analyzeLayout(List<ClassifiedObject> objects) {
    if (objects == null || objects.isEmpty()) {
      return DocumentLayout.EMPTY;
    }
    TreeMap<Integer, List<ClassifiedObject>> byPage = new TreeMap<>();
    for (ClassifiedObject object : objects) {
      byPage.computeIfAbsent(object.page(), key -> new ArrayList<>()).add(object);
    }

    Map<ClassifiedObject, ClassifiedObject> assigned = new IdentityHashMap<>();
    Map<Integer, PageLayout> pages = new LinkedHashMap<>();
    Map<Integer, PageType> pageTypes = new LinkedHashMap<>();
    int firstPage = byPage.firstKey();
    int lastPage = byPage.lastKey();
    for (Map.Entry<Integer, List<ClassifiedObject>> entry : byPage.entrySet()) {
      int pageNumber = entry.getKey();
      List<ClassifiedObject> pageObjects = entry.getValue();
      pages.put(pageNumber, analyzePage(pageNumber, pageObjects, assigned));
      pageTypes.put(
          pageNumber,
          pageTypeResolver.resolve(pageObjects, pageNumber == firstPage, pageNumber == lastPage));
    }

    List<ClassifiedObject> grouped = new ArrayList<>(objects.size());
    for (ClassifiedObject object : objects) {
      grouped.add(assigned.getOrDefault(object, object));
    }
    DocumentStructure structure = new DocumentStructure(pages.size(), objects.size(), pageTypes);
    log.info(
        "Analyzed layout of {} objects on {} pages (page types: {})",
        objects.size(),
        pages.size(),
        pageTypes);
    return new DocumentLayout(pages, structure, grouped);
  }

  /** Analyzes one page in isolation. An empty page yields a single-column layout without groups. */
  public PageLayout analyzePage(int pageNumber, List<ClassifiedObject> objects) {
    return analyzePage(pageNumber, objects, new IdentityHashMap<>());
  }

  private PageLayout analyzePage(
      int pageNumber,
      List<ClassifiedObject> objects,
      Map<ClassifiedObject, ClassifiedObject> assigned) {
    if (objects == null || objects.isEmpty()) {
      return PageLayout.empty(pageNumber);
    }
    List<ObjectGroup> groups = groupByProximity(pageNumber, objects, assigned);
    List<ClassifiedObject> members = new ArrayList<>(objects.size());
    groups.forEach(group -> members.addAll(group.members()));

    List<Double> columns = detectColumns(members);
    List<ClassifiedObject> readingOrder = determineReadingOrder(members, columns);
    ContentZones zones = detectZones(readingOrder);
    log.debug(
        "Page {}: {} objects, {} columns, {} groups",
        pageNumber,
        objects.size(),
        columns.size(),
        groups.size());
    return new PageLayout(pageNumber, columns, groups, readingOrder, zones);
  }

  /**
   * Clusters distinct x origins: a new column starts wherever the gap to the previous origin
   * exceeds the column threshold. Returns the left edge of each column.
   */
  List<Double> detectColumns(List<ClassifiedObject> objects) {
    double[] origins =
        objects.stream().mapToDouble(ClassifiedObject::x).sorted().distinct().toArray();
    if (origins.length == 0) {
      return List.of();
    }
    List<Double> columns = new ArrayList<>();
    columns.add(origins[0]);
    for (int i = 1; i < origins.length; i++) {
      if (origins[i] - origins[i - 1] > properties.getColumnThreshold()) {
        columns.add(origins[i]);
      }
    }
    return columns;
  }

  private List<ObjectGroup> groupByProximity(
      int pageNumber,
      List<ClassifiedObject> objects,
      Map<ClassifiedObject, ClassifiedObject> assigned) {
    List<ClassifiedObject> sorted = new ArrayList<>(objects);
    sorted.sort(TOP_TO_BOTTOM);

    List<List<ClassifiedObject>> buckets = new ArrayList<>();
    List<ClassifiedObject> current = new ArrayList<>();
    for (ClassifiedObject object : sorted) {
      if (!current.isEmpty()
          && object.y() - current.get(current.size() - 1).y() > properties.getGroupThreshold()) {
        buckets.add(current);
        current = new ArrayList<>();
      }
      current.add(object);
    }
    buckets.add(current);

    List<ObjectGroup> groups = new ArrayList<>(buckets.size());
    for (int index = 0; index < buckets.size(); index++) {
      String groupId = "p" + pageNumber + "-g" + index;
      List<ClassifiedObject> members = new ArrayList<>(buckets.get(index).size());
      BoundingBox bounds = null;
      for (ClassifiedObject object : buckets.get(index)) {
        ClassifiedObject member = object.withGroupId(groupId);
        assigned.put(object, member);
        members.add(member);
        bounds = bounds == null ? member.boundingBox() : bounds.union(member.boundingBox());
      }
      groups.add(
          new ObjectGroup(
              groupId, pageNumber, members, bounds, layoutHint(members), hasOverlap(members)));
    }
    return groups;
  }

  private List<ClassifiedObject> determineReadingOrder(
      List<ClassifiedObject> objects, List<Double> columns) {
    if (columns.size() <= 1) {
      List<ClassifiedObject> ordered = new ArrayList<>(objects);
      ordered.sort(TOP_TO_BOTTOM);
      return ordered;
    }
    List<List<ClassifiedObject>> byColumn = new ArrayList<>(columns.size());
    for (int i = 0; i < columns.size(); i++) {
      byColumn.add(new ArrayList<>());
    }
    for (ClassifiedObject object : objects) {
      byColumn.get(columnIndex(columns, object.x())).add(object);
    }
    List<ClassifiedObject> ordered = new ArrayList<>(objects.size());
    for (List<ClassifiedObject> column : byColumn) {
      column.sort(TOP_TO_BOTTOM);
      ordered.addAll(column);
    }
    return ordered;
  }

  /** Index of the column whose left edge is the closest one at or before {@code x}. */
  private static int columnIndex(List<Double> columns, double x) {
    int position = Collections.binarySearch(columns, x);
    if (position >= 0) {
      return position;
    }
    int insertion = -position - 1;
    return Math.max(0, insertion - 1);
  }

  private ContentZones detectZones(List<ClassifiedObject> readingOrder) {
    double minY = Double.MAX_VALUE;
    double maxY = -Double.MAX_VALUE;
    for (ClassifiedObject object : readingOrder) {
      minY = Math.min(minY, object.y());
      maxY = Math.max(maxY, object.y());
    }
    double range = maxY - minY;
    if (range <= 0) {
      return new ContentZones(List.of(), readingOrder, List.of());
    }
    double headerRatio = properties.getHeaderZoneRatio();
    double footerRatio = properties.getFooterZoneRatio();
    double headerLimit = minY + range * headerRatio;
    double footerLimit = maxY - range * footerRatio;
    List<ClassifiedObject> header = new ArrayList<>();
    List<ClassifiedObject> body = new ArrayList<>();
    List<ClassifiedObject> footer = new ArrayList<>();
    for (ClassifiedObject object : readingOrder) {
      if (headerRatio > 0 && object.y() <= headerLimit) {
        header.add(object);
      } else if (footerRatio > 0 && object.y() >= footerLimit) {
        footer.add(object);
      } else {
        body.add(object);
      }
    }
    return new ContentZones(header, body, footer);
  }

  private String layoutHint(List<ClassifiedObject> members) {
    if (members.stream().anyMatch(member -> HERO_TYPES.contains(member.type()))) {
      return "hero";
    }
    if (members.size() > 1) {
      long listLike =
          members.stream().filter(member -> LIST_LIKE_TYPES.contains(member.type())).count();
      if (listLike * 2 > members.size()) {
        return "list";
      }
      double minX = members.stream().mapToDouble(ClassifiedObject::x).min().orElse(0);
      double maxX = members.stream().mapToDouble(ClassifiedObject::x).max().orElse(0);
      if (maxX - minX > properties.getColumnThreshold()) {
        return "grid";
      }
      ClassifiedObject first = members.get(0);
      if (first.style() != null && first.style().isTitleStyle()) {
        return "accordion";
      }
    }
    return "stack";
  }

  private boolean hasOverlap(List<ClassifiedObject> members) {
    double threshold = properties.getOverlapThreshold();
    for (int i = 1; i < members.size(); i++) {
      BoundingBox previous = members.get(i - 1).boundingBox();
      BoundingBox current = members.get(i).boundingBox();
      if (previous.overlapsWith(current, threshold) || current.overlapsWith(previous, threshold)) {
        return true;
      }
    }
    return false;
  }
}
