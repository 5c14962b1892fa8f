package com.studysnap.layout.classification;

import com.studysnap.layout.model.ClassifiedObject;
import com.studysnap.layout.model.ObjectType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Per-type counts and mean confidence of one document's classification. Corrections are not
 * counted here; see {@link CorrectionLog} for the process-wide log.
 */
public record ClassificationStatistics(int total, Map<ObjectType, TypeStatistics> byType) {

  public record TypeStatistics(int count, double averageConfidence) {}

  public static ClassificationStatistics of(List<ClassifiedObject> objects) {
    if (objects == null || objects.isEmpty()) {
      return new ClassificationStatistics(0, Map.of());
    }
    Map<ObjectType, int[]> counts = new EnumMap<>(ObjectType.class);
    Map<ObjectType, Double> sums = new EnumMap<>(ObjectType.class);
    for (ClassifiedObject object : objects) {
      counts.computeIfAbsent(object.type(), key -> new int[1])[0]++;
      sums.merge(object.type(), object.confidence(), Double::sum);
    }
    Map<ObjectType, TypeStatistics> byType = new EnumMap<>(ObjectType.class);
    counts.forEach(
        (type, count) -> byType.put(type, new TypeStatistics(count[0], sums.get(type) / count[0])));
    return new ClassificationStatistics(objects.size(), Collections.unmodifiableMap(byType));
  }

  public int count(ObjectType type) {
    TypeStatistics stats = byType.get(type);
    return stats != null ? stats.count() : 0;
  }
}
