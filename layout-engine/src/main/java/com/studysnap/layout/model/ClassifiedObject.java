package com.studysnap.layout.model;

/**
 * A fragment together with its semantic type.
 *
 * @param groupId proximity group the object was placed in, {@code null} until layout analysis
 */
public record ClassifiedObject(
    String id,
    ObjectType type,
    double confidence,
    String content,
    TextStyle style,
    BoundingBox boundingBox,
    String groupId,
    HtmlHint htmlHint) {

  public ClassifiedObject {
    confidence = Math.max(0.0d, Math.min(1.0d, confidence));
    content = content != null ? content : "";
    boundingBox = boundingBox != null ? boundingBox : BoundingBox.EMPTY;
    htmlHint = htmlHint != null ? htmlHint : HtmlHint.DEFAULT;
  }

  public int page() {
    return boundingBox.page();
  }

  public double x() {
    return boundingBox.x();
  }

  public double y() {
    return boundingBox.y();
  }

  public ClassifiedObject withGroupId(String newGroupId) {
    return new ClassifiedObject(
        id, type, confidence, content, style, boundingBox, newGroupId, htmlHint);
  }
}
