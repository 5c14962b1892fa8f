package com.studysnap.layout.model;

/**
 * One extracted text unit as handed over by the extraction collaborator.
 *
 * @param id optional identifier assigned by the extractor
 * @param style optional style, {@code null} when the extractor could not determine it
 * @param boundingBox optional geometry, {@code null} when unknown
 */
public record TextFragment(String id, String text, TextStyle style, BoundingBox boundingBox) {

  public TextFragment {
    text = text != null ? text : "";
  }

  public static TextFragment of(String text) {
    return new TextFragment(null, text, null, null);
  }

  public static TextFragment of(String text, TextStyle style) {
    return new TextFragment(null, text, style, null);
  }

  public static TextFragment of(String text, TextStyle style, BoundingBox boundingBox) {
    return new TextFragment(null, text, style, boundingBox);
  }
}
