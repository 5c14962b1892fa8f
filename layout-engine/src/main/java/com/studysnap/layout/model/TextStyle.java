package com.studysnap.layout.model;

import java.util.Locale;

/**
 * Font and colour information attached to a fragment by the extractor.
 *
 * @param color hex colour in {@code #RRGGBB} form
 * @param background optional background colour, {@code null} when transparent
 */
public record TextStyle(
    String fontName,
    double fontSize,
    FontStyle fontStyle,
    String color,
    TextAlignment alignment,
    String background,
    double lineHeight) {

  public static final String DEFAULT_FONT_NAME = "Unknown";
  public static final double DEFAULT_FONT_SIZE = 12.0d;
  public static final String DEFAULT_COLOR = "#000000";
  public static final double DEFAULT_LINE_HEIGHT = 1.5d;

  public TextStyle {
    fontName = fontName == null || fontName.isBlank() ? DEFAULT_FONT_NAME : fontName;
    fontStyle = fontStyle != null ? fontStyle : FontStyle.REGULAR;
    color = color == null || color.isBlank() ? DEFAULT_COLOR : color.trim();
    alignment = alignment != null ? alignment : TextAlignment.LEFT;
    lineHeight = lineHeight > 0 ? lineHeight : DEFAULT_LINE_HEIGHT;
  }

  public static TextStyle of(double fontSize, FontStyle fontStyle) {
    return of(fontSize, fontStyle, DEFAULT_COLOR);
  }

  public static TextStyle of(double fontSize, FontStyle fontStyle, String color) {
    return new TextStyle(
        DEFAULT_FONT_NAME, fontSize, fontStyle, color, TextAlignment.LEFT, null, DEFAULT_LINE_HEIGHT);
  }

  /** Large, bold or coloured text usually marks a heading. */
  public boolean isTitleStyle() {
    return fontSize >= 14.0d
        || fontStyle.isBold()
        || !DEFAULT_COLOR.equals(color.toUpperCase(Locale.ROOT));
  }
}
