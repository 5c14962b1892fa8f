package com.studysnap.layout.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.studysnap.layout.mobile.MobileLayout;
import com.studysnap.layout.model.BoundingBox;
import com.studysnap.layout.model.FontStyle;
import com.studysnap.layout.model.TextAlignment;
import com.studysnap.layout.model.TextFragment;
import com.studysnap.layout.model.TextStyle;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JSON exchange with the extraction collaborator (fragments in) and the renderer (mobile layout
 * out). Both sides use snake_case field names.
 */
public class FragmentJsonCodec {

  private static final TypeReference<List<FragmentPayload>> FRAGMENT_LIST =
      new TypeReference<>() {};

  private final ObjectMapper objectMapper;

  public FragmentJsonCodec() {
    this(new ObjectMapper());
  }

  public FragmentJsonCodec(ObjectMapper baseMapper) {
    this.objectMapper =
        Objects.requireNonNull(baseMapper, "baseMapper")
            .copy()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  /**
   * Parses a JSON array of fragments.
   *
   * @throws IllegalArgumentException when the input is not a valid fragment array
   */
  public List<TextFragment> readFragments(String json) {
    if (json == null || json.isBlank()) {
      throw new IllegalArgumentException("Fragment JSON must not be blank");
    }
    try {
      return toFragments(objectMapper.readValue(json, FRAGMENT_LIST));
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("Malformed fragment JSON: " + ex.getOriginalMessage(), ex);
    }
  }

  public List<TextFragment> readFragments(InputStream input) {
    Objects.requireNonNull(input, "input");
    try {
      return toFragments(objectMapper.readValue(input, FRAGMENT_LIST));
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("Malformed fragment JSON: " + ex.getOriginalMessage(), ex);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to read fragment JSON", ex);
    }
  }

  public String writeLayout(MobileLayout layout) {
    Objects.requireNonNull(layout, "layout");
    try {
      return objectMapper.writeValueAsString(layout);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Failed to serialize mobile layout", ex);
    }
  }

  private static List<TextFragment> toFragments(List<FragmentPayload> payloads) {
    if (payloads == null) {
      return List.of();
    }
    List<TextFragment> fragments = new ArrayList<>(payloads.size());
    for (int i = 0; i < payloads.size(); i++) {
      FragmentPayload payload = payloads.get(i);
      if (payload == null) {
        throw new IllegalArgumentException("Fragment at index " + i + " is null");
      }
      fragments.add(
          new TextFragment(
              payload.id(),
              payload.text(),
              payload.style() != null ? payload.style().toStyle() : null,
              payload.bbox() != null ? payload.bbox().toBox() : null));
    }
    return fragments;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  private record FragmentPayload(String id, String text, StylePayload style, BoxPayload bbox) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  private record StylePayload(
      @JsonProperty("font_name") String fontName,
      @JsonProperty("font_size") Double fontSize,
      @JsonProperty("font_style") String fontStyle,
      String color,
      String alignment,
      String background,
      @JsonProperty("line_height") Double lineHeight) {

    TextStyle toStyle() {
      return new TextStyle(
          fontName,
          fontSize != null ? fontSize : TextStyle.DEFAULT_FONT_SIZE,
          FontStyle.fromValue(fontStyle),
          color,
          TextAlignment.fromValue(alignment),
          background,
          lineHeight != null ? lineHeight : TextStyle.DEFAULT_LINE_HEIGHT);
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  private record BoxPayload(double x, double y, double width, double height, Integer page) {

    BoundingBox toBox() {
      return new BoundingBox(x, y, width, height, page != null ? page : 1);
    }
  }
}
