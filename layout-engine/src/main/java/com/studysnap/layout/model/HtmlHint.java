package com.studysnap.layout.model;

/** Rendering suggestion for a classified fragment; renderers are free to ignore it. */
public record HtmlHint(String tag, String cssClass) {

  public static final HtmlHint DEFAULT = new HtmlHint("div", "content");
}
