package com.studysnap.layout.mobile;

import org.springframework.lang.Nullable;

/** Identity block shown at the top of the mobile page. Every field may be absent. */
public record Hero(@Nullable String candidate, @Nullable String slogan, @Nullable String party) {

  public static final Hero EMPTY = new Hero(null, null, null);
}
