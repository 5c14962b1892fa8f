package com.studysnap.layout.layout;

import java.util.Locale;

/** Coarse purpose of a whole page. */
public enum PageType {
  COVER,
  PROFILE,
  PLEDGE,
  ACHIEVEMENT,
  CONTACT,
  CONTENT;

  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
