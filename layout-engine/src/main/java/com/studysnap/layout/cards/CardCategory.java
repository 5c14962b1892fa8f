package com.studysnap.layout.cards;

/** Topic of a detected card. {@link #GENERAL} is used when no keyword list matches. */
public enum CardCategory {
  EDUCATION,
  TRANSPORT,
  WELFARE,
  DEVELOPMENT,
  CULTURE,
  SAFETY,
  ECONOMY,
  FAMILY,
  GENERAL
}
