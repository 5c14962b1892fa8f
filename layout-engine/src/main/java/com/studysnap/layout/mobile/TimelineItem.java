package com.studysnap.layout.mobile;

import org.springframework.lang.Nullable;

/** @param year leading four-digit year of the entry, {@code null} when the text has none */
public record TimelineItem(@Nullable String year, String content) {}
