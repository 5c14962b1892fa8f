package com.studysnap.layout.mobile;

import com.studysnap.layout.model.ObjectType;

public record ContactEntry(ObjectType type, String value) {}
