package com.foo.skilltemplate.model;

import java.util.Optional;

/** 밴드별 숙련도 등급. 편집기 드롭다운의 선택지와 같은 표기를 쓴다. */
public enum ProficiencyLevel {
  BEGINNER("Beginner", ColumnRole.BEGINNER),
  DEVELOPING("Developing", ColumnRole.DEVELOPING),
  INTERMEDIATE("Intermediate", ColumnRole.INTERMEDIATE),
  ADVANCED("Advanced", ColumnRole.ADVANCED),
  EXPERT("Expert", ColumnRole.EXPERT);

  private final String displayName;
  private final ColumnRole columnRole;

  ProficiencyLevel(String displayName, ColumnRole columnRole) {
    this.displayName = displayName;
    this.columnRole = columnRole;
  }

  public String getDisplayName() {
    return displayName;
  }

  public ColumnRole getColumnRole() {
    return columnRole;
  }

  /** 셀 값이 등급 표기와 일치하면(대소문자, 앞뒤 공백 무시) 해당 등급. */
  public static Optional<ProficiencyLevel> fromDisplayName(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    for (ProficiencyLevel level : values()) {
      if (level.displayName.equalsIgnoreCase(trimmed)) {
        return Optional.of(level);
      }
    }
    return Optional.empty();
  }
}
