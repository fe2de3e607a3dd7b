package com.foo.skilltemplate.model;

import java.util.List;
import java.util.Locale;

/**
 * 헤더 텍스트로부터 컬럼에 부여하는 의미 역할.
 *
 * <p>키워드 표는 고정이다. 헤더 행 탐색 키워드({@code skill.template.header-keywords})를 바꿀 때는 이 표와 어긋나지 않게 한다.
 */
public enum ColumnRole {
  SKILL("skill", "name", "title"),
  DESCRIPTION("desc", "about", "detail"),
  MANDATORY("mandatory", "required"),
  EMPLOYEES("employee", "count", "target"),
  CATEGORY("category"),
  BEGINNER("beginner", "basic"),
  DEVELOPING("developing"),
  INTERMEDIATE("intermediate"),
  ADVANCED("advanced"),
  EXPERT("expert");

  /** 컬럼 인덱스가 결정되지 않은 역할의 값. 0번 컬럼으로 취급하면 안 된다. */
  public static final int UNRESOLVED = -1;

  private final List<String> keywords;

  ColumnRole(String... keywords) {
    this.keywords = List.of(keywords);
  }

  public List<String> getKeywords() {
    return keywords;
  }

  /** 헤더 셀 텍스트(소문자 변환 후)에 키워드 중 하나라도 포함되면 일치. */
  public boolean matchesHeader(String headerCell) {
    if (headerCell == null || headerCell.isEmpty()) {
      return false;
    }
    String lower = headerCell.toLowerCase(Locale.ROOT);
    for (String keyword : keywords) {
      if (lower.contains(keyword)) {
        return true;
      }
    }
    return false;
  }
}
