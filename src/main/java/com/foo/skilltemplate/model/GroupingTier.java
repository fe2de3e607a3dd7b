package com.foo.skilltemplate.model;

/** 카테고리 그룹핑에 실제로 사용된 전략. 우선순위 순서로 선언한다. */
public enum GroupingTier {

  /** 헤더에 카테고리 컬럼이 있어 셀 값으로 묶었다. */
  CATEGORY_COLUMN,

  /** "1. Core Skills" 같은 섹션 표시 행으로 묶었다. */
  SECTION_MARKERS,

  /** 카테고리 컬럼도 섹션 표시도 없어 스킬 이름의 키워드로 추론했다. */
  KEYWORD_INFERENCE
}
