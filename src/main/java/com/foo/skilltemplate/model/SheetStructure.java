package com.foo.skilltemplate.model;

import java.util.List;
import java.util.Optional;
import lombok.Builder;

/**
 * 시트 한 장에 대한 구조 추론 결과.
 *
 * @param headerRowIndex 헤더로 판단한 행
 * @param columnRoles 헤더 기준 역할별 컬럼
 * @param tier 그룹핑에 사용된 전략
 * @param categories 표시 순서로 정렬된 카테고리
 * @param sectionMarkerRows 섹션 표시로 소비된 데이터 행
 * @param blankRows 건너뛴 빈 데이터 행
 */
@Builder
public record SheetStructure(
    int headerRowIndex,
    ColumnRoleMap columnRoles,
    GroupingTier tier,
    List<Category> categories,
    List<Integer> sectionMarkerRows,
    List<Integer> blankRows) {

  public SheetStructure {
    categories = List.copyOf(categories);
    sectionMarkerRows = List.copyOf(sectionMarkerRows);
    blankRows = List.copyOf(blankRows);
  }

  public Optional<Category> findCategory(String name) {
    return categories.stream().filter(c -> c.name().equals(name)).findFirst();
  }

  public List<String> categoryNames() {
    return categories.stream().map(Category::name).toList();
  }

  public int skillCount() {
    return categories.stream().mapToInt(Category::size).sum();
  }

  /** 원본 행 인덱스로 현재 표시 중인 스킬 레코드를 찾는다. */
  public Optional<SkillRecord> findSkill(int originalRowIndex) {
    return categories.stream()
        .flatMap(c -> c.skills().stream())
        .filter(s -> s.originalRowIndex() == originalRowIndex)
        .findFirst();
  }
}
