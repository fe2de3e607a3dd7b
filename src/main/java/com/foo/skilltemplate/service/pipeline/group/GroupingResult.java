package com.foo.skilltemplate.service.pipeline.group;

import com.foo.skilltemplate.model.Category;
import com.foo.skilltemplate.model.GroupingTier;
import java.util.List;

/**
 * 그룹핑 한 번의 결과. 카테고리는 파생 순서(처음 등장한 순서)를 따른다.
 *
 * <p>모든 데이터 행은 카테고리의 스킬, 섹션 표시 행, 빈 행 중 정확히 한 곳에만 나타난다.
 */
public record GroupingResult(
    GroupingTier tier,
    List<Category> categories,
    List<Integer> sectionMarkerRows,
    List<Integer> blankRows) {

  public GroupingResult {
    categories = List.copyOf(categories);
    sectionMarkerRows = List.copyOf(sectionMarkerRows);
    blankRows = List.copyOf(blankRows);
  }
}
