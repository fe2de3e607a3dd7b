package com.foo.skilltemplate.service.content;

import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * 샘플 템플릿 시트에 함께 들어 있는 등급 정의(루브릭) 행을 걸러낸다.
 *
 * <p>"Definition:" 같은 메타 헤더로 시작하거나 루브릭 문구로 시작하는 셀이 하나라도 있으면 참고용 행으로 본다. 스킬 설명을 실수로 지우지 않도록
 * 문구는 충분히 길게 잡는다.
 */
@Component
public class ReferenceRowFilter {

  private static final List<String> META_PREFIXES =
      List.of("Definition:", "Indicators:", "Typical Activities:");

  private static final List<String> RUBRIC_PHRASES =
      List.of(
          "Requires close supervision",
          "Understanding of basic concepts",
          "Beginning to apply",
          "Can perform routine tasks",
          "Shows initiative",
          "May mentor junior",
          "Coaches other",
          "Trusted to lead",
          "Shapes strategy",
          "Recognised authority",
          "Drives innovation",
          "Represents the organisation");

  public boolean isReferenceRow(List<String> row) {
    for (String cell : row) {
      String value = cell == null ? "" : cell.trim();
      if (value.isEmpty()) {
        continue;
      }
      if (META_PREFIXES.stream().anyMatch(value::startsWith)
          || RUBRIC_PHRASES.stream().anyMatch(value::startsWith)) {
        return true;
      }
    }
    return false;
  }

  public List<List<String>> strip(List<List<String>> rows) {
    List<List<String>> kept = new ArrayList<>(rows.size());
    for (List<String> row : rows) {
      if (!isReferenceRow(row)) {
        kept.add(row);
      }
    }
    return kept;
  }
}
