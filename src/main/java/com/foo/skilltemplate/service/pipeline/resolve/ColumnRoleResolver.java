package com.foo.skilltemplate.service.pipeline.resolve;

import com.foo.skilltemplate.config.SkillTemplateProperties;
import com.foo.skilltemplate.model.ColumnRole;
import com.foo.skilltemplate.model.ColumnRoleMap;
import com.foo.skilltemplate.model.ColumnRoleMap.SkillColumnSource;
import com.foo.skilltemplate.model.Sheet;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 헤더 행 텍스트로 컬럼 역할을 결정한다.
 *
 * <p>스킬 컬럼만은 헤더 텍스트로 찾지 못하면 데이터 행 내용으로 추정한다. "Skill" 헤더가 없어도 앞쪽 컬럼에 스킬 이름을 두는 템플릿이 많다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ColumnRoleResolver {

  private static final Pattern NUMERIC = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

  private final SkillTemplateProperties properties;

  public ColumnRoleMap resolve(Sheet sheet, int headerRowIndex) {
    List<String> header = sheet.rowCount() == 0 ? List.of() : sheet.row(headerRowIndex);

    Map<ColumnRole, Integer> resolved = new EnumMap<>(ColumnRole.class);
    for (ColumnRole role : ColumnRole.values()) {
      resolved.put(role, findHeaderColumn(header, role));
    }

    if (resolved.get(ColumnRole.SKILL) != ColumnRole.UNRESOLVED) {
      return ColumnRoleMap.of(resolved, SkillColumnSource.HEADER_TEXT);
    }

    ColumnRoleMap withoutSkill = ColumnRoleMap.of(resolved, SkillColumnSource.DEFAULT);
    Set<Integer> claimed = withoutSkill.claimedColumns(ColumnRole.SKILL);
    HeuristicPick pick = pickSkillColumnByContent(sheet, headerRowIndex, claimed);
    resolved.put(ColumnRole.SKILL, pick.column());

    log.debug(
        "No skill header text, using column {} ({}, claimed={})",
        pick.column(),
        pick.source(),
        claimed);
    return ColumnRoleMap.of(resolved, pick.source());
  }

  /** 왼쪽부터 검사해 처음 일치하는 헤더 셀의 인덱스. */
  int findHeaderColumn(List<String> header, ColumnRole role) {
    for (int i = 0; i < header.size(); i++) {
      if (role.matchesHeader(header.get(i))) {
        return i;
      }
    }
    return ColumnRole.UNRESOLVED;
  }

  record HeuristicPick(int column, SkillColumnSource source) {}

  /**
   * 헤더 다음 데이터 행을 표본으로 앞쪽 후보 컬럼들을 점수화한다. 3자 초과 텍스트 +2, 숫자 -1, 그 외 비어 있지 않은 값 +1.
   * 동점이면 왼쪽 컬럼을 유지한다. 다른 역할이 차지한 컬럼은 후보에서도, 기본값에서도 제외한다.
   */
  HeuristicPick pickSkillColumnByContent(Sheet sheet, int headerRowIndex, Set<Integer> claimed) {
    HeuristicPick fallback =
        new HeuristicPick(lowestUnclaimed(claimed), SkillColumnSource.DEFAULT);
    int from = headerRowIndex + 1;
    int to = Math.min(sheet.rowCount(), from + properties.getSkillSampleRows());
    if (from >= to) {
      return fallback;
    }

    int bestColumn = 0;
    int bestScore = Integer.MIN_VALUE;
    int candidates = 0;
    boolean allEqual = true;

    for (int column = 0; column < properties.getSkillCandidateColumns(); column++) {
      if (claimed.contains(column)) {
        continue;
      }
      int score = 0;
      for (int row = from; row < to; row++) {
        score += scoreValue(sheet.cell(row, column).trim());
      }
      if (candidates > 0 && score != bestScore) {
        allEqual = false;
      }
      candidates++;
      if (score > bestScore) {
        bestScore = score;
        bestColumn = column;
      }
    }

    // 후보가 없거나 점수로 구분되지 않으면 비어 있는 가장 왼쪽 컬럼
    if (candidates == 0 || (candidates > 1 && allEqual)) {
      return fallback;
    }
    return new HeuristicPick(bestColumn, SkillColumnSource.CONTENT_HEURISTIC);
  }

  private static int lowestUnclaimed(Set<Integer> claimed) {
    int column = 0;
    while (claimed.contains(column)) {
      column++;
    }
    return column;
  }

  static int scoreValue(String value) {
    if (value.isEmpty()) {
      return 0;
    }
    if (value.length() > 3) {
      return 2;
    }
    if (NUMERIC.matcher(value).matches()) {
      return -1;
    }
    return 1;
  }
}
