package com.foo.skilltemplate.model;

import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import lombok.EqualsAndHashCode;

/**
 * 역할별 컬럼 인덱스. 결정되지 않은 역할은 {@link ColumnRole#UNRESOLVED}.
 *
 * <p>헤더 행 기준으로 시트당 한 번 계산되며, 헤더 행이 바뀌기 전까지 재사용된다.
 */
@EqualsAndHashCode
public final class ColumnRoleMap {

  /** 스킬 컬럼이 어떤 방식으로 결정되었는지. */
  public enum SkillColumnSource {
    HEADER_TEXT,
    CONTENT_HEURISTIC,
    DEFAULT
  }

  private final EnumMap<ColumnRole, Integer> indexes;
  private final SkillColumnSource skillColumnSource;

  private ColumnRoleMap(EnumMap<ColumnRole, Integer> indexes, SkillColumnSource skillColumnSource) {
    this.indexes = indexes;
    this.skillColumnSource = skillColumnSource;
  }

  public static ColumnRoleMap of(Map<ColumnRole, Integer> resolved, SkillColumnSource source) {
    EnumMap<ColumnRole, Integer> copy = new EnumMap<>(ColumnRole.class);
    for (ColumnRole role : ColumnRole.values()) {
      Integer index = resolved.get(role);
      copy.put(role, index == null || index < 0 ? ColumnRole.UNRESOLVED : index);
    }
    return new ColumnRoleMap(copy, source);
  }

  public int indexOf(ColumnRole role) {
    return indexes.get(role);
  }

  public boolean isResolved(ColumnRole role) {
    return indexes.get(role) != ColumnRole.UNRESOLVED;
  }

  public SkillColumnSource getSkillColumnSource() {
    return skillColumnSource;
  }

  /** 결정된 역할들이 점유한 컬럼 인덱스. {@code excluded} 역할은 제외한다. */
  public Set<Integer> claimedColumns(ColumnRole excluded) {
    Set<Integer> claimed = new LinkedHashSet<>();
    indexes.forEach(
        (role, index) -> {
          if (role != excluded && index != ColumnRole.UNRESOLVED) {
            claimed.add(index);
          }
        });
    return claimed;
  }

  @Override
  public String toString() {
    return "ColumnRoleMap" + indexes + " (skill from " + skillColumnSource + ")";
  }
}
