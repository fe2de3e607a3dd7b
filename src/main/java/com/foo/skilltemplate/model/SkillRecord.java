package com.foo.skilltemplate.model;

import java.util.Locale;

/**
 * 시트의 데이터 행 하나를 역할 기준으로 읽는 뷰.
 *
 * <p>행을 복사하지 않고 {@code originalRowIndex}로 시트를 가리킨다. 인덱스는 변경(특히 행 삭제) 이후에는 무효이므로 변경마다 새로 파생된
 * 레코드를 사용해야 한다.
 */
public record SkillRecord(int originalRowIndex, Sheet sheet, ColumnRoleMap roles) {

  /** 역할에 해당하는 셀 값. 결정되지 않은 역할이면 빈 문자열. */
  public String get(ColumnRole role) {
    int column = roles.indexOf(role);
    if (column == ColumnRole.UNRESOLVED) {
      return "";
    }
    return sheet.cell(originalRowIndex, column);
  }

  public String skillName() {
    return get(ColumnRole.SKILL).trim();
  }

  public String description() {
    return get(ColumnRole.DESCRIPTION).trim();
  }

  /** 필수 여부 셀이 "yes" 또는 "true"면 필수. */
  public boolean isMandatory() {
    String value = get(ColumnRole.MANDATORY).trim().toLowerCase(Locale.ROOT);
    return value.equals("yes") || value.equals("true");
  }

  public String employeeCount() {
    return get(ColumnRole.EMPLOYEES).trim();
  }

  public String rating(ProficiencyLevel level) {
    return get(level.getColumnRole()).trim();
  }

  @Override
  public String toString() {
    return "SkillRecord[row=" + originalRowIndex + ", skill=" + skillName() + "]";
  }
}
