package com.foo.skilltemplate.service.pipeline;

import com.foo.skilltemplate.model.ColumnRole;
import com.foo.skilltemplate.model.ColumnRoleMap;
import com.foo.skilltemplate.model.ProficiencyLevel;
import com.foo.skilltemplate.model.Sheet;
import com.foo.skilltemplate.model.SheetStructure;
import com.foo.skilltemplate.service.pipeline.mutation.MutationApplier;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * 템플릿 하나의 편집 세션.
 *
 * <p>각 변경은 직전 변경의 결과 시트에 적용되고, 적용 후 그룹핑을 처음부터 다시 계산한다. 헤더 행과 컬럼 역할은 헤더 행 자체가 편집되거나 삭제될
 * 때만 다시 결정한다. 스레드 안전하지 않으므로 호출자가 변경을 하나씩 순서대로 넘겨야 한다.
 */
@Slf4j
public class TemplateEditSession {

  private final SkillTemplateStructureService structureService;
  private final MutationApplier mutationApplier;

  private Sheet sheet;
  private ColumnRoleMap roles;
  private SheetStructure structure;

  TemplateEditSession(
      SkillTemplateStructureService structureService,
      MutationApplier mutationApplier,
      Sheet sheet,
      ColumnRoleMap roles) {
    this.structureService = structureService;
    this.mutationApplier = mutationApplier;
    this.sheet = sheet;
    this.roles = roles;
    this.structure = structureService.derive(sheet, roles);
  }

  public Sheet getSheet() {
    return sheet;
  }

  public SheetStructure getStructure() {
    return structure;
  }

  public SheetStructure editCell(int rowIndex, int columnIndex, String value) {
    Sheet edited = mutationApplier.editCell(sheet, rowIndex, columnIndex, value);
    if (rowIndex == sheet.getHeaderRowIndex()) {
      log.debug("Header row {} edited, resolving header and columns again", rowIndex);
      return replaceAndReresolve(edited);
    }
    return replace(edited, roles);
  }

  /** 카테고리에 빈 스킬 행을 추가하고 새 행의 원본 인덱스를 돌려준다. */
  public int addSkill(String category) {
    int newRowIndex = sheet.rowCount();
    replace(mutationApplier.addRow(sheet, roles, category), roles);
    return newRowIndex;
  }

  public SheetStructure deleteRow(int rowIndex) {
    boolean headerDeleted = rowIndex == sheet.getHeaderRowIndex();
    Sheet deleted = mutationApplier.deleteRow(sheet, rowIndex);
    if (headerDeleted) {
      log.debug("Header row {} deleted, resolving header and columns again", rowIndex);
      return replaceAndReresolve(deleted);
    }
    return replace(deleted, roles);
  }

  /** 필수 여부 컬럼에 Yes/No를 쓴다. 컬럼이 없으면 아무것도 하지 않는다. */
  public SheetStructure setMandatory(int rowIndex, boolean mandatory) {
    return editRoleCell(rowIndex, ColumnRole.MANDATORY, mandatory ? "Yes" : "No");
  }

  /** 밴드 컬럼에 등급 표기를 쓴다. value가 null이면 값을 지운다. */
  public SheetStructure setRating(int rowIndex, ProficiencyLevel band, ProficiencyLevel value) {
    String text = value == null ? "" : value.getDisplayName();
    return editRoleCell(rowIndex, band.getColumnRole(), text);
  }

  /** 저장할 행렬. 카테고리와 역할 정보는 포함하지 않는다. */
  public List<List<String>> toMatrix() {
    return sheet.toMatrix();
  }

  private SheetStructure editRoleCell(int rowIndex, ColumnRole role, String value) {
    int column = roles.indexOf(role);
    if (column == ColumnRole.UNRESOLVED) {
      log.debug("Ignoring edit of unresolved {} column on row {}", role, rowIndex);
      return structure;
    }
    return editCell(rowIndex, column, value);
  }

  private SheetStructure replaceAndReresolve(Sheet changed) {
    Sheet located = structureService.locateHeader(changed);
    return replace(located, structureService.resolveRoles(located));
  }

  private SheetStructure replace(Sheet changed, ColumnRoleMap newRoles) {
    this.sheet = changed;
    this.roles = newRoles;
    this.structure = structureService.derive(changed, newRoles);
    return structure;
  }
}
