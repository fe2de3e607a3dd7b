package com.foo.skilltemplate.service.pipeline.mutation;

import com.foo.skilltemplate.model.ColumnRole;
import com.foo.skilltemplate.model.ColumnRoleMap;
import com.foo.skilltemplate.model.Sheet;
import com.foo.skilltemplate.validation.InvalidIndexException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 시트에 셀 편집, 행 추가, 행 삭제를 적용해 새 시트를 돌려준다.
 *
 * <p>범위 검사는 복사 전에 끝나므로 실패한 변경은 원래 시트에 아무 흔적도 남기지 않는다. 행 삭제 뒤에는 이후 행들의 원본 인덱스가 하나씩 당겨지므로
 * 이전에 파생된 {@code SkillRecord}를 재사용하면 안 된다.
 */
@Slf4j
@Component
public class MutationApplier {

  public Sheet editCell(Sheet sheet, int rowIndex, int columnIndex, String newValue) {
    checkRow(sheet, rowIndex);
    checkColumn(sheet, columnIndex);

    List<List<String>> rows = new ArrayList<>(sheet.getRows());
    List<String> row = new ArrayList<>(rows.get(rowIndex));
    while (row.size() <= columnIndex) {
      row.add("");
    }
    row.set(columnIndex, newValue == null ? "" : newValue);
    rows.set(rowIndex, row);

    log.debug("Edited cell ({}, {})", rowIndex, columnIndex);
    return sheet.withRows(rows, sheet.getHeaderRowIndex());
  }

  /**
   * 시트 끝에 헤더 폭만큼의 빈 행을 붙인다. 카테고리 컬럼이 있으면 대상 카테고리 이름을 미리 채운다. 새 행의 인덱스는 추가 전 행 수와 같다.
   */
  public Sheet addRow(Sheet sheet, ColumnRoleMap roles, String category) {
    int width = Math.max(sheet.headerRow().size(), 1);
    List<String> newRow = new ArrayList<>(Collections.nCopies(width, ""));

    int categoryColumn = roles.indexOf(ColumnRole.CATEGORY);
    if (categoryColumn != ColumnRole.UNRESOLVED && category != null) {
      while (newRow.size() <= categoryColumn) {
        newRow.add("");
      }
      newRow.set(categoryColumn, category);
    }

    List<List<String>> rows = new ArrayList<>(sheet.getRows());
    rows.add(newRow);
    log.debug("Appended row {} for category '{}'", sheet.rowCount(), category);
    return sheet.withRows(rows, sheet.getHeaderRowIndex());
  }

  /** 행을 제거한다. 헤더보다 위의 행이 지워지면 헤더 행 인덱스도 하나 당긴다. */
  public Sheet deleteRow(Sheet sheet, int rowIndex) {
    checkRow(sheet, rowIndex);

    List<List<String>> rows = new ArrayList<>(sheet.getRows());
    rows.remove(rowIndex);

    int header = sheet.getHeaderRowIndex();
    if (rowIndex < header) {
      header--;
    }
    header = Math.min(header, Math.max(rows.size() - 1, 0));

    log.debug("Deleted row {}, {} row(s) remain", rowIndex, rows.size());
    return sheet.withRows(rows, header);
  }

  private void checkRow(Sheet sheet, int rowIndex) {
    if (rowIndex < 0 || rowIndex >= sheet.rowCount()) {
      throw InvalidIndexException.row(rowIndex, sheet.rowCount());
    }
  }

  private void checkColumn(Sheet sheet, int columnIndex) {
    int columnCount = sheet.columnCount();
    if (columnIndex < 0 || columnIndex >= columnCount) {
      throw InvalidIndexException.column(columnIndex, columnCount);
    }
  }
}
