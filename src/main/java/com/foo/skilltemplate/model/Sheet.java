package com.foo.skilltemplate.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 업로드된 스킬 템플릿 한 장의 셀 행렬.
 *
 * <p>행의 위치가 곧 행의 식별자(원본 행 인덱스)이므로 행 순서는 절대 바꾸지 않는다. 인스턴스는 불변이며 모든 변경은 새 {@code Sheet}를
 * 만든다. 셀은 항상 문자열이고, 값이 없는 셀은 빈 문자열로 정규화된다.
 */
@Getter
@EqualsAndHashCode
public final class Sheet {

  /** 헤더 행이 올 수 있는 앞쪽 행 수. 헤더 행 인덱스는 이보다 작다. */
  public static final int MAX_HEADER_ROWS = 10;

  private final List<List<String>> rows;
  private final int headerRowIndex;

  private Sheet(List<List<String>> rows, int headerRowIndex) {
    this.rows = rows;
    this.headerRowIndex = headerRowIndex;
  }

  /** 임의 값 행렬로부터 시트를 만든다. 헤더 행 인덱스는 0으로 시작한다. */
  public static Sheet of(List<? extends List<?>> matrix) {
    if (matrix == null) {
      return new Sheet(List.of(), 0);
    }
    List<List<String>> copy = new ArrayList<>(matrix.size());
    for (List<?> row : matrix) {
      copy.add(normalizeRow(row));
    }
    return new Sheet(Collections.unmodifiableList(copy), 0);
  }

  public static Sheet empty() {
    return new Sheet(List.of(), 0);
  }

  public Sheet withHeaderRowIndex(int index) {
    checkHeaderRowIndex(index, rows.size());
    return new Sheet(rows, index);
  }

  /** 변경된 행 목록으로 새 시트를 만든다. 헤더 행 인덱스는 호출자가 보정한다. */
  public Sheet withRows(List<List<String>> newRows, int newHeaderRowIndex) {
    checkHeaderRowIndex(newHeaderRowIndex, newRows.size());
    List<List<String>> copy = new ArrayList<>(newRows.size());
    for (List<String> row : newRows) {
      copy.add(List.copyOf(row));
    }
    return new Sheet(Collections.unmodifiableList(copy), newHeaderRowIndex);
  }

  public int rowCount() {
    return rows.size();
  }

  /** 가장 넓은 행의 셀 수. */
  public int columnCount() {
    int max = 0;
    for (List<String> row : rows) {
      max = Math.max(max, row.size());
    }
    return max;
  }

  public List<String> row(int rowIndex) {
    return rows.get(rowIndex);
  }

  public List<String> headerRow() {
    return rows.isEmpty() ? List.of() : rows.get(headerRowIndex);
  }

  /** 행 길이를 벗어난 위치(들쭉날쭉한 행)는 빈 문자열을 돌려준다. */
  public String cell(int rowIndex, int columnIndex) {
    if (rowIndex < 0 || rowIndex >= rows.size() || columnIndex < 0) {
      return "";
    }
    List<String> row = rows.get(rowIndex);
    return columnIndex < row.size() ? row.get(columnIndex) : "";
  }

  public boolean isBlankRow(int rowIndex) {
    return isBlank(rows.get(rowIndex));
  }

  /** 저장용 행렬. 호출자가 수정해도 시트에는 영향이 없다. */
  public List<List<String>> toMatrix() {
    List<List<String>> copy = new ArrayList<>(rows.size());
    for (List<String> row : rows) {
      copy.add(new ArrayList<>(row));
    }
    return copy;
  }

  public static boolean isBlank(List<String> row) {
    for (String cell : row) {
      if (!cell.isBlank()) {
        return false;
      }
    }
    return true;
  }

  /**
   * 셀 값을 문자열로 정규화한다. null은 빈 문자열, 숫자/불리언 같은 스칼라는 문자열 표현, 중첩 배열이나 객체처럼 셀이 될 수 없는 값은 빈 문자열이
   * 된다.
   */
  public static String toCellText(Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof String s) {
      return s;
    }
    if (value instanceof Collection<?> || value instanceof Map<?, ?> || value.getClass().isArray()) {
      return "";
    }
    return String.valueOf(value);
  }

  private static void checkHeaderRowIndex(int index, int rowCount) {
    if (index < 0 || index >= MAX_HEADER_ROWS || (index > 0 && index >= rowCount)) {
      throw new IllegalArgumentException(
          "Header row index %d outside first %d row(s) of sheet with %d row(s)"
              .formatted(index, MAX_HEADER_ROWS, rowCount));
    }
  }

  private static List<String> normalizeRow(List<?> row) {
    if (row == null) {
      return List.of();
    }
    List<String> cells = new ArrayList<>(row.size());
    for (Object value : row) {
      cells.add(toCellText(value));
    }
    return Collections.unmodifiableList(cells);
  }

  @Override
  public String toString() {
    return "Sheet[rows=" + rows.size() + ", headerRowIndex=" + headerRowIndex + "]";
  }
}
