package com.foo.skilltemplate.validation;

import lombok.Getter;

/** 변경 요청이 현재 시트 범위를 벗어난 행 또는 컬럼을 가리킬 때. 시트는 건드리지 않은 상태다. */
@Getter
public class InvalidIndexException extends RuntimeException {

  public enum Axis {
    ROW,
    COLUMN
  }

  private final Axis axis;
  private final int index;
  private final int bound;

  public InvalidIndexException(Axis axis, int index, int bound) {
    super(buildMessage(axis, index, bound));
    this.axis = axis;
    this.index = index;
    this.bound = bound;
  }

  public static InvalidIndexException row(int index, int rowCount) {
    return new InvalidIndexException(Axis.ROW, index, rowCount);
  }

  public static InvalidIndexException column(int index, int columnCount) {
    return new InvalidIndexException(Axis.COLUMN, index, columnCount);
  }

  public String toKoreanMessage() {
    if (axis == Axis.ROW) {
      return "행 인덱스 %d이(가) 범위를 벗어났습니다. 현재 행 수: %d".formatted(index, bound);
    }
    return "컬럼 인덱스 %d이(가) 범위를 벗어났습니다. 현재 컬럼 수: %d".formatted(index, bound);
  }

  private static String buildMessage(Axis axis, int index, int bound) {
    return "%s index %d out of range [0, %d)".formatted(
        axis == Axis.ROW ? "Row" : "Column", index, bound);
  }
}
