package com.foo.skilltemplate.service.pipeline.group;

import com.foo.skilltemplate.model.Sheet;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** 섹션 스캔 단계에서 데이터 행 하나의 종류를 판별한다. */
@Component
public class SectionRowClassifier {

  private static final Pattern NUMBERED_PREFIX = Pattern.compile("^\\d+\\.");
  private static final Pattern NUMBERED_PREFIX_WITH_SPACE = Pattern.compile("^\\d+\\.\\s*");
  private static final Pattern BARE_NUMBER = Pattern.compile("^\\d+$");

  private static final int MIN_SECTION_TEXT_LENGTH = 3;
  private static final int MAX_TEXT_SECTION_LENGTH = 50;

  public enum RowKind {
    /** "1. Core Skills" */
    NUMBERED_SECTION,
    /** 첫 셀에 숫자만 있고 나머지 셀이 빈 행 */
    BARE_NUMBER_SECTION,
    /** 첫 셀에 짧은 텍스트만 있고 나머지 셀이 빈 행 */
    TEXT_SECTION,
    BLANK,
    SKILL;

    public boolean isSectionMarker() {
      return this == NUMBERED_SECTION || this == BARE_NUMBER_SECTION || this == TEXT_SECTION;
    }
  }

  public RowKind classify(List<String> row) {
    String firstCell = firstCell(row);
    boolean hasOtherContent = hasOtherContent(row);

    if (NUMBERED_PREFIX.matcher(firstCell).find()) {
      // "1. AB"처럼 번호 뒤 텍스트가 짧으면 섹션이 아니며 다른 패턴도 보지 않는다
      String textAfterNumber = NUMBERED_PREFIX_WITH_SPACE.matcher(firstCell).replaceFirst("");
      if (textAfterNumber.length() > MIN_SECTION_TEXT_LENGTH) {
        return RowKind.NUMBERED_SECTION;
      }
    } else if (BARE_NUMBER.matcher(firstCell).matches() && !hasOtherContent) {
      return RowKind.BARE_NUMBER_SECTION;
    } else if (firstCell.length() > 2
        && firstCell.length() < MAX_TEXT_SECTION_LENGTH
        && !firstCell.contains(":")
        && !hasOtherContent) {
      return RowKind.TEXT_SECTION;
    }

    return Sheet.isBlank(row) ? RowKind.BLANK : RowKind.SKILL;
  }

  /** 헤더 바로 위 행이 "1. Core Skills" 형태면 첫 섹션 이름으로 쓴다. */
  public boolean isLeadingSectionTitle(List<String> row) {
    String firstCell = firstCell(row);
    return NUMBERED_PREFIX.matcher(firstCell).find() && firstCell.length() > 3;
  }

  public String firstCell(List<String> row) {
    return row.isEmpty() ? "" : row.get(0).trim();
  }

  private boolean hasOtherContent(List<String> row) {
    for (int i = 1; i < row.size(); i++) {
      if (!row.get(i).isBlank()) {
        return true;
      }
    }
    return false;
  }
}
