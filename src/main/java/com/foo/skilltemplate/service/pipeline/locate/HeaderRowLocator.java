package com.foo.skilltemplate.service.pipeline.locate;

import com.foo.skilltemplate.config.SkillTemplateProperties;
import com.foo.skilltemplate.model.Sheet;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 앞쪽 행들을 헤더 키워드로 점수화해 헤더 행을 고른다.
 *
 * <p>키워드가 하나도 없으면 0번 행을 돌려준다. 인식하지 못한 헤더는 오류가 아니라 최선의 추정으로 처리한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HeaderRowLocator {

  private final SkillTemplateProperties properties;

  public int locate(Sheet sheet) {
    int limit = Math.min(sheet.rowCount(), properties.getHeaderScanRows());
    int bestIndex = 0;
    int bestScore = -1;

    for (int i = 0; i < limit; i++) {
      int score = score(sheet.row(i));
      // 동점이면 먼저 나온 행 유지
      if (score > bestScore) {
        bestScore = score;
        bestIndex = i;
      }
    }

    if (bestScore <= 0) {
      log.debug("No header keyword in first {} row(s), falling back to row 0", limit);
      return 0;
    }
    log.debug("Header row resolved to {} (score {})", bestIndex, bestScore);
    return bestIndex;
  }

  /** 행의 셀을 공백으로 이어 붙인 소문자 텍스트에 포함된 키워드 수. */
  int score(List<String> row) {
    String text = String.join(" ", row).toLowerCase(Locale.ROOT);
    int score = 0;
    for (String keyword : properties.getHeaderKeywords()) {
      if (text.contains(keyword.toLowerCase(Locale.ROOT))) {
        score++;
      }
    }
    return score;
  }
}
