package com.foo.skilltemplate.validation;

import com.foo.skilltemplate.config.SkillTemplateProperties;
import com.foo.skilltemplate.model.Sheet;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 업로드 시점의 구조 검사. 앞쪽 행 중 어느 셀이든 "skill", "name" 같은 헤더 값과 정확히 일치해야 한다.
 *
 * <p>구조 추론 자체는 헤더를 못 찾아도 실패하지 않는다. 이 검사는 스킬 템플릿이 아닌 파일을 업로드 단계에서 걸러내기 위한 것이다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TemplateStructureValidator {

  private final SkillTemplateProperties properties;

  public void validate(Sheet sheet, String sourceName) {
    if (!hasHeaderToken(sheet)) {
      log.warn("Rejected template '{}': no skill/name header in first {} row(s)", sourceName,
          properties.getHeaderScanRows());
      throw new UnsupportedTemplateException(sourceName);
    }
  }

  public boolean hasHeaderToken(Sheet sheet) {
    List<String> tokens = properties.getRequiredHeaderTokens();
    int limit = Math.min(sheet.rowCount(), properties.getHeaderScanRows());
    for (int i = 0; i < limit; i++) {
      for (String cell : sheet.row(i)) {
        String value = cell.trim().toLowerCase(Locale.ROOT);
        if (!value.isEmpty() && tokens.contains(value)) {
          return true;
        }
      }
    }
    return false;
  }
}
