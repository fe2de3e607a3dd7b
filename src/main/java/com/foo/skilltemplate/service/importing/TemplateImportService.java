package com.foo.skilltemplate.service.importing;

import com.foo.skilltemplate.model.Sheet;
import com.foo.skilltemplate.service.content.ReferenceRowFilter;
import com.foo.skilltemplate.validation.TemplateStructureValidator;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 변환기가 넘겨준 시트별 행렬을 템플릿으로 만든다.
 *
 * <p>빈 시트는 건너뛰고, 나머지 시트는 모두 구조 검사를 통과해야 한다. 하나라도 실패하면 예외를 던지며 부분 결과는 돌려주지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TemplateImportService {

  private final TemplateStructureValidator structureValidator;
  private final ReferenceRowFilter referenceRowFilter;

  /**
   * @param customName 사용자가 지정한 템플릿 이름(없으면 null)
   * @param fileName 업로드 파일명
   * @param sheets 시트 이름 → 셀 행렬, 통합 문서의 시트 순서
   */
  public List<ImportedTemplate> importWorkbook(
      String customName, String fileName, Map<String, ? extends List<? extends List<?>>> sheets) {
    return doImport(customName, fileName, sheets, false);
  }

  /** 샘플 통합 문서용. 등급 정의(루브릭) 행을 먼저 제거한다. */
  public List<ImportedTemplate> importSampleWorkbook(
      String fileName, Map<String, ? extends List<? extends List<?>>> sheets) {
    return doImport(null, fileName, sheets, true);
  }

  private List<ImportedTemplate> doImport(
      String customName,
      String fileName,
      Map<String, ? extends List<? extends List<?>>> sheets,
      boolean stripReferenceRows) {
    List<ImportedTemplate> templates = new ArrayList<>();

    for (var entry : sheets.entrySet()) {
      String sheetName = entry.getKey();
      Sheet sheet = Sheet.of(entry.getValue());
      if (stripReferenceRows) {
        sheet = Sheet.of(referenceRowFilter.strip(sheet.getRows()));
      }

      if (isEmpty(sheet)) {
        log.info("Skipping empty sheet '{}' in {}", sheetName, fileName);
        continue;
      }

      structureValidator.validate(sheet, sheetName);
      String templateName = templateName(customName, sheetName, sheets.size());
      templates.add(new ImportedTemplate(templateName, fileName, sheet));
    }

    log.info("Imported {} template(s) from {}", templates.size(), fileName);
    return templates;
  }

  /** 시트 이름의 밑줄은 공백으로 바꾼다. 사용자 이름이 있으면 단일 시트는 그 이름, 여러 시트는 "이름 - 시트". */
  static String templateName(String customName, String sheetName, int sheetCount) {
    String formattedSheetName = sheetName.replace('_', ' ');
    if (customName == null || customName.isBlank()) {
      return formattedSheetName;
    }
    return sheetCount == 1 ? customName : customName + " - " + formattedSheetName;
  }

  private boolean isEmpty(Sheet sheet) {
    for (int i = 0; i < sheet.rowCount(); i++) {
      if (!sheet.isBlankRow(i)) {
        return false;
      }
    }
    return true;
  }
}
