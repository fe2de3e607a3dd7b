package com.foo.skilltemplate.service.pipeline.group;

import com.foo.skilltemplate.config.SkillTemplateProperties;
import com.foo.skilltemplate.model.Category;
import com.foo.skilltemplate.model.ColumnRole;
import com.foo.skilltemplate.model.ColumnRoleMap;
import com.foo.skilltemplate.model.GroupingTier;
import com.foo.skilltemplate.model.Sheet;
import com.foo.skilltemplate.model.SkillRecord;
import com.foo.skilltemplate.service.pipeline.group.SectionRowClassifier.RowKind;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 헤더 아래 데이터 행을 카테고리로 나눈다.
 *
 * <p>세 전략을 우선순위대로 시도하며 결과에는 하나만 쓰인다.
 *
 * <ol>
 *   <li>카테고리 컬럼이 있으면 그 셀 값으로 묶는다.
 *   <li>없으면 섹션 표시 행("1. Core Skills", "2", "Core Skills")을 찾아 그 아래 행들을 묶는다.
 *   <li>섹션 표시가 하나도 없으면 스킬 이름 키워드로 카테고리를 추론한다.
 * </ol>
 *
 * <p>시트와 역할 맵만으로 결과가 정해지는 순수 함수이며, 변경이 있을 때마다 처음부터 다시 계산한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SectionGrouper {

  private final SkillTemplateProperties properties;
  private final SectionRowClassifier rowClassifier;
  private final KeywordCategoryClassifier keywordClassifier;

  public GroupingResult group(Sheet sheet, int headerRowIndex, ColumnRoleMap roles) {
    if (roles.isResolved(ColumnRole.CATEGORY)) {
      return groupByCategoryColumn(sheet, headerRowIndex, roles);
    }

    GroupingResult sections = groupBySectionMarkers(sheet, headerRowIndex, roles);
    if (sections != null) {
      return sections;
    }

    log.debug("No section markers below header row {}, inferring categories from skill names",
        headerRowIndex);
    return groupByKeywords(sheet, headerRowIndex, roles);
  }

  private GroupingResult groupByCategoryColumn(Sheet sheet, int headerRowIndex,
      ColumnRoleMap roles) {
    int categoryColumn = roles.indexOf(ColumnRole.CATEGORY);
    Map<String, List<SkillRecord>> groups = new LinkedHashMap<>();

    for (int i = headerRowIndex + 1; i < sheet.rowCount(); i++) {
      String value = sheet.cell(i, categoryColumn).trim();
      String category = value.isEmpty() ? properties.getUncategorized() : value;
      groups.computeIfAbsent(category, k -> new ArrayList<>())
          .add(new SkillRecord(i, sheet, roles));
    }

    return new GroupingResult(GroupingTier.CATEGORY_COLUMN, toCategories(groups), List.of(),
        List.of());
  }

  /** 섹션 표시가 하나도 없으면 null. */
  private GroupingResult groupBySectionMarkers(Sheet sheet, int headerRowIndex,
      ColumnRoleMap roles) {
    SectionScan scan = new SectionScan(properties.getDefaultSection());

    if (headerRowIndex > 0) {
      List<String> above = sheet.row(headerRowIndex - 1);
      if (rowClassifier.isLeadingSectionTitle(above)) {
        scan.enterSection(rowClassifier.firstCell(above));
      }
    }

    for (int i = headerRowIndex + 1; i < sheet.rowCount(); i++) {
      List<String> row = sheet.row(i);
      RowKind kind = rowClassifier.classify(row);
      if (kind.isSectionMarker()) {
        scan.enterSection(rowClassifier.firstCell(row));
        scan.markerRows.add(i);
      } else if (kind == RowKind.BLANK) {
        scan.blankRows.add(i);
      } else {
        scan.addSkill(new SkillRecord(i, sheet, roles));
      }
    }

    if (!scan.foundSection) {
      return null;
    }
    return new GroupingResult(GroupingTier.SECTION_MARKERS, toCategories(scan.groups),
        scan.markerRows, scan.blankRows);
  }

  private GroupingResult groupByKeywords(Sheet sheet, int headerRowIndex, ColumnRoleMap roles) {
    Map<String, List<SkillRecord>> groups = new LinkedHashMap<>();
    List<Integer> blankRows = new ArrayList<>();

    for (int i = headerRowIndex + 1; i < sheet.rowCount(); i++) {
      if (sheet.isBlankRow(i)) {
        blankRows.add(i);
        continue;
      }
      SkillRecord skill = new SkillRecord(i, sheet, roles);
      String category = keywordClassifier.classify(skill.skillName());
      groups.computeIfAbsent(category, k -> new ArrayList<>()).add(skill);
    }

    return new GroupingResult(GroupingTier.KEYWORD_INFERENCE, toCategories(groups), List.of(),
        blankRows);
  }

  private List<Category> toCategories(Map<String, List<SkillRecord>> groups) {
    List<Category> categories = new ArrayList<>(groups.size());
    groups.forEach((name, skills) -> categories.add(new Category(name, skills)));
    return categories;
  }

  /** 섹션 스캔 한 번 동안의 누적 상태. 호출마다 새로 만든다. */
  private static final class SectionScan {
    private String currentSection;
    private boolean foundSection;
    // 스킬이 하나도 없는 섹션은 카테고리로 만들지 않는다
    private final Map<String, List<SkillRecord>> groups = new LinkedHashMap<>();
    private final List<Integer> markerRows = new ArrayList<>();
    private final List<Integer> blankRows = new ArrayList<>();

    SectionScan(String defaultSection) {
      this.currentSection = defaultSection;
    }

    void enterSection(String name) {
      currentSection = name;
      foundSection = true;
    }

    void addSkill(SkillRecord skill) {
      groups.computeIfAbsent(currentSection, k -> new ArrayList<>()).add(skill);
    }
  }
}
