package com.foo.skilltemplate.service.pipeline;

import com.foo.skilltemplate.model.ColumnRoleMap;
import com.foo.skilltemplate.model.Sheet;
import com.foo.skilltemplate.model.SheetStructure;
import com.foo.skilltemplate.service.pipeline.group.GroupingResult;
import com.foo.skilltemplate.service.pipeline.group.SectionGrouper;
import com.foo.skilltemplate.service.pipeline.locate.HeaderRowLocator;
import com.foo.skilltemplate.service.pipeline.mutation.MutationApplier;
import com.foo.skilltemplate.service.pipeline.resolve.ColumnRoleResolver;
import com.foo.skilltemplate.service.pipeline.sort.CategorySorter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 시트 구조 추론 파이프라인: 헤더 행 탐색 → 컬럼 역할 결정 → 그룹핑 → 정렬.
 *
 * <p>모든 단계가 입력만으로 결과가 정해지므로 같은 시트를 두 번 분석하면 같은 결과가 나온다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SkillTemplateStructureService {

  private final HeaderRowLocator headerRowLocator;
  private final ColumnRoleResolver columnRoleResolver;
  private final SectionGrouper sectionGrouper;
  private final CategorySorter categorySorter;
  private final MutationApplier mutationApplier;

  /** 헤더와 역할을 새로 결정한 뒤 그룹핑한다. */
  public SheetStructure analyze(Sheet sheet) {
    Sheet located = locateHeader(sheet);
    ColumnRoleMap roles = columnRoleResolver.resolve(located, located.getHeaderRowIndex());
    return derive(located, roles);
  }

  /** 헤더 행 인덱스를 채운 시트. */
  public Sheet locateHeader(Sheet sheet) {
    return sheet.withHeaderRowIndex(headerRowLocator.locate(sheet));
  }

  public ColumnRoleMap resolveRoles(Sheet sheet) {
    return columnRoleResolver.resolve(sheet, sheet.getHeaderRowIndex());
  }

  /** 이미 결정된 헤더와 역할로 그룹핑과 정렬만 다시 한다. */
  public SheetStructure derive(Sheet sheet, ColumnRoleMap roles) {
    GroupingResult grouping = sectionGrouper.group(sheet, sheet.getHeaderRowIndex(), roles);
    SheetStructure structure =
        SheetStructure.builder()
            .headerRowIndex(sheet.getHeaderRowIndex())
            .columnRoles(roles)
            .tier(grouping.tier())
            .categories(categorySorter.sort(grouping.categories()))
            .sectionMarkerRows(grouping.sectionMarkerRows())
            .blankRows(grouping.blankRows())
            .build();

    log.debug(
        "Derived {} categor(ies), {} skill(s) using {} (header row {})",
        structure.categories().size(),
        structure.skillCount(),
        structure.tier(),
        structure.headerRowIndex());
    return structure;
  }

  public TemplateEditSession openSession(Sheet sheet) {
    Sheet located = locateHeader(sheet);
    ColumnRoleMap roles = resolveRoles(located);
    log.info(
        "Opened edit session: {} row(s), header row {}, {}",
        located.rowCount(),
        located.getHeaderRowIndex(),
        roles);
    return new TemplateEditSession(this, mutationApplier, located, roles);
  }
}
