package com.foo.skilltemplate.service.pipeline;

import static com.foo.skilltemplate.support.Sheets.row;
import static com.foo.skilltemplate.support.Sheets.sheet;
import static org.assertj.core.api.Assertions.assertThat;

import com.foo.skilltemplate.model.Category;
import com.foo.skilltemplate.model.ColumnRole;
import com.foo.skilltemplate.model.GroupingTier;
import com.foo.skilltemplate.model.ProficiencyLevel;
import com.foo.skilltemplate.model.Sheet;
import com.foo.skilltemplate.model.SheetStructure;
import com.foo.skilltemplate.model.SkillRecord;
import com.foo.skilltemplate.support.Sheets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SkillTemplateStructureServiceTest {

  private SkillTemplateStructureService service;

  @BeforeEach
  void setUp() {
    service = Sheets.structureService();
  }

  @Test
  void analyze_explicitCategoryColumn() {
    Sheet sheet =
        sheet(
            row("Skill", "Category", "Mandatory"),
            row("Python", "Technical", "Yes"),
            row("Negotiation", "Business", "No"),
            row("SQL", "Technical", "yes"));

    SheetStructure structure = service.analyze(sheet);

    assertThat(structure.headerRowIndex()).isZero();
    assertThat(structure.tier()).isEqualTo(GroupingTier.CATEGORY_COLUMN);
    assertThat(structure.categoryNames()).containsExactlyInAnyOrder("Technical", "Business");
    SkillRecord sql = structure.findSkill(3).orElseThrow();
    assertThat(sql.skillName()).isEqualTo("SQL");
    assertThat(sql.isMandatory()).isTrue();
  }

  @Test
  void analyze_numberedSections_sortedByNumber() {
    Sheet sheet =
        sheet(
            row("1. Core Skills", "", "", ""),
            row("Skill Name", "Description", "Mandatory", "Expert"),
            row("Python", "Scripting", "Yes", "Expert"),
            row("SQL", "Queries", "No", ""),
            row("2. Advanced Skills", "", "", ""),
            row("Kubernetes", "Orchestration", "No", "Advanced"));

    SheetStructure structure = service.analyze(sheet);

    assertThat(structure.headerRowIndex()).isEqualTo(1);
    assertThat(structure.tier()).isEqualTo(GroupingTier.SECTION_MARKERS);
    assertThat(structure.categoryNames()).containsExactly("1. Core Skills", "2. Advanced Skills");
    SkillRecord kubernetes = structure.findCategory("2. Advanced Skills").orElseThrow()
        .skills().get(0);
    assertThat(kubernetes.originalRowIndex()).isEqualTo(5);
    assertThat(kubernetes.description()).isEqualTo("Orchestration");
    assertThat(kubernetes.rating(ProficiencyLevel.EXPERT)).isEqualTo("Advanced");
  }

  @Test
  void analyze_sectionsSortedEvenWhenListedOutOfOrder() {
    Sheet sheet =
        sheet(
            row("Skill", "Mandatory"),
            row("3. Later", ""),
            row("Python", "Yes"),
            row("1. Earlier", ""),
            row("SQL", "No"));

    assertThat(service.analyze(sheet).categoryNames()).containsExactly("1. Earlier", "3. Later");
  }

  @Test
  void analyze_keywordInference() {
    Sheet sheet =
        sheet(
            row("Skill", "Mandatory", "Beginner"),
            row("Python Data Analysis", "Yes", "x"),
            row("HR Policy Review", "No", "x"));

    SheetStructure structure = service.analyze(sheet);

    assertThat(structure.tier()).isEqualTo(GroupingTier.KEYWORD_INFERENCE);
    assertThat(structure.findCategory("HR Skills").orElseThrow().skills())
        .extracting(SkillRecord::skillName)
        .containsExactly("HR Policy Review");
    assertThat(structure.findCategory("Technology & Analytics").orElseThrow().skills())
        .extracting(SkillRecord::skillName)
        .containsExactly("Python Data Analysis");
  }

  @Test
  void analyze_noHeaderKeywords_degradesWithoutFailing() {
    Sheet sheet = sheet(row("Python", "3"), row("Java", "4"), row("Go", "2"));

    SheetStructure structure = service.analyze(sheet);

    assertThat(structure.headerRowIndex()).isZero();
    assertThat(structure.columnRoles().indexOf(ColumnRole.SKILL)).isZero();
    assertThat(structure.categories()).extracting(Category::name).containsExactly("General Skills");
  }

  @Test
  void analyze_emptySheet() {
    SheetStructure structure = service.analyze(Sheet.empty());

    assertThat(structure.headerRowIndex()).isZero();
    assertThat(structure.categories()).isEmpty();
  }

  @Test
  void analyze_isIdempotent() {
    Sheet sheet =
        sheet(
            row("Competency Matrix"),
            row("Skill", "Mandatory", "Expert"),
            row("Core", "", ""),
            row("Python", "Yes", "x"),
            row("", "", ""),
            row("Leadership", "", ""),
            row("Coaching", "No", "x"));

    SheetStructure first = service.analyze(sheet);
    SheetStructure second = service.analyze(sheet);

    assertThat(second).isEqualTo(first);
  }
}
