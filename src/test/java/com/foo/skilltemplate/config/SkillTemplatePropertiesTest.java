package com.foo.skilltemplate.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.foo.skilltemplate.config.SkillTemplateProperties.CategoryRule;
import com.foo.skilltemplate.model.ColumnRole;
import com.foo.skilltemplate.model.GroupingTier;
import com.foo.skilltemplate.model.Sheet;
import com.foo.skilltemplate.model.SheetStructure;
import com.foo.skilltemplate.service.pipeline.SkillTemplateStructureService;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = "skill.template.default-section=Other Skills")
class SkillTemplatePropertiesTest {

  @Autowired private SkillTemplateProperties properties;

  @Autowired private SkillTemplateStructureService structureService;

  @Test
  void bindsApplicationYaml() {
    assertThat(properties.getHeaderScanRows()).isEqualTo(10);
    assertThat(properties.getSkillSampleRows()).isEqualTo(20);
    assertThat(properties.getUncategorized()).isEqualTo("Uncategorized");
    assertThat(properties.getCategoryRules())
        .extracting(CategoryRule::getName)
        .containsExactlyElementsOf(
            SkillTemplateProperties.defaultCategoryRules().stream()
                .map(CategoryRule::getName)
                .toList());
    assertThat(properties.getCategoryRules().get(0).getKeywords())
        .containsExactly("hr", "human resource");
  }

  @Test
  void everyHeaderKeyword_matchesSomeColumnRole() {
    for (String keyword : properties.getHeaderKeywords()) {
      assertThat(Arrays.stream(ColumnRole.values()).anyMatch(role -> role.matchesHeader(keyword)))
          .as("role for header keyword '%s'", keyword)
          .isTrue();
    }
  }

  @Test
  void overriddenDefaultSection_usedByPipeline() {
    Sheet sheet =
        Sheet.of(List.of(List.of("Skill", "Mandatory"), List.of("Public Speaking", "Yes")));

    SheetStructure structure = structureService.analyze(sheet);

    assertThat(structure.tier()).isEqualTo(GroupingTier.KEYWORD_INFERENCE);
    assertThat(structure.categoryNames()).containsExactly("Other Skills");
  }
}
