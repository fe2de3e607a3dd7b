package com.foo.skilltemplate.config;

import com.foo.skilltemplate.model.ColumnRole;
import com.foo.skilltemplate.model.Sheet;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "skill.template")
public class SkillTemplateProperties {

  /** 헤더 행을 찾을 때 살펴보는 앞쪽 행 수. */
  @Min(1)
  @Max(Sheet.MAX_HEADER_ROWS)
  private int headerScanRows = 10;

  /**
   * 헤더 행 점수 계산에 쓰는 키워드.
   *
   * <p>역할별 컬럼 키워드는 {@link ColumnRole}에 고정되어 있고 설정으로 바꿀 수 없다. 여기 키워드는 모두 어떤 역할의 헤더와도 일치해야 한다.
   * 그렇지 않으면 헤더로 고른 행에서 컬럼 역할을 찾지 못한다.
   */
  @NotEmpty
  private List<String> headerKeywords =
      new ArrayList<>(
          List.of(
              "skill",
              "name",
              "mandatory",
              "beginner",
              "intermediate",
              "expert",
              "developing",
              "advanced"));

  /** 스킬 컬럼 내용 추정에 사용하는 데이터 행 수. */
  @Min(1)
  private int skillSampleRows = 20;

  /** 스킬 컬럼 후보(앞에서부터 몇 개 컬럼). */
  @Min(1)
  private int skillCandidateColumns = 3;

  @NotBlank private String defaultSection = "General Skills";

  @NotBlank private String uncategorized = "Uncategorized";

  /** 업로드 검증 시 헤더로 인정하는 셀 값(소문자, 완전 일치). */
  @NotEmpty
  private List<String> requiredHeaderTokens =
      new ArrayList<>(List.of("skill", "name", "competency", "technical skills"));

  /** 키워드 기반 카테고리 추론 표. 순서대로 검사하며 처음 일치한 규칙을 쓴다. */
  @Valid private List<CategoryRule> categoryRules = defaultCategoryRules();

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class CategoryRule {
    @NotBlank private String name;
    @NotEmpty private List<String> keywords = new ArrayList<>();
  }

  public static List<CategoryRule> defaultCategoryRules() {
    List<CategoryRule> rules = new ArrayList<>();
    rules.add(rule("HR Skills", "hr", "human resource"));
    rules.add(rule("Legal & Compliance", "legal", "compliance", "regulatory"));
    rules.add(rule("Advisory & Negotiation", "advisory", "negotiation", "client"));
    rules.add(rule("Risk Management", "risk", "management"));
    rules.add(rule("Technology & Analytics", "technology", "analytics", "data"));
    rules.add(rule("Strategic Planning", "strategic", "planning"));
    rules.add(rule("Communication Skills", "communication", "presentation"));
    rules.add(rule("Leadership & Team Management", "leadership", "team"));
    return rules;
  }

  private static CategoryRule rule(String name, String... keywords) {
    return new CategoryRule(name, new ArrayList<>(List.of(keywords)));
  }
}
