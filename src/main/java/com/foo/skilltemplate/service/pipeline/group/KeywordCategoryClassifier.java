package com.foo.skilltemplate.service.pipeline.group;

import com.foo.skilltemplate.config.SkillTemplateProperties;
import com.foo.skilltemplate.config.SkillTemplateProperties.CategoryRule;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** 스킬 이름에 포함된 키워드로 카테고리를 추론한다. 규칙 표는 설정에서 온다. */
@Component
@RequiredArgsConstructor
public class KeywordCategoryClassifier {

  private final SkillTemplateProperties properties;

  public String classify(String skillName) {
    String lower = skillName == null ? "" : skillName.trim().toLowerCase(Locale.ROOT);
    if (!lower.isEmpty()) {
      for (CategoryRule rule : properties.getCategoryRules()) {
        for (String keyword : rule.getKeywords()) {
          if (lower.contains(keyword.toLowerCase(Locale.ROOT))) {
            return rule.getName();
          }
        }
      }
    }
    return properties.getDefaultSection();
  }
}
