package com.foo.skilltemplate.validation;

import lombok.Getter;

/** 업로드한 시트에서 스킬 템플릿 헤더를 찾을 수 없을 때. */
@Getter
public class UnsupportedTemplateException extends RuntimeException {

  private final String sourceName;

  public UnsupportedTemplateException(String sourceName) {
    super("Template not supported: '%s' does not contain a valid 'Skill' or 'Name' column header."
        .formatted(sourceName));
    this.sourceName = sourceName;
  }

  public String toKoreanMessage() {
    return "지원하지 않는 템플릿입니다. '%s' 시트에 'Skill' 또는 'Name' 헤더가 없습니다".formatted(sourceName);
  }
}
