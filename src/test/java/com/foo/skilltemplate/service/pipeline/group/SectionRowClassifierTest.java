package com.foo.skilltemplate.service.pipeline.group;

import static com.foo.skilltemplate.support.Sheets.row;
import static org.assertj.core.api.Assertions.assertThat;

import com.foo.skilltemplate.service.pipeline.group.SectionRowClassifier.RowKind;
import org.junit.jupiter.api.Test;

class SectionRowClassifierTest {

  private final SectionRowClassifier classifier = new SectionRowClassifier();

  @Test
  void numberedSection_evenWithOtherContent() {
    assertThat(classifier.classify(row("1. Core Skills", "", ""))).isEqualTo(RowKind.NUMBERED_SECTION);
    assertThat(classifier.classify(row("2.Strategic Skills", "note", "")))
        .isEqualTo(RowKind.NUMBERED_SECTION);
  }

  @Test
  void numberedPrefix_withShortText_isSkillAndSkipsOtherPatterns() {
    // "1. AB"는 번호 뒤 텍스트가 3자 이하라 섹션이 아니고, 텍스트 섹션 규칙도 적용하지 않는다
    assertThat(classifier.classify(row("1. AB", "", ""))).isEqualTo(RowKind.SKILL);
    assertThat(classifier.classify(row("3.", "", ""))).isEqualTo(RowKind.SKILL);
  }

  @Test
  void bareNumber_withoutOtherContent_isSection() {
    assertThat(classifier.classify(row("2", "", " "))).isEqualTo(RowKind.BARE_NUMBER_SECTION);
  }

  @Test
  void bareNumber_withOtherContent_isSkill() {
    assertThat(classifier.classify(row("2", "Python", "Yes"))).isEqualTo(RowKind.SKILL);
  }

  @Test
  void shortTextAlone_isTextSection() {
    assertThat(classifier.classify(row("Core Skills", "", ""))).isEqualTo(RowKind.TEXT_SECTION);
    assertThat(classifier.classify(row("  Leadership  "))).isEqualTo(RowKind.TEXT_SECTION);
  }

  @Test
  void textAlone_thatLooksLikeContent_isSkill() {
    assertThat(classifier.classify(row("Note: fill in every level", "", "")))
        .isEqualTo(RowKind.SKILL);
    assertThat(classifier.classify(row("Go", "", ""))).isEqualTo(RowKind.SKILL);
    assertThat(classifier.classify(row("x".repeat(50), "", ""))).isEqualTo(RowKind.SKILL);
  }

  @Test
  void blankRow() {
    assertThat(classifier.classify(row("", " ", ""))).isEqualTo(RowKind.BLANK);
    assertThat(classifier.classify(row())).isEqualTo(RowKind.BLANK);
  }

  @Test
  void leadingSectionTitle() {
    assertThat(classifier.isLeadingSectionTitle(row("1. Core Skills"))).isTrue();
    assertThat(classifier.isLeadingSectionTitle(row("1."))).isFalse();
    assertThat(classifier.isLeadingSectionTitle(row("Core Skills"))).isFalse();
  }
}
