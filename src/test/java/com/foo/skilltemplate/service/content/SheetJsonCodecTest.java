package com.foo.skilltemplate.service.content;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.foo.skilltemplate.model.Sheet;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SheetJsonCodecTest {

  private SheetJsonCodec codec;

  @BeforeEach
  void setUp() {
    codec = new SheetJsonCodec(new ObjectMapper());
  }

  @Test
  void read_storedContent() {
    Sheet sheet = codec.read("[[\"Skill\",\"Mandatory\"],[\"Python\",\"Yes\"]]");

    assertThat(sheet.toMatrix())
        .containsExactly(List.of("Skill", "Mandatory"), List.of("Python", "Yes"));
    assertThat(sheet.getHeaderRowIndex()).isZero();
  }

  @Test
  void read_malformedCells_coercedInsteadOfFailing() {
    Sheet sheet = codec.read("[[\"Python\", null, 3, true, [1, 2], {\"a\": 1}], \"oops\"]");

    assertThat(sheet.row(0)).containsExactly("Python", "", "3", "true", "", "");
    assertThat(sheet.row(1)).isEmpty();
  }

  @Test
  void read_blank_isEmptySheet() {
    assertThat(codec.read("  ").rowCount()).isZero();
    assertThat(codec.read(null).rowCount()).isZero();
  }

  @Test
  void read_invalidJson_rejected() {
    assertThatThrownBy(() -> codec.read("[[\"Skill\""))
        .isInstanceOf(IllegalArgumentException.class)
        .hasCauseInstanceOf(JsonProcessingException.class);
  }

  @Test
  void read_nonArrayRoot_rejected() {
    assertThatThrownBy(() -> codec.read("{\"rows\": []}"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void write_thenRead_preservesMatrix() {
    Sheet sheet = Sheet.of(List.of(List.of("Skill", "Category"), List.of("Python", "")));

    String json = codec.write(sheet);

    assertThat(json).isEqualTo("[[\"Skill\",\"Category\"],[\"Python\",\"\"]]");
    assertThat(codec.read(json)).isEqualTo(sheet);
  }
}
