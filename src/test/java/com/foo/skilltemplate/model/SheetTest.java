package com.foo.skilltemplate.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SheetTest {

  @Test
  void of_normalizesMissingAndNonStringCells() {
    List<Object> row = new ArrayList<>(Arrays.asList("Python", null, 3, true, new BigDecimal("2.5")));
    row.add(List.of("nested"));
    row.add(Map.of("k", "v"));

    Sheet sheet = Sheet.of(List.of(row));

    assertThat(sheet.row(0)).containsExactly("Python", "", "3", "true", "2.5", "", "");
  }

  @Test
  void of_nullRow_becomesEmptyRow() {
    List<List<Object>> matrix = new ArrayList<>();
    matrix.add(null);

    assertThat(Sheet.of(matrix).row(0)).isEmpty();
  }

  @Test
  void cell_outsideRaggedRow_isEmpty() {
    Sheet sheet = Sheet.of(List.of(List.of("Skill", "Mandatory"), List.of("Python")));

    assertThat(sheet.cell(1, 1)).isEmpty();
    assertThat(sheet.cell(5, 0)).isEmpty();
    assertThat(sheet.columnCount()).isEqualTo(2);
  }

  @Test
  void toMatrix_isDefensiveCopy() {
    Sheet sheet = Sheet.of(List.of(List.of("Skill"), List.of("Python")));

    List<List<String>> matrix = sheet.toMatrix();
    matrix.get(1).set(0, "Changed");

    assertThat(sheet.cell(1, 0)).isEqualTo("Python");
  }

  @Test
  void rows_areUnmodifiable() {
    Sheet sheet = Sheet.of(List.of(List.of("Skill")));

    assertThatThrownBy(() -> sheet.getRows().add(List.of("x")))
        .isInstanceOf(UnsupportedOperationException.class);
    assertThatThrownBy(() -> sheet.row(0).set(0, "x"))
        .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test
  void withHeaderRowIndex_outsideSheet_rejected() {
    Sheet sheet = Sheet.of(List.of(List.of("Skill")));

    assertThatThrownBy(() -> sheet.withHeaderRowIndex(1))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(Sheet.empty().withHeaderRowIndex(0).headerRow()).isEmpty();
  }

  @Test
  void headerRowIndex_limitedToFirstTenRows() {
    List<List<String>> rows = new ArrayList<>();
    for (int i = 0; i < 20; i++) {
      rows.add(List.of("row " + i));
    }
    Sheet sheet = Sheet.of(rows);

    assertThat(sheet.withHeaderRowIndex(9).headerRow()).containsExactly("row 9");
    assertThatThrownBy(() -> sheet.withHeaderRowIndex(15))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("first 10 row(s)");
    assertThatThrownBy(() -> sheet.withRows(rows, Sheet.MAX_HEADER_ROWS))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
