package com.foo.skilltemplate.service.content;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.foo.skilltemplate.model.Sheet;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 저장소에 보관하는 템플릿 내용(JSON 2차원 배열)과 {@link Sheet} 사이의 변환.
 *
 * <p>셀에 문자열이 아닌 값이 들어 있어도 실패하지 않는다. 숫자와 불리언은 문자열 표현으로, null과 배열/객체는 빈 문자열로 바꾼다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SheetJsonCodec {

  private final ObjectMapper objectMapper;

  public Sheet read(String json) {
    if (json == null || json.isBlank()) {
      return Sheet.empty();
    }

    JsonNode root;
    try {
      root = objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("템플릿 내용 JSON 형식이 올바르지 않습니다.", e);
    }
    if (!root.isArray()) {
      throw new IllegalArgumentException("템플릿 내용은 행 배열이어야 합니다.");
    }

    List<List<String>> rows = new ArrayList<>(root.size());
    for (JsonNode rowNode : root) {
      rows.add(readRow(rowNode, rows.size()));
    }
    return Sheet.of(rows);
  }

  public String write(Sheet sheet) {
    try {
      return objectMapper.writeValueAsString(sheet.toMatrix());
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Cannot serialize sheet content", e);
    }
  }

  private List<String> readRow(JsonNode rowNode, int rowIndex) {
    if (!rowNode.isArray()) {
      log.debug("Row {} is not an array, stored as empty row", rowIndex);
      return List.of();
    }
    List<String> cells = new ArrayList<>(rowNode.size());
    for (JsonNode cell : rowNode) {
      cells.add(readCell(cell, rowIndex));
    }
    return cells;
  }

  private String readCell(JsonNode cell, int rowIndex) {
    if (cell.isNull() || cell.isMissingNode()) {
      return "";
    }
    if (cell.isContainerNode()) {
      log.debug("Nested value in row {} coerced to empty cell", rowIndex);
      return "";
    }
    return cell.asText();
  }
}
