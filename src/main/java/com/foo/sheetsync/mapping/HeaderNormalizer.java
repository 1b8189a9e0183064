package com.foo.sheetsync.mapping;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

public final class HeaderNormalizer {

  private static final Pattern SEPARATORS = Pattern.compile("[._]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private HeaderNormalizer() {}

  /** 소문자로 바꾸고 '.', '_'를 공백으로 치환한 뒤 연속 공백을 하나로 줄인다. "Shipment_No." -> "shipment no" */
  public static String normalizeHeader(Object raw) {
    if (raw == null) {
      return "";
    }
    String text = SEPARATORS.matcher(raw.toString().toLowerCase()).replaceAll(" ");
    return WHITESPACE.matcher(text.strip()).replaceAll(" ");
  }

  public static List<String> normalizeHeaders(List<?> headers) {
    List<String> normalized = new ArrayList<>(headers.size());
    for (Object header : headers) {
      normalized.add(normalizeHeader(header));
    }
    return normalized;
  }

  /**
   * 셀 값을 정리한다. 앞뒤 공백을 제거하고 비어 있으면 null을 반환한다.
   *
   * <p>날짜처럼 보이는 텍스트도 원문 그대로 전달한다. 날짜 해석은 이후 단계의 책임이다.
   */
  public static String normalizeCell(String value) {
    if (value == null) {
      return null;
    }
    String trimmed = value.strip();
    return trimmed.isEmpty() ? null : trimmed;
  }

  /** 정규화된 헤더 목록에서 필드의 0-based 열 인덱스를 찾는다. 없으면 -1. */
  public static int columnIndex(List<String> normalizedHeaders, ShipmentField field) {
    return normalizedHeaders.indexOf(field.header());
  }

  /**
   * 데이터 행 하나를 필드 -> 값 맵으로 변환한다. 모든 필드가 키로 존재하며 헤더가 없거나 셀이 비면 값은 null이다.
   */
  public static Map<ShipmentField, String> mapRow(List<String> normalizedHeaders, List<String> row) {
    Map<ShipmentField, String> mapped = new EnumMap<>(ShipmentField.class);
    for (ShipmentField field : ShipmentField.values()) {
      int column = columnIndex(normalizedHeaders, field);
      // 같은 헤더가 두 번 나오면 첫 번째 열을 사용한다.
      String value = column >= 0 && column < row.size() ? normalizeCell(row.get(column)) : null;
      mapped.put(field, value);
    }
    return mapped;
  }

  public static boolean isBlankRow(List<String> row) {
    for (String cell : row) {
      if (cell != null && !cell.isBlank()) {
        return false;
      }
    }
    return true;
  }
}
