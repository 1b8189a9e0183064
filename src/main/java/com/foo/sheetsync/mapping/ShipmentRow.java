package com.foo.sheetsync.mapping;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 시트에서 읽은 행 하나와 그 출처.
 *
 * @param sheetRow 1-based 행 번호
 * @param sheetCell 식별 컬럼의 A1 주소
 */
public record ShipmentRow(
    Map<ShipmentField, String> values, String sheetTitle, int sheetRow, String sheetCell) {

  public ShipmentRow {
    EnumMap<ShipmentField, String> copy = new EnumMap<>(ShipmentField.class);
    copy.putAll(values);
    values = Collections.unmodifiableMap(copy);
  }

  public String get(ShipmentField field) {
    return values.get(field);
  }

  public String shipmentNo() {
    return values.get(ShipmentField.SHIPMENT_NO);
  }
}
