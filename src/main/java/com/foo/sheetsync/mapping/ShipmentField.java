package com.foo.sheetsync.mapping;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 인식하는 업무 컬럼과 정규화된 헤더 텍스트의 고정 매핑.
 *
 * <p>여기에 없는 헤더는 무시된다.
 */
public enum ShipmentField {
  SHIPMENT_NO("shipment no"),
  ORDER_NAME("order name"),
  SHIPMENT_STATUS("shipment status"),
  SOURCE_LOCATION("source location"),
  DESTINATION_LOCATION("destination location"),
  SERVICE_PROVIDER("service provider"),
  PLAN_DATE("plan mos date"),
  STATUS_DELIVERY("status delivery"),
  INSERT_TIME("insert time"),
  ATD("atd"),
  ATA("ata"),
  GLOBAL_POD_CYCLE_STATISTIC("global pod cycle statistic"),
  PERIOD("period"),
  PM_LOCATION("pm location"),
  LAST_STATUS("last status"),
  DRIVER_CONTACT_NAME("driver contact name"),
  DRIVER_CONTACT_NUMBER("driver contact number"),
  REMARK("remark");

  private static final Map<String, ShipmentField> BY_HEADER;

  static {
    Map<String, ShipmentField> byHeader = new HashMap<>();
    for (ShipmentField field : values()) {
      byHeader.put(field.header, field);
    }
    BY_HEADER = Collections.unmodifiableMap(byHeader);
  }

  private final String header;

  ShipmentField(String header) {
    this.header = header;
  }

  /** 정규화된 헤더 텍스트. */
  public String header() {
    return header;
  }

  public static Optional<ShipmentField> fromHeader(String normalizedHeader) {
    return Optional.ofNullable(BY_HEADER.get(normalizedHeader));
  }
}
