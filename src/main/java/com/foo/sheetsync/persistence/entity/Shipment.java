package com.foo.sheetsync.persistence.entity;

import com.foo.sheetsync.mapping.ShipmentField;
import com.foo.sheetsync.mapping.ShipmentRow;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.time.LocalDateTime;
import java.util.Objects;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 시트 행 하나에 대응하는 배송 레코드.
 *
 * <p>shipmentNo는 생성 후 바뀌지 않는다. sheetTitle/sheetRow/sheetCell은 시트 위치의 캐시일 뿐이며 쓰기 전에 항상 검증해야 한다.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "shipment",
    indexes = {@Index(name = "ix_shipment_order_name", columnList = "order_name")})
public class Shipment {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @NotBlank
  @Size(max = 64)
  @Column(name = "shipment_no", nullable = false, unique = true, length = 64, updatable = false)
  private String shipmentNo;

  @Column(name = "order_name")
  private String orderName;

  @Column(name = "shipment_status")
  private String shipmentStatus;

  @Column(name = "source_location")
  private String sourceLocation;

  @Column(name = "destination_location")
  private String destinationLocation;

  @Column(name = "service_provider")
  private String serviceProvider;

  @Column(name = "plan_date")
  private String planDate;

  @Column(name = "status_delivery")
  private String statusDelivery;

  @Column(name = "insert_time")
  private String insertTime;

  @Column(name = "atd")
  private String atd;

  @Column(name = "ata")
  private String ata;

  @Column(name = "global_pod_cycle_statistic")
  private String globalPodCycleStatistic;

  @Column(name = "period")
  private String period;

  @Column(name = "pm_location")
  private String pmLocation;

  @Column(name = "last_status")
  private String lastStatus;

  @Column(name = "driver_contact_name")
  private String driverContactName;

  @Column(name = "driver_contact_number")
  private String driverContactNumber;

  @Column(name = "remark", length = 1000)
  private String remark;

  @Builder.Default
  @Column(name = "is_deleted", nullable = false)
  private boolean deleted = false;

  @Column(name = "sheet_title")
  private String sheetTitle;

  @Column(name = "sheet_row")
  private Integer sheetRow;

  @Column(name = "sheet_cell", length = 16)
  private String sheetCell;

  @Column(name = "sheet_written_at")
  private LocalDateTime sheetWrittenAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @Column(name = "updated_at")
  private LocalDateTime updatedAt;

  public static Shipment fromRow(ShipmentRow row, LocalDateTime now) {
    Shipment shipment =
        Shipment.builder().shipmentNo(row.shipmentNo()).createdAt(now).updatedAt(now).build();
    shipment.copyFrom(row);
    return shipment;
  }

  /**
   * 시트 행의 값을 반영한다. 식별자와 감사 컬럼을 제외한 컬럼 중 하나라도 달라졌을 때만 updatedAt을 갱신한다.
   *
   * @return 실제로 값이 바뀌었는지 여부
   */
  public boolean applyFrom(ShipmentRow row, LocalDateTime now) {
    if (!differsFrom(row)) {
      return false;
    }
    copyFrom(row);
    this.updatedAt = now;
    return true;
  }

  public boolean differsFrom(ShipmentRow row) {
    for (ShipmentField field : ShipmentField.values()) {
      if (field != ShipmentField.SHIPMENT_NO && !Objects.equals(get(field), row.get(field))) {
        return true;
      }
    }
    return deleted
        || !Objects.equals(sheetTitle, row.sheetTitle())
        || !Objects.equals(sheetRow, row.sheetRow())
        || !Objects.equals(sheetCell, row.sheetCell());
  }

  private void copyFrom(ShipmentRow row) {
    for (ShipmentField field : ShipmentField.values()) {
      if (field != ShipmentField.SHIPMENT_NO) {
        set(field, row.get(field));
      }
    }
    this.deleted = false;
    this.sheetTitle = row.sheetTitle();
    this.sheetRow = row.sheetRow();
    this.sheetCell = row.sheetCell();
  }

  public boolean hasPointer() {
    return sheetTitle != null && sheetRow != null && sheetRow > 0;
  }

  public void movePointer(String title, int row, String cell, LocalDateTime writtenAt) {
    this.sheetTitle = title;
    this.sheetRow = row;
    this.sheetCell = cell;
    this.sheetWrittenAt = writtenAt;
  }

  public String get(ShipmentField field) {
    return switch (field) {
      case SHIPMENT_NO -> shipmentNo;
      case ORDER_NAME -> orderName;
      case SHIPMENT_STATUS -> shipmentStatus;
      case SOURCE_LOCATION -> sourceLocation;
      case DESTINATION_LOCATION -> destinationLocation;
      case SERVICE_PROVIDER -> serviceProvider;
      case PLAN_DATE -> planDate;
      case STATUS_DELIVERY -> statusDelivery;
      case INSERT_TIME -> insertTime;
      case ATD -> atd;
      case ATA -> ata;
      case GLOBAL_POD_CYCLE_STATISTIC -> globalPodCycleStatistic;
      case PERIOD -> period;
      case PM_LOCATION -> pmLocation;
      case LAST_STATUS -> lastStatus;
      case DRIVER_CONTACT_NAME -> driverContactName;
      case DRIVER_CONTACT_NUMBER -> driverContactNumber;
      case REMARK -> remark;
    };
  }

  public void set(ShipmentField field, String value) {
    switch (field) {
      case SHIPMENT_NO -> {
        if (shipmentNo != null && !shipmentNo.equals(value)) {
          throw new IllegalStateException("shipmentNo는 변경할 수 없습니다: " + shipmentNo);
        }
        shipmentNo = value;
      }
      case ORDER_NAME -> orderName = value;
      case SHIPMENT_STATUS -> shipmentStatus = value;
      case SOURCE_LOCATION -> sourceLocation = value;
      case DESTINATION_LOCATION -> destinationLocation = value;
      case SERVICE_PROVIDER -> serviceProvider = value;
      case PLAN_DATE -> planDate = value;
      case STATUS_DELIVERY -> statusDelivery = value;
      case INSERT_TIME -> insertTime = value;
      case ATD -> atd = value;
      case ATA -> ata = value;
      case GLOBAL_POD_CYCLE_STATISTIC -> globalPodCycleStatistic = value;
      case PERIOD -> period = value;
      case PM_LOCATION -> pmLocation = value;
      case LAST_STATUS -> lastStatus = value;
      case DRIVER_CONTACT_NAME -> driverContactName = value;
      case DRIVER_CONTACT_NUMBER -> driverContactNumber = value;
      case REMARK -> remark = value;
    }
  }
}
