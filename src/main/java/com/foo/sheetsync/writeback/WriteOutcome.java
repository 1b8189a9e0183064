package com.foo.sheetsync.writeback;

import com.foo.sheetsync.mapping.ShipmentField;

/**
 * 쓰기 하나의 결과.
 *
 * @param cellAddress 실제로 쓴(또는 쓰려던) 셀의 A1 주소. 위치를 찾지 못했으면 null
 * @param error 실패 사유. 성공이면 null
 */
public record WriteOutcome(
    String recordKey,
    ShipmentField field,
    String value,
    String sheetTitle,
    String cellAddress,
    Status status,
    String error) {

  public enum Status {
    WRITTEN,
    FAILED,
    /** 같은 작업 안에서 이미 다른 쓰기가 같은 셀을 대상으로 했다. */
    SKIPPED_DUPLICATE
  }

  static WriteOutcome written(CellWrite write, String sheetTitle, String cellAddress) {
    return new WriteOutcome(
        write.recordKey(), write.field(), write.value(), sheetTitle, cellAddress, Status.WRITTEN, null);
  }

  static WriteOutcome failed(CellWrite write, String sheetTitle, String cellAddress, String error) {
    return new WriteOutcome(
        write.recordKey(), write.field(), write.value(), sheetTitle, cellAddress, Status.FAILED, error);
  }

  static WriteOutcome duplicate(CellWrite write, String sheetTitle, String cellAddress) {
    return new WriteOutcome(
        write.recordKey(),
        write.field(),
        write.value(),
        sheetTitle,
        cellAddress,
        Status.SKIPPED_DUPLICATE,
        null);
  }

  public boolean isFailed() {
    return status == Status.FAILED;
  }
}
