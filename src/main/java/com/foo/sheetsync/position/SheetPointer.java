package com.foo.sheetsync.position;

import com.foo.sheetsync.persistence.entity.Shipment;

/** DB에 캐시된 위치 포인터. 검증 전까지는 신뢰할 수 없다. */
public record SheetPointer(String sheetTitle, int row) {

  /** 포인터가 없으면 null. */
  public static SheetPointer of(Shipment shipment) {
    return shipment.hasPointer()
        ? new SheetPointer(shipment.getSheetTitle(), shipment.getSheetRow())
        : null;
  }
}
