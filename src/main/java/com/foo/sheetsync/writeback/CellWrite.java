package com.foo.sheetsync.writeback;

import com.foo.sheetsync.mapping.ShipmentField;
import com.foo.sheetsync.position.IdentityRef;
import com.foo.sheetsync.position.SheetPointer;

/**
 * 레코드 하나의 필드 하나를 시트에 쓰는 요청.
 *
 * @param recordKey 결과를 레코드별로 묶는 키 (shipment no)
 * @param identity 위치를 검증하고 찾을 때 비교할 식별 값
 * @param pointer 캐시된 위치. 없으면 null
 */
public record CellWrite(
    String recordKey,
    IdentityRef identity,
    SheetPointer pointer,
    ShipmentField field,
    String value) {}
