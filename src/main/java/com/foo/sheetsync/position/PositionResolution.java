package com.foo.sheetsync.position;

/** 쓰기 전 위치 확정 결과. 예외 대신 값으로 표현해 배치 루프가 다음 레코드로 계속 진행할 수 있게 한다. */
public sealed interface PositionResolution {

  /** 캐시된 포인터가 그대로 유효하다. */
  record Verified(SheetPosition position) implements PositionResolution {}

  /** 포인터가 어긋나 전체 검색으로 새 위치를 찾았다. 호출자는 이 위치를 DB에 다시 저장해야 한다. */
  record Relocated(SheetPosition position) implements PositionResolution {}

  record NotFound(String reason) implements PositionResolution {}

  default boolean isResolved() {
    return !(this instanceof NotFound);
  }

  /** 확정된 위치. 찾지 못했으면 null. */
  default SheetPosition resolvedPosition() {
    if (this instanceof Verified verified) {
      return verified.position();
    }
    if (this instanceof Relocated relocated) {
      return relocated.position();
    }
    return null;
  }
}
