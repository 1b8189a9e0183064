package com.foo.sheetsync.position;

/** 캐시된 포인터 검증 결과. */
public sealed interface PositionCheck {

  record Verified(SheetPosition position) implements PositionCheck {}

  record NeedsRelocation(String reason) implements PositionCheck {}
}
