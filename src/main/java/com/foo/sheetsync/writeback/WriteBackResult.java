package com.foo.sheetsync.writeback;

import java.util.List;
import lombok.Builder;

/**
 * write-back 결과. 시트 쓰기 일부가 실패해도 예외 대신 writes 에 실패가 기록된다.
 *
 * @param updatedCount 갱신된 기존 레코드 수. 새로 만든 경우 0
 * @param created 일치하는 레코드가 없어 새로 만들었는지 여부
 * @param correctedPosition 캐시된 위치가 어긋나 다시 찾은 위치로 포인터를 고쳤는지 여부
 * @param sheetUpdatesSkipped 요청에 따라 시트 쓰기를 건너뛰었는지 여부
 */
@Builder
public record WriteBackResult(
    int updatedCount,
    boolean created,
    String shipmentNo,
    String sheetTitle,
    Integer sheetRow,
    String sheetCell,
    boolean correctedPosition,
    boolean sheetUpdatesSkipped,
    List<WriteOutcome> writes) {

  public WriteBackResult {
    writes = writes == null ? List.of() : List.copyOf(writes);
  }

  public List<WriteOutcome> failedWrites() {
    return writes.stream().filter(WriteOutcome::isFailed).toList();
  }
}
