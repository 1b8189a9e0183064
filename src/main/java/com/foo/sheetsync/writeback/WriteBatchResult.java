package com.foo.sheetsync.writeback;

import com.foo.sheetsync.position.PositionResolution;
import java.util.List;
import java.util.Map;

/**
 * 배치 쓰기의 결과.
 *
 * @param outcomes 입력 순서대로의 쓰기별 결과
 * @param resolutions 레코드 키별 위치 확정 결과. {@link PositionResolution.Relocated}이면 호출자가 포인터를 갱신해야 한다.
 * @param batched 단일 배치 호출로 적용되었는지 여부. false면 셀 단위로 적용되었거나 쓸 셀이 없었다.
 */
public record WriteBatchResult(
    List<WriteOutcome> outcomes, Map<String, PositionResolution> resolutions, boolean batched) {

  public static WriteBatchResult empty() {
    return new WriteBatchResult(List.of(), Map.of(), false);
  }

  public long writtenCount() {
    return outcomes.stream().filter(o -> o.status() == WriteOutcome.Status.WRITTEN).count();
  }

  public List<WriteOutcome> failures() {
    return outcomes.stream().filter(WriteOutcome::isFailed).toList();
  }
}
