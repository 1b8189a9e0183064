package com.foo.sheetsync.archive;

import java.time.LocalDate;
import java.util.List;

/**
 * 보관 처리 결과.
 *
 * @param matchedRows 기준 날짜보다 오래되고 종료 상태인 행 수
 * @param formattedRows 실제로 서식이 적용된 행 수. 열이 없는 시트이거나 배치 적용에 실패한 행은 제외된다.
 */
public record ArchiveSweepResult(
    int thresholdDays,
    LocalDate thresholdDate,
    int matchedRows,
    int formattedRows,
    List<String> sheetsProcessed,
    List<AffectedRow> affectedRows) {

  /**
   * @param planDate 시트에 입력된 원문 그대로의 날짜
   */
  public record AffectedRow(
      String sheet, int row, String planDate, String status, boolean formatted) {}
}
