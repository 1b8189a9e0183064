package com.foo.sheetsync.sync;

import com.foo.sheetsync.mapping.ShipmentRow;
import java.util.List;

/**
 * 시트에서 수집한 행 목록. 시트 순서, 행 순서를 유지한다.
 *
 * @param failedSheets 읽기에 실패해 건너뛴 시트 제목
 */
public record CollectedRows(List<ShipmentRow> rows, List<String> readSheets, List<String> failedSheets) {}
