package com.foo.sheetsync.writeback;

import com.foo.sheetsync.config.SheetSyncProperties;
import com.foo.sheetsync.position.PositionResolution;
import com.foo.sheetsync.position.PositionResolver;
import com.foo.sheetsync.position.SheetPosition;
import com.foo.sheetsync.position.WorksheetContext;
import com.foo.sheetsync.sheet.CellFormatRequest;
import com.foo.sheetsync.sheet.GridRange;
import com.foo.sheetsync.sheet.TextStyle;
import com.foo.sheetsync.sheet.Worksheet;
import com.foo.sheetsync.util.A1Notation;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 셀 쓰기 목록을 위치 확정 후 하나의 배치 요청으로 적용한다.
 *
 * <p>각 셀에는 값, 메모, 글꼴/링크 서식이 함께 적용된다. 배치 호출이 실패하면 셀 단위 호출로 대체하며, 한 셀의 실패가 다른 셀에 영향을 주지 않는다.
 * 위치를 찾지 못한 레코드의 쓰기는 실패로 기록되고 나머지 쓰기는 계속 진행된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WriteBackBatcher {

  private final SheetSyncProperties properties;
  private final PositionResolver positionResolver;

  public WriteBatchResult apply(WorksheetContext context, List<CellWrite> writes) {
    if (writes.isEmpty()) {
      return WriteBatchResult.empty();
    }

    Map<String, PositionResolution> resolutions = new LinkedHashMap<>();
    WriteOutcome[] outcomes = new WriteOutcome[writes.size()];
    Map<CellKey, PendingCell> pending = new LinkedHashMap<>();

    for (int i = 0; i < writes.size(); i++) {
      CellWrite write = writes.get(i);
      PositionResolution resolution =
          resolutions.computeIfAbsent(
              write.recordKey(),
              key -> positionResolver.resolve(context, write.pointer(), write.identity()));

      SheetPosition position = resolution.resolvedPosition();
      if (position == null) {
        outcomes[i] =
            WriteOutcome.failed(write, null, null, ((PositionResolution.NotFound) resolution).reason());
        continue;
      }

      int column;
      try {
        column = context.column(position.sheetTitle(), write.field());
      } catch (IOException | RuntimeException e) {
        outcomes[i] =
            WriteOutcome.failed(write, position.sheetTitle(), null, "header read failed: " + e.getMessage());
        continue;
      }
      if (column < 0) {
        outcomes[i] =
            WriteOutcome.failed(
                write,
                position.sheetTitle(),
                null,
                "column '" + write.field().header() + "' not found");
        continue;
      }

      CellKey key = new CellKey(position.sheetTitle(), position.row(), column);
      String address = A1Notation.rowColToA1(position.row(), column);
      if (pending.containsKey(key)) {
        outcomes[i] = WriteOutcome.duplicate(write, position.sheetTitle(), address);
        continue;
      }
      pending.put(key, new PendingCell(i, write, position, column, address));
    }

    boolean batched = false;
    if (!pending.isEmpty()) {
      batched = submitBatch(context, pending.values());
      for (PendingCell cell : pending.values()) {
        outcomes[cell.index()] =
            batched
                ? WriteOutcome.written(cell.write(), cell.position().sheetTitle(), cell.address())
                : writeSingleCell(context, cell);
      }
    }

    WriteBatchResult result = new WriteBatchResult(List.of(outcomes), resolutions, batched);
    log.info(
        "Wrote {} cells for {} records ({} failed, batched={})",
        result.writtenCount(),
        resolutions.size(),
        result.failures().size(),
        batched);
    return result;
  }

  private boolean submitBatch(WorksheetContext context, Iterable<PendingCell> cells) {
    List<CellFormatRequest> requests = new ArrayList<>();
    for (PendingCell cell : cells) {
      requests.add(
          CellFormatRequest.builder()
              .range(GridRange.cell(cell.position().sheetId(), cell.position().row(), cell.column()))
              .value(cellValue(cell.write()))
              .note(properties.getNoteText())
              .style(cellStyle())
              .build());
    }

    try {
      context.document().batchApply(requests);
      return true;
    } catch (IOException | RuntimeException e) {
      log.warn(
          "Batch update of {} cells failed, falling back to per-cell writes: {}",
          requests.size(),
          e.getMessage());
      return false;
    }
  }

  private WriteOutcome writeSingleCell(WorksheetContext context, PendingCell cell) {
    String title = cell.position().sheetTitle();
    try {
      Worksheet worksheet = context.worksheet(title);
      worksheet.writeCell(cell.position().row(), cell.column(), cellValue(cell.write()));
      worksheet.applyNote(cell.address(), properties.getNoteText());
      worksheet.applyFormat(cell.address(), cellStyle());
      return WriteOutcome.written(cell.write(), title, cell.address());
    } catch (IOException | RuntimeException e) {
      log.warn("Failed to write cell '{}'!{}: {}", title, cell.address(), e.getMessage());
      return WriteOutcome.failed(cell.write(), title, cell.address(), e.getMessage());
    }
  }

  private static String cellValue(CellWrite write) {
    return write.value() == null ? "" : write.value();
  }

  private TextStyle cellStyle() {
    return TextStyle.annotated(properties.getNoteFontSize(), properties.getNoteLinkUri());
  }

  private record CellKey(String sheetTitle, int row, int column) {}

  private record PendingCell(
      int index, CellWrite write, SheetPosition position, int column, String address) {}
}
