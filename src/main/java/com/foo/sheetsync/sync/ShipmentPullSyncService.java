package com.foo.sheetsync.sync;

import com.foo.sheetsync.config.SheetSyncConfigurationException;
import com.foo.sheetsync.config.SheetSyncProperties;
import com.foo.sheetsync.mapping.SheetTitleFilter;
import com.foo.sheetsync.mapping.ShipmentRow;
import com.foo.sheetsync.sheet.SpreadsheetDocument;
import com.foo.sheetsync.sheet.WorksheetIdRegistry;
import com.foo.sheetsync.sheet.WorksheetInfo;
import com.foo.sheetsync.sheet.WorksheetSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * 참여 워크시트 전체를 배송 테이블로 미러링한다.
 *
 * <ol>
 *   <li>워크시트 열거 후 제목 필터 적용
 *   <li>시트별 한 번의 읽기로 행 수집 (실패한 시트는 건너뜀)
 *   <li>식별자 기준 중복 제거, 나중에 읽은 행이 이긴다
 *   <li>변경이 있을 때만 갱신하는 upsert 및 사라진 식별자 soft-delete
 * </ol>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ShipmentPullSyncService {

  private final SheetSyncProperties properties;
  private final WorksheetSource worksheetSource;
  private final WorksheetIdRegistry worksheetIdRegistry;
  private final SheetTitleFilter sheetTitleFilter;
  private final SheetRowCollector rowCollector;
  private final ShipmentUpsertHandler upsertHandler;
  private final SyncLogService syncLogService;

  public PullSyncResult pullSync() {
    if (!properties.hasDocumentLocator()) {
      throw new SheetSyncConfigurationException(
          "sheet.sync.document-locator is not configured");
    }

    log.info("Starting shipment sheet sync");
    try {
      PullSyncResult result = doPullSync();
      log.info(
          "Shipment sheet sync completed (created={}, updated={}, softDeleted={}, total={})",
          result.created(),
          result.updated(),
          result.softDeleted(),
          result.total());
      return result;
    } catch (RuntimeException e) {
      log.error("Shipment sheet sync failed", e);
      syncLogService.recordFailure("Shipment sheet sync failed", e);
      throw e;
    }
  }

  /** 요청 처리 스레드를 막지 않도록 전용 워커에서 pull-sync 를 실행한다. */
  @Async("sheetSyncExecutor")
  public CompletableFuture<PullSyncResult> pullSyncAsync() {
    return CompletableFuture.completedFuture(pullSync());
  }

  private PullSyncResult doPullSync() {
    CollectedRows collected;
    try (SpreadsheetDocument document = worksheetSource.open(properties.getDocumentLocator())) {
      List<WorksheetInfo> worksheets = document.listWorksheets();
      worksheetIdRegistry.refresh(worksheets);

      List<WorksheetInfo> participating =
          worksheets.stream().filter(info -> sheetTitleFilter.participates(info.title())).toList();
      log.info(
          "Found {} of {} worksheets to sync: {}",
          participating.size(),
          worksheets.size(),
          preview(participating));

      collected = rowCollector.collect(document, participating);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to open spreadsheet document", e);
    }

    if (!collected.failedSheets().isEmpty()) {
      log.warn("Skipped unreadable worksheets: {}", collected.failedSheets());
    }

    if (collected.rows().isEmpty()) {
      log.info("No shipment rows found to sync");
      syncLogService.recordSuccess(PullSyncResult.empty(), List.of(), "No shipment rows found");
      return PullSyncResult.empty();
    }

    Map<String, ShipmentRow> deduped = new LinkedHashMap<>();
    for (ShipmentRow row : collected.rows()) {
      deduped.put(row.shipmentNo(), row);
    }
    log.debug("Deduplicated {} rows into {} shipments", collected.rows().size(), deduped.size());

    PullSyncResult result = upsertHandler.upsertAll(deduped.values());
    syncLogService.recordSuccess(
        result,
        deduped.keySet(),
        "Synced %d worksheets (%d skipped)"
            .formatted(collected.readSheets().size(), collected.failedSheets().size()));
    return result;
  }

  private String preview(List<WorksheetInfo> worksheets) {
    List<String> titles = worksheets.stream().map(WorksheetInfo::title).toList();
    if (titles.size() <= 3) {
      return String.join(", ", titles);
    }
    return String.join(", ", titles.subList(0, 3)) + ", ...";
  }
}
