package com.foo.sheetsync.archive;

import com.foo.sheetsync.archive.ArchiveSweepResult.AffectedRow;
import com.foo.sheetsync.config.SheetSyncConfigurationException;
import com.foo.sheetsync.config.SheetSyncProperties;
import com.foo.sheetsync.mapping.HeaderNormalizer;
import com.foo.sheetsync.mapping.SheetTitleFilter;
import com.foo.sheetsync.mapping.ShipmentField;
import com.foo.sheetsync.sheet.CellFormatRequest;
import com.foo.sheetsync.sheet.GridRange;
import com.foo.sheetsync.sheet.SpreadsheetDocument;
import com.foo.sheetsync.sheet.TextStyle;
import com.foo.sheetsync.sheet.WorksheetIdRegistry;
import com.foo.sheetsync.sheet.WorksheetInfo;
import com.foo.sheetsync.sheet.WorksheetSource;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 기준 날짜보다 오래되고 종료 상태인 행을 흐린 글꼴로 표시한다.
 *
 * <p>서식 요청은 모아서 일정 개수마다 한 번에 적용하고, 마지막에 남은 요청을 적용한다. 배치 적용에 실패한 행은 formatted=false 로 보고된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ArchiveSweepService {

  static final TextStyle.Rgb ARCHIVE_TEXT_COLOR = new TextStyle.Rgb(0.6, 0.6, 0.6);

  private final SheetSyncProperties properties;
  private final WorksheetSource worksheetSource;
  private final WorksheetIdRegistry worksheetIdRegistry;
  private final SheetTitleFilter sheetTitleFilter;
  private final PlanDateParser planDateParser;
  private final Clock clock;

  public ArchiveSweepResult sweep() {
    return sweep(properties.getArchiveThresholdDays());
  }

  public ArchiveSweepResult sweep(int thresholdDays) {
    if (thresholdDays < 0) {
      throw new IllegalArgumentException("thresholdDays는 0 이상이어야 합니다: " + thresholdDays);
    }
    if (!properties.hasDocumentLocator()) {
      throw new SheetSyncConfigurationException("sheet.sync.document-locator is not configured");
    }

    LocalDate thresholdDate = LocalDate.now(clock).minusDays(thresholdDays);
    log.info(
        "Marking rows for archiving where '{}' is before {} and '{}' is {}",
        ShipmentField.PLAN_DATE.header(),
        thresholdDate,
        ShipmentField.STATUS_DELIVERY.header(),
        properties.getArchiveTerminalStatus());

    try (SpreadsheetDocument document = worksheetSource.open(properties.getDocumentLocator())) {
      List<WorksheetInfo> worksheets = document.listWorksheets();
      worksheetIdRegistry.refresh(worksheets);
      List<WorksheetInfo> participating =
          worksheets.stream().filter(info -> sheetTitleFilter.participates(info.title())).toList();

      Sweep sweep = new Sweep(document);
      for (WorksheetInfo info : participating) {
        sweepWorksheet(sweep, document, info, thresholdDate);
      }
      sweep.flush();

      int formatted = (int) sweep.affected.stream().filter(AffectedRow::formatted).count();
      log.info(
          "Matched {} rows for archiving across {} worksheets; formatted {} rows",
          sweep.affected.size(),
          participating.size(),
          formatted);
      return new ArchiveSweepResult(
          thresholdDays,
          thresholdDate,
          sweep.affected.size(),
          formatted,
          participating.stream().map(WorksheetInfo::title).toList(),
          List.copyOf(sweep.affected));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to open spreadsheet document", e);
    }
  }

  private void sweepWorksheet(
      Sweep sweep, SpreadsheetDocument document, WorksheetInfo info, LocalDate thresholdDate) {
    List<List<String>> values;
    try {
      values = document.worksheet(info.title()).readAllValues();
    } catch (IOException | RuntimeException e) {
      log.warn("Failed to read worksheet '{}', skipping it: {}", info.title(), e.getMessage());
      return;
    }

    int headerIndex = properties.getHeaderRow() - 1;
    if (values.size() <= headerIndex) {
      return;
    }
    List<String> headers = HeaderNormalizer.normalizeHeaders(values.get(headerIndex));
    int dateColumn = HeaderNormalizer.columnIndex(headers, ShipmentField.PLAN_DATE);
    int statusColumn = HeaderNormalizer.columnIndex(headers, ShipmentField.STATUS_DELIVERY);
    if (dateColumn < 0 || statusColumn < 0) {
      log.warn(
          "Worksheet '{}' has no '{}' or '{}' column, skipping it",
          info.title(),
          ShipmentField.PLAN_DATE.header(),
          ShipmentField.STATUS_DELIVERY.header());
      return;
    }

    for (int i = properties.getDataStartRow() - 1; i < values.size(); i++) {
      List<String> row = values.get(i);
      if (HeaderNormalizer.isBlankRow(row)) {
        continue;
      }
      String planCell = cell(row, dateColumn);
      String statusCell = cell(row, statusColumn);
      if (planCell.isBlank()) {
        continue;
      }
      Optional<LocalDate> planDate = planDateParser.parse(planCell);
      if (planDate.isEmpty() || !planDate.get().isBefore(thresholdDate)) {
        continue;
      }
      if (!statusCell.strip().equalsIgnoreCase(properties.getArchiveTerminalStatus())) {
        continue;
      }

      int rowNumber = i + 1;
      if (info.columnCount() <= 0) {
        sweep.affected.add(new AffectedRow(info.title(), rowNumber, planCell, statusCell, false));
        continue;
      }
      sweep.add(
          new AffectedRow(info.title(), rowNumber, planCell, statusCell, true),
          CellFormatRequest.builder()
              .range(GridRange.row(info.sheetId(), rowNumber, info.columnCount()))
              .style(archiveStyle())
              .build());
    }
  }

  private TextStyle archiveStyle() {
    return new TextStyle(
        properties.getNoteFontSize(), properties.getNoteLinkUri(), ARCHIVE_TEXT_COLOR);
  }

  private static String cell(List<String> row, int column) {
    return column < row.size() && row.get(column) != null ? row.get(column) : "";
  }

  /** 한 번의 보관 처리 동안 쌓인 서식 요청과 대상 행. */
  private class Sweep {

    private final SpreadsheetDocument document;
    private final List<AffectedRow> affected = new ArrayList<>();
    private final List<CellFormatRequest> pending = new ArrayList<>();
    private final List<Integer> pendingRows = new ArrayList<>();

    private Sweep(SpreadsheetDocument document) {
      this.document = document;
    }

    void add(AffectedRow row, CellFormatRequest request) {
      pendingRows.add(affected.size());
      affected.add(row);
      pending.add(request);
      if (pending.size() >= properties.getArchiveFlushSize()) {
        flush();
      }
    }

    void flush() {
      if (pending.isEmpty()) {
        return;
      }
      try {
        document.batchApply(List.copyOf(pending));
        log.debug("Applied {} archive format requests", pending.size());
      } catch (IOException | RuntimeException e) {
        log.warn("Failed to apply {} archive format requests: {}", pending.size(), e.getMessage());
        for (int index : pendingRows) {
          AffectedRow row = affected.get(index);
          affected.set(
              index, new AffectedRow(row.sheet(), row.row(), row.planDate(), row.status(), false));
        }
      }
      pending.clear();
      pendingRows.clear();
    }
  }
}
