package com.foo.sheetsync.sync;

import com.foo.sheetsync.config.SheetSyncProperties;
import com.foo.sheetsync.mapping.HeaderNormalizer;
import com.foo.sheetsync.mapping.ShipmentField;
import com.foo.sheetsync.mapping.ShipmentRow;
import com.foo.sheetsync.sheet.SpreadsheetDocument;
import com.foo.sheetsync.sheet.Worksheet;
import com.foo.sheetsync.sheet.WorksheetInfo;
import com.foo.sheetsync.util.A1Notation;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 참여 워크시트의 데이터 행을 수집한다.
 *
 * <p>시트당 원격 읽기는 한 번뿐이다. 읽기에 실패한 시트는 로그를 남기고 건너뛰며 나머지 시트는 계속 처리한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SheetRowCollector {

  private final SheetSyncProperties properties;

  public CollectedRows collect(SpreadsheetDocument document, List<WorksheetInfo> worksheets) {
    List<ShipmentRow> rows = new ArrayList<>();
    List<String> readSheets = new ArrayList<>();
    List<String> failedSheets = new ArrayList<>();

    for (WorksheetInfo info : worksheets) {
      List<List<String>> values;
      long start = System.nanoTime();
      try {
        Worksheet worksheet = document.worksheet(info.title());
        values = worksheet.readAllValues();
      } catch (IOException | RuntimeException e) {
        log.warn("Failed to read worksheet '{}', skipping it: {}", info.title(), e.getMessage());
        failedSheets.add(info.title());
        continue;
      }
      log.debug(
          "Read {} rows from '{}' in {} ms",
          values.size(),
          info.title(),
          (System.nanoTime() - start) / 1_000_000);
      readSheets.add(info.title());
      rows.addAll(toRows(info.title(), values));
    }

    return new CollectedRows(rows, readSheets, failedSheets);
  }

  List<ShipmentRow> toRows(String sheetTitle, List<List<String>> values) {
    int headerIndex = properties.getHeaderRow() - 1;
    if (values.size() <= headerIndex) {
      return List.of();
    }

    List<String> headers = HeaderNormalizer.normalizeHeaders(values.get(headerIndex));
    int identityColumn = HeaderNormalizer.columnIndex(headers, ShipmentField.SHIPMENT_NO);
    if (identityColumn < 0) {
      log.warn("Worksheet '{}' has no '{}' column, skipping it", sheetTitle,
          ShipmentField.SHIPMENT_NO.header());
      return List.of();
    }

    List<ShipmentRow> rows = new ArrayList<>();
    for (int i = properties.getDataStartRow() - 1; i < values.size(); i++) {
      List<String> rowValues = values.get(i);
      if (HeaderNormalizer.isBlankRow(rowValues)) {
        continue;
      }
      Map<ShipmentField, String> mapped = HeaderNormalizer.mapRow(headers, rowValues);
      if (mapped.get(ShipmentField.SHIPMENT_NO) == null) {
        continue;
      }
      int rowNumber = i + 1;
      rows.add(
          new ShipmentRow(
              mapped,
              sheetTitle,
              rowNumber,
              A1Notation.rowColToA1(rowNumber, identityColumn + 1)));
    }
    return rows;
  }
}
