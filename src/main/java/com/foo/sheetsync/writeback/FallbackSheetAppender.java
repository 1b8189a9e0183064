package com.foo.sheetsync.writeback;

import com.foo.sheetsync.mapping.HeaderNormalizer;
import com.foo.sheetsync.mapping.SheetTitleFilter;
import com.foo.sheetsync.mapping.ShipmentField;
import com.foo.sheetsync.position.SheetPosition;
import com.foo.sheetsync.position.WorksheetContext;
import com.foo.sheetsync.sheet.Worksheet;
import com.foo.sheetsync.sheet.WorksheetInfo;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** 시트 출처가 없는 레코드를 fallback 워크시트 끝에 한 행으로 추가한다. */
@Slf4j
@Component
@RequiredArgsConstructor
public class FallbackSheetAppender {

  private final SheetTitleFilter sheetTitleFilter;

  /**
   * @return 추가된 행의 식별 셀 위치. fallback 워크시트나 식별 컬럼이 없으면 empty
   */
  public Optional<SheetPosition> append(WorksheetContext context, Map<ShipmentField, String> values)
      throws IOException {
    Optional<WorksheetInfo> target =
        context.listWorksheets().stream()
            .filter(info -> sheetTitleFilter.isFallbackSheet(info.title()))
            .findFirst();
    if (target.isEmpty()) {
      log.warn("Fallback worksheet not found, skipping append");
      return Optional.empty();
    }

    String title = target.get().title();
    List<String> headers = context.headers(title);
    int identityColumn = HeaderNormalizer.columnIndex(headers, ShipmentField.SHIPMENT_NO);
    if (identityColumn < 0) {
      log.warn("Fallback worksheet '{}' has no '{}' column, skipping append", title,
          ShipmentField.SHIPMENT_NO.header());
      return Optional.empty();
    }

    List<String> row = new ArrayList<>(Collections.nCopies(headers.size(), ""));
    values.forEach(
        (field, value) -> {
          int column = HeaderNormalizer.columnIndex(headers, field);
          if (column >= 0 && value != null) {
            row.set(column, value);
          }
        });

    Worksheet worksheet = context.worksheet(title);
    int rowNumber = worksheet.appendRow(row);
    log.info("Appended '{}' to worksheet '{}' row {}",
        values.get(ShipmentField.SHIPMENT_NO), title, rowNumber);
    return Optional.of(new SheetPosition(title, worksheet.sheetId(), rowNumber, identityColumn + 1));
  }
}
