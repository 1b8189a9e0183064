package com.foo.sheetsync.position;

import com.foo.sheetsync.mapping.SheetTitleFilter;
import com.foo.sheetsync.sheet.Worksheet;
import com.foo.sheetsync.sheet.WorksheetIdRegistry;
import com.foo.sheetsync.sheet.WorksheetInfo;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 캐시된 위치를 믿을 수 없을 때 참여 워크시트 전체에서 식별 값을 찾는다.
 *
 * <p>시트마다 식별 컬럼을 한 번만 읽는다. 읽기에 실패한 시트는 건너뛴다. 결과는 시트 순서, 행 순서대로 정렬된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FallbackLocator {

  private final SheetTitleFilter sheetTitleFilter;
  private final WorksheetIdRegistry worksheetIdRegistry;

  public List<SheetPosition> locate(WorksheetContext context, IdentityRef identity)
      throws IOException {
    List<WorksheetInfo> worksheets = context.listWorksheets();
    worksheetIdRegistry.refresh(worksheets);

    List<SheetPosition> matches = new ArrayList<>();
    for (WorksheetInfo info : worksheets) {
      if (!sheetTitleFilter.participates(info.title())) {
        continue;
      }
      try {
        int column = context.column(info.title(), identity.field());
        if (column < 0) {
          continue;
        }
        Worksheet worksheet = context.worksheet(info.title());
        List<String> values = worksheet.readColumn(column);
        for (int i = context.headerRow(); i < values.size(); i++) {
          if (identity.matches(values.get(i))) {
            matches.add(new SheetPosition(info.title(), info.sheetId(), i + 1, column));
          }
        }
      } catch (IOException | RuntimeException e) {
        log.warn(
            "Failed to search worksheet '{}' for '{}': {}",
            info.title(),
            identity.value(),
            e.getMessage());
      }
    }

    log.debug("Found {} matches for '{}'", matches.size(), identity.value());
    return matches;
  }
}
