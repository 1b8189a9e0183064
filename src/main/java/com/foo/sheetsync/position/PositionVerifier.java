package com.foo.sheetsync.position;

import com.foo.sheetsync.sheet.Worksheet;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 캐시된 포인터의 식별 셀이 아직 같은 값을 담고 있는지 확인한다.
 *
 * <p>시트가 이름이 바뀌었거나 셀을 읽을 수 없는 경우도 검증 실패로 취급하며 예외를 던지지 않는다.
 */
@Slf4j
@Component
public class PositionVerifier {

  public PositionCheck verify(WorksheetContext context, SheetPointer pointer, IdentityRef identity) {
    if (pointer == null) {
      return new PositionCheck.NeedsRelocation("no cached position");
    }
    if (pointer.row() <= context.headerRow()) {
      return new PositionCheck.NeedsRelocation("cached row points at the header");
    }

    try {
      Worksheet worksheet = context.worksheet(pointer.sheetTitle());
      int column = context.column(pointer.sheetTitle(), identity.field());
      if (column < 0) {
        return new PositionCheck.NeedsRelocation(
            "worksheet has no '" + identity.field().header() + "' column");
      }
      String actual = worksheet.readCell(pointer.row(), column);
      if (!identity.matches(actual)) {
        log.warn(
            "Position drift at '{}' row {}: expected '{}' but found '{}'",
            pointer.sheetTitle(),
            pointer.row(),
            identity.value(),
            actual);
        return new PositionCheck.NeedsRelocation("identity mismatch");
      }
      return new PositionCheck.Verified(
          new SheetPosition(pointer.sheetTitle(), worksheet.sheetId(), pointer.row(), column));
    } catch (IOException | RuntimeException e) {
      log.warn(
          "Failed to verify position '{}' row {}: {}",
          pointer.sheetTitle(),
          pointer.row(),
          e.getMessage());
      return new PositionCheck.NeedsRelocation("read failed: " + e.getMessage());
    }
  }
}
