package com.foo.sheetsync.position;

import java.io.IOException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 포인터 검증과 전체 검색을 묶어 쓰기 대상 위치를 확정한다.
 *
 * <p>검색 결과가 여러 개이면 마지막으로 읽은 위치(가장 뒤 시트의 가장 아래 행)를 사용한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PositionResolver {

  private final PositionVerifier positionVerifier;
  private final FallbackLocator fallbackLocator;

  public PositionResolution resolve(
      WorksheetContext context, SheetPointer pointer, IdentityRef identity) {
    PositionCheck check = positionVerifier.verify(context, pointer, identity);
    if (check instanceof PositionCheck.Verified verified) {
      return new PositionResolution.Verified(verified.position());
    }

    List<SheetPosition> matches;
    try {
      matches = fallbackLocator.locate(context, identity);
    } catch (IOException | RuntimeException e) {
      log.warn("Fallback search for '{}' failed: {}", identity.value(), e.getMessage());
      return new PositionResolution.NotFound("fallback search failed: " + e.getMessage());
    }
    if (matches.isEmpty()) {
      return new PositionResolution.NotFound("identity not found in spreadsheet");
    }

    SheetPosition relocated = matches.get(matches.size() - 1);
    if (matches.size() > 1) {
      log.info(
          "'{}' matched {} rows, using '{}' row {}",
          identity.value(),
          matches.size(),
          relocated.sheetTitle(),
          relocated.row());
    }
    return new PositionResolution.Relocated(relocated);
  }
}
