package com.foo.sheetsync.sheet;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 프로세스 전역 워크시트 제목 -> 숫자 id 캐시.
 *
 * <p>워크시트를 열거할 때마다 갱신되는 참고용 정보이며, 캐시 미스나 오래된 값이 정확성에 영향을 주어서는 안 된다.
 */
@Slf4j
@Component
public class WorksheetIdRegistry {

  private final Map<String, Integer> idsByTitle = new ConcurrentHashMap<>();

  public void refresh(Collection<WorksheetInfo> worksheets) {
    for (WorksheetInfo info : worksheets) {
      idsByTitle.put(info.title(), info.sheetId());
    }
    log.debug("Refreshed worksheet id registry with {} sheets", worksheets.size());
  }

  public Optional<Integer> findId(String title) {
    return Optional.ofNullable(idsByTitle.get(title));
  }

  public int size() {
    return idsByTitle.size();
  }
}
