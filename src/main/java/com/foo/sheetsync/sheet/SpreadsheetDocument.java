package com.foo.sheetsync.sheet;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/** 여러 워크시트를 가진 스프레드시트 문서 하나. 닫을 때 세션이 종료된다. */
public interface SpreadsheetDocument extends Closeable {

  List<WorksheetInfo> listWorksheets() throws IOException;

  /**
   * 제목으로 워크시트를 연다.
   *
   * @throws IOException 워크시트가 없거나(이름 변경/삭제 포함) 읽을 수 없는 경우
   */
  Worksheet worksheet(String title) throws IOException;

  /**
   * 여러 셀 갱신 요청을 한 번의 호출로 적용한다. 전부 적용되거나 전혀 적용되지 않으며, 실패 시 호출자가 잡아서 개별 호출로 대체해야 한다.
   */
  void batchApply(List<CellFormatRequest> requests) throws IOException;
}
