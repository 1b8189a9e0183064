package com.foo.sheetsync.position;

import com.foo.sheetsync.util.A1Notation;

/**
 * 워크시트 안에서 레코드의 식별 셀 위치.
 *
 * @param row 1-based 행 번호
 * @param identityColumn 식별 컬럼의 1-based 열 번호
 */
public record SheetPosition(String sheetTitle, int sheetId, int row, int identityColumn) {

  public String cellAddress() {
    return A1Notation.rowColToA1(row, identityColumn);
  }
}
