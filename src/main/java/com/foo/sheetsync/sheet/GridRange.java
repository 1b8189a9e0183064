package com.foo.sheetsync.sheet;

import com.foo.sheetsync.util.A1Notation;

/** 0-based, 끝 인덱스 미포함 범위. */
public record GridRange(
    int sheetId, int startRowIndex, int endRowIndex, int startColumnIndex, int endColumnIndex) {

  public GridRange {
    if (startRowIndex < 0 || startColumnIndex < 0) {
      throw new IllegalArgumentException("Range start must be non-negative");
    }
    if (endRowIndex <= startRowIndex || endColumnIndex <= startColumnIndex) {
      throw new IllegalArgumentException("Range must not be empty");
    }
  }

  /** 1-based 행/열의 셀 하나. */
  public static GridRange cell(int sheetId, int row, int col) {
    return new GridRange(sheetId, row - 1, row, col - 1, col);
  }

  /** 1-based 행의 첫 번째 열부터 columnCount개 열. */
  public static GridRange row(int sheetId, int row, int columnCount) {
    return new GridRange(sheetId, row - 1, row, 0, columnCount);
  }

  public boolean isSingleCell() {
    return endRowIndex - startRowIndex == 1 && endColumnIndex - startColumnIndex == 1;
  }

  public String toA1() {
    String start = A1Notation.rowColToA1(startRowIndex + 1, startColumnIndex + 1);
    if (isSingleCell()) {
      return start;
    }
    return start + ":" + A1Notation.rowColToA1(endRowIndex, endColumnIndex);
  }
}
