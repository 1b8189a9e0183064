package com.foo.sheetsync.sheet;

import java.io.IOException;
import java.util.List;

/**
 * 문서 안의 워크시트(탭) 하나. 행/열 번호는 모두 1-based이다.
 *
 * <p>비어 있는 셀은 빈 문자열로 읽힌다. 각 행의 길이는 마지막으로 값이 있는 셀까지이다.
 */
public interface Worksheet {

  String title();

  int sheetId();

  int columnCount();

  /** 헤더와 데이터 행을 한 번의 호출로 읽는다. */
  List<List<String>> readAllValues() throws IOException;

  List<String> readRow(int row) throws IOException;

  List<String> readColumn(int col) throws IOException;

  String readCell(int row, int col) throws IOException;

  void writeCell(int row, int col, String value) throws IOException;

  /** 마지막 행 다음에 행을 추가하고 추가된 행 번호를 반환한다. */
  int appendRow(List<String> values) throws IOException;

  void applyNote(String cellAddress, String text) throws IOException;

  /** @param cellAddressOrRange "B4" 또는 "A4:K4" 형태의 주소 */
  void applyFormat(String cellAddressOrRange, TextStyle style) throws IOException;
}
