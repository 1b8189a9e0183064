package com.foo.sheetsync.position;

import com.foo.sheetsync.mapping.HeaderNormalizer;
import com.foo.sheetsync.mapping.ShipmentField;
import com.foo.sheetsync.sheet.SpreadsheetDocument;
import com.foo.sheetsync.sheet.Worksheet;
import com.foo.sheetsync.sheet.WorksheetInfo;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 작업 하나 동안 열린 워크시트와 헤더 행을 캐시한다. 같은 시트의 헤더는 작업당 한 번만 읽는다.
 *
 * <p>스레드 안전하지 않다. 작업마다 새로 만든다.
 */
public class WorksheetContext {

  private final SpreadsheetDocument document;
  private final int headerRow;
  private final Map<String, Worksheet> worksheets = new HashMap<>();
  private final Map<String, List<String>> headers = new HashMap<>();
  private List<WorksheetInfo> worksheetInfos;

  public WorksheetContext(SpreadsheetDocument document, int headerRow) {
    this.document = document;
    this.headerRow = headerRow;
  }

  public SpreadsheetDocument document() {
    return document;
  }

  public List<WorksheetInfo> listWorksheets() throws IOException {
    if (worksheetInfos == null) {
      worksheetInfos = document.listWorksheets();
    }
    return worksheetInfos;
  }

  public Worksheet worksheet(String title) throws IOException {
    Worksheet worksheet = worksheets.get(title);
    if (worksheet == null) {
      worksheet = document.worksheet(title);
      worksheets.put(title, worksheet);
    }
    return worksheet;
  }

  public List<String> headers(String title) throws IOException {
    List<String> normalized = headers.get(title);
    if (normalized == null) {
      normalized = HeaderNormalizer.normalizeHeaders(worksheet(title).readRow(headerRow));
      headers.put(title, normalized);
    }
    return normalized;
  }

  /** 필드의 1-based 열 번호. 헤더에 없으면 -1. */
  public int column(String title, ShipmentField field) throws IOException {
    int index = HeaderNormalizer.columnIndex(headers(title), field);
    return index < 0 ? -1 : index + 1;
  }

  public int headerRow() {
    return headerRow;
  }
}
