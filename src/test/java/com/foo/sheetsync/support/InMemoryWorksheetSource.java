package com.foo.sheetsync.support;

import com.foo.sheetsync.sheet.CellFormatRequest;
import com.foo.sheetsync.sheet.GridRange;
import com.foo.sheetsync.sheet.SpreadsheetDocument;
import com.foo.sheetsync.sheet.TextStyle;
import com.foo.sheetsync.sheet.Worksheet;
import com.foo.sheetsync.sheet.WorksheetInfo;
import com.foo.sheetsync.sheet.WorksheetSource;
import com.foo.sheetsync.util.A1Notation;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** 원격 호출을 기록하고 실패를 주입할 수 있는 메모리 기반 워크시트 소스. */
public class InMemoryWorksheetSource implements WorksheetSource {

  private final Map<String, FakeSheet> sheets = new LinkedHashMap<>();
  private final List<String> calls = new ArrayList<>();
  private final List<List<CellFormatRequest>> batches = new ArrayList<>();
  private final Set<String> failingReads = new HashSet<>();
  private final Set<String> failingCellWrites = new HashSet<>();
  private final Set<String> failingAppends = new HashSet<>();
  private boolean failBatch;
  private boolean failOpen;
  private int nextSheetId = 100;

  @SafeVarargs
  public final FakeSheet addSheet(String title, List<String>... rows) {
    FakeSheet sheet = new FakeSheet(title, nextSheetId++);
    for (List<String> row : rows) {
      sheet.rows.add(new ArrayList<>(row));
    }
    sheets.put(title, sheet);
    return sheet;
  }

  public FakeSheet sheet(String title) {
    return sheets.get(title);
  }

  public void removeSheet(String title) {
    sheets.remove(title);
  }

  public List<String> calls() {
    return List.copyOf(calls);
  }

  public long callCount(String prefix) {
    return calls.stream().filter(call -> call.startsWith(prefix)).count();
  }

  public void clearCalls() {
    calls.clear();
    batches.clear();
  }

  public List<List<CellFormatRequest>> batches() {
    return List.copyOf(batches);
  }

  public void failReadsOf(String title) {
    failingReads.add(title);
  }

  public void failOpen() {
    failOpen = true;
  }

  public void failBatchApply() {
    failBatch = true;
  }

  /** 셀 단위 쓰기에서 해당 셀만 실패시킨다. */
  public void failCellWrite(String title, String cellAddress) {
    failingCellWrites.add(title + "!" + cellAddress);
  }

  public void failAppendTo(String title) {
    failingAppends.add(title);
  }

  public static List<String> row(String... values) {
    return Arrays.asList(values);
  }

  @Override
  public SpreadsheetDocument open(String documentLocator) throws IOException {
    calls.add("open:" + documentLocator);
    if (failOpen) {
      throw new IOException("simulated open failure of " + documentLocator);
    }
    return new Document();
  }

  public static class FakeSheet {

    private final String title;
    private final int sheetId;
    private final List<List<String>> rows = new ArrayList<>();
    private final Map<String, String> notes = new HashMap<>();
    private final Map<String, TextStyle> styles = new HashMap<>();
    private Integer columnCountOverride;

    FakeSheet(String title, int sheetId) {
      this.title = title;
      this.sheetId = sheetId;
    }

    public int sheetId() {
      return sheetId;
    }

    public String value(int row, int col) {
      if (row > rows.size()) {
        return "";
      }
      List<String> values = rows.get(row - 1);
      return col > values.size() || values.get(col - 1) == null ? "" : values.get(col - 1);
    }

    public void set(int row, int col, String value) {
      while (rows.size() < row) {
        rows.add(new ArrayList<>());
      }
      List<String> values = rows.get(row - 1);
      while (values.size() < col) {
        values.add("");
      }
      values.set(col - 1, value);
    }

    /** row 위치에 새 행을 끼워 넣는다. 기존 행은 한 칸씩 아래로 밀린다. */
    public void insertRow(int row, List<String> values) {
      rows.add(row - 1, new ArrayList<>(values));
    }

    public List<List<String>> rows() {
      return rows;
    }

    public String note(String cellAddress) {
      return notes.get(cellAddress);
    }

    public TextStyle style(String cellAddress) {
      return styles.get(cellAddress);
    }

    public void setColumnCount(int columnCount) {
      this.columnCountOverride = columnCount;
    }

    int columnCount() {
      if (columnCountOverride != null) {
        return columnCountOverride;
      }
      return rows.stream().mapToInt(List::size).max().orElse(0);
    }
  }

  private class Document implements SpreadsheetDocument {

    @Override
    public List<WorksheetInfo> listWorksheets() {
      calls.add("listWorksheets");
      List<WorksheetInfo> infos = new ArrayList<>();
      for (FakeSheet sheet : sheets.values()) {
        infos.add(new WorksheetInfo(sheet.title, sheet.sheetId, sheet.columnCount()));
      }
      return infos;
    }

    @Override
    public Worksheet worksheet(String title) throws IOException {
      calls.add("worksheet:" + title);
      FakeSheet sheet = sheets.get(title);
      if (sheet == null) {
        throw new IOException("Worksheet not found: " + title);
      }
      return new FakeWorksheet(sheet);
    }

    @Override
    public void batchApply(List<CellFormatRequest> requests) throws IOException {
      calls.add("batchApply:" + requests.size());
      if (failBatch) {
        throw new IOException("simulated batch failure");
      }
      Map<Integer, FakeSheet> byId = new HashMap<>();
      for (FakeSheet sheet : sheets.values()) {
        byId.put(sheet.sheetId, sheet);
      }
      for (CellFormatRequest request : requests) {
        if (!byId.containsKey(request.range().sheetId())) {
          throw new IOException("Unknown sheet id: " + request.range().sheetId());
        }
      }
      batches.add(List.copyOf(requests));
      for (CellFormatRequest request : requests) {
        FakeSheet sheet = byId.get(request.range().sheetId());
        GridRange range = request.range();
        for (int r = range.startRowIndex() + 1; r <= range.endRowIndex(); r++) {
          for (int c = range.startColumnIndex() + 1; c <= range.endColumnIndex(); c++) {
            String address = A1Notation.rowColToA1(r, c);
            if (request.value() != null) {
              sheet.set(r, c, request.value());
            }
            if (request.note() != null) {
              sheet.notes.put(address, request.note());
            }
            if (request.style() != null) {
              sheet.styles.put(address, request.style());
            }
          }
        }
      }
    }

    @Override
    public void close() {
      calls.add("close");
    }
  }

  private class FakeWorksheet implements Worksheet {

    private final FakeSheet sheet;

    FakeWorksheet(FakeSheet sheet) {
      this.sheet = sheet;
    }

    @Override
    public String title() {
      return sheet.title;
    }

    @Override
    public int sheetId() {
      return sheet.sheetId;
    }

    @Override
    public int columnCount() {
      return sheet.columnCount();
    }

    @Override
    public List<List<String>> readAllValues() throws IOException {
      record("readAllValues:" + sheet.title);
      List<List<String>> copy = new ArrayList<>();
      for (List<String> row : sheet.rows) {
        copy.add(new ArrayList<>(row));
      }
      return copy;
    }

    @Override
    public List<String> readRow(int row) throws IOException {
      record("readRow:" + sheet.title + ":" + row);
      return row > sheet.rows.size() ? List.of() : new ArrayList<>(sheet.rows.get(row - 1));
    }

    @Override
    public List<String> readColumn(int col) throws IOException {
      record("readColumn:" + sheet.title + ":" + col);
      List<String> values = new ArrayList<>();
      for (int r = 1; r <= sheet.rows.size(); r++) {
        values.add(sheet.value(r, col));
      }
      return values;
    }

    @Override
    public String readCell(int row, int col) throws IOException {
      record("readCell:" + sheet.title + ":" + A1Notation.rowColToA1(row, col));
      return sheet.value(row, col);
    }

    @Override
    public void writeCell(int row, int col, String value) throws IOException {
      String address = A1Notation.rowColToA1(row, col);
      calls.add("writeCell:" + sheet.title + ":" + address);
      if (failingCellWrites.contains(sheet.title + "!" + address)) {
        throw new IOException("simulated cell failure at " + address);
      }
      sheet.set(row, col, value == null ? "" : value);
    }

    @Override
    public int appendRow(List<String> values) throws IOException {
      calls.add("appendRow:" + sheet.title);
      if (failingAppends.contains(sheet.title)) {
        throw new IOException("simulated append failure on " + sheet.title);
      }
      sheet.rows.add(new ArrayList<>(values));
      return sheet.rows.size();
    }

    @Override
    public void applyNote(String cellAddress, String text) {
      calls.add("applyNote:" + sheet.title + ":" + cellAddress);
      sheet.notes.put(cellAddress, text);
    }

    @Override
    public void applyFormat(String cellAddressOrRange, TextStyle style) {
      calls.add("applyFormat:" + sheet.title + ":" + cellAddressOrRange);
      sheet.styles.put(cellAddressOrRange, style);
    }

    private void record(String call) throws IOException {
      calls.add(call);
      if (failingReads.contains(sheet.title)) {
        throw new IOException("simulated read failure of " + sheet.title);
      }
    }
  }
}
