package com.foo.sheetsync.sheet.xlsx;

import com.foo.sheetsync.sheet.TextStyle;
import com.foo.sheetsync.sheet.Worksheet;
import com.foo.sheetsync.util.A1Notation;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.xssf.usermodel.XSSFSheet;

class XlsxWorksheet implements Worksheet {

  private static final ThreadLocal<DataFormatter> DATA_FORMATTER =
      ThreadLocal.withInitial(DataFormatter::new);

  private final XlsxSpreadsheetDocument document;
  private final XSSFSheet sheet;
  private final int sheetId;

  XlsxWorksheet(XlsxSpreadsheetDocument document, XSSFSheet sheet, int sheetId) {
    this.document = document;
    this.sheet = sheet;
    this.sheetId = sheetId;
  }

  @Override
  public String title() {
    return sheet.getSheetName();
  }

  @Override
  public int sheetId() {
    return sheetId;
  }

  @Override
  public int columnCount() {
    return XlsxSpreadsheetDocument.columnCount(sheet);
  }

  @Override
  public List<List<String>> readAllValues() throws IOException {
    document.ensureOpen();
    List<List<String>> values = new ArrayList<>();
    int lastNonEmpty = -1;
    for (int r = 0; r <= sheet.getLastRowNum(); r++) {
      List<String> rowValues = valuesOf(sheet.getRow(r));
      values.add(rowValues);
      if (!rowValues.isEmpty()) {
        lastNonEmpty = r;
      }
    }
    return new ArrayList<>(values.subList(0, lastNonEmpty + 1));
  }

  @Override
  public List<String> readRow(int row) throws IOException {
    document.ensureOpen();
    return valuesOf(sheet.getRow(row - 1));
  }

  @Override
  public List<String> readColumn(int col) throws IOException {
    document.ensureOpen();
    List<String> values = new ArrayList<>();
    int lastNonEmpty = -1;
    for (int r = 0; r <= sheet.getLastRowNum(); r++) {
      Row row = sheet.getRow(r);
      String value = row == null ? "" : format(row.getCell(col - 1));
      values.add(value);
      if (!value.isEmpty()) {
        lastNonEmpty = r;
      }
    }
    return new ArrayList<>(values.subList(0, lastNonEmpty + 1));
  }

  @Override
  public String readCell(int row, int col) throws IOException {
    document.ensureOpen();
    Row sheetRow = sheet.getRow(row - 1);
    return sheetRow == null ? "" : format(sheetRow.getCell(col - 1));
  }

  @Override
  public void writeCell(int row, int col, String value) throws IOException {
    document.ensureOpen();
    document.cellAt(sheet, row - 1, col - 1).setCellValue(value);
    document.markDirty();
  }

  @Override
  public int appendRow(List<String> values) throws IOException {
    int rowNumber = readAllValues().size() + 1;
    for (int c = 0; c < values.size(); c++) {
      String value = values.get(c);
      if (value != null && !value.isEmpty()) {
        document.cellAt(sheet, rowNumber - 1, c).setCellValue(value);
      }
    }
    document.markDirty();
    return rowNumber;
  }

  @Override
  public void applyNote(String cellAddress, String text) throws IOException {
    document.ensureOpen();
    int[] rowCol = A1Notation.a1ToRowCol(cellAddress);
    document.applyNote(sheet, document.cellAt(sheet, rowCol[0] - 1, rowCol[1] - 1), text);
    document.markDirty();
  }

  @Override
  public void applyFormat(String cellAddressOrRange, TextStyle style) throws IOException {
    document.ensureOpen();
    String[] parts = cellAddressOrRange.split(":", 2);
    int[] start = A1Notation.a1ToRowCol(parts[0]);
    int[] end = parts.length > 1 ? A1Notation.a1ToRowCol(parts[1]) : start;
    for (int r = start[0]; r <= end[0]; r++) {
      for (int c = start[1]; c <= end[1]; c++) {
        document.applyStyle(document.cellAt(sheet, r - 1, c - 1), style);
      }
    }
    document.markDirty();
  }

  private List<String> valuesOf(Row row) {
    List<String> values = new ArrayList<>();
    if (row == null) {
      return values;
    }
    int lastNonEmpty = -1;
    for (int c = 0; c < row.getLastCellNum(); c++) {
      String value = format(row.getCell(c));
      values.add(value);
      if (!value.isEmpty()) {
        lastNonEmpty = c;
      }
    }
    return new ArrayList<>(values.subList(0, lastNonEmpty + 1));
  }

  private String format(Cell cell) {
    if (cell == null) {
      return "";
    }
    return DATA_FORMATTER.get().formatCellValue(cell);
  }
}
