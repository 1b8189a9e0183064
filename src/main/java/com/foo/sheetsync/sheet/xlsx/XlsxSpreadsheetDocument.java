package com.foo.sheetsync.sheet.xlsx;

import com.foo.sheetsync.sheet.CellFormatRequest;
import com.foo.sheetsync.sheet.GridRange;
import com.foo.sheetsync.sheet.SpreadsheetDocument;
import com.foo.sheetsync.sheet.TextStyle;
import com.foo.sheetsync.sheet.Worksheet;
import com.foo.sheetsync.sheet.WorksheetInfo;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.common.usermodel.HyperlinkType;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.ClientAnchor;
import org.apache.poi.ss.usermodel.Comment;
import org.apache.poi.ss.usermodel.CreationHelper;
import org.apache.poi.ss.usermodel.Drawing;
import org.apache.poi.ss.usermodel.Hyperlink;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFFont;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.openxmlformats.schemas.spreadsheetml.x2006.main.CTSheet;

/**
 * 메모리에 올린 워크북 위의 문서 세션. 변경 사항은 세션을 닫을 때 파일에 다시 기록된다.
 *
 * <p>워크시트 id는 .xlsx 패키지에 저장된 sheetId를 사용하므로 시트 순서가 바뀌어도 유지된다.
 */
@Slf4j
class XlsxSpreadsheetDocument implements SpreadsheetDocument {

  private final Path path;
  private final XSSFWorkbook workbook;
  private final Map<StyleKey, XSSFCellStyle> styleCache = new HashMap<>();
  private boolean dirty;
  private boolean closed;

  XlsxSpreadsheetDocument(Path path, XSSFWorkbook workbook) {
    this.path = path;
    this.workbook = workbook;
  }

  @Override
  public List<WorksheetInfo> listWorksheets() throws IOException {
    ensureOpen();
    List<WorksheetInfo> infos = new ArrayList<>();
    for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
      XSSFSheet sheet = workbook.getSheetAt(i);
      infos.add(new WorksheetInfo(sheet.getSheetName(), sheetIdAt(i), columnCount(sheet)));
    }
    return infos;
  }

  @Override
  public Worksheet worksheet(String title) throws IOException {
    ensureOpen();
    XSSFSheet sheet = workbook.getSheet(title);
    if (sheet == null) {
      throw new IOException("Worksheet not found: " + title);
    }
    return new XlsxWorksheet(this, sheet, sheetIdAt(workbook.getSheetIndex(sheet)));
  }

  @Override
  public void batchApply(List<CellFormatRequest> requests) throws IOException {
    ensureOpen();
    Map<Integer, XSSFSheet> sheetsById = new HashMap<>();
    for (int i = 0; i < workbook.getNumberOfSheets(); i++) {
      sheetsById.put(sheetIdAt(i), workbook.getSheetAt(i));
    }

    // 하나라도 적용할 수 없으면 아무것도 바꾸지 않는다.
    for (CellFormatRequest request : requests) {
      if (!sheetsById.containsKey(request.range().sheetId())) {
        throw new IOException(
            "Batch rejected: unknown sheetId " + request.range().sheetId());
      }
    }

    for (CellFormatRequest request : requests) {
      XSSFSheet sheet = sheetsById.get(request.range().sheetId());
      GridRange range = request.range();
      for (int r = range.startRowIndex(); r < range.endRowIndex(); r++) {
        for (int c = range.startColumnIndex(); c < range.endColumnIndex(); c++) {
          Cell cell = cellAt(sheet, r, c);
          if (request.value() != null) {
            cell.setCellValue(request.value());
          }
          if (request.note() != null) {
            applyNote(sheet, cell, request.note());
          }
          if (request.style() != null) {
            applyStyle(cell, request.style());
          }
        }
      }
    }
    markDirty();
    log.debug("Applied batch of {} requests to {}", requests.size(), path.getFileName());
  }

  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    try {
      if (dirty) {
        Path tmp = Files.createTempFile(parentDirectory(), ".sheet-sync-", ".xlsx");
        try (OutputStream out = Files.newOutputStream(tmp)) {
          workbook.write(out);
        }
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        log.debug("Saved spreadsheet document {}", path);
      }
    } finally {
      workbook.close();
    }
  }

  void markDirty() {
    dirty = true;
  }

  void ensureOpen() throws IOException {
    if (closed) {
      throw new IOException("Spreadsheet session is closed");
    }
  }

  Cell cellAt(XSSFSheet sheet, int rowIndex, int columnIndex) {
    Row row = sheet.getRow(rowIndex);
    if (row == null) {
      row = sheet.createRow(rowIndex);
    }
    Cell cell = row.getCell(columnIndex);
    if (cell == null) {
      cell = row.createCell(columnIndex);
    }
    return cell;
  }

  void applyNote(XSSFSheet sheet, Cell cell, String text) {
    CreationHelper factory = workbook.getCreationHelper();
    Comment existing = cell.getCellComment();
    if (existing != null) {
      existing.setString(factory.createRichTextString(text));
      return;
    }
    Drawing<?> drawing = sheet.createDrawingPatriarch();
    ClientAnchor anchor = factory.createClientAnchor();
    anchor.setCol1(cell.getColumnIndex());
    anchor.setCol2(cell.getColumnIndex() + 2);
    anchor.setRow1(cell.getRowIndex());
    anchor.setRow2(cell.getRowIndex() + 3);
    Comment comment = drawing.createCellComment(anchor);
    comment.setString(factory.createRichTextString(text));
    cell.setCellComment(comment);
  }

  void applyStyle(Cell cell, TextStyle style) {
    XSSFCellStyle base = (XSSFCellStyle) cell.getCellStyle();
    StyleKey key = new StyleKey(base.getIndex(), style.fontSize(), style.foregroundColor());
    XSSFCellStyle resolved = styleCache.computeIfAbsent(key, k -> deriveStyle(base, style));
    cell.setCellStyle(resolved);

    if (style.linkUri() != null) {
      Hyperlink link = workbook.getCreationHelper().createHyperlink(HyperlinkType.URL);
      link.setAddress(style.linkUri());
      cell.setHyperlink(link);
    }
  }

  private XSSFCellStyle deriveStyle(XSSFCellStyle base, TextStyle style) {
    XSSFFont baseFont = base.getFont();
    XSSFFont font = workbook.createFont();
    font.setFontName(baseFont.getFontName());
    font.setBold(baseFont.getBold());
    font.setItalic(baseFont.getItalic());
    font.setUnderline(baseFont.getUnderline());
    font.setFontHeightInPoints(
        style.fontSize() != null ? style.fontSize().shortValue() : baseFont.getFontHeightInPoints());
    if (style.foregroundColor() != null) {
      font.setColor(toColor(style.foregroundColor()));
    } else if (baseFont.getXSSFColor() != null) {
      font.setColor(baseFont.getXSSFColor());
    }

    XSSFCellStyle derived = workbook.createCellStyle();
    derived.cloneStyleFrom(base);
    derived.setFont(font);
    return derived;
  }

  private XSSFColor toColor(TextStyle.Rgb rgb) {
    byte[] bytes = {
      (byte) Math.round(rgb.red() * 255),
      (byte) Math.round(rgb.green() * 255),
      (byte) Math.round(rgb.blue() * 255)
    };
    return new XSSFColor(bytes, null);
  }

  private int sheetIdAt(int index) {
    CTSheet ctSheet = workbook.getCTWorkbook().getSheets().getSheetArray(index);
    return (int) ctSheet.getSheetId();
  }

  static int columnCount(XSSFSheet sheet) {
    int max = 0;
    for (Row row : sheet) {
      max = Math.max(max, row.getLastCellNum());
    }
    return max;
  }

  private Path parentDirectory() {
    Path parent = path.toAbsolutePath().getParent();
    return Objects.requireNonNull(parent, "document has no parent directory");
  }

  private record StyleKey(short baseIndex, Integer fontSize, TextStyle.Rgb color) {}
}
