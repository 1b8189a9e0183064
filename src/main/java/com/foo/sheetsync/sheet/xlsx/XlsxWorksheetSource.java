package com.foo.sheetsync.sheet.xlsx;

import com.foo.sheetsync.sheet.SpreadsheetDocument;
import com.foo.sheetsync.sheet.WorksheetSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;

/** .xlsx 파일 하나를 스프레드시트 문서 하나로 다루는 어댑터. */
@Slf4j
public class XlsxWorksheetSource implements WorksheetSource {

  @Override
  public SpreadsheetDocument open(String documentLocator) throws IOException {
    if (documentLocator == null || documentLocator.isBlank()) {
      throw new IllegalArgumentException("documentLocator is required");
    }
    Path path = Path.of(documentLocator.trim());
    if (!Files.isRegularFile(path)) {
      throw new IOException("Spreadsheet document not found: " + path);
    }
    log.debug("Opening spreadsheet document {}", path);
    return new XlsxSpreadsheetDocument(path, SecureWorkbookLoader.load(path));
  }
}
