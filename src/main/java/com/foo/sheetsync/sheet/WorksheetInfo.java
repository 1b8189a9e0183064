package com.foo.sheetsync.sheet;

public record WorksheetInfo(String title, int sheetId, int columnCount) {}
