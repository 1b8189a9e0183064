package com.foo.sheetsync.config;

import java.time.ZoneId;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "sheet.sync")
public class SheetSyncProperties {

  /** 스프레드시트 문서 위치. POI 어댑터에서는 .xlsx 파일 경로. */
  private String documentLocator = "";

  /** 헤더 행 번호 (1-indexed). */
  private int headerRow = 1;

  /** 데이터 시작 행 번호 (1-indexed). */
  private int dataStartRow = 2;

  private Set<String> excludedSheets =
      new LinkedHashSet<>(List.of("pm location & contact pic", "other"));

  /** 비어 있지 않으면 이 접두어로 시작하는 시트만 동기화하고 제외 목록은 무시한다. */
  private String sheetPrefix = "";

  private String fallbackSheetTitle = "Unknown";

  private String noteText = "Modified by Fast Tracker";
  private String noteLinkUri = "https://idnsc.dpdns.org/admin";
  private int noteFontSize = 8;

  private Set<String> arrivalStatuses = new LinkedHashSet<>(List.of("ARRIVED AT SITE", "POD"));
  private Set<String> departureStatuses =
      new LinkedHashSet<>(List.of("ON THE WAY", "TRANSPORTING FROM WH"));

  private int archiveThresholdDays = 7;
  private String archiveTerminalStatus = "POD";
  private int archiveFlushSize = 90;

  private String timeZone = "Asia/Jakarta";

  public boolean hasDocumentLocator() {
    return documentLocator != null && !documentLocator.isBlank();
  }

  public boolean hasSheetPrefix() {
    return sheetPrefix != null && !sheetPrefix.isEmpty();
  }

  public ZoneId getZoneId() {
    return ZoneId.of(timeZone);
  }
}
