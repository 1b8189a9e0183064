package com.foo.sheetsync.archive;

import com.foo.sheetsync.config.SheetSyncConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class ArchiveSweepJob {

  private final ArchiveSweepService archiveSweepService;

  @Scheduled(cron = "${sheet.sync.archive-cron:0 30 1 * * *}")
  public void run() {
    try {
      ArchiveSweepResult result = archiveSweepService.sweep();
      log.info(
          "Scheduled archive sweep completed (matched={}, formatted={})",
          result.matchedRows(),
          result.formattedRows());
    } catch (SheetSyncConfigurationException e) {
      log.warn("Scheduled archive sweep skipped: {}", e.getMessage());
    } catch (RuntimeException e) {
      log.error("Scheduled archive sweep failed", e);
    }
  }
}
