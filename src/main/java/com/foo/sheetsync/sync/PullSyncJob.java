package com.foo.sheetsync.sync;

import com.foo.sheetsync.config.SheetSyncConfigurationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** 주기적인 pull-sync. 설정이 없으면 경고만 남기고 다음 주기를 기다린다. */
@Slf4j
@Component
@RequiredArgsConstructor
public class PullSyncJob {

  private final ShipmentPullSyncService pullSyncService;

  @Scheduled(cron = "${sheet.sync.pull-cron:0 */10 * * * *}")
  public void run() {
    try {
      pullSyncService.pullSync();
    } catch (SheetSyncConfigurationException e) {
      log.warn("Scheduled shipment sync skipped: {}", e.getMessage());
    } catch (RuntimeException e) {
      log.error("Scheduled shipment sync failed", e);
    }
  }
}
