package com.foo.sheetsync.config;

import com.foo.sheetsync.sheet.WorksheetSource;
import com.foo.sheetsync.sheet.xlsx.XlsxWorksheetSource;
import java.time.Clock;
import java.util.concurrent.Executor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class SheetSyncConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public Clock sheetSyncClock(SheetSyncProperties properties) {
    return Clock.system(properties.getZoneId());
  }

  @Bean
  @ConditionalOnMissingBean(WorksheetSource.class)
  public WorksheetSource worksheetSource() {
    return new XlsxWorksheetSource();
  }

  /** pull-sync 전용 단일 워커. 요청 처리 스레드를 막지 않도록 분리한다. */
  @Bean(name = "sheetSyncExecutor")
  public Executor sheetSyncExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setQueueCapacity(4);
    executor.setThreadNamePrefix("sheet-sync-");
    executor.initialize();
    return executor;
  }
}
