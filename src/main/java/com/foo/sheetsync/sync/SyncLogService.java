package com.foo.sheetsync.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.foo.sheetsync.persistence.entity.SyncLog;
import com.foo.sheetsync.persistence.repository.SyncLogRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/** pull-sync 실행 이력을 남긴다. 동기화 트랜잭션이 롤백되어도 이력은 남도록 별도 트랜잭션을 사용한다. */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncLogService {

  private static final int MAX_ERROR_LENGTH = 2000;

  private final SyncLogRepository syncLogRepository;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public SyncLog recordSuccess(PullSyncResult result, Collection<String> shipmentNumbers, String message) {
    List<String> sorted = List.copyOf(new TreeSet<>(shipmentNumbers));
    SyncLog syncLog =
        SyncLog.builder()
            .status(SyncLog.Status.SUCCESS)
            .syncedCount(sorted.size())
            .createdCount(result.created())
            .updatedCount(result.updated())
            .softDeletedCount(result.softDeleted())
            .shipmentNumbersJson(sorted.isEmpty() ? null : toJson(sorted))
            .message(message)
            .createdAt(LocalDateTime.now(clock))
            .build();
    return syncLogRepository.save(syncLog);
  }

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public SyncLog recordFailure(String message, Throwable error) {
    SyncLog syncLog =
        SyncLog.builder()
            .status(SyncLog.Status.FAILED)
            .message(message)
            .errorMessage(truncate(String.valueOf(error.getMessage())))
            .createdAt(LocalDateTime.now(clock))
            .build();
    return syncLogRepository.save(syncLog);
  }

  @Transactional(readOnly = true)
  public Optional<SyncLog> latest() {
    return syncLogRepository.findTopByOrderByCreatedAtDescIdDesc();
  }

  private String toJson(List<String> shipmentNumbers) {
    try {
      return objectMapper.writeValueAsString(shipmentNumbers);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize synced shipment numbers", e);
    }
  }

  private String truncate(String text) {
    return text.length() <= MAX_ERROR_LENGTH ? text : text.substring(0, MAX_ERROR_LENGTH);
  }
}
