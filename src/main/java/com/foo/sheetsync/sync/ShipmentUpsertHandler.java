package com.foo.sheetsync.sync;

import com.foo.sheetsync.mapping.ShipmentRow;
import com.foo.sheetsync.persistence.entity.Shipment;
import com.foo.sheetsync.persistence.repository.ShipmentRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 중복 제거된 시트 행을 식별자 기준으로 upsert 하고, 이번 입력에 없는 활성 레코드를 soft-delete 한다.
 *
 * <p>건수는 upsert 전 스냅샷과의 집합 차이로 계산한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ShipmentUpsertHandler {

  private final ShipmentRepository shipmentRepository;
  private final Clock clock;

  @Transactional
  public PullSyncResult upsertAll(Collection<ShipmentRow> incoming) {
    LocalDateTime now = LocalDateTime.now(clock);

    Map<String, Shipment> snapshot = new HashMap<>();
    for (Shipment shipment : shipmentRepository.findAll()) {
      snapshot.put(shipment.getShipmentNo(), shipment);
    }

    int created = 0;
    int updated = 0;
    List<Shipment> toInsert = new ArrayList<>();
    Set<String> incomingKeys = new HashSet<>();

    for (ShipmentRow row : incoming) {
      incomingKeys.add(row.shipmentNo());
      Shipment existing = snapshot.get(row.shipmentNo());
      if (existing == null) {
        toInsert.add(Shipment.fromRow(row, now));
        created++;
      } else if (existing.applyFrom(row, now)) {
        // 변경된 엔티티만 dirty 상태가 되어 flush 시 UPDATE 된다.
        updated++;
      }
    }
    shipmentRepository.saveAll(toInsert);

    List<String> vanished = new ArrayList<>();
    for (Shipment shipment : snapshot.values()) {
      if (!shipment.isDeleted() && !incomingKeys.contains(shipment.getShipmentNo())) {
        vanished.add(shipment.getShipmentNo());
      }
    }
    int softDeleted = vanished.isEmpty() ? 0 : shipmentRepository.softDeleteAll(vanished, now);

    log.info(
        "Upserted {} shipments (created={}, updated={}, softDeleted={})",
        incoming.size(),
        created,
        updated,
        softDeleted);
    return new PullSyncResult(created, updated, softDeleted, incoming.size());
  }
}
