package com.foo.sheetsync.writeback;

import com.foo.sheetsync.config.SheetSyncConfigurationException;
import com.foo.sheetsync.config.SheetSyncProperties;
import com.foo.sheetsync.mapping.HeaderNormalizer;
import com.foo.sheetsync.mapping.ShipmentField;
import com.foo.sheetsync.persistence.entity.Shipment;
import com.foo.sheetsync.persistence.repository.ShipmentRepository;
import com.foo.sheetsync.position.IdentityRef;
import com.foo.sheetsync.position.PositionResolution;
import com.foo.sheetsync.position.SheetPointer;
import com.foo.sheetsync.position.SheetPosition;
import com.foo.sheetsync.position.WorksheetContext;
import com.foo.sheetsync.sheet.SpreadsheetDocument;
import com.foo.sheetsync.sheet.WorksheetSource;
import com.foo.sheetsync.writeback.WriteBackRequest.LookupBy;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 배송 레코드 필드를 갱신하고 같은 값을 시트의 해당 셀에 다시 쓴다.
 *
 * <p>일치하는 레코드가 없으면 새 레코드를 만들고 fallback 워크시트에 행을 추가한다. 시트 쓰기의 부분 실패는 결과에 기록되며 예외로 전파되지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ShipmentWriteBackService {

  private static final int UNKNOWN_PREFIX_MAX_LENGTH = 32;

  private final SheetSyncProperties properties;
  private final ShipmentRepository shipmentRepository;
  private final WorksheetSource worksheetSource;
  private final WriteBackRequestParser requestParser;
  private final DerivedWritePolicy derivedWritePolicy;
  private final WriteBackBatcher writeBackBatcher;
  private final FallbackSheetAppender fallbackSheetAppender;
  private final Clock clock;

  @Transactional
  public WriteBackResult writeBack(String requestJson) {
    return writeBack(requestParser.parse(requestJson));
  }

  @Transactional
  public WriteBackResult writeBack(WriteBackRequest request) {
    requestParser.validate(request);
    if (request.updates().containsKey(ShipmentField.SHIPMENT_NO)) {
      throw new IllegalArgumentException("shipment no는 변경할 수 없습니다.");
    }
    String identityKey = HeaderNormalizer.normalizeCell(request.identityKey());
    if (!request.skipRemote() && !properties.hasDocumentLocator()) {
      throw new SheetSyncConfigurationException("sheet.sync.document-locator is not configured");
    }

    Map<ShipmentField, String> updates = derivedWritePolicy.withDerived(normalized(request.updates()));
    LocalDateTime now = LocalDateTime.now(clock);

    List<Shipment> matched = findMatches(request.lookupBy(), identityKey);
    if (matched.isEmpty()) {
      return create(request, identityKey, updates, now);
    }
    return update(request, matched, updates, now);
  }

  private WriteBackResult update(
      WriteBackRequest request,
      List<Shipment> matched,
      Map<ShipmentField, String> updates,
      LocalDateTime now) {
    List<CellWrite> writes = new ArrayList<>();
    for (Shipment shipment : matched) {
      // order name 은 DB 조회에만 쓰고, 시트 위치는 항상 shipment no 로 확인한다.
      IdentityRef identity = new IdentityRef(ShipmentField.SHIPMENT_NO, shipment.getShipmentNo());
      SheetPointer pointer = SheetPointer.of(shipment);
      updates.forEach(
          (field, value) ->
              writes.add(new CellWrite(shipment.getShipmentNo(), identity, pointer, field, value)));
      applyUpdates(shipment, updates, now);
    }
    log.info(
        "Updated {} shipments by {} '{}' with fields {}",
        matched.size(),
        request.lookupBy(),
        request.identityKey(),
        updates.keySet());

    Shipment first = matched.get(0);
    if (request.skipRemote()) {
      return resultFor(first, matched.size(), false, false, true, List.of());
    }

    WriteBatchResult batch;
    try (SpreadsheetDocument document = worksheetSource.open(properties.getDocumentLocator())) {
      batch = writeBackBatcher.apply(new WorksheetContext(document, properties.getHeaderRow()), writes);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to open spreadsheet document", e);
    }

    boolean corrected = false;
    for (Shipment shipment : matched) {
      PositionResolution resolution = batch.resolutions().get(shipment.getShipmentNo());
      if (resolution instanceof PositionResolution.Relocated relocated) {
        SheetPosition position = relocated.position();
        log.info(
            "Corrected position of '{}' from '{}' row {} to '{}' row {}",
            shipment.getShipmentNo(),
            shipment.getSheetTitle(),
            shipment.getSheetRow(),
            position.sheetTitle(),
            position.row());
        shipment.movePointer(position.sheetTitle(), position.row(), position.cellAddress(), now);
        corrected = true;
      } else if (resolution instanceof PositionResolution.Verified) {
        shipment.setSheetWrittenAt(now);
      } else if (resolution != null) {
        log.warn(
            "Shipment '{}' not written to sheet: {}",
            shipment.getShipmentNo(),
            ((PositionResolution.NotFound) resolution).reason());
      }
    }
    return resultFor(first, matched.size(), false, corrected, false, batch.outcomes());
  }

  private WriteBackResult create(
      WriteBackRequest request,
      String identityKey,
      Map<ShipmentField, String> updates,
      LocalDateTime now) {
    String shipmentNo =
        request.lookupBy() == LookupBy.SHIPMENT_NO
            ? identityKey
            : generateUnknownShipmentNo(identityKey);

    Shipment shipment = Shipment.builder().shipmentNo(shipmentNo).createdAt(now).updatedAt(now).build();
    shipment.set(request.lookupBy().field(), identityKey);
    updates.forEach(shipment::set);
    if (shipment.getInsertTime() == null) {
      shipment.setInsertTime(derivedWritePolicy.currentInsertTime());
    }

    List<WriteOutcome> writes = List.of();
    if (!request.skipRemote()) {
      try (SpreadsheetDocument document = worksheetSource.open(properties.getDocumentLocator())) {
        writes =
            appendToFallbackSheet(
                new WorksheetContext(document, properties.getHeaderRow()), shipment, now);
      } catch (IOException e) {
        throw new UncheckedIOException("Failed to open spreadsheet document", e);
      }
    }

    shipmentRepository.save(shipment);
    log.info(
        "Created shipment '{}' for {} '{}' (sheet={}, row={})",
        shipmentNo,
        request.lookupBy(),
        identityKey,
        shipment.getSheetTitle(),
        shipment.getSheetRow());
    return resultFor(shipment, 0, true, false, request.skipRemote(), writes);
  }

  /** 추가에 실패하면 레코드는 포인터 없이 남기고 실패를 결과로 돌려준다. */
  private List<WriteOutcome> appendToFallbackSheet(
      WorksheetContext context, Shipment shipment, LocalDateTime now) {
    Map<ShipmentField, String> rowValues = new EnumMap<>(ShipmentField.class);
    for (ShipmentField field : ShipmentField.values()) {
      if (shipment.get(field) != null) {
        rowValues.put(field, shipment.get(field));
      }
    }
    try {
      Optional<SheetPosition> appended = fallbackSheetAppender.append(context, rowValues);
      appended.ifPresent(
          position ->
              shipment.movePointer(
                  position.sheetTitle(), position.row(), position.cellAddress(), now));
      return List.of();
    } catch (IOException | RuntimeException e) {
      log.warn(
          "Failed to append '{}' to fallback worksheet, keeping it without a sheet position: {}",
          shipment.getShipmentNo(),
          e.getMessage());
      return List.of(
          new WriteOutcome(
              shipment.getShipmentNo(),
              ShipmentField.SHIPMENT_NO,
              shipment.getShipmentNo(),
              properties.getFallbackSheetTitle(),
              null,
              WriteOutcome.Status.FAILED,
              "append failed: " + e.getMessage()));
    }
  }

  private List<Shipment> findMatches(LookupBy lookupBy, String identityKey) {
    if (lookupBy == LookupBy.ORDER_NAME) {
      return shipmentRepository.findActiveByOrderName(identityKey);
    }
    return shipmentRepository.findByShipmentNo(identityKey).map(List::of).orElse(List.of());
  }

  private static void applyUpdates(
      Shipment shipment, Map<ShipmentField, String> updates, LocalDateTime now) {
    boolean changed = false;
    for (Map.Entry<ShipmentField, String> entry : updates.entrySet()) {
      if (!Objects.equals(shipment.get(entry.getKey()), entry.getValue())) {
        shipment.set(entry.getKey(), entry.getValue());
        changed = true;
      }
    }
    if (changed) {
      shipment.setUpdatedAt(now);
    }
  }

  private static Map<ShipmentField, String> normalized(Map<ShipmentField, String> updates) {
    Map<ShipmentField, String> result = new EnumMap<>(ShipmentField.class);
    updates.forEach((field, value) -> result.put(field, HeaderNormalizer.normalizeCell(value)));
    return result;
  }

  private static WriteBackResult resultFor(
      Shipment shipment,
      int updatedCount,
      boolean created,
      boolean corrected,
      boolean skipped,
      List<WriteOutcome> writes) {
    return WriteBackResult.builder()
        .updatedCount(updatedCount)
        .created(created)
        .shipmentNo(shipment.getShipmentNo())
        .sheetTitle(shipment.getSheetTitle())
        .sheetRow(shipment.getSheetRow())
        .sheetCell(shipment.getSheetCell())
        .correctedPosition(corrected)
        .sheetUpdatesSkipped(skipped)
        .writes(writes)
        .build();
  }

  /** "UNKNOWN-<영숫자 외 문자를 '-'로 바꾼 order name 앞 32자>-<hex 6자리>" */
  static String generateUnknownShipmentNo(String orderName) {
    String sanitized =
        orderName.replaceAll("[^\\p{IsAlphabetic}\\p{IsDigit}]+", "-").replaceAll("^-+|-+$", "");
    if (sanitized.isEmpty()) {
      sanitized = "order";
    }
    if (sanitized.length() > UNKNOWN_PREFIX_MAX_LENGTH) {
      sanitized = sanitized.substring(0, UNKNOWN_PREFIX_MAX_LENGTH);
    }
    String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 6);
    return "UNKNOWN-" + sanitized + "-" + suffix;
  }
}
