package com.foo.sheetsync.writeback;

import com.foo.sheetsync.config.SheetSyncProperties;
import com.foo.sheetsync.mapping.ShipmentField;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * 필드 갱신에 딸린 파생 타임스탬프 쓰기를 계산한다.
 *
 * <ul>
 *   <li>status delivery 가 도착 상태이면 ata, 출발 상태이면 atd 를 현재 시각으로 찍는다.
 *   <li>pm location 을 갱신하면 insert time 을 현재 시각으로 찍는다.
 * </ul>
 *
 * 호출자가 같은 필드를 명시적으로 보냈다면 그 값을 유지한다.
 */
@Component
public class DerivedWritePolicy {

  static final DateTimeFormatter STATUS_STAMP_FORMAT =
      DateTimeFormatter.ofPattern("M/d/yyyy H:mm:ss", Locale.ENGLISH);
  static final DateTimeFormatter INSERT_TIME_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss", Locale.ENGLISH);

  private final Clock clock;
  private final Set<String> arrivalStatuses;
  private final Set<String> departureStatuses;

  public DerivedWritePolicy(SheetSyncProperties properties, Clock clock) {
    this.clock = clock;
    this.arrivalStatuses = upperCased(properties.getArrivalStatuses());
    this.departureStatuses = upperCased(properties.getDepartureStatuses());
  }

  /** 요청된 갱신에 파생 쓰기를 더한 새 맵을 반환한다. */
  public Map<ShipmentField, String> withDerived(Map<ShipmentField, String> updates) {
    Map<ShipmentField, String> result = new EnumMap<>(ShipmentField.class);
    result.putAll(updates);
    LocalDateTime now = LocalDateTime.now(clock);

    String status = updates.get(ShipmentField.STATUS_DELIVERY);
    if (status != null) {
      String normalized = status.strip().toUpperCase(Locale.ROOT);
      if (arrivalStatuses.contains(normalized)) {
        result.putIfAbsent(ShipmentField.ATA, STATUS_STAMP_FORMAT.format(now));
      }
      if (departureStatuses.contains(normalized)) {
        result.putIfAbsent(ShipmentField.ATD, STATUS_STAMP_FORMAT.format(now));
      }
    }

    if (updates.get(ShipmentField.PM_LOCATION) != null) {
      result.putIfAbsent(ShipmentField.INSERT_TIME, INSERT_TIME_FORMAT.format(now));
    }
    return result;
  }

  public String currentInsertTime() {
    return INSERT_TIME_FORMAT.format(LocalDateTime.now(clock));
  }

  private static Set<String> upperCased(Set<String> statuses) {
    return statuses.stream()
        .map(s -> s.strip().toUpperCase(Locale.ROOT))
        .collect(Collectors.toUnmodifiableSet());
  }
}
