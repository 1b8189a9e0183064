package com.foo.sheetsync.writeback;

import com.foo.sheetsync.mapping.ShipmentField;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.Map;
import lombok.Builder;

/**
 * 배송 레코드 필드 갱신 요청.
 *
 * @param lookupBy identityKey 를 비교할 컬럼
 * @param updates 갱신할 필드와 값. 값이 null 이면 셀을 비운다.
 * @param skipRemote true 면 DB만 갱신하고 시트 쓰기는 건너뛴다.
 */
@Builder
public record WriteBackRequest(
    @NotNull(message = "lookupBy는 필수입니다.") LookupBy lookupBy,
    @NotBlank(message = "identityKey는 필수입니다.") String identityKey,
    @NotEmpty(message = "updates는 비어 있을 수 없습니다.") Map<ShipmentField, String> updates,
    boolean skipRemote) {

  public enum LookupBy {
    /** 식별자로 정확히 하나의 레코드를 찾는다. */
    SHIPMENT_NO(ShipmentField.SHIPMENT_NO),
    /** 대소문자와 앞뒤 공백을 무시하고 같은 order name 을 가진 활성 레코드 전부를 찾는다. */
    ORDER_NAME(ShipmentField.ORDER_NAME);

    private final ShipmentField field;

    LookupBy(ShipmentField field) {
      this.field = field;
    }

    public ShipmentField field() {
      return field;
    }
  }

  public static WriteBackRequest byShipmentNo(String shipmentNo, Map<ShipmentField, String> updates) {
    return new WriteBackRequest(LookupBy.SHIPMENT_NO, shipmentNo, updates, false);
  }

  public static WriteBackRequest byOrderName(String orderName, Map<ShipmentField, String> updates) {
    return new WriteBackRequest(LookupBy.ORDER_NAME, orderName, updates, false);
  }

  public WriteBackRequest withSkipRemote(boolean skip) {
    return new WriteBackRequest(lookupBy, identityKey, updates, skip);
  }
}
