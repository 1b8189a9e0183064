package com.foo.sheetsync.position;

import com.foo.sheetsync.mapping.HeaderNormalizer;
import com.foo.sheetsync.mapping.ShipmentField;

/** 시트에서 레코드를 찾을 때 비교하는 식별 컬럼과 값. */
public record IdentityRef(ShipmentField field, String value) {

  public IdentityRef {
    value = HeaderNormalizer.normalizeCell(value);
    if (field == null || value == null) {
      throw new IllegalArgumentException("식별 컬럼과 값은 필수입니다.");
    }
  }

  public boolean matches(String cellValue) {
    return value.equals(HeaderNormalizer.normalizeCell(cellValue));
  }
}
