package com.foo.sheetsync.sheet;

import lombok.Builder;

/**
 * 범위 하나에 값, 메모, 서식을 동시에 적용하는 요청. null 필드는 적용하지 않는다.
 *
 * @param value 범위의 모든 셀에 쓸 문자열 값
 * @param note 셀 메모
 * @param style 글꼴 서식
 */
@Builder
public record CellFormatRequest(GridRange range, String value, String note, TextStyle style) {

  public CellFormatRequest {
    if (range == null) {
      throw new IllegalArgumentException("range is required");
    }
  }
}
