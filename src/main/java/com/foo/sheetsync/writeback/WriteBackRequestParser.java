package com.foo.sheetsync.writeback;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/** JSON 요청 본문을 엄격하게 읽고 검증한다. 형식 오류와 검증 실패는 모두 IllegalArgumentException 이다. */
@Component
@RequiredArgsConstructor
public class WriteBackRequestParser {

  private final ObjectMapper objectMapper;
  private final Validator validator;

  public WriteBackRequest parse(String json) {
    if (json == null || json.isBlank()) {
      throw new IllegalArgumentException("요청 본문은 필수입니다.");
    }

    try {
      ObjectMapper strictMapper =
          objectMapper.copy().enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
      strictMapper.setConfig(
          strictMapper.getDeserializationConfig().without(MapperFeature.ALLOW_COERCION_OF_SCALARS));
      strictMapper
          .coercionConfigFor(LogicalType.Textual)
          .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
          .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
          .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);

      WriteBackRequest request = strictMapper.readValue(json, WriteBackRequest.class);
      validate(request);
      return request;
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("요청 형식이 올바르지 않습니다.");
    }
  }

  public void validate(WriteBackRequest request) {
    if (request == null) {
      throw new IllegalArgumentException("요청은 필수입니다.");
    }
    Set<ConstraintViolation<WriteBackRequest>> violations = validator.validate(request);
    if (!violations.isEmpty()) {
      throw new IllegalArgumentException(violations.iterator().next().getMessage());
    }
  }
}
