package com.foo.sheetsync.mapping;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class HeaderNormalizerTest {

  @ParameterizedTest
  @CsvSource(
      delimiter = '|',
      value = {
        "Shipment No. | shipment no",
        "shipment_no | shipment no",
        "  Plan   MOS_Date  | plan mos date",
        "STATUS.DELIVERY | status delivery",
        "ATA | ata"
      })
  void normalizeHeader_lowercasesAndCollapsesSeparators(String raw, String expected) {
    assertThat(HeaderNormalizer.normalizeHeader(raw)).isEqualTo(expected);
  }

  @Test
  void normalizeHeader_nonStringValue_usesTextForm() {
    assertThat(HeaderNormalizer.normalizeHeader(null)).isEmpty();
    assertThat(HeaderNormalizer.normalizeHeader(2024)).isEqualTo("2024");
  }

  @Test
  void normalizeCell_trimsAndTurnsEmptyIntoNull() {
    assertThat(HeaderNormalizer.normalizeCell("  DN-1 ")).isEqualTo("DN-1");
    assertThat(HeaderNormalizer.normalizeCell("   ")).isNull();
    assertThat(HeaderNormalizer.normalizeCell(null)).isNull();
  }

  @Test
  void normalizeCell_dateLikeText_passesThroughRaw() {
    assertThat(HeaderNormalizer.normalizeCell("5 Sept 24")).isEqualTo("5 Sept 24");
    assertThat(HeaderNormalizer.normalizeCell("2024/01/05")).isEqualTo("2024/01/05");
  }

  @Test
  void mapRow_dropsUnknownHeadersAndFillsMissingWithNull() {
    List<String> headers =
        HeaderNormalizer.normalizeHeaders(List.of("Shipment No", "Mystery", "Order_Name", "ATA"));

    Map<ShipmentField, String> mapped =
        HeaderNormalizer.mapRow(headers, Arrays.asList("DN-1", "x", " Order A ", ""));

    assertThat(mapped).hasSize(ShipmentField.values().length);
    assertThat(mapped.get(ShipmentField.SHIPMENT_NO)).isEqualTo("DN-1");
    assertThat(mapped.get(ShipmentField.ORDER_NAME)).isEqualTo("Order A");
    assertThat(mapped.get(ShipmentField.ATA)).isNull();
    assertThat(mapped.get(ShipmentField.REMARK)).isNull();
    assertThat(mapped.values()).doesNotContain("x");
  }

  @Test
  void mapRow_shortRow_yieldsNullForMissingCells() {
    List<String> headers = HeaderNormalizer.normalizeHeaders(List.of("shipment no", "remark"));

    Map<ShipmentField, String> mapped = HeaderNormalizer.mapRow(headers, List.of("DN-1"));

    assertThat(mapped.get(ShipmentField.REMARK)).isNull();
  }

  @Test
  void mapRow_duplicateHeader_usesFirstColumn() {
    List<String> headers = HeaderNormalizer.normalizeHeaders(List.of("remark", "Remark"));

    Map<ShipmentField, String> mapped = HeaderNormalizer.mapRow(headers, List.of("first", "second"));

    assertThat(mapped.get(ShipmentField.REMARK)).isEqualTo("first");
  }

  @Test
  void isBlankRow_onlyWhitespace_isBlank() {
    assertThat(HeaderNormalizer.isBlankRow(List.of(" ", ""))).isTrue();
    assertThat(HeaderNormalizer.isBlankRow(List.of())).isTrue();
    assertThat(HeaderNormalizer.isBlankRow(List.of("", "x"))).isFalse();
  }
}
