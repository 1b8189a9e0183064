package com.foo.sheetsync.writeback;

import static com.foo.sheetsync.support.InMemoryWorksheetSource.row;
import static org.assertj.core.api.Assertions.assertThat;

import com.foo.sheetsync.config.SheetSyncProperties;
import com.foo.sheetsync.mapping.SheetTitleFilter;
import com.foo.sheetsync.mapping.ShipmentField;
import com.foo.sheetsync.position.FallbackLocator;
import com.foo.sheetsync.position.IdentityRef;
import com.foo.sheetsync.position.PositionResolution;
import com.foo.sheetsync.position.PositionResolver;
import com.foo.sheetsync.position.PositionVerifier;
import com.foo.sheetsync.position.SheetPointer;
import com.foo.sheetsync.position.WorksheetContext;
import com.foo.sheetsync.sheet.WorksheetIdRegistry;
import com.foo.sheetsync.support.InMemoryWorksheetSource;
import com.foo.sheetsync.support.InMemoryWorksheetSource.FakeSheet;
import com.foo.sheetsync.writeback.WriteOutcome.Status;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WriteBackBatcherTest {

  private InMemoryWorksheetSource source;
  private SheetSyncProperties properties;
  private WriteBackBatcher batcher;

  @BeforeEach
  void setUp() {
    source = new InMemoryWorksheetSource();
    source.addSheet(
        "Jakarta",
        row("Shipment No", "Order Name", "Status Delivery", "ATA"),
        row("DN-1", "Order A", "ON THE WAY", ""),
        row("DN-2", "Order B", "ON THE WAY", ""));

    properties = new SheetSyncProperties();
    SheetTitleFilter filter = new SheetTitleFilter(properties);
    PositionResolver resolver =
        new PositionResolver(
            new PositionVerifier(), new FallbackLocator(filter, new WorksheetIdRegistry()));
    batcher = new WriteBackBatcher(properties, resolver);
  }

  @Test
  void apply_resolvedWrites_submittedAsSingleBatchWithNoteAndStyle() throws IOException {
    WriteBatchResult result =
        batcher.apply(
            context(),
            List.of(
                write("DN-1", 2, ShipmentField.STATUS_DELIVERY, "POD"),
                write("DN-1", 2, ShipmentField.ATA, "6/15/2024 10:00:00"),
                write("DN-2", 3, ShipmentField.STATUS_DELIVERY, "ARRIVED AT SITE")));

    assertThat(result.batched()).isTrue();
    assertThat(result.writtenCount()).isEqualTo(3);
    assertThat(source.callCount("batchApply")).isEqualTo(1);
    assertThat(source.callCount("writeCell")).isZero();

    FakeSheet sheet = source.sheet("Jakarta");
    assertThat(sheet.value(2, 3)).isEqualTo("POD");
    assertThat(sheet.value(2, 4)).isEqualTo("6/15/2024 10:00:00");
    assertThat(sheet.value(3, 3)).isEqualTo("ARRIVED AT SITE");
    assertThat(sheet.note("C2")).isEqualTo(properties.getNoteText());
    assertThat(sheet.style("C2").fontSize()).isEqualTo(properties.getNoteFontSize());
    assertThat(sheet.style("C2").linkUri()).isEqualTo(properties.getNoteLinkUri());
  }

  @Test
  void apply_batchFails_degradesToPerCellWritesWithIsolatedFailures() throws IOException {
    source.failBatchApply();
    source.failCellWrite("Jakarta", "C3");

    WriteBatchResult result =
        batcher.apply(
            context(),
            List.of(
                write("DN-1", 2, ShipmentField.STATUS_DELIVERY, "POD"),
                write("DN-2", 3, ShipmentField.STATUS_DELIVERY, "POD"),
                write("DN-2", 3, ShipmentField.ATA, "6/15/2024 10:00:00")));

    assertThat(result.batched()).isFalse();
    assertThat(result.outcomes())
        .extracting(WriteOutcome::status)
        .containsExactly(Status.WRITTEN, Status.FAILED, Status.WRITTEN);
    assertThat(source.callCount("writeCell")).isEqualTo(3);

    FakeSheet sheet = source.sheet("Jakarta");
    assertThat(sheet.value(2, 3)).isEqualTo("POD");
    assertThat(sheet.value(3, 3)).isEqualTo("ON THE WAY");
    assertThat(sheet.value(3, 4)).isEqualTo("6/15/2024 10:00:00");
    assertThat(sheet.note("C2")).isEqualTo(properties.getNoteText());
    assertThat(sheet.style("D3")).isNotNull();
  }

  @Test
  void apply_unresolvableRecord_failsOnlyItsWrites() throws IOException {
    WriteBatchResult result =
        batcher.apply(
            context(),
            List.of(
                write("DN-404", 9, ShipmentField.STATUS_DELIVERY, "POD"),
                write("DN-1", 2, ShipmentField.STATUS_DELIVERY, "POD")));

    assertThat(result.failures()).hasSize(1);
    assertThat(result.failures().get(0).recordKey()).isEqualTo("DN-404");
    assertThat(result.failures().get(0).error()).isEqualTo("identity not found in spreadsheet");
    assertThat(result.resolutions().get("DN-404"))
        .isInstanceOf(PositionResolution.NotFound.class);
    assertThat(source.sheet("Jakarta").value(2, 3)).isEqualTo("POD");
  }

  @Test
  void apply_driftedPointer_writesRelocatedRowAndReportsIt() throws IOException {
    source.sheet("Jakarta").insertRow(2, row("DN-0", "Order Z", "", ""));

    WriteBatchResult result =
        batcher.apply(context(), List.of(write("DN-1", 2, ShipmentField.STATUS_DELIVERY, "POD")));

    PositionResolution resolution = result.resolutions().get("DN-1");
    assertThat(resolution).isInstanceOf(PositionResolution.Relocated.class);
    assertThat(resolution.resolvedPosition().row()).isEqualTo(3);
    assertThat(result.outcomes().get(0).cellAddress()).isEqualTo("C3");
    assertThat(source.sheet("Jakarta").value(3, 3)).isEqualTo("POD");
    assertThat(source.sheet("Jakarta").value(2, 3)).isEmpty();
  }

  @Test
  void apply_samePositionTwice_writtenOnce() throws IOException {
    WriteBatchResult result =
        batcher.apply(
            context(),
            List.of(
                write("DN-1", 2, ShipmentField.STATUS_DELIVERY, "POD"),
                new CellWrite(
                    "DN-1-copy",
                    new IdentityRef(ShipmentField.SHIPMENT_NO, "DN-1"),
                    new SheetPointer("Jakarta", 2),
                    ShipmentField.STATUS_DELIVERY,
                    "POD")));

    assertThat(result.outcomes())
        .extracting(WriteOutcome::status)
        .containsExactly(Status.WRITTEN, Status.SKIPPED_DUPLICATE);
    assertThat(source.batches()).hasSize(1);
    assertThat(source.batches().get(0)).hasSize(1);
  }

  @Test
  void apply_columnMissingFromWorksheet_failsThatWrite() throws IOException {
    WriteBatchResult result =
        batcher.apply(context(), List.of(write("DN-1", 2, ShipmentField.REMARK, "late")));

    assertThat(result.failures()).hasSize(1);
    assertThat(result.failures().get(0).error()).isEqualTo("column 'remark' not found");
    assertThat(source.callCount("batchApply")).isZero();
  }

  private WorksheetContext context() throws IOException {
    return new WorksheetContext(source.open("doc"), 1);
  }

  private static CellWrite write(String shipmentNo, int row, ShipmentField field, String value) {
    return new CellWrite(
        shipmentNo,
        new IdentityRef(ShipmentField.SHIPMENT_NO, shipmentNo),
        new SheetPointer("Jakarta", row),
        field,
        value);
  }
}
