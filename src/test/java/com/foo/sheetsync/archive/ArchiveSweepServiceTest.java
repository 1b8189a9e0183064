package com.foo.sheetsync.archive;

import static com.foo.sheetsync.support.InMemoryWorksheetSource.row;
import static org.assertj.core.api.Assertions.*;

import com.foo.sheetsync.archive.ArchiveSweepResult.AffectedRow;
import com.foo.sheetsync.config.SheetSyncConfigurationException;
import com.foo.sheetsync.config.SheetSyncProperties;
import com.foo.sheetsync.mapping.SheetTitleFilter;
import com.foo.sheetsync.sheet.CellFormatRequest;
import com.foo.sheetsync.sheet.GridRange;
import com.foo.sheetsync.sheet.TextStyle;
import com.foo.sheetsync.sheet.WorksheetIdRegistry;
import com.foo.sheetsync.support.InMemoryWorksheetSource;
import com.foo.sheetsync.support.InMemoryWorksheetSource.FakeSheet;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ArchiveSweepServiceTest {

  private InMemoryWorksheetSource source;
  private SheetSyncProperties properties;
  private ArchiveSweepService service;

  @BeforeEach
  void setUp() {
    source = new InMemoryWorksheetSource();
    properties = new SheetSyncProperties();
    properties.setDocumentLocator("memory://plan");
    Clock clock = Clock.fixed(Instant.parse("2024-06-15T03:00:00Z"), ZoneId.of("Asia/Jakarta"));
    service =
        new ArchiveSweepService(
            properties,
            source,
            new WorksheetIdRegistry(),
            new SheetTitleFilter(properties),
            new PlanDateParser(clock),
            clock);
  }

  @Test
  void sweep_matchesStrictlyOlderTerminalRowsOnly() {
    FakeSheet jakarta =
        source.addSheet(
            "Jakarta",
            row("Shipment No", "Plan MOS Date", "Status Delivery", "Remark"),
            row("DN-1", "8 Jun 24", "POD", ""),
            row("DN-2", "7 Jun 24", "pod", ""),
            row("DN-3", "1 Jun 2024", " Pod ", ""),
            row("DN-4", "2024/06/01", "ON THE WAY", ""),
            row("DN-5", "sometime", "POD", ""),
            row("DN-6", "", "POD", ""),
            row("DN-7", "12 Sept 23", "POD", "old"));

    ArchiveSweepResult result = service.sweep(7);

    assertThat(result.thresholdDays()).isEqualTo(7);
    assertThat(result.thresholdDate()).isEqualTo(LocalDate.of(2024, 6, 8));
    assertThat(result.matchedRows()).isEqualTo(3);
    assertThat(result.formattedRows()).isEqualTo(3);
    assertThat(result.sheetsProcessed()).containsExactly("Jakarta");
    assertThat(result.affectedRows())
        .containsExactly(
            new AffectedRow("Jakarta", 3, "7 Jun 24", "pod", true),
            new AffectedRow("Jakarta", 4, "1 Jun 2024", " Pod ", true),
            new AffectedRow("Jakarta", 8, "12 Sept 23", "POD", true));

    CellFormatRequest request = source.batches().get(0).get(0);
    assertThat(request.range()).isEqualTo(GridRange.row(jakarta.sheetId(), 3, 4));
    assertThat(request.value()).isNull();
    assertThat(request.note()).isNull();
    assertThat(request.style())
        .isEqualTo(
            new TextStyle(8, properties.getNoteLinkUri(), new TextStyle.Rgb(0.6, 0.6, 0.6)));
    assertThat(jakarta.style("D4")).isNotNull();
    assertThat(jakarta.style("A2")).isNull();
  }

  @Test
  void sweep_zeroThreshold_comparesAgainstToday() {
    source.addSheet(
        "Jakarta",
        row("Plan MOS Date", "Status Delivery"),
        row("15 Jun 24", "POD"),
        row("14 Jun 24", "POD"));

    ArchiveSweepResult result = service.sweep(0);

    assertThat(result.thresholdDate()).isEqualTo(LocalDate.of(2024, 6, 15));
    assertThat(result.affectedRows()).extracting(AffectedRow::row).containsExactly(3);
  }

  @Test
  void sweep_negativeThreshold_rejectedWithoutRemoteCalls() {
    source.addSheet("Jakarta", row("Plan MOS Date", "Status Delivery"));

    assertThatThrownBy(() -> service.sweep(-1)).isInstanceOf(IllegalArgumentException.class);
    assertThat(source.calls()).isEmpty();
  }

  @Test
  void sweep_missingDocumentLocator_isConfigurationError() {
    properties.setDocumentLocator("");

    assertThatThrownBy(() -> service.sweep(7))
        .isInstanceOf(SheetSyncConfigurationException.class);
    assertThat(source.calls()).isEmpty();
  }

  @Test
  void sweep_flushesInBoundedChunksAndOnceAtTheEnd() {
    properties.setArchiveFlushSize(2);
    source.addSheet(
        "Jakarta",
        row("Plan MOS Date", "Status Delivery"),
        row("1 Jan 24", "POD"),
        row("2 Jan 24", "POD"),
        row("3 Jan 24", "POD"));
    source.addSheet(
        "Surabaya",
        row("Status Delivery", "Plan MOS Date"),
        row("POD", "4 Jan 24"),
        row("POD", "5 Jan 24"));

    ArchiveSweepResult result = service.sweep(7);

    assertThat(result.formattedRows()).isEqualTo(5);
    assertThat(source.batches()).extracting(List::size).containsExactly(2, 2, 1);
    assertThat(result.sheetsProcessed()).containsExactly("Jakarta", "Surabaya");
  }

  @Test
  void sweep_worksheetReportingZeroColumns_matchedButNotFormatted() {
    source.addSheet("Jakarta", row("Plan MOS Date", "Status Delivery"), row("1 Jan 24", "POD"))
        .setColumnCount(0);

    ArchiveSweepResult result = service.sweep(7);

    assertThat(result.matchedRows()).isEqualTo(1);
    assertThat(result.formattedRows()).isZero();
    assertThat(result.affectedRows().get(0).formatted()).isFalse();
    assertThat(source.callCount("batchApply")).isZero();
  }

  @Test
  void sweep_batchFailure_reportsRowsAsNotFormatted() {
    source.failBatchApply();
    source.addSheet("Jakarta", row("Plan MOS Date", "Status Delivery"), row("1 Jan 24", "POD"));

    ArchiveSweepResult result = service.sweep(7);

    assertThat(result.matchedRows()).isEqualTo(1);
    assertThat(result.formattedRows()).isZero();
  }

  @Test
  void sweep_skipsExcludedUnreadableAndIncompleteWorksheets() {
    source.addSheet("Other", row("Plan MOS Date", "Status Delivery"), row("1 Jan 24", "POD"));
    source.addSheet("Broken", row("Plan MOS Date", "Status Delivery"), row("1 Jan 24", "POD"));
    source.addSheet("No Status", row("Plan MOS Date"), row("1 Jan 24"));
    source.addSheet("Jakarta", row("Plan MOS Date", "Status Delivery"), row("1 Jan 24", "POD"));
    source.failReadsOf("Broken");

    ArchiveSweepResult result = service.sweep(7);

    assertThat(result.affectedRows()).extracting(AffectedRow::sheet).containsExactly("Jakarta");
    assertThat(result.sheetsProcessed()).containsExactly("Broken", "No Status", "Jakarta");
  }

  @Test
  void sweep_prefixMode_onlyPlanSheetsParticipate() {
    properties.setSheetPrefix("Plan MOS");
    service =
        new ArchiveSweepService(
            properties,
            source,
            new WorksheetIdRegistry(),
            new SheetTitleFilter(properties),
            new PlanDateParser(Clock.systemDefaultZone()),
            Clock.fixed(Instant.parse("2024-06-15T03:00:00Z"), ZoneId.of("Asia/Jakarta")));
    source.addSheet("Plan MOS Jan", row("Plan MOS Date", "Status Delivery"), row("1 Jan 24", "POD"));
    source.addSheet("Jakarta", row("Plan MOS Date", "Status Delivery"), row("1 Jan 24", "POD"));

    ArchiveSweepResult result = service.sweep(7);

    assertThat(result.sheetsProcessed()).containsExactly("Plan MOS Jan");
    assertThat(result.matchedRows()).isEqualTo(1);
  }
}
