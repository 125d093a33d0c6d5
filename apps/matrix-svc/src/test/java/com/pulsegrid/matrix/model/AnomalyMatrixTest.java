package com.pulsegrid.matrix.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class AnomalyMatrixTest {

    private final List<Segment> segmentsA = List.of(new Segment("mobile", "Mobile", 0), new Segment("desktop", "Desktop", 1));
    private final List<Segment> segmentsB = List.of(new Segment("new", "New visitors", 0));
    private final List<Metric> metrics = List.of(new Metric("revenue", "Revenue", Polarity.HIGHER_IS_GOOD, Metric.Format.CURRENCY, 0));
    private final AssessmentWindow window = new AssessmentWindow(LocalDate.of(2024, 3, 4), LocalDate.of(2024, 3, 10));

    @Test
    void looksUpCellsAndReportsCompleteness() {
        AnomalyMatrix partial = AnomalyMatrix.of(segmentsA, segmentsB, metrics, window, false, Instant.EPOCH,
                List.of(new CellResult("mobile", "new", "revenue", 2, 1, 1)));

        assertThat(partial.cell("mobile", "new", "revenue")).hasValueSatisfying(cell -> assertThat(cell.net()).isEqualTo(1));
        assertThat(partial.cell("desktop", "new", "revenue")).isEmpty();
        assertThat(partial.isComplete()).isFalse();

        AnomalyMatrix full = AnomalyMatrix.of(segmentsA, segmentsB, metrics, window, false, Instant.EPOCH, List.of(
                new CellResult("mobile", "new", "revenue", 2, 1, 1),
                new CellResult("desktop", "new", "revenue", 0, 3, -3)));
        assertThat(full.isComplete()).isTrue();
        assertThat(full.size()).isEqualTo(2);
    }

    @Test
    void rejectsDuplicateCells() {
        List<CellResult> results = List.of(
                new CellResult("mobile", "new", "revenue", 1, 0, 1),
                new CellResult("mobile", "new", "revenue", 0, 1, -1));

        assertThatThrownBy(() -> AnomalyMatrix.of(segmentsA, segmentsB, metrics, window, false, Instant.EPOCH, results))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("mobile");
    }

    @Test
    void cellResultKeepsNetConsistent() {
        assertThatThrownBy(() -> new CellResult("mobile", "new", "revenue", 2, 1, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CellResult("mobile", "new", "revenue", -1, 0, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void weekendDetectionUsesCalendarDay() {
        assertThat(new DayRecord(LocalDate.of(2024, 3, 9), 1.0, 1.0, 2.0, 0.0).isWeekend()).isTrue();
        assertThat(new DayRecord(LocalDate.of(2024, 3, 8), 1.0, 1.0, 2.0, 0.0).isWeekend()).isFalse();
        assertThat(new DayRecord(LocalDate.of(2024, 3, 8), null, 1.0, 2.0, 0.0).hasActualAndBounds()).isFalse();
        assertThat(new DayRecord(LocalDate.of(2024, 3, 8), Double.NaN, 1.0, 2.0, 0.0).hasActualAndBounds()).isFalse();
    }
}
