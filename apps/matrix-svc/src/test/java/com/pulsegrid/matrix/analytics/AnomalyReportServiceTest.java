package com.pulsegrid.matrix.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.pulsegrid.matrix.config.ReportDefinition;
import com.pulsegrid.matrix.model.AnomalyMatrix;
import com.pulsegrid.matrix.model.AssessmentWindow;
import com.pulsegrid.matrix.model.CellResult;
import com.pulsegrid.matrix.model.Metric;
import com.pulsegrid.matrix.model.Polarity;
import com.pulsegrid.matrix.model.Segment;
import com.pulsegrid.matrix.provider.ProviderException;
import com.pulsegrid.matrix.provider.TimeSeriesProvider;
import com.pulsegrid.matrix.snapshot.MatrixSnapshotStore;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AnomalyReportServiceTest {

    @Mock
    private MatrixBuilder matrixBuilder;

    @Mock
    private TimeSeriesProvider provider;

    @Mock
    private MatrixSnapshotStore snapshotStore;

    private final Segment a1 = new Segment("seg-a1", "SegA1", 0);
    private final Segment b1 = new Segment("seg-b1", "SegB1", 0);
    private final Metric revenue = new Metric("revenue", "Revenue", Polarity.HIGHER_IS_GOOD, Metric.Format.CURRENCY, 0);
    private final AssessmentWindow window = new AssessmentWindow(LocalDate.of(2024, 3, 4), LocalDate.of(2024, 3, 8));
    private final ReportDefinition definition = new ReportDefinition(
            List.of(a1), List.of(b1), List.of(revenue), null, window, false, 35, 1);

    private AnomalyReportService service;

    @BeforeEach
    void setUp() {
        service = new AnomalyReportService(definition, matrixBuilder, provider, snapshotStore);
    }

    @Test
    void reusesMatchingSnapshotWithoutQueryingProvider() {
        AnomalyMatrix stored = matrix(2, 1);
        when(snapshotStore.load(definition.fingerprint())).thenReturn(Optional.of(stored));

        AnomalyMatrix first = service.getMatrix(false);
        AnomalyMatrix second = service.getMatrix(false);

        assertThat(first).isSameAs(stored);
        assertThat(second).isSameAs(stored);
        verify(snapshotStore, times(1)).load(definition.fingerprint());
        verify(matrixBuilder, never()).build(any(ReportDefinition.class), any());
    }

    @Test
    void buildsAndPersistsWhenNoSnapshot() {
        AnomalyMatrix built = matrix(1, 1);
        when(snapshotStore.load(definition.fingerprint())).thenReturn(Optional.empty());
        when(matrixBuilder.build(definition, provider)).thenReturn(built);

        AnomalyMatrix result = service.getMatrix(false);

        assertThat(result).isSameAs(built);
        verify(snapshotStore).save(built, definition.fingerprint());
        assertThat(service.getCell("seg-a1", "seg-b1", "revenue"))
                .contains(new CellResult("seg-a1", "seg-b1", "revenue", 1, 1, 0));
        assertThat(service.getCell("seg-a1", "seg-b1", "orders")).isEmpty();
    }

    @Test
    void refreshAlwaysRebuilds() {
        when(matrixBuilder.build(definition, provider)).thenReturn(matrix(1, 0), matrix(3, 0));

        service.getMatrix(true);
        AnomalyMatrix refreshed = service.getMatrix(true);

        assertThat(refreshed.cell("seg-a1", "seg-b1", "revenue")).map(CellResult::good).contains(3);
        verify(matrixBuilder, times(2)).build(definition, provider);
        verify(snapshotStore, never()).load(any());
    }

    @Test
    void failedRebuildKeepsPreviousMatrix() {
        AnomalyMatrix first = matrix(1, 0);
        when(matrixBuilder.build(definition, provider))
                .thenReturn(first)
                .thenThrow(new ProviderException("seg-a1 x seg-b1", "upstream 503", null));

        service.rebuild("test");

        assertThatThrownBy(() -> service.rebuild("test")).isInstanceOf(ProviderException.class);
        assertThat(service.getMatrix(false)).isSameAs(first);
        verify(snapshotStore, times(1)).save(any(), any());
    }

    @Test
    void snapshotWriteFailureStillServesRebuiltMatrix() {
        AnomalyMatrix built = matrix(2, 0);
        when(matrixBuilder.build(definition, provider)).thenReturn(built);
        doThrow(new UncheckedIOException("disk full", new IOException("disk full")))
                .when(snapshotStore).save(built, definition.fingerprint());

        AnomalyMatrix result = service.rebuild("test");

        assertThat(result).isSameAs(built);
        assertThat(service.getMatrix(false)).isSameAs(built);
        assertThat(service.hasMatrix()).isTrue();
        verify(snapshotStore, never()).load(any());
    }

    @Test
    void hasMatrixOnlyWhenSnapshotMatchesConfiguration() {
        when(snapshotStore.load(definition.fingerprint())).thenReturn(Optional.empty());

        assertThat(service.hasMatrix()).isFalse();
        verify(matrixBuilder, never()).build(any(ReportDefinition.class), any());
    }

    @Test
    void hasMatrixWhenMatchingSnapshotLoads() {
        when(snapshotStore.load(definition.fingerprint())).thenReturn(Optional.of(matrix(1, 0)));

        assertThat(service.hasMatrix()).isTrue();
    }

    private AnomalyMatrix matrix(int good, int bad) {
        return AnomalyMatrix.of(List.of(a1), List.of(b1), List.of(revenue), window, false,
                Instant.parse("2024-03-11T06:00:00Z"),
                List.of(new CellResult("seg-a1", "seg-b1", "revenue", good, bad, good - bad)));
    }
}
