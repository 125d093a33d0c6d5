package com.pulsegrid.matrix.analytics;

import com.pulsegrid.matrix.config.ReportDefinition;
import com.pulsegrid.matrix.model.AnomalyMatrix;
import com.pulsegrid.matrix.model.CellResult;
import com.pulsegrid.matrix.provider.TimeSeriesProvider;
import com.pulsegrid.matrix.snapshot.MatrixSnapshotStore;
import java.io.UncheckedIOException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Service
public class AnomalyReportService {

    private static final Logger log = LoggerFactory.getLogger(AnomalyReportService.class);

    private final ReportDefinition definition;
    private final MatrixBuilder matrixBuilder;
    private final TimeSeriesProvider provider;
    private final MatrixSnapshotStore snapshotStore;
    private final AtomicReference<AnomalyMatrix> current = new AtomicReference<>();

    public AnomalyReportService(
            ReportDefinition definition,
            MatrixBuilder matrixBuilder,
            TimeSeriesProvider provider,
            MatrixSnapshotStore snapshotStore
    ) {
        this.definition = definition;
        this.matrixBuilder = matrixBuilder;
        this.provider = provider;
        this.snapshotStore = snapshotStore;
    }

    /**
     * Returns the current matrix, reusing the in-memory copy or a matching snapshot before
     * querying the provider.
     */
    public AnomalyMatrix getMatrix(boolean refresh) {
        if (refresh) {
            return rebuild("request");
        }
        AnomalyMatrix cached = current.get();
        if (cached != null) {
            return cached;
        }
        synchronized (this) {
            cached = current.get();
            if (cached != null) {
                return cached;
            }
            Optional<AnomalyMatrix> stored = snapshotStore.load(definition.fingerprint());
            if (stored.isPresent()) {
                log.info("Anomaly matrix loaded from snapshot: cells={}, generatedAt={}",
                        stored.get().size(), stored.get().generatedAt());
                current.set(stored.get());
                return stored.get();
            }
            return rebuild("initial");
        }
    }

    public Optional<CellResult> getCell(String segmentAId, String segmentBId, String metricId) {
        return getMatrix(false).cell(segmentAId, segmentBId, metricId);
    }

    public synchronized AnomalyMatrix rebuild(String source) {
        log.info("Anomaly matrix rebuild ({}): {} cells expected", source, definition.cellCount());
        AnomalyMatrix matrix = matrixBuilder.build(definition, provider);
        current.set(matrix);
        try {
            snapshotStore.save(matrix, definition.fingerprint());
        } catch (UncheckedIOException ex) {
            log.error("Anomaly matrix snapshot not written; serving the rebuilt matrix from memory", ex);
        }
        return matrix;
    }

    @Scheduled(cron = "${pulsegrid.report.refresh-cron:-}")
    public void rebuildOnSchedule() {
        rebuild("scheduled");
    }

    /**
     * True when a matrix can be served without querying the provider: one is cached, or a
     * stored snapshot matches the current configuration.
     */
    public boolean hasMatrix() {
        return current.get() != null || snapshotStore.load(definition.fingerprint()).isPresent();
    }

    public ReportDefinition definition() {
        return definition;
    }
}
