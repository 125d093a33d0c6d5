package com.pulsegrid.matrix.snapshot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.pulsegrid.matrix.config.PulsegridProperties;
import com.pulsegrid.matrix.model.AnomalyMatrix;
import com.pulsegrid.matrix.model.AssessmentWindow;
import com.pulsegrid.matrix.model.CellResult;
import com.pulsegrid.matrix.model.Metric;
import com.pulsegrid.matrix.model.Segment;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Stores the last anomaly matrix as a JSON file so a report can be re-rendered without
 * querying the provider again.
 */
@Component
public class MatrixSnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(MatrixSnapshotStore.class);
    static final int FORMAT_VERSION = 1;

    private final Path file;
    private final boolean enabled;
    private final ObjectMapper mapper;

    public record MatrixSnapshot(
            int version,
            String fingerprint,
            Instant generatedAt,
            LocalDate windowStart,
            LocalDate windowEnd,
            boolean includeWeekends,
            List<Segment> segmentsA,
            List<Segment> segmentsB,
            List<Metric> metrics,
            List<CellResult> cells
    ) {}

    @Autowired
    public MatrixSnapshotStore(PulsegridProperties properties, ObjectMapper objectMapper) {
        this(properties.snapshot().path(), properties.snapshot().enabledFlag(), objectMapper);
    }

    MatrixSnapshotStore(Path file, boolean enabled, ObjectMapper objectMapper) {
        this.file = file;
        this.enabled = enabled;
        this.mapper = objectMapper.copy()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean exists() {
        return enabled && Files.isRegularFile(file);
    }

    public Path file() {
        return file;
    }

    public void save(AnomalyMatrix matrix, String fingerprint) {
        if (!enabled) {
            return;
        }
        MatrixSnapshot snapshot = new MatrixSnapshot(
                FORMAT_VERSION,
                fingerprint,
                matrix.generatedAt(),
                matrix.window().start(),
                matrix.window().end(),
                matrix.includeWeekends(),
                matrix.segmentsA(),
                matrix.segmentsB(),
                matrix.metrics(),
                matrix.cells()
        );
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writeValue(temp.toFile(), snapshot);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("Saved anomaly matrix snapshot: cells={}, file={}", matrix.size(), file.toAbsolutePath());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write anomaly matrix snapshot " + file, ex);
        }
    }

    /**
     * Loads the stored matrix when it was produced from the same configuration. Unreadable or
     * stale snapshots are ignored so the caller rebuilds.
     */
    public Optional<AnomalyMatrix> load(String fingerprint) {
        if (!exists()) {
            return Optional.empty();
        }
        MatrixSnapshot snapshot;
        try {
            snapshot = mapper.readValue(file.toFile(), MatrixSnapshot.class);
        } catch (IOException | RuntimeException ex) {
            log.warn("Ignoring unreadable anomaly matrix snapshot {}: {}", file, ex.getMessage());
            return Optional.empty();
        }
        if (snapshot.version() != FORMAT_VERSION) {
            log.warn("Ignoring anomaly matrix snapshot {} with format version {}", file, snapshot.version());
            return Optional.empty();
        }
        if (fingerprint != null && !fingerprint.equals(snapshot.fingerprint())) {
            log.warn("Ignoring anomaly matrix snapshot {}: produced from a different report configuration", file);
            return Optional.empty();
        }
        AnomalyMatrix matrix;
        try {
            matrix = AnomalyMatrix.of(
                    snapshot.segmentsA(),
                    snapshot.segmentsB(),
                    snapshot.metrics(),
                    new AssessmentWindow(snapshot.windowStart(), snapshot.windowEnd()),
                    snapshot.includeWeekends(),
                    snapshot.generatedAt(),
                    snapshot.cells()
            );
        } catch (RuntimeException ex) {
            log.warn("Ignoring inconsistent anomaly matrix snapshot {}: {}", file, ex.getMessage());
            return Optional.empty();
        }
        if (!matrix.isComplete()) {
            log.warn("Ignoring partial anomaly matrix snapshot {}: {} of {} cells", file, matrix.size(),
                    matrix.segmentsA().size() * matrix.segmentsB().size() * matrix.metrics().size());
            return Optional.empty();
        }
        return Optional.of(matrix);
    }
}
