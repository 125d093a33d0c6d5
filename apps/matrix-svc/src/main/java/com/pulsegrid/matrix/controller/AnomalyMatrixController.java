package com.pulsegrid.matrix.controller;

import com.pulsegrid.matrix.analytics.AnomalyReportService;
import com.pulsegrid.matrix.controller.dto.AnomalyMatrixResponseDto;
import com.pulsegrid.matrix.model.AnomalyMatrix;
import com.pulsegrid.matrix.model.CellResult;
import com.pulsegrid.matrix.security.RequestContextHolder;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Validated
@RequestMapping("/anomaly-matrix")
public class AnomalyMatrixController {

    private static final int MAX_ID_LENGTH = 128;

    private final AnomalyReportService reportService;

    public AnomalyMatrixController(AnomalyReportService reportService) {
        this.reportService = reportService;
    }

    @GetMapping
    public ResponseEntity<AnomalyMatrixResponseDto> getMatrix(
            @RequestParam(value = "refresh", required = false, defaultValue = "false") boolean refresh
    ) {
        return ResponseEntity.ok(map(reportService.getMatrix(refresh)));
    }

    @PostMapping("/runs")
    public ResponseEntity<AnomalyMatrixResponseDto> rebuild() {
        return ResponseEntity.status(HttpStatus.CREATED).body(map(reportService.rebuild("request")));
    }

    @GetMapping("/cells/{segmentA}/{segmentB}/{metric}")
    public ResponseEntity<AnomalyMatrixResponseDto.Cell> getCell(
            @PathVariable("segmentA") @Size(max = MAX_ID_LENGTH) String segmentA,
            @PathVariable("segmentB") @Size(max = MAX_ID_LENGTH) String segmentB,
            @PathVariable("metric") @Size(max = MAX_ID_LENGTH) String metric
    ) {
        return reportService.getCell(segmentA, segmentB, metric)
                .map(AnomalyMatrixController::mapCell)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    private AnomalyMatrixResponseDto map(AnomalyMatrix matrix) {
        return new AnomalyMatrixResponseDto(
                matrix.window().start(),
                matrix.window().end(),
                matrix.includeWeekends(),
                matrix.generatedAt(),
                matrix.segmentsA().stream()
                        .map(segment -> new AnomalyMatrixResponseDto.SegmentView(segment.id(), segment.name(), segment.ordinal()))
                        .toList(),
                matrix.segmentsB().stream()
                        .map(segment -> new AnomalyMatrixResponseDto.SegmentView(segment.id(), segment.name(), segment.ordinal()))
                        .toList(),
                matrix.metrics().stream()
                        .map(metric -> new AnomalyMatrixResponseDto.MetricView(
                                metric.id(),
                                metric.name(),
                                metric.polarity() == null ? null : metric.polarity().name(),
                                metric.format().name(),
                                metric.decimals()))
                        .toList(),
                matrix.cells().stream().map(AnomalyMatrixController::mapCell).toList(),
                RequestContextHolder.get().map(RequestContextHolder.RequestContext::traceId).orElse(null)
        );
    }

    private static AnomalyMatrixResponseDto.Cell mapCell(CellResult cell) {
        return new AnomalyMatrixResponseDto.Cell(cell.segmentAId(), cell.segmentBId(), cell.metricId(),
                cell.good(), cell.bad(), cell.net());
    }
}
