package com.pulsegrid.matrix.health;

import com.pulsegrid.matrix.analytics.AnomalyReportService;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness plus whether a matrix is already available without querying the provider.
 */
@RestController
public class HealthzController {

    private final AnomalyReportService reportService;

    public HealthzController(AnomalyReportService reportService) {
        this.reportService = reportService;
    }

    @GetMapping(path = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> healthz() {
        return Map.of(
                "status", "UP",
                "snapshot", reportService.hasMatrix() ? "PRESENT" : "ABSENT"
        );
    }
}
