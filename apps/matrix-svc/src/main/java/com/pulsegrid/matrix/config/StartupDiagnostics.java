package com.pulsegrid.matrix.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class StartupDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(StartupDiagnostics.class);
    private final PulsegridProperties props;
    private final ReportDefinition definition;

    public StartupDiagnostics(PulsegridProperties props, ReportDefinition definition) {
        this.props = props;
        this.definition = definition;
    }

    @PostConstruct
    void logConfig() {
        log.info("Report config: window={}..{}, includeWeekends={}, trendDays={}, baseFilterPresent={}, parallelism={}",
                definition.window().start(), definition.window().end(), definition.includeWeekends(),
                definition.trendDays(), definition.baseSegmentFilter() != null, definition.parallelism());
        log.info("Matrix shape: segmentsA={}, segmentsB={}, metrics={}, cells={}",
                definition.segmentsA().size(), definition.segmentsB().size(), definition.metrics().size(),
                definition.cellCount());

        // Never log the key itself.
        var provider = props.provider();
        log.info("Provider config: baseUrl='{}', reportSuite='{}', lookbackDays={}, apiKeyPresent={}",
                provider.baseUrl(), provider.reportSuite(), provider.lookbackDaysOrDefault(), provider.hasApiKey());

        var snapshot = props.snapshot();
        log.info("Snapshot config: enabled={}, file='{}'", snapshot.enabledFlag(), snapshot.path().toAbsolutePath());
    }
}
