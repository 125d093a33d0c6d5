package com.pulsegrid.matrix.analytics;

import com.pulsegrid.matrix.config.ConfigurationException;
import com.pulsegrid.matrix.config.ReportDefinition;
import com.pulsegrid.matrix.model.Metric;
import com.pulsegrid.matrix.model.Polarity;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Lookup table from metric id to whether a higher than expected value is good or bad.
 */
@Component
public class MetricPolarityRegistry {

    private final Map<String, Polarity> polarities;

    @Autowired
    public MetricPolarityRegistry(ReportDefinition definition) {
        this(definition.metrics());
    }

    MetricPolarityRegistry(Collection<Metric> metrics) {
        Map<String, Polarity> table = new LinkedHashMap<>();
        for (Metric metric : metrics) {
            if (metric.polarity() != null) {
                table.put(metric.id(), metric.polarity());
            }
        }
        this.polarities = Map.copyOf(table);
    }

    public static MetricPolarityRegistry of(Collection<Metric> metrics) {
        return new MetricPolarityRegistry(metrics);
    }

    public Polarity polarity(String metricId) {
        Polarity polarity = polarities.get(metricId);
        if (polarity == null) {
            throw new ConfigurationException("pulsegrid.metrics",
                    "No polarity registered for metric '" + metricId + "'");
        }
        return polarity;
    }

    public Polarity polarity(Metric metric) {
        return polarity(metric.id());
    }

    public boolean isRegistered(String metricId) {
        return polarities.containsKey(metricId);
    }

    public void requireRegistered(Collection<Metric> metrics) {
        for (Metric metric : metrics) {
            if (!isRegistered(metric.id())) {
                throw new ConfigurationException("pulsegrid.metrics",
                        "No polarity registered for metric '" + metric.id() + "'");
            }
        }
    }
}
