package com.pulsegrid.matrix.provider;

import com.pulsegrid.matrix.model.Metric;
import com.pulsegrid.matrix.model.SegmentFilter;
import com.pulsegrid.matrix.model.SegmentPairSeries;
import java.time.LocalDate;
import java.util.List;

/**
 * Source of actual, forecast and confidence band values per metric and day. One call serves
 * every requested metric for a single segment combination.
 */
public interface TimeSeriesProvider {

    enum Granularity {
        DAY
    }

    SegmentPairSeries fetch(
            SegmentFilter filter,
            List<Metric> metrics,
            LocalDate windowStart,
            LocalDate windowEnd,
            Granularity granularity
    );
}
