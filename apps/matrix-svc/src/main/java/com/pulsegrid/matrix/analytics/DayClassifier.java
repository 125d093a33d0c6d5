package com.pulsegrid.matrix.analytics;

import com.pulsegrid.matrix.model.Classification;
import com.pulsegrid.matrix.model.DayRecord;
import com.pulsegrid.matrix.model.Polarity;
import org.springframework.stereotype.Component;

/**
 * Classifies one day's actual value against its forecast band. The band is inclusive:
 * a value equal to either bound is not an anomaly.
 */
@Component
public class DayClassifier {

    public Classification classify(DayRecord day, Polarity polarity, boolean includeWeekends) {
        return classify(day, polarity, day.isWeekend(), includeWeekends);
    }

    public Classification classify(DayRecord day, Polarity polarity, boolean weekend, boolean includeWeekends) {
        if (weekend && !includeWeekends) {
            return Classification.EXCLUDED_WEEKEND;
        }
        if (day == null || !day.hasActualAndBounds()) {
            return Classification.NO_ANOMALY;
        }
        double actual = day.actual();
        boolean higherIsGood = polarity == Polarity.HIGHER_IS_GOOD;
        if (actual > day.upper()) {
            return higherIsGood ? Classification.GOOD_ANOMALY : Classification.BAD_ANOMALY;
        }
        if (actual < day.lower()) {
            return higherIsGood ? Classification.BAD_ANOMALY : Classification.GOOD_ANOMALY;
        }
        return Classification.NO_ANOMALY;
    }
}
