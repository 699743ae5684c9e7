package org.nowstart.tseval.result;

import java.util.Map;
import org.nowstart.tseval.data.type.TrialStatus;

public record ResultRow(
        String dataset,
        String algorithm,
        TrialStatus status,
        double durationSeconds,
        Map<String, Double> metrics,
        String error
) {
}
