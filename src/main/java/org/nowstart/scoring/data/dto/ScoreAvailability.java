package org.nowstart.scoring.data.dto;

import org.nowstart.scoring.data.type.ScoreAvailabilityReason;

public record ScoreAvailability(
        boolean eligible,
        ScoreAvailabilityReason reasonCode,
        String reason
) {

    private static final ScoreAvailability ELIGIBLE = new ScoreAvailability(true, null, null);

    public ScoreAvailability {
        if (!eligible && reasonCode == null) {
            throw new IllegalArgumentException("reasonCode is required for an ineligible record");
        }
    }

    public static ScoreAvailability eligibleRecord() {
        return ELIGIBLE;
    }

    public static ScoreAvailability ineligible(ScoreAvailabilityReason reasonCode, String reason) {
        return new ScoreAvailability(false, reasonCode, reason);
    }
}
