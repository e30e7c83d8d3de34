package com.enms.analytics.exception;

import lombok.Getter;

/**
 * A non-terminal job already exists for the requested target; retry once it finishes.
 */
@Getter
public class TrainingInProgressException extends AnalyticsException {

    private final Long activeJobId;

    public TrainingInProgressException(String targetKey, Long activeJobId) {
        super(ErrorKind.TRAINING_IN_PROGRESS,
                "A job is already active for " + targetKey
                        + (activeJobId != null ? " (job " + activeJobId + ")" : ""));
        this.activeJobId = activeJobId;
    }
}
