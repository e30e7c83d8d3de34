package com.enms.analytics.exception;

import java.time.LocalDate;

public class NoDataForPeriodException extends AnalyticsException {

    public NoDataForPeriodException(String target, LocalDate date) {
        super(ErrorKind.NO_DATA_FOR_PERIOD, "No readings found for " + target + " on " + date);
    }
}
