package com.enms.analytics.baseline;

public enum TargetType {
    EQUIPMENT,
    SEU
}
