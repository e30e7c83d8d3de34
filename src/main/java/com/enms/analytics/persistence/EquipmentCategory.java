package com.enms.analytics.persistence;

public enum EquipmentCategory {
    COMPRESSOR,
    HVAC,
    BOILER,
    CHILLER,
    MOTOR,
    PUMP,
    INJECTION_MOLDING,
    OTHER
}
