package com.agentrouter.common.model;

public enum EscalationPriority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
