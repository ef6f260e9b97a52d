package com.agentrouter.common.model;

public enum EscalationStatus {
    PENDING,
    RESOLVED
}
