package com.agentrouter.client;

public enum ConnectionState {
    CONNECTING,
    CONNECTED,
    RECONNECTING,
    /** Reconnect budget exhausted; the tracked sessions themselves are unaffected. */
    DISCONNECTED
}
