package com.agentrouter.orchestrator.controller;

public record ResolveEscalationRequest(String response, String operatorId) {}
