package com.agentrouter.orchestrator.controller;

import java.util.Map;

public record QueryRequest(String text, Map<String, Object> context) {}
