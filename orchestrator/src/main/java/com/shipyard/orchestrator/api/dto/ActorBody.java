package com.shipyard.orchestrator.api.dto;

/** Request body for pause and resume. */
public record ActorBody(String actor, String reason) {}
