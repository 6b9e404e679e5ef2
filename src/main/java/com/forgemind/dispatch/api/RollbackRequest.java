package com.forgemind.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/behaviors/{id}/rollback-flag.
 */
public record RollbackRequest(String reason) {}
