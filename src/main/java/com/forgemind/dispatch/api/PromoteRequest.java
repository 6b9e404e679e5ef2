package com.forgemind.dispatch.api;

import com.forgemind.core.model.LifecycleState;

/**
 * Inbound JSON body for POST /api/v1/behaviors/{id}/promote.
 *
 * @param target lifecycle state to move to
 */
public record PromoteRequest(LifecycleState target) {}
