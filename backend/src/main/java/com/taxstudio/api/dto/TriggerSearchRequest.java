package com.taxstudio.api.dto;

/**
 * POST /api/v1/precision-search/trigger body. Validated by the dispatcher so that every rejection
 * surfaces as INVALID_TRIGGER.
 */
public record TriggerSearchRequest(String scope, String transactionId) {
}
