package com.taxstudio.api.dto;

public record TriggerSearchResponse(boolean success, String queueId) {
}
