package com.kakeibo.ledger.exception;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned by every failed API call.
 */
@Value
@Builder
public class ApiError {
    String error;
    String message;
    Map<String, String> details;
    Instant timestamp;
}
