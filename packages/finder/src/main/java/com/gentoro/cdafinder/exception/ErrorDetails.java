package com.gentoro.cdafinder.exception;

import java.time.Instant;
import java.util.Map;

/** Flattened view of a failure, suitable for logging. */
public record ErrorDetails(
    String type,
    String message,
    CdaFinderErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
