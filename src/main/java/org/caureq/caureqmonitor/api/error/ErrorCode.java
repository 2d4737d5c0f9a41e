package org.caureq.caureqmonitor.api.error;

public enum ErrorCode {
    BAD_REQUEST, VALIDATION_FAILED, NOT_FOUND, CONFLICT, UNSUPPORTED,
    AUTH_REQUIRED, INTERNAL_ERROR
}
