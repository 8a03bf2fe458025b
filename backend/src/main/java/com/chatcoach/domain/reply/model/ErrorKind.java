package com.chatcoach.domain.reply.model;

public enum ErrorKind {
    PROVIDER_UNAVAILABLE,
    PROVIDER_RATE_LIMITED,
    PROVIDER_TIMEOUT,
    CAPABILITY_UNSUPPORTED,
    PROVIDER_REQUEST,
    UNPARSABLE_MODEL_OUTPUT,
    TIMEOUT,
    CACHE_BACKEND_ERROR,
    INTERNAL
}
