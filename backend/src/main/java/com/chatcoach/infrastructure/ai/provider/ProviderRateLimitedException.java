package com.chatcoach.infrastructure.ai.provider;

import com.chatcoach.domain.reply.model.ErrorKind;

/**
 * Provider throttled the request.
 */
public class ProviderRateLimitedException extends ProviderException {

    public ProviderRateLimitedException(String provider, String message) {
        super(provider, message);
    }

    public ProviderRateLimitedException(String provider, String message, Throwable cause) {
        super(provider, message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.PROVIDER_RATE_LIMITED;
    }
}
