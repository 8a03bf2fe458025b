package com.chatcoach.infrastructure.ai.provider;

import com.chatcoach.domain.reply.model.ErrorKind;

/**
 * The request itself was rejected (bad parameters, unknown model, oversized prompt).
 * Another provider would reject it too, so no fallback is attempted.
 */
public class ProviderRequestException extends ProviderException {

    public ProviderRequestException(String provider, String message, Throwable cause) {
        super(provider, message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.PROVIDER_REQUEST;
    }

    @Override
    public boolean isRecoverable() {
        return false;
    }
}
