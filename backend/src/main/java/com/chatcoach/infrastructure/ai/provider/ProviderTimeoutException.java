package com.chatcoach.infrastructure.ai.provider;

import com.chatcoach.domain.reply.model.ErrorKind;

/**
 * Provider did not answer within the remaining time budget.
 */
public class ProviderTimeoutException extends ProviderException {

    public ProviderTimeoutException(String provider, String message) {
        super(provider, message);
    }

    public ProviderTimeoutException(String provider, String message, Throwable cause) {
        super(provider, message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.PROVIDER_TIMEOUT;
    }
}
