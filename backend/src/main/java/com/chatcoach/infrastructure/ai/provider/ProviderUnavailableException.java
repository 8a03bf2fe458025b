package com.chatcoach.infrastructure.ai.provider;

import com.chatcoach.domain.reply.model.ErrorKind;

/**
 * Transport, authentication or upstream server failure.
 */
public class ProviderUnavailableException extends ProviderException {

    public ProviderUnavailableException(String provider, String message) {
        super(provider, message);
    }

    public ProviderUnavailableException(String provider, String message, Throwable cause) {
        super(provider, message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.PROVIDER_UNAVAILABLE;
    }
}
