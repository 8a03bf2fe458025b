package com.chatcoach.infrastructure.ai.provider;

import com.chatcoach.domain.reply.model.ErrorKind;

/**
 * Provider cannot serve the requested capability (e.g. vision).
 */
public class CapabilityUnsupportedException extends ProviderException {

    public CapabilityUnsupportedException(String provider, String message) {
        super(provider, message);
    }

    public CapabilityUnsupportedException(String provider, String message, Throwable cause) {
        super(provider, message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CAPABILITY_UNSUPPORTED;
    }
}
