package com.chatcoach.infrastructure.ai.provider;

import com.chatcoach.domain.reply.model.ErrorKind;
import lombok.Getter;

/**
 * Base class of adapter-level failures. Recoverable kinds trigger fallback to the next candidate.
 */
@Getter
public abstract class ProviderException extends RuntimeException {

    private final String provider;

    protected ProviderException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    protected ProviderException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    public abstract ErrorKind kind();

    /**
     * Whether another provider may succeed where this one failed.
     */
    public boolean isRecoverable() {
        return true;
    }
}
